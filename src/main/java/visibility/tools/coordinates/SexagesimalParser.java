package visibility.tools.coordinates;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses catalog style right ascension and declination strings into decimal degrees
 **/
public class SexagesimalParser {

    // 05h 35m 17.3s
    private static final Pattern RA_PATTERN = Pattern.compile("(\\d+)h\\s*(\\d+)m\\s*(\\d+(?:\\.\\d+)?)s");
    // +22° 00' 52.1", also +22d 00m 52.1s
    private static final Pattern DEC_PATTERN = Pattern.compile("([+-]?)(\\d+)[°d]\\s*(\\d+)['m]\\s*(\\d+(?:\\.\\d+)?)(?![\\d.])[\"s]?");

    private static final double DEGREES_PER_HOUR = 15.0;

    private SexagesimalParser() {

    }

    public static Optional<EquatorialPosition> parse(String ra, String dec) {
        OptionalDouble raDeg = parseRightAscension(ra);
        OptionalDouble decDeg = parseDeclination(dec);
        if (raDeg.isEmpty() || decDeg.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new EquatorialPosition(raDeg.getAsDouble(), decDeg.getAsDouble()));
    }

    /**
     * @param ra either hours-minutes-seconds ("05h 35m 17.3s") or plain decimal degrees
     * @return the right ascension in degrees, or empty when the text is not understood
     **/
    public static OptionalDouble parseRightAscension(String ra) {
        if (ra == null) {
            return OptionalDouble.empty();
        }
        Matcher matcher = RA_PATTERN.matcher(ra);
        if (!matcher.find()) {
            return parseDecimal(ra);
        }
        try {
            double hours = Integer.parseInt(matcher.group(1))
                    + Integer.parseInt(matcher.group(2)) / 60.0
                    + Double.parseDouble(matcher.group(3)) / 3600.0;
            return OptionalDouble.of(hours * DEGREES_PER_HOUR);
        } catch (NumberFormatException e) {
            // digit runs too long for an int
            return OptionalDouble.empty();
        }
    }

    /**
     * @param dec either degrees-arcminutes-arcseconds ("+22° 00' 52.1\"") or plain decimal degrees
     * @return the declination in degrees, or empty when the text is not understood
     **/
    public static OptionalDouble parseDeclination(String dec) {
        if (dec == null) {
            return OptionalDouble.empty();
        }
        Matcher matcher = DEC_PATTERN.matcher(dec);
        if (!matcher.find()) {
            return parseDecimal(dec);
        }
        try {
            double sign = "-".equals(matcher.group(1)) ? -1 : 1;
            double degrees = Integer.parseInt(matcher.group(2))
                    + Integer.parseInt(matcher.group(3)) / 60.0
                    + Double.parseDouble(matcher.group(4)) / 3600.0;
            return OptionalDouble.of(sign * degrees);
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static OptionalDouble parseDecimal(String text) {
        try {
            double value = Double.parseDouble(text.trim());
            return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

}
