package visibility.tools.utilities;

import org.apache.commons.configuration2.ex.ConfigurationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public class TimeUtils {

    private static final DateTimeFormatter HOUR_MINUTE = DateTimeFormatter.ofPattern("HH:mm").withZone(ZoneOffset.UTC);

    private TimeUtils() {

    }

    /**
     * @param date an ISO date (yyyy-MM-dd)
     * @return the parsed date
     * @throws ConfigurationException if the value is missing or not a date
     */
    public static LocalDate parseDate(String date) throws ConfigurationException {
        if (date == null) {
            throw new ConfigurationException("Missing observation date");
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid observation date: " + date, e);
        }
    }

    /**
     * @return the instant as HH:mm in UTC, or "--:--" when absent
     */
    public static String hourMinute(Instant instant) {
        return instant == null ? "--:--" : HOUR_MINUTE.format(instant);
    }

}
