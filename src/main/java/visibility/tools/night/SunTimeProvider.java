package visibility.tools.night;

import visibility.tools.coordinates.GeoCoordinates;

import java.time.LocalDate;

/**
 * Supplies the night boundaries for a date and place
 **/
public interface SunTimeProvider {

    /**
     * @param date     the evening's calendar date (UTC)
     * @param location the observer
     * @return sunset on {@code date} and sunrise on the following day
     * @throws SunTimeException when the sun does not rise or set at that latitude and date
     **/
    NightInterval nightOf(LocalDate date, GeoCoordinates location) throws SunTimeException;

}
