package visibility.tools.utilities;

import org.apache.commons.configuration2.ex.ConfigurationException;
import org.junit.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.Assert.assertEquals;

public class TimeUtilsTest {

    @Test
    public void parsesIsoDate() throws ConfigurationException {
        assertEquals(LocalDate.of(2025, 1, 15), TimeUtils.parseDate(" 2025-01-15 "));
    }

    @Test
    public void formatsHourMinuteInUtc() {
        assertEquals("21:07", TimeUtils.hourMinute(Instant.parse("2025-01-15T21:07:59Z")));
        assertEquals("--:--", TimeUtils.hourMinute(null));
    }

}
