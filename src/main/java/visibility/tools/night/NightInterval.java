package visibility.tools.night;

import java.time.Duration;
import java.time.Instant;

/**
 * Sunset to the following sunrise
 **/
public record NightInterval(Instant sunset, Instant sunrise) {

    public Duration length() {
        return Duration.between(sunset, sunrise);
    }

}
