package visibility.tools.night;

import java.time.Duration;
import java.time.Instant;

/**
 * First and last qualifying sample of a night. Both bounds are null when nothing qualifies.
 **/
public record VisibilityWindow(Instant start, Instant end) {

    public static final VisibilityWindow NONE = new VisibilityWindow(null, null);

    public boolean isEmpty() {
        return start == null || end == null;
    }

    public Duration duration() {
        return isEmpty() ? Duration.ZERO : Duration.between(start, end);
    }

}
