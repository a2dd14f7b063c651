package passcode.oath;

import com.google.common.primitives.UnsignedLongs;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Maps a point in time to the RFC 6238 moving factor: the number of whole time steps elapsed since the epoch.
 *
 * <p>Both the epoch and timestamps are unsigned seconds. Timestamps before the epoch are rejected rather than
 * wrapped around.
 */
@Value
public class TimeWindow {
    public static final long DEFAULT_EPOCH = 0;
    public static final int DEFAULT_TIME_STEP = 30;

    long epoch;
    int timeStep;

    @Builder
    private TimeWindow(long epoch, int timeStep) {
        checkArgument(timeStep > 0, "timeStep must be positive, got %s", timeStep);
        this.epoch = epoch;
        this.timeStep = timeStep;
    }

    public static class TimeWindowBuilder {
        TimeWindowBuilder() {
            epoch(DEFAULT_EPOCH);
            timeStep(DEFAULT_TIME_STEP);
        }

        public TimeWindowBuilder timeStep(int seconds) {
            this.timeStep = seconds;
            return this;
        }

        public TimeWindowBuilder timeStep(@NonNull Duration step) {
            checkArgument(step.getNano() == 0, "timeStep must be whole seconds, got %s", step);
            checkArgument(step.getSeconds() <= Integer.MAX_VALUE, "timeStep too large: %s", step);
            return timeStep((int) step.getSeconds());
        }
    }

    public long at(long timestamp) {
        checkArgument(UnsignedLongs.compare(timestamp, epoch) >= 0, "timestamp %s precedes epoch %s",
            UnsignedLongs.toString(timestamp), UnsignedLongs.toString(epoch));
        return UnsignedLongs.divide(timestamp - epoch, timeStep);
    }

    public long at(@NonNull Instant instant) {
        checkArgument(instant.getEpochSecond() >= 0, "instant %s precedes the Unix epoch", instant);
        return at(instant.getEpochSecond());
    }
}
