package passcode.oath;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;

/**
 * Time-based one-time passcodes (RFC 6238): an {@link Hotp} fed with the moving factor a {@link TimeWindow} derives
 * from the clock. Only the current time step is accepted.
 */
@Value
@Builder
@Slf4j
public class Totp {
    @NonNull Hotp hotp;
    @NonNull TimeWindow timeWindow;
    @NonNull Clock clock;

    public static class TotpBuilder {
        TotpBuilder() {
            hotp(Hotp.builder().build());
            timeWindow(TimeWindow.builder().build());
            clock(Clock.systemUTC());
        }
    }

    public long counter() {
        return counter(clock.instant());
    }

    public long counter(Instant instant) {
        return timeWindow.at(instant);
    }

    public String generate(byte[] key) {
        return generate(key, clock.instant());
    }

    public String generate(byte[] key, Instant instant) {
        return hotp.generate(key, counter(instant));
    }

    public boolean validate(byte[] key, String code) {
        return validate(key, code, clock.instant());
    }

    public boolean validate(byte[] key, String code, Instant instant) {
        long counter = counter(instant);
        log.debug("Validating code at {} for time step {}", instant, counter);
        return hotp.validate(key, code, counter);
    }
}
