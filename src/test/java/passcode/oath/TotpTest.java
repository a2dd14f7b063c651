package passcode.oath;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

public class TotpTest {
    private static final byte[] KEY = "12345678901234567890".getBytes(StandardCharsets.US_ASCII);

    private static Totp at(long epochSecond) {
        return Totp.builder()
            .hotp(Hotp.builder().digits(8).build())
            .clock(Clock.fixed(Instant.ofEpochSecond(epochSecond), ZoneOffset.UTC))
            .build();
    }

    @Test
    public void testDefaults() {
        Totp totp = Totp.builder().build();

        assertThat(totp.getHotp()).isEqualTo(Hotp.builder().build());
        assertThat(totp.getTimeWindow()).isEqualTo(TimeWindow.builder().build());
        assertThat(totp.generate(KEY)).hasSize(6);
    }

    @Test
    public void testGenerateFromClock() {
        assertThat(at(59).counter()).isEqualTo(1);
        assertThat(at(59).generate(KEY)).isEqualTo("94287082");
        assertThat(at(1111111109).generate(KEY)).isEqualTo("07081804");
    }

    @Test
    public void testValidateFromClock() {
        Totp totp = at(59);

        assertThat(totp.validate(KEY, "94287082")).isTrue();
        assertThat(totp.validate(KEY, "94287083")).isFalse();
    }

    @Test
    public void testCodeValidThroughoutItsTimeStep() {
        Totp totp = at(0);
        String code = totp.generate(KEY, Instant.ofEpochSecond(30));

        assertThat(totp.validate(KEY, code, Instant.ofEpochSecond(30))).isTrue();
        assertThat(totp.validate(KEY, code, Instant.ofEpochSecond(59))).isTrue();
        assertThat(totp.validate(KEY, code, Instant.ofEpochSecond(29))).isFalse();
        assertThat(totp.validate(KEY, code, Instant.ofEpochSecond(60))).isFalse();
    }

    @Test
    public void testShiftedEpoch() {
        Totp totp = Totp.builder()
            .hotp(Hotp.builder().digits(8).build())
            .timeWindow(TimeWindow.builder().epoch(1000).build())
            .clock(Clock.fixed(Instant.ofEpochSecond(1059), ZoneOffset.UTC))
            .build();

        assertThat(totp.counter()).isEqualTo(1);
        assertThat(totp.generate(KEY)).isEqualTo("94287082");
    }
}
