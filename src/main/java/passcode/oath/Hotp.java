package passcode.oath;

import com.google.common.base.Strings;
import com.google.common.math.IntMath;
import com.google.common.primitives.Longs;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * HMAC-based one-time passcode generator (RFC 4226).
 *
 * <p>Counters are unsigned 64-bit values carried in a {@code long}. Instances hold no key material and are safe to
 * share between threads.
 */
@Value
@Slf4j
public class Hotp {
    public static final int DEFAULT_DIGITS = 6;
    // 10^9 still fits below the 31-bit truncated value
    public static final int MAX_DIGITS = 9;

    int digits;
    KeyedHash algorithm;

    @Builder
    private Hotp(int digits, @NonNull KeyedHash algorithm) {
        checkArgument(digits >= 1 && digits <= MAX_DIGITS, "digits must be between 1 and %s, got %s",
            MAX_DIGITS, digits);
        this.digits = digits;
        this.algorithm = algorithm;
    }

    public static class HotpBuilder {
        HotpBuilder() {
            digits(DEFAULT_DIGITS);
            algorithm(HmacAlgorithm.SHA1);
        }
    }

    public String generate(@NonNull byte[] key, long counter) {
        int bin = Truncation.truncate(algorithm.sign(key, movingFactor(counter)));
        int value = bin % IntMath.pow(10, digits);
        return Strings.padStart(Integer.toString(value), digits, '0');
    }

    public boolean validate(@NonNull byte[] key, @NonNull String code, long counter) {
        String expected = generate(key, counter);
        boolean valid = MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            code.getBytes(StandardCharsets.UTF_8)
        );
        if (!valid)
            log.debug("Code rejected for counter {}", Long.toUnsignedString(counter));
        return valid;
    }

    /**
     * @return the counter in network byte order, as hashed by {@link #generate}
     */
    static byte[] movingFactor(long counter) {
        return Longs.toByteArray(counter);
    }
}
