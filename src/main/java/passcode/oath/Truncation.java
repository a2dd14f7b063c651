package passcode.oath;

import com.google.common.primitives.Ints;

/**
 * Dynamic truncation as defined in RFC 4226 section 5.3.
 */
final class Truncation {
    // Largest possible offset (0x0F) plus the four bytes read from it
    static final int MIN_DIGEST_LENGTH = 20;

    private Truncation() {
    }

    /**
     * Selects four bytes at the offset named by the low nibble of the last digest byte and reads them as a
     * big-endian integer with the sign bit cleared.
     *
     * @return a value in [0, 2^31); the caller applies the decimal modulus
     * @throws OtpException if the digest is shorter than {@value #MIN_DIGEST_LENGTH} bytes
     */
    static int truncate(byte[] digest) {
        if (digest == null || digest.length < MIN_DIGEST_LENGTH)
            throw new OtpException("Digest must be at least " + MIN_DIGEST_LENGTH + " bytes, got "
                + (digest == null ? "none" : digest.length));

        int offset = digest[digest.length - 1] & 0x0F;
        return Ints.fromBytes(
            (byte) (digest[offset] & 0x7F),
            digest[offset + 1],
            digest[offset + 2],
            digest[offset + 3]
        );
    }
}
