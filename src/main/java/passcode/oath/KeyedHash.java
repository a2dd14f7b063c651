package passcode.oath;

/**
 * A keyed-hash primitive: combines a secret key and a message into a fixed-length digest.
 *
 * @see HmacAlgorithm
 */
@FunctionalInterface
public interface KeyedHash {
    byte[] sign(byte[] key, byte[] message);
}
