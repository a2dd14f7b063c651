package passcode.oath;

/**
 * Raised when a passcode cannot be computed, such as when the keyed hash fails or yields a digest too short to
 * truncate. No partial code is ever returned alongside it.
 */
public class OtpException extends RuntimeException {
    public OtpException(String message) {
        super(message);
    }

    public OtpException(String message, Throwable cause) {
        super(message, cause);
    }
}
