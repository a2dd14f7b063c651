package passcode.oath;

import lombok.Getter;
import lombok.NonNull;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;

import static com.google.common.base.Preconditions.checkArgument;

@Getter
public enum HmacAlgorithm implements KeyedHash {
    SHA1("HmacSHA1", 20),
    SHA256("HmacSHA256", 32),
    SHA512("HmacSHA512", 64);

    private final String jceName;

    private final int digestLength;

    HmacAlgorithm(String jceName, int digestLength) {
        this.jceName = jceName;
        this.digestLength = digestLength;
    }

    @Override
    public byte[] sign(@NonNull byte[] key, @NonNull byte[] message) {
        checkArgument(key.length > 0, "Key must not be empty");
        try {
            // Mac is not thread safe
            Mac mac = Mac.getInstance(jceName);
            mac.init(new SecretKeySpec(key, jceName));
            return mac.doFinal(message);
        } catch (GeneralSecurityException e) {
            throw new OtpException("Unable to compute " + jceName, e);
        }
    }
}
