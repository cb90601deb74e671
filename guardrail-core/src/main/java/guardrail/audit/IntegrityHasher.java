package guardrail.audit;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import java.util.logging.Logger;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Keyed HMAC-SHA256 over audit canonical forms and data-subject identifiers.
 *
 * <p>Outputs are lower-case hex, 64 characters. Subject identifiers are hashed with a
 * distinct prefix so a subject hash can never collide with an event signature.
 *
 * <p>This class is thread-safe; a fresh {@link Mac} is created per call.
 */
public final class IntegrityHasher {
  private static final Logger logger = Logger.getLogger(IntegrityHasher.class.getName());

  static final String ALGORITHM = "HmacSHA256";
  private static final HexFormat HEX = HexFormat.of();
  private static final String SUBJECT_PREFIX = "subject:";

  private final byte[] key;

  public IntegrityHasher(byte[] key) {
    Objects.requireNonNull(key, "key");
    if (key.length == 0) {
      throw new IllegalArgumentException("key must not be empty");
    }
    this.key = Arrays.copyOf(key, key.length);
  }

  public static IntegrityHasher fromSecret(String secret) {
    Objects.requireNonNull(secret, "secret");
    return new IntegrityHasher(secret.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Creates a hasher with a random key. Signatures made with it cannot be verified after a
   * restart, so a warning is logged.
   */
  public static IntegrityHasher withGeneratedKey() {
    logger.warning("Audit secret key not configured - generated a random key; "
        + "audit integrity hashes will not verify across restarts");
    byte[] key = new byte[32];
    new SecureRandom().nextBytes(key);
    return new IntegrityHasher(key);
  }

  public String sign(String canonicalForm) {
    Objects.requireNonNull(canonicalForm, "canonicalForm");
    return HEX.formatHex(mac(canonicalForm));
  }

  /**
   * Compares in constant time.
   */
  public boolean verify(String canonicalForm, String expectedHash) {
    if (canonicalForm == null || expectedHash == null || !isHex64(expectedHash)) {
      return false;
    }
    byte[] actual = mac(canonicalForm);
    return MessageDigest.isEqual(actual, HEX.parseHex(expectedHash));
  }

  /**
   * Pseudonymizes a raw data-subject identifier, e.g. a national id number.
   */
  public String hashSubject(String rawSubjectId) {
    Objects.requireNonNull(rawSubjectId, "rawSubjectId");
    return HEX.formatHex(mac(SUBJECT_PREFIX + rawSubjectId));
  }

  private byte[] mac(String input) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(key, ALGORITHM));
      return mac.doFinal(input.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(ALGORITHM + " unavailable", e);
    }
  }

  static boolean isHex64(String value) {
    if (value.length() != 64) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
        return false;
      }
    }
    return true;
  }
}
