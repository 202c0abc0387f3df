package campus.registration;

import campus.util.RandomCodes;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the email verification flow.
 *
 * @param codeTtl        lifetime of a verification code
 * @param resendCooldown minimum time between two codes
 * @param maxAttempts    failed attempts after which the registration expires
 * @param codeLength     characters per code
 */
public record RegistrationPolicy(Duration codeTtl, Duration resendCooldown, int maxAttempts, int codeLength) {

  public static final RegistrationPolicy DEFAULT =
      new RegistrationPolicy(Duration.ofMinutes(10), Duration.ofMinutes(1), 3, 6);

  public RegistrationPolicy {
    Objects.requireNonNull(codeTtl, "codeTtl");
    Objects.requireNonNull(resendCooldown, "resendCooldown");
    if (codeTtl.isNegative() || codeTtl.isZero()) {
      throw new IllegalArgumentException("codeTtl must be > 0, got: " + codeTtl);
    }
    if (resendCooldown.isNegative()) {
      throw new IllegalArgumentException("resendCooldown must be >= 0, got: " + resendCooldown);
    }
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0, got: " + maxAttempts);
    }
    if (codeLength <= 0) {
      throw new IllegalArgumentException("codeLength must be > 0, got: " + codeLength);
    }
  }

  String newCode() {
    return RandomCodes.alphanumeric(codeLength);
  }
}
