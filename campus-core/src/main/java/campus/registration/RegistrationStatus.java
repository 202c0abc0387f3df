package campus.registration;

import java.util.Locale;

/**
 * Stored registration status. Transitions only move forward:
 * {@code PENDING -> VERIFIED -> COMPLETED}, or {@code PENDING -> EXPIRED} after too many
 * failed attempts. A code resend brings an expired registration back to {@code PENDING}.
 */
public enum RegistrationStatus {
  PENDING,
  VERIFIED,
  COMPLETED,
  EXPIRED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static RegistrationStatus fromValue(String value) {
    return RegistrationStatus.valueOf(value.toUpperCase(Locale.ROOT));
  }
}
