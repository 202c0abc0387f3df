package campus.user;

import java.util.Locale;

/**
 * Organization-wide role of a user.
 */
public enum Role {
  GUEST,
  STUDENT,
  STAFF,
  AITUSA;

  /** Lowercase storage value. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * @throws IllegalArgumentException for unknown values
   */
  public static Role fromValue(String value) {
    return Role.valueOf(value.toUpperCase(Locale.ROOT));
  }
}
