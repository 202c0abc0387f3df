package campus.validation;

import java.util.regex.Pattern;

/**
 * Email address syntax check: ASCII local part, dot-separated DNS labels and an
 * alphabetic TLD, at most 254 characters (RFC 5321).
 */
public final class Emails {
  public static final int MAX_LENGTH = 254;

  private static final Pattern PATTERN = Pattern.compile(
      "^[a-zA-Z0-9._%+\\-]+@"
          + "(?:[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?\\.)+"
          + "[A-Za-z]{2,63}$");

  private Emails() {
  }

  public static boolean isWellFormed(String email) {
    return email != null
        && email.length() <= MAX_LENGTH
        && PATTERN.matcher(email).matches();
  }
}
