package campus.util;

import java.security.SecureRandom;

/**
 * Random codes over {@code A-Z0-9} drawn from a {@link SecureRandom}.
 */
public final class RandomCodes {
  static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

  private static final SecureRandom RANDOM = new SecureRandom();

  private RandomCodes() {
  }

  public static String alphanumeric(int length) {
    if (length <= 0) {
      throw new IllegalArgumentException("length must be > 0, got: " + length);
    }
    char[] code = new char[length];
    for (int i = 0; i < length; i++) {
      code[i] = ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length()));
    }
    return new String(code);
  }
}
