package campus.spi;

/**
 * One-way password hashing. The algorithm and its cost are implementation choices.
 *
 * @see campus.crypto.Argon2PasswordHasher
 */
public interface PasswordHasher {

  String hash(String plaintext);

  /** Returns false on mismatch or an unreadable hash. */
  boolean matches(String hash, String plaintext);
}
