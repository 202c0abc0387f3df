package campus.crypto;

import campus.spi.PasswordHasher;
import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Argon2id {@link PasswordHasher}. Hashes are PHC strings
 * ({@code $argon2id$v=19$m=...,t=...,p=...$salt$hash}) so the cost parameters travel with
 * each hash and can be raised without invalidating stored ones.
 *
 * <p>Defaults are 3 iterations, 64 MiB and parallelism 4. Tests should build a cheap
 * instance:
 *
 * <pre>{@code
 * PasswordHasher hasher = Argon2PasswordHasher.builder()
 *     .iterations(1)
 *     .memoryKib(1024)
 *     .parallelism(1)
 *     .build();
 * }</pre>
 */
public final class Argon2PasswordHasher implements PasswordHasher {
  private static final Logger logger = Logger.getLogger(Argon2PasswordHasher.class.getName());

  private static final int SALT_LENGTH = 16;
  private static final int HASH_LENGTH = 32;

  private final Argon2 argon2;
  private final int iterations;
  private final int memoryKib;
  private final int parallelism;

  private Argon2PasswordHasher(Builder builder) {
    this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, HASH_LENGTH);
    this.iterations = builder.iterations;
    this.memoryKib = builder.memoryKib;
    this.parallelism = builder.parallelism;
  }

  public static Argon2PasswordHasher withDefaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String hash(String plaintext) {
    Objects.requireNonNull(plaintext, "plaintext");
    char[] chars = plaintext.toCharArray();
    try {
      return argon2.hash(iterations, memoryKib, parallelism, chars);
    } finally {
      argon2.wipeArray(chars);
    }
  }

  @Override
  public boolean matches(String hash, String plaintext) {
    if (hash == null || plaintext == null) {
      return false;
    }
    char[] chars = plaintext.toCharArray();
    try {
      return argon2.verify(hash, chars);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Unreadable password hash", e);
      return false;
    } finally {
      argon2.wipeArray(chars);
    }
  }

  public static final class Builder {
    private int iterations = 3;
    private int memoryKib = 65536;
    private int parallelism = 4;

    private Builder() {
    }

    public Builder iterations(int iterations) {
      this.iterations = requirePositive(iterations, "iterations");
      return this;
    }

    /** Memory cost in KiB. */
    public Builder memoryKib(int memoryKib) {
      this.memoryKib = requirePositive(memoryKib, "memoryKib");
      return this;
    }

    public Builder parallelism(int parallelism) {
      this.parallelism = requirePositive(parallelism, "parallelism");
      return this;
    }

    public Argon2PasswordHasher build() {
      return new Argon2PasswordHasher(this);
    }

    private static int requirePositive(int value, String name) {
      if (value <= 0) {
        throw new IllegalArgumentException(name + " must be > 0");
      }
      return value;
    }
  }
}
