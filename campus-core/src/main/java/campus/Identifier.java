package campus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Objects;
import java.util.UUID;

/**
 * 128-bit identifier of aggregates and events, serialized in canonical UUID form.
 *
 * <p>New identifiers are time-ordered (monotonic ULIDs rendered as UUIDs), which keeps
 * primary-key inserts append-mostly. {@link #ZERO} stands for "not set".
 */
public final class Identifier implements Comparable<Identifier> {
  public static final Identifier ZERO = new Identifier(new UUID(0L, 0L));

  private final UUID value;

  private Identifier(UUID value) {
    this.value = value;
  }

  public static Identifier newId() {
    return new Identifier(UlidCreator.getMonotonicUlid().toUuid());
  }

  public static Identifier of(UUID value) {
    return new Identifier(Objects.requireNonNull(value, "value"));
  }

  /**
   * Parses the canonical string form.
   *
   * @throws IllegalArgumentException if {@code value} is not a UUID
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Identifier parse(String value) {
    Objects.requireNonNull(value, "value");
    return new Identifier(UUID.fromString(value));
  }

  public UUID toUuid() {
    return value;
  }

  public boolean isZero() {
    return value.getMostSignificantBits() == 0L && value.getLeastSignificantBits() == 0L;
  }

  /** True when {@code id} is null or {@link #ZERO}. */
  public static boolean isMissing(Identifier id) {
    return id == null || id.isZero();
  }

  @Override
  public int compareTo(Identifier other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Identifier other)) return false;
    return value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @JsonValue
  @Override
  public String toString() {
    return value.toString();
  }
}
