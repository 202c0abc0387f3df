package campus.spi;

/**
 * Change applied to a loaded aggregate inside {@link Repository#update}.
 */
@FunctionalInterface
public interface Mutation<T> {

  void apply(T aggregate);
}
