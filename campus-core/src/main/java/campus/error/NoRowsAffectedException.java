package campus.error;

/** An update statement matched no row. */
public final class NoRowsAffectedException extends DomainException {
  public NoRowsAffectedException(String resource) {
    super("no_rows_affected", "no rows affected updating " + resource);
  }
}
