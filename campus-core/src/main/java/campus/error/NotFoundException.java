package campus.error;

/**
 * The resource does not exist or was soft-deleted. Both cases share this type and message
 * so callers cannot probe for deleted resources.
 */
public final class NotFoundException extends DomainException {
  public NotFoundException(String resource) {
    super("not_found", resource + " not found");
  }
}
