package campus.app;

import campus.error.DomainException;
import campus.error.InternalException;

import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Error boundary of the application services: business errors and cancellation pass
 * through, anything else leaves as {@link InternalException}.
 */
final class Services {
  private static final Logger logger = Logger.getLogger(Services.class.getName());

  private Services() {
  }

  static <T> T guard(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DomainException | CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, operation + " failed", e);
      throw new InternalException(operation, e);
    }
  }

  static void run(String operation, Runnable action) {
    guard(operation, () -> {
      action.run();
      return null;
    });
  }
}
