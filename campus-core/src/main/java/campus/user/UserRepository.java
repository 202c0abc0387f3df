package campus.user;

import campus.spi.Repository;

import java.util.Optional;

/**
 * Users of every role. Email and barcode are unique across all users.
 */
public interface UserRepository extends Repository<User> {

  Optional<User> findByEmail(String email);

  boolean existsByEmail(String email);

  boolean existsByBarcode(String barcode);
}
