package campus.registration;

import campus.spi.Repository;

import java.util.Optional;

/**
 * Registrations are unique per email.
 */
public interface RegistrationRepository extends Repository<Registration> {

  Optional<Registration> findByEmail(String email);
}
