package campus.invitation;

import campus.spi.Repository;

import java.util.Optional;

public interface StaffInvitationRepository extends Repository<StaffInvitation> {

  /** Finds an invitation by its code, including deleted ones. */
  Optional<StaffInvitation> findByCode(String code);
}
