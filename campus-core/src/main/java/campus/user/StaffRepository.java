package campus.user;

import campus.spi.Repository;

public interface StaffRepository extends Repository<Staff> {
}
