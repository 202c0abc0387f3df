package campus.user;

import campus.spi.Repository;

public interface StudentRepository extends Repository<Student> {
}
