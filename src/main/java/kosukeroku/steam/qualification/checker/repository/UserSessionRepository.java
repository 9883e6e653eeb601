package kosukeroku.steam.qualification.checker.repository;

import kosukeroku.steam.qualification.checker.entity.UserSession;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserSessionRepository extends CrudRepository<UserSession, Long> {
}
