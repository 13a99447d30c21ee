package aforo.ledger.repository;

import aforo.ledger.entity.ConsumedRegistrationKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConsumedRegistrationKeyRepository extends JpaRepository<ConsumedRegistrationKey, String> {
}
