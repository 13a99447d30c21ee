package aforo.ledger.repository;

import aforo.ledger.entity.Subscriber;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for Subscriber entities.
 */
@Repository
public interface SubscriberRepository extends JpaRepository<Subscriber, Long> {

    /**
     * Load several subscribers in ascending id order.
     */
    List<Subscriber> findByIdInOrderByIdAsc(Collection<Long> ids);
}
