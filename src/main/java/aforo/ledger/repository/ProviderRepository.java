package aforo.ledger.repository;

import aforo.ledger.entity.Provider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for Provider entities.
 */
@Repository
public interface ProviderRepository extends JpaRepository<Provider, Long> {

    /**
     * Ids of every active provider, ascending.
     */
    @Query("SELECT p.id FROM Provider p WHERE p.active = true ORDER BY p.id")
    List<Long> findActiveIds();

    /**
     * Load several providers in ascending id order, the fixed order multi-entity operations use.
     */
    List<Provider> findByIdInOrderByIdAsc(Collection<Long> ids);
}
