package aforo.ledger.repository;

import aforo.ledger.entity.SettlementKind;
import aforo.ledger.entity.WithdrawalRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for payouts made to providers.
 */
@Repository
public interface WithdrawalRecordRepository extends JpaRepository<WithdrawalRecord, Long> {

    List<WithdrawalRecord> findByProviderIdOrderBySettledAtDescIdDesc(Long providerId);

    List<WithdrawalRecord> findByProviderIdAndYearAndMonthOrderBySettledAtAsc(Long providerId, int year, int month);

    List<WithdrawalRecord> findByProviderIdAndKind(Long providerId, SettlementKind kind);

    /**
     * Total ever paid to a provider, zero when nothing was paid.
     */
    @Query("SELECT COALESCE(SUM(w.amount), 0) FROM WithdrawalRecord w WHERE w.providerId = :providerId")
    long sumAmountByProviderId(@Param("providerId") Long providerId);
}
