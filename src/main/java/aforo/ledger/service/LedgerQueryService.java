package aforo.ledger.service;

import aforo.ledger.dto.ProviderEarningsResponse;
import aforo.ledger.dto.SubscriberDuesResponse;
import aforo.ledger.entity.Provider;
import aforo.ledger.entity.Subscriber;
import aforo.ledger.entity.WithdrawalRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only views over the ledger. Nothing here changes balances, rosters or schedules.
 */
public interface LedgerQueryService {

    Optional<Provider> getProvider(Long providerId);

    Optional<Subscriber> getSubscriber(Long subscriberId);

    /**
     * Earnings accrued by each roster member up to now.
     */
    ProviderEarningsResponse providerEarnings(Long providerId);

    /**
     * What a subscriber would owe each of its providers if it cancelled now.
     */
    SubscriberDuesResponse subscriberDues(Long subscriberId);

    /**
     * Payouts made to a provider, newest first.
     */
    List<WithdrawalRecord> withdrawalHistory(Long providerId);

    List<WithdrawalRecord> withdrawalsForMonth(Long providerId, int year, int month);
}
