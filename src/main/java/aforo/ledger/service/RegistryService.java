package aforo.ledger.service;

import aforo.ledger.dto.SettlementResult;
import aforo.ledger.entity.Provider;
import aforo.ledger.entity.Subscriber;
import aforo.ledger.security.Caller;

import java.util.List;

/**
 * Provider and subscriber lifecycle: registration, deposits, fee changes, activation and removal.
 * Earnings math is delegated to the settlement side.
 */
public interface RegistryService {

    /**
     * Register a provider owned by the caller.
     *
     * @param registrationKey one-time key; a key already used is rejected
     * @param fee hourly fee, at least the configured minimal fee
     * @return the new provider, active, with one open-ended fee entry
     */
    Provider registerProvider(Caller caller, byte[] registrationKey, long fee);

    /**
     * Register a subscriber owned by the caller and pull its deposit.
     * Inactive or unknown providers in the list are skipped.
     *
     * @param deposit full amount recorded as balance and pulled from the caller
     * @param plan opaque label
     * @param providerIds between the configured minimum and maximum number of distinct ids
     */
    Subscriber registerSubscriber(Caller caller, long deposit, String plan, List<Long> providerIds);

    /**
     * Top up a subscriber's balance from its owner.
     */
    Subscriber deposit(Caller caller, Long subscriberId, long amount);

    /**
     * Change a provider's hourly fee from now on. Time before now keeps its old rate.
     */
    Provider changeFee(Caller caller, Long providerId, long newFee);

    /**
     * Administrator batch toggle of provider activation; entries already in the requested
     * state are left alone.
     */
    void setProviderStatus(Caller caller, List<Long> providerIds, List<Boolean> active);

    /**
     * Administrator removal: pays out residual earnings, detaches the provider from its
     * subscribers and deletes it.
     */
    SettlementResult removeProvider(Caller caller, Long providerId);
}
