package aforo.ledger.service;

import aforo.ledger.dto.CancellationResult;
import aforo.ledger.dto.SettlementResult;
import aforo.ledger.entity.Provider;
import aforo.ledger.entity.SettlementKind;
import aforo.ledger.security.Caller;

import java.time.Instant;

/**
 * Turns accrued earnings into payouts: provider withdrawals and subscriber cancellations.
 * Every operation commits all balance, roster and schedule changes together or none of them.
 */
public interface SettlementService {

    /**
     * Pay a provider everything its roster accrued since the last settlement, debiting each
     * subscriber its share.
     *
     * @param caller owner or operator of the provider, or the administrator
     * @param providerId provider to settle; must be active
     * @return the payout and per-subscriber debits; amount zero when nothing had accrued
     */
    SettlementResult withdraw(Caller caller, Long providerId);

    /**
     * Settle a subscriber's dues with every provider it is subscribed to and take it off their
     * rosters. A shortfall beyond the balance is pulled from the owner; any excess balance stays
     * with the ledger.
     *
     * @param caller owner of the subscriber
     * @param subscriberId subscriber to cancel; must not be cancelled already
     */
    CancellationResult cancel(Caller caller, Long subscriberId);

    /**
     * Settlement routine shared by withdrawals and provider removal. Must run inside the
     * caller's transaction; authorization and the active check are the caller's job.
     */
    SettlementResult settle(Provider provider, Instant now, SettlementKind kind);
}
