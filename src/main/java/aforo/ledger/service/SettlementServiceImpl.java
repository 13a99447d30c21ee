package aforo.ledger.service;

import aforo.ledger.accrual.EarningsCalculator;
import aforo.ledger.accrual.LedgerMath;
import aforo.ledger.client.ValueTransferClient;
import aforo.ledger.config.LedgerProperties;
import aforo.ledger.config.LedgerProperties.OverdraftPolicy;
import aforo.ledger.dto.CancellationResult;
import aforo.ledger.dto.SettlementResult;
import aforo.ledger.entity.Provider;
import aforo.ledger.entity.SettlementKind;
import aforo.ledger.entity.Subscriber;
import aforo.ledger.entity.WithdrawalRecord;
import aforo.ledger.exception.LedgerStateException;
import aforo.ledger.exception.TransferFailedException;
import aforo.ledger.exception.ValidationException;
import aforo.ledger.repository.ProviderRepository;
import aforo.ledger.repository.SubscriberRepository;
import aforo.ledger.repository.WithdrawalRecordRepository;
import aforo.ledger.security.AccessGuard;
import aforo.ledger.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Implementation of SettlementService.
 * The clock is read once per operation; external transfers run last so a failure
 * rolls back everything the operation changed in the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementServiceImpl implements SettlementService {

    private final ProviderRepository providerRepository;
    private final SubscriberRepository subscriberRepository;
    private final WithdrawalRecordRepository withdrawalRecordRepository;
    private final EarningsCalculator earningsCalculator;
    private final ValueTransferClient valueTransferClient;
    private final AccessGuard accessGuard;
    private final LedgerProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public SettlementResult withdraw(Caller caller, Long providerId) {
        Provider provider = providerRepository.findById(providerId)
                .orElseThrow(() -> new LedgerStateException("Provider " + providerId + " not found"));
        accessGuard.requireProviderSettlement(caller, provider);
        if (!provider.isActive()) {
            log.warn("Withdrawal refused for inactive provider {}", providerId);
            throw new LedgerStateException("Provider " + providerId + " is not active");
        }

        return settle(provider, clock.instant(), SettlementKind.WITHDRAWAL);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public SettlementResult settle(Provider provider, Instant now, SettlementKind kind) {
        Map<Long, Long> earnings = earningsCalculator.perSubscriberEarnings(provider, now);
        Map<Long, Subscriber> subscribers = earnings.isEmpty()
                ? Map.of()
                : subscriberRepository.findByIdInOrderByIdAsc(earnings.keySet()).stream()
                        .collect(Collectors.toMap(Subscriber::getId, Function.identity()));

        OverdraftPolicy policy = properties.getSettlement().getOverdraftPolicy();
        Map<Long, Long> debits = new LinkedHashMap<>();
        long accrued = 0L;
        long payout = 0L;

        for (Map.Entry<Long, Long> entry : earnings.entrySet()) {
            Long subscriberId = entry.getKey();
            long owed = entry.getValue();
            Subscriber subscriber = subscribers.get(subscriberId);
            if (subscriber == null) {
                throw new LedgerStateException("Subscriber " + subscriberId
                        + " on the roster of provider " + provider.getId() + " does not exist");
            }

            long debit = debitFor(provider, subscriber, owed, policy);
            if (debit > 0) {
                subscriber.debit(debit);
            }
            debits.put(subscriberId, debit);
            accrued = LedgerMath.add(accrued, owed);
            payout = LedgerMath.add(payout, debit);
        }

        if (payout > 0) {
            provider.recordWithdrawal(now, payout);
            provider.feeSchedule().pruneBefore(now);
            withdrawalRecordRepository.save(WithdrawalRecord.of(provider.getId(), null, kind, payout, now));
            payOut(provider, payout);
        }

        log.info("Provider {} settled ({}): accrued {}, paid {} from {} subscriber(s)",
                provider.getId(), kind, accrued, payout, debits.size());

        return SettlementResult.builder()
                .providerId(provider.getId())
                .kind(kind)
                .accrued(accrued)
                .amount(payout)
                .subscriberDebits(debits)
                .settledAt(now)
                .build();
    }

    @Override
    @Transactional
    public CancellationResult cancel(Caller caller, Long subscriberId) {
        Subscriber subscriber = subscriberRepository.findById(subscriberId)
                .orElseThrow(() -> new LedgerStateException("Subscriber " + subscriberId + " not found"));
        accessGuard.requireSubscriberOwner(caller, subscriber);
        if (subscriber.isPaused()) {
            log.warn("Cancellation refused for already cancelled subscriber {}", subscriberId);
            throw new LedgerStateException("Subscriber " + subscriberId + " is already cancelled");
        }

        Instant now = clock.instant();
        List<Provider> providers = subscriber.getProviderIds().isEmpty()
                ? List.of()
                : providerRepository.findByIdInOrderByIdAsc(subscriber.getProviderIds());
        if (providers.size() != subscriber.getProviderIds().size()) {
            log.warn("Subscriber {} lists providers {} but only {} still exist",
                    subscriberId, subscriber.getProviderIds(), providers.size());
        }

        // Dues are computed once and reused for the payouts below.
        Map<Long, Long> dues = new LinkedHashMap<>();
        long owed = 0L;
        for (Provider provider : providers) {
            long amount = earningsCalculator.earningsForOne(provider, subscriberId, now);
            dues.put(provider.getId(), amount);
            owed = LedgerMath.add(owed, amount);
        }

        long shortfall = 0L;
        if (owed > subscriber.getBalance()) {
            shortfall = LedgerMath.subtract(owed, subscriber.getBalance());
            subscriber.setBalance(0L);
        } else {
            subscriber.debit(owed);
        }

        for (Provider provider : providers) {
            long amount = dues.get(provider.getId());
            if (amount > 0) {
                withdrawalRecordRepository.save(
                        WithdrawalRecord.of(provider.getId(), subscriberId, SettlementKind.CANCELLATION, amount, now));
            }
            provider.roster().remove(subscriberId);
        }
        subscriber.getProviderIds().clear();
        subscriber.setPaused(true);

        if (shortfall > 0) {
            pullShortfall(subscriber, shortfall);
        }
        for (Provider provider : providers) {
            long amount = dues.get(provider.getId());
            if (amount > 0) {
                payOut(provider, amount);
            }
        }

        log.info("Subscriber {} cancelled: owed {}, shortfall pulled {}, balance left {}",
                subscriberId, owed, shortfall, subscriber.getBalance());

        return CancellationResult.builder()
                .subscriberId(subscriberId)
                .owed(owed)
                .shortfallPulled(shortfall)
                .providerPayouts(dues)
                .remainingBalance(subscriber.getBalance())
                .cancelledAt(now)
                .build();
    }

    private long debitFor(Provider provider, Subscriber subscriber, long owed, OverdraftPolicy policy) {
        long balance = subscriber.getBalance();
        if (owed <= balance) {
            return owed;
        }
        switch (policy) {
            case ALLOW:
                log.warn("Subscriber {} overdrawn by provider {}: owes {}, balance {}",
                        subscriber.getId(), provider.getId(), owed, balance);
                return owed;
            case REJECT:
                log.warn("Withdrawal for provider {} rejected: subscriber {} owes {}, balance {}",
                        provider.getId(), subscriber.getId(), owed, balance);
                throw new ValidationException("Subscriber " + subscriber.getId() + " cannot cover "
                        + owed + " owed to provider " + provider.getId());
            case CLAMP:
            default:
                long covered = Math.max(0L, balance);
                log.warn("Subscriber {} covers {} of {} owed to provider {}; {} forgone",
                        subscriber.getId(), covered, owed, provider.getId(), owed - covered);
                return covered;
        }
    }

    private void payOut(Provider provider, long amount) {
        try {
            valueTransferClient.transfer(provider.getOwner(), amount);
        } catch (TransferFailedException e) {
            log.error("Payout of {} to owner {} of provider {} failed, rolling back: {}",
                    amount, provider.getOwner(), provider.getId(), e.getMessage());
            throw e;
        }
    }

    private void pullShortfall(Subscriber subscriber, long shortfall) {
        try {
            valueTransferClient.transferFrom(subscriber.getOwner(), properties.getCustodyAccount(), shortfall);
        } catch (TransferFailedException e) {
            log.error("Pulling shortfall {} from owner {} of subscriber {} failed, rolling back: {}",
                    shortfall, subscriber.getOwner(), subscriber.getId(), e.getMessage());
            throw e;
        }
    }
}
