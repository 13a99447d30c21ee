package aforo.ledger.service;

import aforo.ledger.accrual.LedgerMath;
import aforo.ledger.client.ValueTransferClient;
import aforo.ledger.config.LedgerProperties;
import aforo.ledger.dto.SettlementResult;
import aforo.ledger.entity.Provider;
import aforo.ledger.entity.SettlementKind;
import aforo.ledger.entity.Subscriber;
import aforo.ledger.event.ProviderRegisteredEvent;
import aforo.ledger.event.ProviderRemovedEvent;
import aforo.ledger.event.SubscriberRegisteredEvent;
import aforo.ledger.exception.LedgerStateException;
import aforo.ledger.exception.ValidationException;
import aforo.ledger.repository.ProviderRepository;
import aforo.ledger.repository.SubscriberRepository;
import aforo.ledger.security.AccessGuard;
import aforo.ledger.security.Caller;
import aforo.ledger.util.RegistrationKeyHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Implementation of RegistryService.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegistryServiceImpl implements RegistryService {

    private final ProviderRepository providerRepository;
    private final SubscriberRepository subscriberRepository;
    private final RegistrationKeyStore registrationKeyStore;
    private final IdAllocator idAllocator;
    private final SettlementService settlementService;
    private final ValueTransferClient valueTransferClient;
    private final AccessGuard accessGuard;
    private final ApplicationEventPublisher eventPublisher;
    private final LedgerProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public Provider registerProvider(Caller caller, byte[] registrationKey, long fee) {
        accessGuard.requireCaller(caller);
        if (registrationKey == null || registrationKey.length == 0) {
            throw new ValidationException("Registration key is required");
        }
        if (fee < properties.getMinimalFee()) {
            log.warn("Provider registration by {} refused: fee {} below minimum {}",
                    caller.principal(), fee, properties.getMinimalFee());
            throw new ValidationException("Fee " + fee + " is below the minimal fee " + properties.getMinimalFee());
        }

        String digest = RegistrationKeyHasher.digest(registrationKey);
        if (registrationKeyStore.contains(digest)) {
            log.warn("Provider registration by {} refused: registration key already used", caller.principal());
            throw new ValidationException("Registration key has already been used");
        }

        int maxProviders = properties.getMaxProviders();
        if (maxProviders > 0 && providerRepository.count() >= maxProviders) {
            log.warn("Provider registration by {} refused: {} providers registered", caller.principal(), maxProviders);
            throw new ValidationException("Provider capacity of " + maxProviders + " reached");
        }

        Instant now = clock.instant();
        Provider provider = Provider.register(
                idAllocator.nextProviderId(), caller.principal(), properties.getOperatorPrincipal(), fee, now);
        Provider savedProvider = providerRepository.save(provider);
        registrationKeyStore.insert(digest);

        eventPublisher.publishEvent(ProviderRegisteredEvent.builder()
                .providerId(savedProvider.getId())
                .owner(savedProvider.getOwner())
                .registrationKey(registrationKey.clone())
                .fee(fee)
                .registeredAt(now)
                .build());

        log.info("Provider {} registered for {} at fee {}", savedProvider.getId(), caller.principal(), fee);
        return savedProvider;
    }

    @Override
    @Transactional
    public Subscriber registerSubscriber(Caller caller, long deposit, String plan, List<Long> providerIds) {
        accessGuard.requireCaller(caller);
        LedgerProperties.Registration rules = properties.getRegistration();
        int requested = providerIds == null ? 0 : providerIds.size();
        if (requested < rules.getMinProviders() || requested > rules.getMaxProviders()) {
            throw new ValidationException("Provider list must hold between " + rules.getMinProviders()
                    + " and " + rules.getMaxProviders() + " ids, got " + requested);
        }
        if (providerIds.stream().anyMatch(Objects::isNull) || new HashSet<>(providerIds).size() != requested) {
            throw new ValidationException("Provider list must hold distinct ids: " + providerIds);
        }
        if (deposit <= 0) {
            throw new ValidationException("Deposit must be positive, got " + deposit);
        }

        Instant now = clock.instant();
        long subscriberId = idAllocator.nextSubscriberId();
        Map<Long, Provider> providers = providerRepository.findByIdInOrderByIdAsc(providerIds).stream()
                .collect(Collectors.toMap(Provider::getId, Function.identity()));

        long workingDeposit = deposit;
        List<Long> joined = new ArrayList<>();
        for (Long providerId : providerIds) {
            Provider provider = providers.get(providerId);
            if (provider == null || !provider.isActive()) {
                log.debug("Skipping provider {} for subscriber {}: missing or inactive", providerId, subscriberId);
                continue;
            }
            provider.roster().add(subscriberId, now);
            long reserve = LedgerMath.multiply(rules.getDepositMonths(), provider.feeSchedule().currentRate());
            workingDeposit = LedgerMath.subtract(workingDeposit, reserve);
            joined.add(providerId);
        }

        if (workingDeposit < 0) {
            if (rules.isEnforceMinimumDeposit()) {
                log.warn("Subscriber registration by {} refused: deposit {} short by {}",
                        caller.principal(), deposit, -workingDeposit);
                throw new ValidationException("Deposit " + deposit + " does not cover " + rules.getDepositMonths()
                        + " fee periods of the selected providers, short by " + (-workingDeposit));
            }
            log.warn("Subscriber {} deposit {} short by {} of the minimum; accepted",
                    subscriberId, deposit, -workingDeposit);
        }

        Subscriber subscriber = Subscriber.register(subscriberId, caller.principal(), deposit, plan, joined, now);
        Subscriber savedSubscriber = subscriberRepository.save(subscriber);

        valueTransferClient.transferFrom(caller.principal(), properties.getCustodyAccount(), deposit);

        eventPublisher.publishEvent(SubscriberRegisteredEvent.builder()
                .subscriberId(savedSubscriber.getId())
                .owner(savedSubscriber.getOwner())
                .deposit(deposit)
                .plan(plan)
                .providerIds(List.copyOf(joined))
                .registeredAt(now)
                .build());

        log.info("Subscriber {} registered for {} with deposit {} on {} provider(s)",
                savedSubscriber.getId(), caller.principal(), deposit, joined.size());
        return savedSubscriber;
    }

    @Override
    @Transactional
    public Subscriber deposit(Caller caller, Long subscriberId, long amount) {
        Subscriber subscriber = requireSubscriber(subscriberId);
        accessGuard.requireSubscriberOwner(caller, subscriber);
        if (amount <= 0) {
            throw new ValidationException("Deposit must be positive, got " + amount);
        }
        if (subscriber.isPaused()) {
            throw new LedgerStateException("Subscriber " + subscriberId + " is cancelled");
        }

        subscriber.credit(amount);
        valueTransferClient.transferFrom(subscriber.getOwner(), properties.getCustodyAccount(), amount);

        log.info("Subscriber {} deposited {}, balance now {}", subscriberId, amount, subscriber.getBalance());
        return subscriber;
    }

    @Override
    @Transactional
    public Provider changeFee(Caller caller, Long providerId, long newFee) {
        Provider provider = requireProvider(providerId);
        accessGuard.requireProviderOwner(caller, provider);
        if (!provider.isActive()) {
            throw new LedgerStateException("Provider " + providerId + " is not active");
        }
        if (newFee < properties.getMinimalFee()) {
            throw new ValidationException("Fee " + newFee + " is below the minimal fee " + properties.getMinimalFee());
        }

        Instant now = clock.instant();
        long previous = provider.feeSchedule().currentRate();
        provider.feeSchedule().appendRate(newFee, now);

        log.info("Provider {} fee changed from {} to {} at {}", providerId, previous, newFee, now);
        return provider;
    }

    @Override
    @Transactional
    public void setProviderStatus(Caller caller, List<Long> providerIds, List<Boolean> active) {
        accessGuard.requireAdmin(caller);
        if (providerIds == null || active == null || providerIds.size() != active.size()) {
            throw new ValidationException("Provider ids and status flags must have the same length");
        }

        for (int i = 0; i < providerIds.size(); i++) {
            Provider provider = requireProvider(providerIds.get(i));
            boolean flag = Boolean.TRUE.equals(active.get(i));
            if (provider.isActive() == flag) {
                continue;
            }
            provider.setActive(flag);
            log.info("Provider {} {}", provider.getId(), flag ? "activated" : "deactivated");
        }
    }

    @Override
    @Transactional
    public SettlementResult removeProvider(Caller caller, Long providerId) {
        accessGuard.requireAdmin(caller);
        Provider provider = requireProvider(providerId);

        Instant now = clock.instant();
        SettlementResult residual = settlementService.settle(provider, now, SettlementKind.REMOVAL);

        List<Long> members = List.copyOf(provider.roster().members());
        if (!members.isEmpty()) {
            for (Subscriber subscriber : subscriberRepository.findByIdInOrderByIdAsc(members)) {
                subscriber.getProviderIds().remove(providerId);
            }
        }
        providerRepository.delete(provider);

        eventPublisher.publishEvent(ProviderRemovedEvent.builder()
                .providerId(providerId)
                .owner(provider.getOwner())
                .residualPayout(residual.getAmount())
                .removedAt(now)
                .build());

        log.info("Provider {} removed after residual payout {} ({} subscriber(s) detached)",
                providerId, residual.getAmount(), members.size());
        return residual;
    }

    private Provider requireProvider(Long providerId) {
        return providerRepository.findById(providerId)
                .orElseThrow(() -> new LedgerStateException("Provider " + providerId + " not found"));
    }

    private Subscriber requireSubscriber(Long subscriberId) {
        return subscriberRepository.findById(subscriberId)
                .orElseThrow(() -> new LedgerStateException("Subscriber " + subscriberId + " not found"));
    }
}
