package aforo.ledger.service;

import aforo.ledger.accrual.EarningsCalculator;
import aforo.ledger.accrual.LedgerMath;
import aforo.ledger.dto.ProviderEarningsResponse;
import aforo.ledger.dto.SubscriberDuesResponse;
import aforo.ledger.entity.Provider;
import aforo.ledger.entity.Subscriber;
import aforo.ledger.entity.WithdrawalRecord;
import aforo.ledger.exception.LedgerStateException;
import aforo.ledger.exception.ValidationException;
import aforo.ledger.repository.ProviderRepository;
import aforo.ledger.repository.SubscriberRepository;
import aforo.ledger.repository.WithdrawalRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class LedgerQueryServiceImpl implements LedgerQueryService {

    private final ProviderRepository providerRepository;
    private final SubscriberRepository subscriberRepository;
    private final WithdrawalRecordRepository withdrawalRecordRepository;
    private final EarningsCalculator earningsCalculator;
    private final Clock clock;

    @Override
    public Optional<Provider> getProvider(Long providerId) {
        return providerRepository.findById(providerId);
    }

    @Override
    public Optional<Subscriber> getSubscriber(Long subscriberId) {
        return subscriberRepository.findById(subscriberId);
    }

    @Override
    public ProviderEarningsResponse providerEarnings(Long providerId) {
        Provider provider = providerRepository.findById(providerId)
                .orElseThrow(() -> new LedgerStateException("Provider " + providerId + " not found"));

        Instant now = clock.instant();
        Map<Long, Long> perSubscriber = earningsCalculator.perSubscriberEarnings(provider, now);

        return ProviderEarningsResponse.builder()
                .providerId(providerId)
                .currentRate(provider.feeSchedule().currentRate())
                .perSubscriber(perSubscriber)
                .total(earningsCalculator.total(perSubscriber))
                .lastWithdrawalAt(provider.getLastWithdrawalAt())
                .asOf(now)
                .build();
    }

    @Override
    public SubscriberDuesResponse subscriberDues(Long subscriberId) {
        Subscriber subscriber = subscriberRepository.findById(subscriberId)
                .orElseThrow(() -> new LedgerStateException("Subscriber " + subscriberId + " not found"));

        Instant now = clock.instant();
        Map<Long, Long> perProvider = new LinkedHashMap<>();
        long total = 0L;
        if (!subscriber.getProviderIds().isEmpty()) {
            for (Provider provider : providerRepository.findByIdInOrderByIdAsc(subscriber.getProviderIds())) {
                long owed = earningsCalculator.earningsForOne(provider, subscriberId, now);
                perProvider.put(provider.getId(), owed);
                total = LedgerMath.add(total, owed);
            }
        }

        log.debug("Subscriber {} owes {} across {} provider(s) as of {}", subscriberId, total, perProvider.size(), now);
        return SubscriberDuesResponse.builder()
                .subscriberId(subscriberId)
                .perProvider(perProvider)
                .total(total)
                .balance(subscriber.getBalance())
                .asOf(now)
                .build();
    }

    @Override
    public List<WithdrawalRecord> withdrawalHistory(Long providerId) {
        return withdrawalRecordRepository.findByProviderIdOrderBySettledAtDescIdDesc(providerId);
    }

    @Override
    public List<WithdrawalRecord> withdrawalsForMonth(Long providerId, int year, int month) {
        if (month < 1 || month > 12) {
            throw new ValidationException("Month must be between 1 and 12, got " + month);
        }
        return withdrawalRecordRepository.findByProviderIdAndYearAndMonthOrderBySettledAtAsc(providerId, year, month);
    }
}
