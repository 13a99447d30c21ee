package aforo.ledger.service;

import aforo.ledger.config.LedgerProperties;
import aforo.ledger.dto.SettlementResult;
import aforo.ledger.exception.LedgerException;
import aforo.ledger.repository.ProviderRepository;
import aforo.ledger.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Withdraws for every active provider once a month under the operator identity.
 * Each provider settles in its own transaction; one failing provider does not stop the run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "aforo.ledger.withdrawal", name = "scheduler-enabled", havingValue = "true")
public class MonthlyWithdrawalJob {

    private final ProviderRepository providerRepository;
    private final SettlementService settlementService;
    private final LedgerProperties properties;

    @Scheduled(cron = "${aforo.ledger.withdrawal.cron:0 0 2 1 * *}", zone = "UTC")
    public void withdrawAll() {
        List<Long> providerIds = providerRepository.findActiveIds();
        log.info("Monthly withdrawal run for {} active provider(s)", providerIds.size());

        Caller operator = Caller.of(properties.getOperatorPrincipal());
        int settled = 0;
        long paid = 0L;
        for (Long providerId : providerIds) {
            try {
                SettlementResult result = settlementService.withdraw(operator, providerId);
                paid += result.getAmount();
                settled++;
            } catch (LedgerException e) {
                log.warn("Monthly withdrawal skipped provider {}: {}", providerId, e.getMessage());
            } catch (Exception e) {
                log.error("Monthly withdrawal failed for provider {}: {}", providerId, e.getMessage(), e);
            }
        }

        log.info("Monthly withdrawal run finished: {} of {} provider(s) settled, {} paid out",
                settled, providerIds.size(), paid);
    }
}
