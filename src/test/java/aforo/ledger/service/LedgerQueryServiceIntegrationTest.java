package aforo.ledger.service;

import aforo.ledger.dto.ProviderEarningsResponse;
import aforo.ledger.dto.SubscriberDuesResponse;
import aforo.ledger.entity.Subscriber;
import aforo.ledger.entity.WithdrawalRecord;
import aforo.ledger.exception.LedgerStateException;
import aforo.ledger.exception.ValidationException;
import aforo.ledger.support.AbstractLedgerIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Ledger Query Service Integration Tests")
class LedgerQueryServiceIntegrationTest extends AbstractLedgerIntegrationTest {

    private List<Long> providers;
    private Subscriber subscriber;

    @BeforeEach
    void setUpLedger() {
        providers = List.of(
                registerProvider(ALICE, 100L).getId(),
                registerProvider(ALICE, 200L).getId(),
                registerProvider(ALICE, 50L).getId());
        subscriber = registerSubscriber(BOB, 100000L, providers);
    }

    @Test
    @DisplayName("Should report accrued earnings without settling them")
    void shouldReportProviderEarnings() {
        clock.advanceHours(5);

        ProviderEarningsResponse earnings = ledgerQueryService.providerEarnings(providers.get(1));

        assertThat(earnings.getCurrentRate()).isEqualTo(200L);
        assertThat(earnings.getPerSubscriber()).containsExactly(Map.entry(subscriber.getId(), 1000L));
        assertThat(earnings.getTotal()).isEqualTo(1000L);
        assertThat(earnings.getLastWithdrawalAt()).isNull();
        assertThat(earnings.getAsOf()).isEqualTo(clock.instant());
        assertThat(reloadSubscriber(subscriber.getId()).getBalance()).isEqualTo(100000L);
    }

    @Test
    @DisplayName("Should report what a subscriber owes each provider")
    void shouldReportSubscriberDues() {
        clock.advanceHours(2);

        SubscriberDuesResponse dues = ledgerQueryService.subscriberDues(subscriber.getId());

        assertThat(dues.getPerProvider()).containsExactly(
                Map.entry(providers.get(0), 200L),
                Map.entry(providers.get(1), 400L),
                Map.entry(providers.get(2), 100L));
        assertThat(dues.getTotal()).isEqualTo(700L);
        assertThat(dues.getBalance()).isEqualTo(100000L);
    }

    @Test
    @DisplayName("Should list withdrawals newest first and by month")
    void shouldListWithdrawals() {
        Long providerId = providers.get(2);
        clock.advanceHours(5);
        settlementService.withdraw(ALICE, providerId);
        // into February 2024
        clock.advanceHours(24 * 35);
        settlementService.withdraw(ALICE, providerId);

        List<WithdrawalRecord> history = ledgerQueryService.withdrawalHistory(providerId);

        assertThat(history).extracting(WithdrawalRecord::getAmount).containsExactly(50L * 24 * 35, 250L);
        assertThat(ledgerQueryService.withdrawalsForMonth(providerId, 2024, 1))
                .singleElement()
                .satisfies(record -> assertThat(record.getAmount()).isEqualTo(250L));
        assertThat(ledgerQueryService.withdrawalsForMonth(providerId, 2024, 2)).hasSize(1);
        assertThat(ledgerQueryService.withdrawalsForMonth(providerId, 2024, 3)).isEmpty();
    }

    @Test
    @DisplayName("Should reject unknown ids and invalid months")
    void shouldRejectInvalidQueries() {
        assertThat(ledgerQueryService.getProvider(99L)).isEmpty();
        assertThat(ledgerQueryService.getSubscriber(subscriber.getId())).isPresent();
        assertThatThrownBy(() -> ledgerQueryService.providerEarnings(99L))
                .isInstanceOf(LedgerStateException.class);
        assertThatThrownBy(() -> ledgerQueryService.withdrawalsForMonth(providers.get(0), 2024, 13))
                .isInstanceOf(ValidationException.class);
    }
}
