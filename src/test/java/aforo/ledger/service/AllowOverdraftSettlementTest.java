package aforo.ledger.service;

import aforo.ledger.dto.CancellationResult;
import aforo.ledger.dto.SettlementResult;
import aforo.ledger.entity.Provider;
import aforo.ledger.entity.Subscriber;
import aforo.ledger.support.AbstractLedgerIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.context.TestPropertySource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@TestPropertySource(properties = {
        "aforo.ledger.settlement.overdraft-policy=ALLOW",
        "aforo.ledger.registration.enforce-minimum-deposit=false"
})
@DisplayName("Settlement With Overdraft Allowed")
class AllowOverdraftSettlementTest extends AbstractLedgerIntegrationTest {

    @Test
    @DisplayName("Should debit a full month of fees even past the balance")
    void shouldDebitFullMonth() {
        // Given
        Provider first = registerProvider(ALICE, 100L);
        registerProvider(ALICE, 100L);
        registerProvider(ALICE, 100L);
        Subscriber subscriber = registerSubscriber(BOB, 1000L, List.of(1L, 2L, 3L));
        assertThat(first.getId()).isEqualTo(1L);
        assertThat(subscriber.getId()).isEqualTo(1L);
        assertThat(reloadSubscriber(1L).getBalance()).isEqualTo(1000L);

        // When
        clock.advanceHours(730);
        SettlementResult result = settlementService.withdraw(ALICE, 1L);

        // Then
        assertThat(result.getAmount()).isEqualTo(73000L);
        assertThat(result.getSubscriberDebits()).containsEntry(1L, 73000L);
        assertThat(reloadSubscriber(1L).getBalance()).isEqualTo(1000L - 73000L);
        verify(valueTransferClient).transfer("alice", 73000L);
    }

    @Test
    @DisplayName("Should pull the shortfall and zero the balance on cancellation")
    void shouldCancelWithShortfall() {
        // Given fees of 50, 50 and 150 and a deposit of 200
        registerProvider(ALICE, 50L);
        registerProvider(ALICE, 50L);
        registerProvider(ALICE, 150L);
        Subscriber subscriber = registerSubscriber(BOB, 200L, List.of(1L, 2L, 3L));
        clock.advanceHours(2);

        // When
        CancellationResult result = settlementService.cancel(BOB, subscriber.getId());

        // Then
        assertThat(result.getOwed()).isEqualTo(500L);
        assertThat(result.getShortfallPulled()).isEqualTo(300L);
        assertThat(result.getProviderPayouts()).containsEntry(1L, 100L).containsEntry(2L, 100L).containsEntry(3L, 300L);
        Subscriber stored = reloadSubscriber(subscriber.getId());
        assertThat(stored.getBalance()).isZero();
        assertThat(stored.getProviderIds()).isEmpty();
        for (long providerId = 1L; providerId <= 3L; providerId++) {
            assertThat(reloadProvider(providerId).roster().contains(subscriber.getId())).isFalse();
        }
        verify(valueTransferClient).transferFrom("bob", CUSTODY, 300L);
        verify(valueTransferClient).transfer("alice", 300L);
    }
}
