package aforo.ledger.service;

import aforo.ledger.entity.IdSequence;
import aforo.ledger.support.AbstractLedgerIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Id Sequence Initializer Integration Tests")
class IdSequenceInitializerIntegrationTest extends AbstractLedgerIntegrationTest {

    @Autowired
    private IdSequenceInitializer idSequenceInitializer;

    @Autowired
    private IdAllocator idAllocator;

    @Test
    @DisplayName("Should seed every sequence at startup")
    void shouldSeedAtStartup() {
        assertThat(idSequenceRepository.findAll())
                .extracting(IdSequence::getName)
                .containsExactlyInAnyOrderElementsOf(SequenceIdAllocator.SEQUENCES);
    }

    @Test
    @DisplayName("Should leave existing counters alone when seeding again")
    void shouldKeepCountersWhenReseeding() {
        registerProvider(ALICE, 100L);

        idSequenceInitializer.seedSequences();

        assertThat(registerProvider(ALICE, 100L).getId()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Should refuse to allocate from a sequence that was never seeded")
    void shouldRefuseUnseededSequence() {
        idSequenceRepository.deleteAll();

        assertThatThrownBy(() -> idAllocator.nextProviderId())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("provider");

        idSequenceInitializer.seedSequences();
        assertThat(idAllocator.nextProviderId()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should end with one row per sequence when instances seed concurrently")
    void shouldSurviveConcurrentSeeding() throws Exception {
        // Given
        idSequenceRepository.deleteAll();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Callable<Void>> seeders = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            seeders.add(() -> {
                idSequenceInitializer.seedSequences();
                return null;
            });
        }

        // When
        try {
            for (Future<Void> result : executor.invokeAll(seeders)) {
                result.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(idSequenceRepository.count()).isEqualTo(SequenceIdAllocator.SEQUENCES.size());
        assertThat(idAllocator.nextProviderId()).isEqualTo(1L);
        assertThat(idAllocator.nextSubscriberId()).isEqualTo(1L);
    }
}
