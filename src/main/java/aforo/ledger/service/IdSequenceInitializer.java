package aforo.ledger.service;

import aforo.ledger.entity.IdSequence;
import aforo.ledger.repository.IdSequenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates the {@code id_sequence} rows once, before any allocation needs them.
 * Each row is inserted in its own transaction; an instance that loses the insert race
 * keeps the row the other one wrote.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdSequenceInitializer {

    private final IdSequenceRepository idSequenceRepository;
    private final TransactionTemplate transactionTemplate;

    @EventListener(ApplicationReadyEvent.class)
    public void seedSequences() {
        for (String name : SequenceIdAllocator.SEQUENCES) {
            seed(name);
        }
    }

    private void seed(String name) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (!idSequenceRepository.existsById(name)) {
                    idSequenceRepository.saveAndFlush(new IdSequence(name, 0L));
                    log.info("Seeded id sequence {}", name);
                }
            });
        } catch (DataIntegrityViolationException e) {
            log.info("Id sequence {} was seeded concurrently: {}", name, e.getMostSpecificCause().getMessage());
        }
    }
}
