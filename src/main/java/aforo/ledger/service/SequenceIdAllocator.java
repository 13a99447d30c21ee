package aforo.ledger.service;

import aforo.ledger.entity.IdSequence;
import aforo.ledger.repository.IdSequenceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Allocates ids from locked rows of the {@code id_sequence} table, inside the caller's transaction.
 * A rolled-back registration gives its id back. Rows are created at startup by
 * {@link IdSequenceInitializer}.
 */
@Component
@RequiredArgsConstructor
public class SequenceIdAllocator implements IdAllocator {

    static final String PROVIDER_SEQUENCE = "provider";
    static final String SUBSCRIBER_SEQUENCE = "subscriber";
    static final List<String> SEQUENCES = List.of(PROVIDER_SEQUENCE, SUBSCRIBER_SEQUENCE);

    private final IdSequenceRepository idSequenceRepository;

    @Override
    @Transactional
    public long nextProviderId() {
        return next(PROVIDER_SEQUENCE);
    }

    @Override
    @Transactional
    public long nextSubscriberId() {
        return next(SUBSCRIBER_SEQUENCE);
    }

    private long next(String name) {
        IdSequence sequence = idSequenceRepository.findForUpdate(name)
                .orElseThrow(() -> new IllegalStateException("Id sequence " + name + " has not been seeded"));
        return sequence.next();
    }
}
