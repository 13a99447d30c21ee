package aforo.ledger.service;

import aforo.ledger.entity.ConsumedRegistrationKey;
import aforo.ledger.repository.ConsumedRegistrationKeyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class JpaRegistrationKeyStore implements RegistrationKeyStore {

    private final ConsumedRegistrationKeyRepository repository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public boolean contains(String digest) {
        return repository.existsById(digest);
    }

    @Override
    @Transactional
    public void insert(String digest) {
        repository.save(new ConsumedRegistrationKey(digest, clock.instant()));
    }
}
