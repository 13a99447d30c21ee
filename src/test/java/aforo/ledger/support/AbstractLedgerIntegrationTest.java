package aforo.ledger.support;

import aforo.ledger.client.ValueTransferClient;
import aforo.ledger.entity.IdSequence;
import aforo.ledger.entity.Provider;
import aforo.ledger.entity.Subscriber;
import aforo.ledger.repository.ConsumedRegistrationKeyRepository;
import aforo.ledger.repository.IdSequenceRepository;
import aforo.ledger.repository.ProviderRepository;
import aforo.ledger.repository.SubscriberRepository;
import aforo.ledger.repository.WithdrawalRecordRepository;
import aforo.ledger.security.Caller;
import aforo.ledger.service.IdSequenceInitializer;
import aforo.ledger.service.LedgerQueryService;
import aforo.ledger.service.RegistryService;
import aforo.ledger.service.SettlementService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Boots the ledger against in-memory H2 with a controllable clock and a mocked transfer service.
 * Every test starts from empty tables and id sequences reset to zero.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class AbstractLedgerIntegrationTest {

    protected static final Caller ADMIN = Caller.of("admin");
    protected static final Caller OPERATOR = Caller.of("operator");
    protected static final Caller ALICE = Caller.of("alice");
    protected static final Caller BOB = Caller.of("bob");
    protected static final String CUSTODY = "custody";

    private static final AtomicInteger KEY_COUNTER = new AtomicInteger();

    @MockBean
    protected ValueTransferClient valueTransferClient;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected RegistryService registryService;

    @Autowired
    protected SettlementService settlementService;

    @Autowired
    protected LedgerQueryService ledgerQueryService;

    @Autowired
    protected ProviderRepository providerRepository;

    @Autowired
    protected SubscriberRepository subscriberRepository;

    @Autowired
    protected WithdrawalRecordRepository withdrawalRecordRepository;

    @Autowired
    protected ConsumedRegistrationKeyRepository consumedRegistrationKeyRepository;

    @Autowired
    protected IdSequenceRepository idSequenceRepository;

    @Autowired
    private IdSequenceInitializer idSequenceInitializer;

    @BeforeEach
    void resetLedger() {
        withdrawalRecordRepository.deleteAll();
        subscriberRepository.deleteAll();
        providerRepository.deleteAll();
        consumedRegistrationKeyRepository.deleteAll();
        idSequenceInitializer.seedSequences();
        List<IdSequence> sequences = idSequenceRepository.findAll();
        sequences.forEach(sequence -> sequence.setLastValue(0L));
        idSequenceRepository.saveAll(sequences);
        clock.setInstant(TestClockConfig.START);
    }

    protected static byte[] freshKey() {
        return ("registration-key-" + KEY_COUNTER.incrementAndGet()).getBytes(StandardCharsets.UTF_8);
    }

    protected Provider registerProvider(Caller owner, long fee) {
        return registryService.registerProvider(owner, freshKey(), fee);
    }

    protected Subscriber registerSubscriber(Caller owner, long deposit, List<Long> providerIds) {
        return registryService.registerSubscriber(owner, deposit, "basic", providerIds);
    }

    protected Provider reloadProvider(Long id) {
        return providerRepository.findById(id).orElseThrow();
    }

    protected Subscriber reloadSubscriber(Long id) {
        return subscriberRepository.findById(id).orElseThrow();
    }
}
