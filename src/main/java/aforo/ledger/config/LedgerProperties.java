package aforo.ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Ledger configuration bound from {@code aforo.ledger.*}.
 */
@Component
@ConfigurationProperties(prefix = "aforo.ledger")
@Validated
@Data
public class LedgerProperties {

    /**
     * Lowest hourly fee a provider may register with or change to.
     */
    @PositiveOrZero
    private long minimalFee = 50L;

    /**
     * Cap on registered providers. Zero disables the cap.
     */
    @PositiveOrZero
    private int maxProviders = 0;

    /**
     * Principal allowed to run administrative operations (status toggles, removals).
     */
    @NotBlank
    private String adminPrincipal = "ledger-admin";

    /**
     * Principal recorded as operator of every provider the ledger registers.
     * Scheduled withdrawals run under this identity.
     */
    @NotBlank
    private String operatorPrincipal = "ledger-operator";

    /**
     * Account holding subscriber deposits; payouts are sent from it.
     */
    @NotBlank
    private String custodyAccount = "ledger-custody";

    @Valid
    private Registration registration = new Registration();

    @Valid
    private Settlement settlement = new Settlement();

    @Valid
    private TransferService transferService = new TransferService();

    @Data
    public static class Registration {

        /**
         * Smallest accepted provider list on subscriber registration (inclusive).
         */
        @Min(1)
        private int minProviders = 3;

        /**
         * Largest accepted provider list on subscriber registration (inclusive).
         */
        @Min(1)
        private int maxProviders = 14;

        /**
         * Reject a subscriber whose deposit does not cover {@link #depositMonths} fees of
         * every provider it joins. When false the shortfall is only logged.
         */
        private boolean enforceMinimumDeposit = true;

        @Positive
        private int depositMonths = 2;
    }

    @Data
    public static class Settlement {

        @NotNull
        private OverdraftPolicy overdraftPolicy = OverdraftPolicy.CLAMP;
    }

    @Data
    public static class TransferService {

        @NotBlank
        private String baseUrl = "http://localhost:8090";

        @Positive
        private int timeoutSeconds = 10;
    }

    /**
     * What a withdrawal does when a subscriber's balance cannot cover its share.
     */
    public enum OverdraftPolicy {
        /** Debit the full share; the balance may go negative. */
        ALLOW,
        /** Debit what the balance covers; the remainder is forgone. */
        CLAMP,
        /** Abort the whole withdrawal. */
        REJECT
    }
}
