package aforo.ledger.client;

import aforo.ledger.client.dto.TransferRequest;
import aforo.ledger.client.dto.TransferResponse;
import aforo.ledger.exception.TransferFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Value-transfer client backed by the custody service's HTTP API.
 */
@Component
@Slf4j
public class HttpValueTransferClient implements ValueTransferClient {

    private static final String TRANSFER_PATH = "/api/transfers";
    private static final String TRANSFER_FROM_PATH = "/api/transfers/pull";

    private final WebClient webClient;

    public HttpValueTransferClient(@Qualifier("valueTransferWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public void transfer(String to, long amount) {
        post(TRANSFER_PATH, TransferRequest.builder().to(to).amount(amount).build());
    }

    @Override
    public void transferFrom(String from, String to, long amount) {
        post(TRANSFER_FROM_PATH, TransferRequest.builder().from(from).to(to).amount(amount).build());
    }

    private void post(String path, TransferRequest request) {
        String description = describe(request);
        try {
            log.debug("Requesting {}", description);

            TransferResponse response = webClient.post()
                    .uri(path)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(TransferResponse.class)
                    .block();

            if (response == null) {
                throw new TransferFailedException("Empty response for " + description);
            }
            if (!response.isSuccess()) {
                throw new TransferFailedException("Declined " + description + ": " + response.getReason());
            }

            log.info("Completed {} as transfer {}", description, response.getTransferId());

        } catch (TransferFailedException e) {
            log.error("Transfer rejected: {}", e.getMessage());
            throw e;
        } catch (WebClientResponseException e) {
            log.error("Error during {}: {} - {}", description, e.getStatusCode(), e.getResponseBodyAsString());
            throw new TransferFailedException("Failed " + description + ": " + e.getMessage(), e);
        } catch (Exception e) {
            log.error("Error during {}: {}", description, e.getMessage(), e);
            throw new TransferFailedException("Failed " + description + ": " + e.getMessage(), e);
        }
    }

    private String describe(TransferRequest request) {
        if (request.getFrom() == null) {
            return "transfer of " + request.getAmount() + " to " + request.getTo();
        }
        return "transfer of " + request.getAmount() + " from " + request.getFrom() + " to " + request.getTo();
    }
}
