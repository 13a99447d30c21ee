package aforo.ledger.client;

import aforo.ledger.exception.TransferFailedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HTTP Value Transfer Client Tests")
class HttpValueTransferClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private HttpValueTransferClient clientReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://transfers.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new HttpValueTransferClient(webClient);
    }

    @Test
    @DisplayName("Should post payouts to the transfer endpoint")
    void shouldPostPayout() {
        HttpValueTransferClient client = clientReturning(HttpStatus.OK, "{\"success\":true,\"transferId\":\"t-1\"}");

        assertThatCode(() -> client.transfer("alice", 500L)).doesNotThrowAnyException();

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/transfers");
    }

    @Test
    @DisplayName("Should post pulls to the pull endpoint")
    void shouldPostPull() {
        HttpValueTransferClient client = clientReturning(HttpStatus.OK, "{\"success\":true,\"transferId\":\"t-2\"}");

        client.transferFrom("bob", "custody", 300L);

        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/transfers/pull");
    }

    @Test
    @DisplayName("Should fail when the service declines the transfer")
    void shouldFailWhenDeclined() {
        HttpValueTransferClient client = clientReturning(HttpStatus.OK,
                "{\"success\":false,\"reason\":\"insufficient funds\"}");

        assertThatThrownBy(() -> client.transferFrom("bob", "custody", 300L))
                .isInstanceOf(TransferFailedException.class)
                .hasMessageContaining("insufficient funds");
    }

    @Test
    @DisplayName("Should wrap an error status")
    void shouldWrapErrorStatus() {
        HttpValueTransferClient client = clientReturning(HttpStatus.INTERNAL_SERVER_ERROR, "{}");

        assertThatThrownBy(() -> client.transfer("alice", 500L))
                .isInstanceOf(TransferFailedException.class)
                .hasMessageContaining("alice");
    }
}
