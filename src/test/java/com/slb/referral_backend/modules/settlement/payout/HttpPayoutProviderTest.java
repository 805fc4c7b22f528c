package com.slb.referral_backend.modules.settlement.payout;

import com.slb.referral_backend.modules.settlement.config.PayoutProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class HttpPayoutProviderTest {

    private final Deque<ClientResponse> responses = new ArrayDeque<>();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private HttpPayoutProvider provider;

    @BeforeEach
    void setUp() {
        PayoutProperties properties = new PayoutProperties();
        properties.setBaseUrl("http://payout.test");
        properties.setApiKey("secret-key");
        properties.setMaxRetries(1);
        properties.setRetryBackoffMs(1);
        properties.setPerHostQps(1000);

        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            ClientResponse next = responses.poll();
            return Mono.just(next != null ? next : status(HttpStatus.INTERNAL_SERVER_ERROR, "no response queued"));
        });
        provider = new HttpPayoutProvider(builder, properties);
    }

    @Test
    void payout_sendsIdempotencyKeyAndReturnsReference() {
        responses.add(json(HttpStatus.OK, "{\"id\":\"po_123\"}"));

        PayoutResult result = provider.payout("acct_7", new BigDecimal("50.00"), "7:2024-W23");

        assertThat(result.success()).isTrue();
        assertThat(result.reference()).isEqualTo("po_123");
        ClientRequest request = requests.get(0);
        assertThat(request.url().toString()).isEqualTo("http://payout.test/v1/payouts");
        assertThat(request.headers().getFirst(HttpPayoutProvider.IDEMPOTENCY_HEADER)).isEqualTo("7:2024-W23");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret-key");
    }

    @Test
    void payout_transientServerError_isRetriedWithSameKey() {
        responses.add(status(HttpStatus.SERVICE_UNAVAILABLE, "busy"));
        responses.add(json(HttpStatus.OK, "{\"id\":\"po_124\"}"));

        PayoutResult result = provider.payout("acct_7", new BigDecimal("50.00"), "7:2024-W23");

        assertThat(result.success()).isTrue();
        assertThat(requests).hasSize(2);
        assertThat(requests).allSatisfy(r ->
                assertThat(r.headers().getFirst(HttpPayoutProvider.IDEMPOTENCY_HEADER)).isEqualTo("7:2024-W23"));
    }

    @Test
    void payout_persistentServerError_failsAfterRetries() {
        responses.add(status(HttpStatus.SERVICE_UNAVAILABLE, "busy"));
        responses.add(status(HttpStatus.SERVICE_UNAVAILABLE, "still busy"));

        PayoutResult result = provider.payout("acct_7", new BigDecimal("50.00"), "7:2024-W23");

        assertThat(result.success()).isFalse();
        assertThat(result.failureReason()).startsWith("HTTP_503");
        assertThat(requests).hasSize(2);
    }

    @Test
    void payout_clientError_isNotRetried() {
        responses.add(status(HttpStatus.BAD_REQUEST, "bad destination"));

        PayoutResult result = provider.payout("acct_7", new BigDecimal("50.00"), "7:2024-W23");

        assertThat(result.failureReason()).isEqualTo("HTTP_400: bad destination");
        assertThat(requests).hasSize(1);
    }

    @Test
    void payout_acceptedWithoutReference_isFailure() {
        responses.add(json(HttpStatus.OK, "{\"status\":\"queued\"}"));

        assertThat(provider.payout("acct_7", BigDecimal.TEN, "7:2024-W23").failureReason())
                .isEqualTo("PROVIDER_NO_REFERENCE");
    }

    @Test
    void payout_missingDestination_makesNoRequest() {
        assertThat(provider.payout(" ", BigDecimal.TEN, "7:2024-W23").success()).isFalse();
        assertThat(requests).isEmpty();
    }

    @Test
    void canReceivePayouts_readsReadinessFlag() {
        responses.add(json(HttpStatus.OK, "{\"ready\":true}"));
        responses.add(json(HttpStatus.OK, "{\"ready\":false,\"reason\":\"KYC_PENDING\"}"));

        assertThat(provider.canReceivePayouts("acct_7").ready()).isTrue();
        PayoutReadiness notReady = provider.canReceivePayouts("acct_7");

        assertThat(notReady.ready()).isFalse();
        assertThat(notReady.reason()).isEqualTo("KYC_PENDING");
        assertThat(requests.get(0).url().getPath()).isEqualTo("/v1/accounts/acct_7/readiness");
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static ClientResponse status(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                .body(body)
                .build();
    }
}
