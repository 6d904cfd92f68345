package org.jstats.fantasyhub_api.modules.sleeper.client;

import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.junit.jupiter.SpringExtension;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(SpringExtension.class)
@ContextConfiguration(classes = {
        SleeperClientRecoverTests.TestRetryConfig.class,
        SleeperClient.class,
        SleeperClientRecoverTests.TestConfig.class
})
class SleeperClientRecoverTests {

    @Configuration
    @EnableRetry
    static class TestRetryConfig { }

    @Configuration
    static class TestConfig {
        @Bean(name = "sleeper")
        RestClient restClient() {
            return Mockito.mock(RestClient.class, RETURNS_DEEP_STUBS);
        }
    }

    @Autowired
    RestClient restClient;

    @Autowired
    SleeperClient client;

    @BeforeEach
    void resetMocks() {
        reset(restClient);
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private RestClient.ResponseSpec stubChain() {
        RestClient.RequestHeadersUriSpec uriSpec = Mockito.mock(RestClient.RequestHeadersUriSpec.class);
        RestClient.RequestHeadersSpec reqSpec = Mockito.mock(RestClient.RequestHeadersSpec.class);
        RestClient.ResponseSpec respSpec = Mockito.mock(RestClient.ResponseSpec.class);

        Mockito.when(restClient.get()).thenReturn(uriSpec);
        Mockito.when(uriSpec.uri(any(Function.class))).thenReturn(reqSpec);
        Mockito.when(reqSpec.accept(any(MediaType.class))).thenReturn(reqSpec);
        Mockito.when(reqSpec.retrieve()).thenReturn(respSpec);
        Mockito.when(respSpec.onStatus(any(Predicate.class), any(RestClient.ResponseSpec.ErrorHandler.class)))
                .thenReturn(respSpec);
        return respSpec;
    }

    @SuppressWarnings("unchecked")
    private void listCallsAlwaysThrow(RuntimeException toThrow) {
        var respSpec = stubChain();
        Mockito.when(respSpec.body(any(ParameterizedTypeReference.class))).thenThrow(toThrow);
    }

    @Test
    void recover_onUpstream5xx_afterThreeAttempts() {
        listCallsAlwaysThrow(new UpstreamErrors.Upstream5xxException(503));

        var ex = assertThrows(UpstreamErrors.UpstreamUnavailableException.class,
                () -> client.fetchRosters("1048"));
        assertTrue(ex.getMessage().contains("rosters of 1048"));
        verify(restClient, times(3)).get();
    }

    @Test
    void recover_onRateLimit_afterThreeAttempts() {
        listCallsAlwaysThrow(new UpstreamErrors.RateLimitedException(Duration.ofSeconds(5)));

        assertThrows(UpstreamErrors.UpstreamUnavailableException.class,
                () -> client.fetchMatchups("1048", 7));
        verify(restClient, times(3)).get();
    }

    @Test
    void recover_onIo_afterThreeAttempts() {
        listCallsAlwaysThrow(new ResourceAccessException("I/O error"));

        assertThrows(UpstreamErrors.UpstreamUnavailableException.class,
                () -> client.fetchLeagueUsers("1048"));
        verify(restClient, times(3)).get();
    }

    @Test
    void unreadableJson_doesNotRetry() {
        listCallsAlwaysThrow(new HttpMessageConversionException("bad json"));

        assertThrows(UpstreamErrors.UpstreamJsonParseException.class,
                () -> client.fetchRosters("1048"));
        verify(restClient, times(1)).get();
    }

    @Test
    void notFound_isEmpty_withoutRetry() {
        var respSpec = stubChain();
        Mockito.when(respSpec.body(eq(SleeperPayload.User.class)))
                .thenThrow(new UpstreamErrors.NotFoundException("user ghost"));

        assertTrue(client.fetchUser("ghost").isEmpty());
        verify(restClient, times(1)).get();
    }

    @Test
    @SuppressWarnings("unchecked")
    void notFound_onList_isEmptyList() {
        var respSpec = stubChain();
        Mockito.when(respSpec.body(any(ParameterizedTypeReference.class)))
                .thenThrow(new UpstreamErrors.NotFoundException("matchups"));

        assertEquals(List.of(), client.fetchMatchups("1048", 3));
    }

    @Test
    void authFailure_surfacesWithoutRetry() {
        var respSpec = stubChain();
        Mockito.when(respSpec.body(eq(SleeperPayload.League.class)))
                .thenThrow(new UpstreamErrors.UpstreamAuthException(403));

        var ex = assertThrows(UpstreamErrors.UpstreamAuthException.class, () -> client.fetchLeague("1048"));
        assertEquals(403, ex.status);
        verify(restClient, times(1)).get();
    }
}
