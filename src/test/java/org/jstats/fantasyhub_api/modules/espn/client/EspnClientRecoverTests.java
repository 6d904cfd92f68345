package org.jstats.fantasyhub_api.modules.espn.client;

import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.junit.jupiter.SpringExtension;
import org.springframework.web.client.RestClient;

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
        EspnClientRecoverTests.TestRetryConfig.class,
        EspnClient.class,
        EspnClientRecoverTests.TestConfig.class
})
class EspnClientRecoverTests {

    @Configuration
    @EnableRetry
    static class TestRetryConfig { }

    @Configuration
    static class TestConfig {
        @Bean(name = "espn")
        RestClient restClient() {
            return Mockito.mock(RestClient.class, RETURNS_DEEP_STUBS);
        }
    }

    @Autowired
    RestClient restClient;

    @Autowired
    EspnClient client;

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

    @Test
    void returnsBody() {
        var league = new EspnPayload.League(77L, 2024, 7, null, null, List.of(), List.of(), List.of());
        var respSpec = stubChain();
        Mockito.when(respSpec.body(eq(EspnPayload.League.class))).thenReturn(league);

        var fetched = client.fetchLeague("77", "2024");

        assertTrue(fetched.isPresent());
        assertEquals(77L, fetched.get().id());
    }

    @Test
    void expiredCookies_surfaceAsAuthFailure_withoutRetry() {
        var respSpec = stubChain();
        Mockito.when(respSpec.body(eq(EspnPayload.League.class)))
                .thenThrow(new UpstreamErrors.UpstreamAuthException(401));

        assertThrows(UpstreamErrors.UpstreamAuthException.class, () -> client.fetchWeek("77", "2024", 7));
        verify(restClient, times(1)).get();
    }

    @Test
    void recover_onUpstream5xx_afterThreeAttempts() {
        var respSpec = stubChain();
        Mockito.when(respSpec.body(eq(EspnPayload.League.class)))
                .thenThrow(new UpstreamErrors.Upstream5xxException(502));

        var ex = assertThrows(UpstreamErrors.UpstreamUnavailableException.class,
                () -> client.fetchWeek("77", "2024", 7));
        assertTrue(ex.getMessage().contains("week 7"));
        verify(restClient, times(3)).get();
    }

    @Test
    void notFound_isEmpty() {
        var respSpec = stubChain();
        Mockito.when(respSpec.body(eq(EspnPayload.League.class)))
                .thenThrow(new UpstreamErrors.NotFoundException("league 77"));

        assertTrue(client.fetchLeague("77", "2024").isEmpty());
    }
}
