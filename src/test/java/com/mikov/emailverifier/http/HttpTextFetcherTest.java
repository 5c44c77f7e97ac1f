package com.mikov.emailverifier.http;

import com.mikov.emailverifier.exception.ConnectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpTextFetcherTest {
    private static final String URL = "https://lists.example.org/domains.txt";

    private MockRestServiceServer server;
    private HttpTextFetcher fetcher;

    @BeforeEach
    void setUp() {
        final var restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        fetcher = new HttpTextFetcher(restTemplate, 3, Duration.ZERO);
    }

    @Test
    void returnsBody() {
        server.expect(requestTo(URL)).andRespond(withSuccess("a.com\nb.com", MediaType.TEXT_PLAIN));

        assertThat(fetcher.fetch(URL)).isEqualTo("a.com\nb.com");
        server.verify();
    }

    @Test
    void decodesUtf8WhenNoCharsetIsDeclared() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("рф\nсайт.рф".getBytes(StandardCharsets.UTF_8), MediaType.TEXT_PLAIN));

        assertThat(fetcher.fetch(URL)).isEqualTo("рф\nсайт.рф");
    }

    @Test
    void honoursDeclaredCharset() {
        final var latin1 = new MediaType("text", "plain", StandardCharsets.ISO_8859_1);
        server.expect(requestTo(URL))
                .andRespond(withSuccess("café.fr".getBytes(StandardCharsets.ISO_8859_1), latin1));

        assertThat(fetcher.fetch(URL)).isEqualTo("café.fr");
    }

    @Test
    void retriesServerErrorsAndTransportFailures() {
        server.expect(requestTo(URL)).andRespond(withServerError());
        server.expect(requestTo(URL)).andRespond(withException(new IOException("connection reset")));
        server.expect(requestTo(URL)).andRespond(withSuccess("a.com", MediaType.TEXT_PLAIN));

        assertThat(fetcher.fetch(URL)).isEqualTo("a.com");
        server.verify();
    }

    @Test
    void failsAfterExhaustingRetries() {
        server.expect(times(3), requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> fetcher.fetch(URL))
                .isInstanceOf(ConnectionException.class)
                .hasCauseInstanceOf(org.springframework.web.client.HttpServerErrorException.class);
        server.verify();
    }

    @Test
    void clientErrorFailsImmediately() {
        server.expect(times(1), requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> fetcher.fetch(URL))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("404");
        server.verify();
    }
}
