package com.mikov.emailverifier.providers;

import com.mikov.emailverifier.http.HttpTextFetcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DomainsProviderTest {

    private static LineFeedDomainsProvider fromText(final String text) {
        return new LineFeedDomainsProvider() {
            @Override
            protected String obtainData() {
                return text;
            }
        };
    }

    @Test
    void parsesOneEntryPerLine() {
        final var entries = fromText("// comment\nGmail.com\r\n\n  yahoo.com  \n// another\nbücher.de\n").provide();

        assertThat(entries).containsExactlyInAnyOrder("gmail.com", "yahoo.com", "xn--bcher-kva.de");
    }

    @Test
    void skipsLinesThatCannotBeEncoded() {
        final var entries = fromText("good.com\n" + "a".repeat(70) + ".com\n").provide();

        assertThat(entries).containsExactly("good.com");
    }

    @Test
    void readsBundledResource() {
        final var provider = new ResourceDomainsProvider("/offline-data/disposable.txt");

        assertThat(provider.provide()).contains("mailinator.com", "yopmail.com");
        assertThat(provider.getDescription()).isEqualTo("classpath:/offline-data/disposable.txt");
    }

    @Test
    void rejectsMissingResource() {
        assertThatThrownBy(() -> new ResourceDomainsProvider("/offline-data/missing.txt"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readsFileOnEveryLoad(@TempDir final Path dir) throws IOException {
        final var file = dir.resolve("domains.txt");
        Files.writeString(file, "first.com\n");
        final var provider = new FileDomainsProvider(file);

        assertThat(provider.provide()).containsExactly("first.com");

        Files.writeString(file, "first.com\nsecond.com\n");
        assertThat(provider.provide()).containsExactlyInAnyOrder("first.com", "second.com");
    }

    @Test
    void rejectsMissingFileAndDirectory(@TempDir final Path dir) {
        assertThatThrownBy(() -> new FileDomainsProvider(dir.resolve("missing.txt")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FileDomainsProvider(dir))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void downloadsRemoteList() {
        final var fetcher = mock(HttpTextFetcher.class);
        when(fetcher.fetch("https://lists.example.org/free.txt")).thenReturn("gmail.com\noutlook.com\n");
        final var provider = new RemoteDomainsProvider("https://lists.example.org/free.txt", fetcher);

        assertThat(provider.provide()).containsExactlyInAnyOrder("gmail.com", "outlook.com");
        assertThat(provider.getDescription()).isEqualTo("https://lists.example.org/free.txt");
    }

    @Test
    void keepsUnicodeEntriesOfRemoteListServedWithoutCharset() {
        final var restTemplate = new RestTemplate();
        final var server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo("https://lists.example.org/tlds.txt"))
                .andRespond(withSuccess("рф\nсайт.рф".getBytes(StandardCharsets.UTF_8), MediaType.TEXT_PLAIN));
        final var provider = new RemoteDomainsProvider("https://lists.example.org/tlds.txt",
                new HttpTextFetcher(restTemplate, 1, Duration.ZERO));

        assertThat(provider.provide()).containsExactly("xn--p1ai", "xn--80aswg.xn--p1ai");
    }
}
