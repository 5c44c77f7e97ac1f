package com.mikov.emailverifier.config;

import com.mikov.emailverifier.http.HttpTextFetcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(final EmailVerifierProperties properties) {
        final var http = properties.getHttp();
        final var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) http.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) http.getReadTimeout().toMillis());
        return new RestTemplate(requestFactory);
    }

    @Bean
    public HttpTextFetcher httpTextFetcher(final RestTemplate restTemplate, final EmailVerifierProperties properties) {
        final var http = properties.getHttp();
        return new HttpTextFetcher(restTemplate, http.getMaxRetries(), http.getRetryDelay());
    }
}
