package com.mikov.emailverifier.smtp.dns;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mikov.emailverifier.exception.ConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * MX lookups through a DNS-over-HTTPS JSON endpoint such as https://dns.google/resolve.
 */
@Slf4j
public class DnsOverHttpsLookupBackend implements MxLookupBackend {

    public static final String GOOGLE_DOH_URL = "https://dns.google/resolve";
    private static final int MX_TYPE = 15;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public DnsOverHttpsLookupBackend(final RestTemplate restTemplate, final ObjectMapper objectMapper, final String baseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    @Override
    public List<MxRecord> getMxRecords(final String hostname) {
        final var uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("name", hostname)
                .queryParam("type", "MX")
                .build()
                .toUri();
        log.debug("Querying DoH server for MX records: {}", uri);

        final DnsResponse response;
        try {
            final var raw = restTemplate.getForObject(uri, String.class);
            log.trace("DoH server response: {}", raw);
            response = raw == null ? new DnsResponse() : objectMapper.readValue(raw, DnsResponse.class);
        } catch (final Exception e) {
            log.error("DoH lookup for {} at {} failed: {}", hostname, baseUrl, e.getMessage());
            throw new ConnectionException("Failed to query DoH server for " + hostname, e);
        }

        final var records = new ArrayList<MxRecord>();
        if (response.answer != null) {
            for (final var answer : response.answer) {
                if (answer.type != MX_TYPE || answer.data == null) {
                    continue;
                }
                final var parts = answer.data.trim().split("\\s+");
                if (parts.length != 2) {
                    log.warn("Invalid MX record format: {}", answer.data);
                    continue;
                }
                try {
                    records.add(new MxRecord(stripTrailingDot(parts[1]), Integer.parseInt(parts[0])));
                } catch (final NumberFormatException e) {
                    log.warn("Invalid MX priority in record: {}", answer.data);
                }
            }
        }

        records.sort(Comparator.comparingInt(MxRecord::priority));
        log.debug("Parsed {} MX records for {}", records.size(), hostname);
        return records;
    }

    private static String stripTrailingDot(final String exchange) {
        return exchange.endsWith(".") ? exchange.substring(0, exchange.length() - 1) : exchange;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class DnsResponse {
        @JsonProperty("Answer")
        private List<Answer> answer;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class Answer {
        @JsonProperty("type")
        private int type;
        @JsonProperty("data")
        private String data;
    }
}
