package com.mikov.emailverifier.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mikov.emailverifier.cache.MxRecordCache;
import com.mikov.emailverifier.smtp.dns.CachingMxLookupBackend;
import com.mikov.emailverifier.smtp.dns.DnsJavaLookupBackend;
import com.mikov.emailverifier.smtp.dns.DnsOverHttpsLookupBackend;
import com.mikov.emailverifier.smtp.dns.MxLookupBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.SimpleResolver;

import java.net.InetAddress;
import java.net.UnknownHostException;

@Slf4j
@Configuration
public class DnsConfig {

    public static final String GOOGLE_DNS = "8.8.8.8";

    @Bean
    public MxRecordCache mxRecordCache(final EmailVerifierProperties properties) {
        final var mx = properties.getMx();
        return new MxRecordCache(mx.getCacheTtl().toMillis(), mx.getCacheMaxSize());
    }

    @Bean
    public MxLookupBackend mxLookupBackend(final EmailVerifierProperties properties,
                                           final RestTemplate restTemplate,
                                           final ObjectMapper objectMapper,
                                           final MxRecordCache mxRecordCache) throws UnknownHostException {
        final var mx = properties.getMx();
        final MxLookupBackend backend;
        if (mx.getBackend() == EmailVerifierProperties.MxBackend.DNS) {
            log.info("Using DNS backend for MX lookups (server: {})", blankToDefault(mx.getDnsServer()));
            backend = new DnsJavaLookupBackend(resolver(mx));
        } else {
            log.info("Using DNS-over-HTTPS backend for MX lookups ({})", mx.getDohUrl());
            backend = new DnsOverHttpsLookupBackend(restTemplate, objectMapper, mx.getDohUrl());
        }
        return new CachingMxLookupBackend(backend, mxRecordCache);
    }

    static Resolver resolver(final EmailVerifierProperties.Mx mx) throws UnknownHostException {
        if (mx.getDnsServer() == null || mx.getDnsServer().isBlank()) {
            return null;
        }
        final InetAddress dnsServer = InetAddress.getByName(mx.getDnsServer());
        final Resolver resolver = new SimpleResolver(dnsServer);
        resolver.setTimeout(mx.getDnsTimeout());
        return resolver;
    }

    private static String blankToDefault(final String dnsServer) {
        return dnsServer == null || dnsServer.isBlank() ? "system default" : dnsServer;
    }
}
