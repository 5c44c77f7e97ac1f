package com.mikov.emailverifier.config;

import com.mikov.emailverifier.smtp.dns.DnsOverHttpsLookupBackend;
import com.mikov.emailverifier.validation.GravatarValidator;
import com.mikov.emailverifier.validation.RegistrabilityValidator;
import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Settings bound from {@code emailverifier.*}. Checked by {@link #validate()} as soon as binding completes.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "emailverifier")
public class EmailVerifierProperties implements InitializingBean {

    public static final String DISPOSABLE_STRICT_URL =
            "https://raw.githubusercontent.com/disposable/disposable-email-domains/master/domains_strict.txt";
    public static final String DISPOSABLE_NORMAL_URL =
            "https://raw.githubusercontent.com/disposable/disposable-email-domains/master/domains.txt";
    public static final String FREE_URL =
            "https://gist.githubusercontent.com/okutbay/5b4974b70673dfdcc21c517632c1f984/raw/daa988474b832059612f1b2468fba6cfcd2390dd/free_email_provider_domains.txt";
    public static final String ROLE_BASED_URL =
            "https://raw.githubusercontent.com/mbalatsko/role-based-email-addresses-list/main/list.txt";

    /**
     * Use bundled data only and disable the checks that need the network.
     */
    private boolean offline = false;

    private Registrability registrability =
            Registrability.of(RegistrabilityValidator.MOZILLA_PSL_URL, RegistrabilityValidator.MOZILLA_PSL_RESOURCE_FILE);
    private Dataset disposable = Dataset.of(DISPOSABLE_STRICT_URL, "/offline-data/disposable.txt");
    private Dataset free = Dataset.of(FREE_URL, "/offline-data/free.txt");
    private Dataset roleBased = Dataset.of(ROLE_BASED_URL, "/offline-data/role-based.txt");
    private Mx mx = new Mx();
    private Gravatar gravatar = new Gravatar();
    private Smtp smtp = new Smtp();
    private Http http = new Http();
    private Executor executor = new Executor();

    public enum Source {
        REMOTE,
        BUNDLED,
        FILE
    }

    public enum MxBackend {
        DOH,
        DNS
    }

    /**
     * Source actually used for a dataset, taking the offline override into account.
     */
    public Source effectiveSource(final Dataset dataset) {
        if (offline && dataset.getSource() == Source.REMOTE) {
            return Source.BUNDLED;
        }
        return dataset.getSource();
    }

    public boolean isMxActive() {
        return mx.isEnabled() && !offline;
    }

    public boolean isGravatarActive() {
        return gravatar.isEnabled() && !offline;
    }

    public boolean isSmtpActive() {
        return smtp.isEnabled() && !offline;
    }

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    /**
     * Rejects combinations that cannot work.
     *
     * @throws IllegalStateException describing the first problem found
     */
    public void validate() {
        validateDataset("registrability", registrability);
        validateDataset("disposable", disposable);
        validateDataset("free", free);
        validateDataset("role-based", roleBased);

        if (smtp.isEnabled() && !mx.isEnabled()) {
            throw new IllegalStateException("emailverifier.smtp.enabled requires emailverifier.mx.enabled");
        }
        requirePositive("emailverifier.smtp.max-retries", smtp.getMaxRetries());
        requirePositive("emailverifier.smtp.timeout", smtp.getTimeout());
        if (smtp.getProxyHost() != null && !smtp.getProxyHost().isBlank() && smtp.getProxyPort() <= 0) {
            throw new IllegalStateException("emailverifier.smtp.proxy-host requires a positive emailverifier.smtp.proxy-port");
        }

        requirePositive("emailverifier.mx.cache-ttl", mx.getCacheTtl());
        requirePositive("emailverifier.mx.dns-timeout", mx.getDnsTimeout());
        requirePositive("emailverifier.mx.cache-max-size", mx.getCacheMaxSize());

        requirePositive("emailverifier.http.max-retries", http.getMaxRetries());
        requirePositive("emailverifier.http.connect-timeout", http.getConnectTimeout());
        requirePositive("emailverifier.http.read-timeout", http.getReadTimeout());
        if (http.getRetryDelay() == null || http.getRetryDelay().isNegative()) {
            throw new IllegalStateException("emailverifier.http.retry-delay must not be negative");
        }

        requirePositive("emailverifier.executor.core-pool-size", executor.getCorePoolSize());
        requirePositive("emailverifier.executor.max-pool-size", executor.getMaxPoolSize());
        if (executor.getMaxPoolSize() < executor.getCorePoolSize()) {
            throw new IllegalStateException("emailverifier.executor.max-pool-size must not be below core-pool-size");
        }
        if (executor.getQueueCapacity() < 0) {
            throw new IllegalStateException("emailverifier.executor.queue-capacity must not be negative");
        }
    }

    private void validateDataset(final String name, final Dataset dataset) {
        if (!dataset.isEnabled()) {
            return;
        }
        final var source = effectiveSource(dataset);
        if (source == null) {
            throw new IllegalStateException("emailverifier." + name + ".source is required");
        }
        if (source == Source.FILE && (dataset.getFilePath() == null || dataset.getFilePath().isBlank())) {
            throw new IllegalStateException("emailverifier." + name + ".file-path is required for source FILE");
        }
        if (source == Source.REMOTE && (dataset.getUrl() == null || dataset.getUrl().isBlank())) {
            throw new IllegalStateException("emailverifier." + name + ".url is required for source REMOTE");
        }
        if (source == Source.BUNDLED && (dataset.getResource() == null || dataset.getResource().isBlank())) {
            throw new IllegalStateException("emailverifier." + name + ".resource is required for source BUNDLED");
        }
    }

    private static void requirePositive(final String name, final int value) {
        if (value <= 0) {
            throw new IllegalStateException(name + " must be positive");
        }
    }

    private static void requirePositive(final String name, final Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException(name + " must be positive");
        }
    }

    @Getter
    @Setter
    public static class Dataset {
        private boolean enabled = true;
        private Source source = Source.REMOTE;
        private String url;
        /**
         * Classpath location of the bundled copy.
         */
        private String resource;
        private String filePath;
        private List<String> allow = new ArrayList<>();
        private List<String> deny = new ArrayList<>();

        static Dataset of(final String url, final String resource) {
            final var dataset = new Dataset();
            dataset.setUrl(url);
            dataset.setResource(resource);
            return dataset;
        }
    }

    @Getter
    @Setter
    public static class Registrability extends Dataset {
        /**
         * Extra suffix rules in public suffix list syntax, applied after the loaded list.
         */
        private Set<String> customRules = new LinkedHashSet<>();

        static Registrability of(final String url, final String resource) {
            final var registrability = new Registrability();
            registrability.setUrl(url);
            registrability.setResource(resource);
            return registrability;
        }
    }

    @Getter
    @Setter
    public static class Mx {
        private boolean enabled = true;
        private MxBackend backend = MxBackend.DOH;
        private String dohUrl = DnsOverHttpsLookupBackend.GOOGLE_DOH_URL;
        /**
         * DNS server for the DNS backend. Blank means the system resolver.
         */
        private String dnsServer = DnsConfig.GOOGLE_DNS;
        private Duration dnsTimeout = Duration.ofSeconds(3);
        private Duration cacheTtl = Duration.ofHours(1);
        private int cacheMaxSize = 1000;
    }

    @Getter
    @Setter
    public static class Gravatar {
        private boolean enabled = true;
        private String baseUrl = GravatarValidator.GRAVATAR_BASE_URL;
    }

    @Getter
    @Setter
    public static class Smtp {
        private boolean enabled = false;
        private boolean catchAllCheck = true;
        private int maxRetries = 2;
        private Duration timeout = Duration.ofSeconds(5);
        private String heloDomain = "example.com";
        private String fromEmail = "check@example.com";
        private String proxyHost;
        private int proxyPort;
    }

    @Getter
    @Setter
    public static class Http {
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Executor {
        private int corePoolSize = 10;
        private int maxPoolSize = 50;
        private int queueCapacity = 100;
    }
}
