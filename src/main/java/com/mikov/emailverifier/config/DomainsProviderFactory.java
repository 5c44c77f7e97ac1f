package com.mikov.emailverifier.config;

import com.mikov.emailverifier.http.HttpTextFetcher;
import com.mikov.emailverifier.providers.DomainsProvider;
import com.mikov.emailverifier.providers.FileDomainsProvider;
import com.mikov.emailverifier.providers.RemoteDomainsProvider;
import com.mikov.emailverifier.providers.ResourceDomainsProvider;
import lombok.RequiredArgsConstructor;

import java.nio.file.Path;

/**
 * Picks the {@link DomainsProvider} implementation a dataset is configured for.
 */
@RequiredArgsConstructor
public class DomainsProviderFactory {
    private final EmailVerifierProperties properties;
    private final HttpTextFetcher httpTextFetcher;

    public DomainsProvider create(final EmailVerifierProperties.Dataset dataset) {
        final var source = properties.effectiveSource(dataset);
        if (source == EmailVerifierProperties.Source.FILE) {
            return new FileDomainsProvider(Path.of(dataset.getFilePath()));
        }
        if (source == EmailVerifierProperties.Source.BUNDLED) {
            return new ResourceDomainsProvider(dataset.getResource());
        }
        return new RemoteDomainsProvider(dataset.getUrl(), httpTextFetcher);
    }
}
