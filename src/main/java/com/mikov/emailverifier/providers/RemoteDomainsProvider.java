package com.mikov.emailverifier.providers;

import com.mikov.emailverifier.http.HttpTextFetcher;
import lombok.RequiredArgsConstructor;

/**
 * Downloads the list from a URL on every load.
 */
@RequiredArgsConstructor
public class RemoteDomainsProvider extends LineFeedDomainsProvider {
    private final String url;
    private final HttpTextFetcher httpTextFetcher;

    @Override
    protected String obtainData() {
        return httpTextFetcher.fetch(url);
    }

    @Override
    public String getDescription() {
        return url;
    }
}
