package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.dtos.GravatarData;
import com.mikov.emailverifier.exception.ConnectionException;
import com.mikov.emailverifier.model.EmailParts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Validator that checks whether the address has a custom Gravatar image.
 * Gravatar is asked to answer 404 instead of serving a generated image; a 200 whose body is
 * the known default image is treated as absent too.
 */
@Slf4j
public class GravatarValidator implements EmailChecker<GravatarData, Void> {

    public static final String GRAVATAR_BASE_URL = "https://www.gravatar.com/avatar";
    public static final String GRAVATAR_DEFAULT_MD5 = "d5fe5cbcc31cff5f8ac010db72eb000c";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public GravatarValidator(final RestTemplate restTemplate, final String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static String emailHash(final EmailParts email) {
        final var normalized = email.toStringNoPlus().toLowerCase(Locale.ROOT);
        return DigestUtils.md5DigestAsHex(normalized.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public GravatarData check(final EmailParts email, final Void context) {
        final var avatarUrl = baseUrl + "/" + emailHash(email);
        final byte[] body;
        try {
            body = restTemplate.getForObject(avatarUrl + "?d=404", byte[].class);
        } catch (final HttpClientErrorException.NotFound e) {
            log.debug("No Gravatar for {}", email.toStringNoPlus());
            return new GravatarData(null);
        } catch (final RestClientException e) {
            log.error("Gravatar lookup for {} failed: {}", email.toStringNoPlus(), e.getMessage());
            throw new ConnectionException("Gravatar lookup failed for " + avatarUrl, e);
        }

        if (body == null || GRAVATAR_DEFAULT_MD5.equals(DigestUtils.md5DigestAsHex(body))) {
            log.debug("Gravatar for {} is the default image", email.toStringNoPlus());
            return new GravatarData(null);
        }
        return new GravatarData(avatarUrl);
    }

    @Override
    public String getName() {
        return "gravatar";
    }
}
