package com.agora.forum.oauth;

import com.agora.forum.config.OAuthProperties;
import com.agora.forum.entity.AuthProvider;
import com.agora.forum.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Verifies Google ID tokens through Google's tokeninfo endpoint.
 *
 * Any non-2xx answer, timeout or unreadable body is a {@link ProviderException}.
 * When {@code oauth.google.client-ids} is configured, the token's audience
 * must be one of them.
 */
@Slf4j
@Component
public class GoogleTokenVerifier implements ProviderVerifier {

    private final RestTemplate restTemplate;
    private final String tokenInfoUrl;
    private final List<String> clientIds;

    public GoogleTokenVerifier(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                               OAuthProperties properties) {
        this.restTemplate = restTemplate;
        this.tokenInfoUrl = properties.getGoogle().getTokenInfoUrl();
        this.clientIds = List.copyOf(properties.getGoogle().getClientIds());
    }

    @Override
    public AuthProvider provider() {
        return AuthProvider.GOOGLE;
    }

    @Override
    public ProviderIdentity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new ProviderException("empty google token");
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(tokenInfoUrl)
                .queryParam("id_token", token)
                .build()
                .encode()
                .toUri();

        GoogleTokenInfo info;
        try {
            ResponseEntity<GoogleTokenInfo> response = restTemplate.getForEntity(uri, GoogleTokenInfo.class);
            info = response.getBody();
        } catch (HttpStatusCodeException e) {
            throw new ProviderException("google rejected token with status " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new ProviderException("google tokeninfo unreachable", e);
        } catch (RestClientException e) {
            throw new ProviderException("unreadable google tokeninfo response", e);
        }

        if (info == null || isBlank(info.getSub()) || isBlank(info.getEmail())) {
            throw new ProviderException("google tokeninfo response missing subject or email");
        }
        if (!clientIds.isEmpty() && !clientIds.contains(info.getAud())) {
            throw new ProviderException("google token issued for another audience");
        }
        if (!Boolean.parseBoolean(info.getEmailVerified())) {
            throw new ProviderException("email not verified");
        }

        return ProviderIdentity.builder()
                .subjectId(info.getSub())
                .email(info.getEmail())
                .emailVerified(true)
                .pictureUrl(isBlank(info.getPicture()) ? null : info.getPicture())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
