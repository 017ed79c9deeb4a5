package cull.email.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cull.email.app.entity.OAuthToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

/**
 * Keeps a valid Gmail access token, using the OAuth2 refresh-token grant.
 * The refresh token itself comes from configuration; the consent flow that
 * produced it happens elsewhere.
 */
@Slf4j
@Service
public class TokenRefreshService {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final OAuthToken token = new OAuthToken();

    @Value("${cull.oauth.client-id:}")
    private String clientId;

    @Value("${cull.oauth.client-secret:}")
    private String clientSecret;

    @Value("${cull.oauth.token-uri:https://oauth2.googleapis.com/token}")
    private String tokenUri;

    public TokenRefreshService(
            @Value("${cull.oauth.refresh-token:}") String refreshToken,
            @Value("${cull.oauth.access-token:}") String accessToken) {
        this.restTemplate = new RestTemplate();
        this.objectMapper = new ObjectMapper();
        token.setRefreshToken(refreshToken == null || refreshToken.isEmpty() ? null : refreshToken);
        if (accessToken != null && !accessToken.isEmpty()) {
            token.setAccessToken(accessToken);
            // expiry unknown, a 401 triggers a refresh
            token.setExpiry(Instant.now().plusSeconds(3600));
        }
    }

    private void validateClientCredentials() {
        if (clientId == null || clientId.isEmpty()) {
            throw new IllegalStateException("Google OAuth client-id is not configured. Please set cull.oauth.client-id");
        }
        if (clientSecret == null || clientSecret.isEmpty()) {
            throw new IllegalStateException("Google OAuth client-secret is not configured. Please set cull.oauth.client-secret");
        }
    }

    /**
     * Returns the cached access token, refreshing it first if it is missing or
     * expires within the next 5 minutes.
     */
    public synchronized String ensureValidAccessToken() {
        Instant now = Instant.now();
        boolean needsRefresh = token.getAccessToken() == null
            || token.getExpiry() == null
            || token.getExpiry().isBefore(now.plusSeconds(300));

        if (needsRefresh) {
            if (token.getRefreshToken() == null) {
                throw new IllegalStateException("Access token expired and no refresh token available. Please set cull.oauth.refresh-token.");
            }
            try {
                log.info("Refreshing Gmail access token");
                refreshAccessToken();
            } catch (RuntimeException e) {
                log.error("Failed to refresh access token: {}", e.getMessage(), e);
                throw new IllegalStateException("Failed to refresh access token. Error: " + e.getMessage(), e);
            }
        }
        return token.getAccessToken();
    }

    /**
     * Handles 401 Unauthorized by refreshing regardless of the cached expiry.
     */
    public synchronized String refreshTokenOn401() {
        if (token.getRefreshToken() == null) {
            throw new IllegalStateException("Received 401 Unauthorized and no refresh token available. Please re-authenticate.");
        }
        log.info("Received 401, refreshing Gmail access token");
        refreshAccessToken();
        return token.getAccessToken();
    }

    synchronized void refreshAccessToken() {
        validateClientCredentials();

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

            MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
            body.add("client_id", clientId);
            body.add("client_secret", clientSecret);
            body.add("refresh_token", token.getRefreshToken());
            body.add("grant_type", "refresh_token");

            HttpEntity<MultiValueMap<String, String>> request = new HttpEntity<>(body, headers);
            ResponseEntity<String> response = restTemplate.postForEntity(tokenUri, request, String.class);

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                String errorBody = response.getBody() != null ? response.getBody() : "No response body";
                throw new IllegalStateException("Failed to refresh token. Status: " + response.getStatusCode() + ", Body: " + errorBody);
            }

            JsonNode jsonResponse = objectMapper.readTree(response.getBody());
            if (!jsonResponse.has("access_token")) {
                throw new IllegalStateException("Token refresh response missing access_token");
            }

            long expiresInSeconds = jsonResponse.has("expires_in")
                ? jsonResponse.get("expires_in").asLong()
                : 3600;
            Instant expiresAt = Instant.now().plusSeconds(expiresInSeconds);

            token.setAccessToken(jsonResponse.get("access_token").asText());
            token.setExpiry(expiresAt);
            if (jsonResponse.has("refresh_token") && !jsonResponse.get("refresh_token").isNull()) {
                token.setRefreshToken(jsonResponse.get("refresh_token").asText());
            }
            if (jsonResponse.has("scope")) {
                token.setScopes(jsonResponse.get("scope").asText());
            }
            log.info("Token refreshed successfully, expires at: {}", expiresAt);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Error refreshing access token: " + e.getMessage(), e);
        }
    }

    OAuthToken getToken() {
        return token;
    }
}
