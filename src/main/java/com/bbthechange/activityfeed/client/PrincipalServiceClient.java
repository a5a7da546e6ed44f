package com.bbthechange.activityfeed.client;

import com.bbthechange.activityfeed.exception.PrincipalServiceException;
import com.bbthechange.activityfeed.model.EmailPreference;
import com.bbthechange.activityfeed.model.PrincipalProfile;
import com.bbthechange.activityfeed.model.Visibility;
import com.bbthechange.activityfeed.service.PrincipalDirectory;
import com.bbthechange.activityfeed.service.RecipientResolver;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Client for the principal service, which owns users, groups, tenants and their relationships.
 *
 * Nothing is cached here: every call is a live lookup. A principal the service no longer knows
 * is treated as invisible with no followers or members. Any other failure is thrown as a
 * {@link PrincipalServiceException} so the caller can retry the whole event.
 */
@Component
public class PrincipalServiceClient implements PrincipalDirectory, RecipientResolver {

    private static final Logger logger = LoggerFactory.getLogger(PrincipalServiceClient.class);

    private static final int MAX_RETRIES = 3;
    private static final long[] RETRY_DELAYS_MS = {200, 400, 800};

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;

    @Autowired
    public PrincipalServiceClient(
            ObjectMapper objectMapper,
            @Value("${principal-service.base-url:http://localhost:8081}") String baseUrl,
            @Value("${principal-service.request-timeout:PT5S}") Duration requestTimeout) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    PrincipalServiceClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.requestTimeout = Duration.ofSeconds(5);
    }

    @Override
    public Visibility currentVisibility(String principalId) {
        return profile(principalId).map(PrincipalProfile::getVisibility).orElse(null);
    }

    /**
     * Checks a single follow relationship; 404 means the user does not (or no longer) follow.
     */
    @Override
    public boolean isFollowerOf(String userId, String principalId) {
        return get("/principals/" + encode(principalId) + "/followers/" + encode(userId)).isPresent();
    }

    @Override
    public boolean isMemberOf(String userId, String groupId) {
        return membersOf(groupId).contains(userId);
    }

    @Override
    public String tenantOf(String principalId) {
        return profile(principalId).map(PrincipalProfile::getTenantAlias).orElse(null);
    }

    @Override
    public boolean isSameOrFederatedTenant(String tenantA, String tenantB) {
        if (tenantA == null || tenantB == null) {
            return false;
        }
        if (Objects.equals(tenantA, tenantB)) {
            return true;
        }
        String path = "/tenants/" + encode(tenantA) + "/federation/" + encode(tenantB);
        return get(path)
                .map(node -> node.path("federated").asBoolean(false))
                .orElse(false);
    }

    @Override
    public EmailPreference emailPreferenceOf(String userId) {
        return profile(userId).map(PrincipalProfile::getEmailPreference).orElse(null);
    }

    @Override
    public String timezoneOf(String principalId) {
        return profile(principalId).map(PrincipalProfile::getTimezone).orElse(null);
    }

    @Override
    public Set<String> followersOf(String principalId) {
        return idList("/principals/" + encode(principalId) + "/followers");
    }

    @Override
    public Set<String> membersOf(String groupId) {
        return idList("/principals/" + encode(groupId) + "/members");
    }

    private Optional<PrincipalProfile> profile(String principalId) {
        String path = "/principals/" + encode(principalId);
        return get(path).map(node -> convert(node, PrincipalProfile.class, path));
    }

    private Set<String> idList(String path) {
        List<String> ids = get(path)
                .map(node -> convert(node, new TypeReference<List<String>>() {}, path))
                .orElse(List.of());
        return new LinkedHashSet<>(ids);
    }

    private <T> T convert(JsonNode node, Class<T> type, String path) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (Exception e) {
            throw PrincipalServiceException.unavailable(path, e);
        }
    }

    private <T> T convert(JsonNode node, TypeReference<T> type, String path) {
        try {
            return objectMapper.readValue(objectMapper.treeAsTokens(node), type);
        } catch (Exception e) {
            throw PrincipalServiceException.unavailable(path, e);
        }
    }

    /**
     * GET with retry on rate limiting. Empty when the service answers 404.
     */
    private Optional<JsonNode> get(String path) {
        int attempt = 0;
        Exception lastException = null;

        while (attempt < MAX_RETRIES) {
            try {
                return Optional.of(fetch(path));
            } catch (PrincipalServiceException e) {
                if (Integer.valueOf(404).equals(e.getStatusCode())) {
                    logger.debug("Principal service has no entry for {}", path);
                    return Optional.empty();
                }
                throw e;
            } catch (RateLimitException e) {
                attempt++;
                lastException = e;

                if (attempt < MAX_RETRIES) {
                    long delayMs = RETRY_DELAYS_MS[attempt - 1];
                    logger.warn("Rate limited by principal service (attempt {}/{}). Retrying in {}ms",
                            attempt, MAX_RETRIES, delayMs);
                    sleep(delayMs);
                }
            } catch (Exception e) {
                throw PrincipalServiceException.unavailable(path, e);
            }
        }

        throw PrincipalServiceException.unavailable(path, lastException);
    }

    private JsonNode fetch(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        int statusCode = response.statusCode();
        logger.debug("Principal service response status: {} for {}", statusCode, path);

        if (statusCode == 404) {
            throw PrincipalServiceException.notFound(path);
        }

        if (statusCode == 429) {
            throw new RateLimitException("Rate limited by principal service");
        }

        if (statusCode < 200 || statusCode >= 300) {
            throw new PrincipalServiceException("Principal service returned status " + statusCode + " for " + path,
                    statusCode);
        }

        return objectMapper.readTree(response.body());
    }

    /**
     * Sleep for the specified duration.
     * Package-private for testing.
     */
    void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PrincipalServiceException("Interrupted while waiting for retry", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Internal exception for rate limiting that triggers retry.
     */
    private static class RateLimitException extends RuntimeException {
        RateLimitException(String message) {
            super(message);
        }
    }
}
