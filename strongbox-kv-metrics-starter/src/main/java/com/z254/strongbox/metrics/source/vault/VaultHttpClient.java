package com.z254.strongbox.metrics.source.vault;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.strongbox.metrics.domain.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thin read-only client for the Vault HTTP API.
 * <p>
 * Authenticates lazily on first use and reuses the token until the server rejects it.
 * Concurrent walks share one login: at most one authentication runs at a time.
 * Requests are scoped to a namespace with the {@code X-Vault-Namespace} header. Nothing
 * is retried; failures surface as {@link RestClientException}.
 */
public class VaultHttpClient {

    private static final Logger log = LoggerFactory.getLogger(VaultHttpClient.class);

    static final String TOKEN_HEADER = "X-Vault-Token";
    static final String NAMESPACE_HEADER = "X-Vault-Namespace";
    private static final String ROUTE_MISSING_MARKER = "no handler for route";

    private final VaultProperties properties;
    private final RestTemplate restTemplate;
    private final AtomicReference<String> currentToken = new AtomicReference<>();
    private final Object loginLock = new Object();

    public VaultHttpClient(VaultProperties properties, RestTemplate restTemplate) {
        this.properties = properties;
        this.restTemplate = restTemplate;
    }

    /**
     * Client with a {@link RestTemplate} honouring the configured timeouts.
     */
    public static VaultHttpClient create(VaultProperties properties) {
        return new VaultHttpClient(properties, createRestTemplate(properties));
    }

    /**
     * {@code GET <path>?list=true} in the given namespace.
     *
     * @throws HttpClientErrorException.NotFound when the path has no children
     */
    public JsonNode list(Namespace namespace, String path) {
        return get(namespace, path, true);
    }

    /**
     * {@code GET <path>} in the given namespace.
     */
    public JsonNode read(Namespace namespace, String path) {
        return get(namespace, path, false);
    }

    /**
     * Whether a 404 means the path does not route to any mount, as opposed to an
     * empty directory under an existing mount.
     */
    public static boolean isRouteMissing(HttpStatusCodeException e) {
        return e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()
                && e.getResponseBodyAsString().contains(ROUTE_MISSING_MARKER);
    }

    // =========================================================================
    // Requests
    // =========================================================================

    private JsonNode get(Namespace namespace, String path, boolean list) {
        URI uri = buildUri(path, list);
        String token = token();
        HttpEntity<Void> entity = new HttpEntity<>(createHeaders(namespace, token));
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(uri, HttpMethod.GET, entity, JsonNode.class);
            JsonNode body = response.getBody();
            if (body == null) {
                throw new RestClientException("Empty response from Vault for " + path);
            }
            return body;
        } catch (HttpClientErrorException.Unauthorized | HttpClientErrorException.Forbidden e) {
            log.warn("Vault rejected token for {} in namespace {}, re-authenticating on next request",
                    path, namespace.metricLabel());
            // only forget the rejected token; another thread may already hold a fresh one
            currentToken.compareAndSet(token, null);
            throw e;
        }
    }

    private URI buildUri(String path, boolean list) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.buildApiUrl(path));
        if (list) {
            builder.queryParam("list", "true");
        }
        return builder.build().encode().toUri();
    }

    private HttpHeaders createHeaders(Namespace namespace, String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(TOKEN_HEADER, token);
        if (!namespace.isRoot()) {
            headers.set(NAMESPACE_HEADER, trimTrailingSlash(namespace.getPath()));
        }
        return headers;
    }

    // =========================================================================
    // Authentication
    // =========================================================================

    private String token() {
        String token = currentToken.get();
        if (token != null) {
            return token;
        }
        synchronized (loginLock) {
            token = currentToken.get();
            if (token == null) {
                token = authenticate();
                currentToken.set(token);
            }
            return token;
        }
    }

    private String authenticate() {
        String token = switch (properties.getAuthentication()) {
            case TOKEN -> authenticateWithToken();
            case APPROLE -> authenticateWithAppRole();
        };
        log.info("Authenticated with Vault at {} using {}", properties.getUri(), properties.getAuthentication());
        return token;
    }

    private String authenticateWithToken() {
        String token = properties.getToken();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("Vault token not configured");
        }
        return token;
    }

    private String authenticateWithAppRole() {
        String roleId = properties.getRoleId();
        String secretId = properties.getSecretId();
        if (roleId == null || secretId == null) {
            throw new IllegalStateException("Vault AppRole credentials not configured");
        }

        String url = properties.buildApiUrl("auth/" + properties.getApprolePath() + "/login");
        Map<String, String> body = Map.of(
                "role_id", roleId,
                "secret_id", secretId
        );

        ResponseEntity<JsonNode> response = restTemplate.postForEntity(url, body, JsonNode.class);
        JsonNode clientToken = response.getBody() == null
                ? null
                : response.getBody().path("auth").path("client_token");
        if (clientToken == null || !clientToken.isTextual()) {
            throw new RestClientException("AppRole login returned no client token");
        }
        return clientToken.asText();
    }

    private static RestTemplate createRestTemplate(VaultProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectionTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return new RestTemplate(requestFactory);
    }

    private static String trimTrailingSlash(String path) {
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
