package com.z254.strongbox.metrics.source.vault;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for reading namespaces, mount tables and key listings from a
 * Vault-compatible server.
 * <p>
 * Configuration example:
 * <pre>
 * strongbox:
 *   metrics:
 *     kv:
 *       source: vault
 *       vault:
 *         uri: https://vault.example.com:8200
 *         authentication: approle
 *         role-id: ${VAULT_ROLE_ID}
 *         secret-id: ${VAULT_SECRET_ID}
 * </pre>
 * The token needs {@code list} capability on {@code sys/namespaces}, {@code read} on
 * {@code sys/mounts} and {@code list} on every KV mount to be counted.
 */
@ConfigurationProperties(prefix = "strongbox.metrics.kv.vault")
public class VaultProperties {

    /**
     * Vault server URI.
     */
    private String uri = "http://localhost:8200";

    /**
     * Authentication method: token or approle.
     */
    private AuthMethod authentication = AuthMethod.TOKEN;

    /**
     * Vault token for token authentication.
     */
    private String token;

    /**
     * AppRole role ID for approle authentication.
     */
    private String roleId;

    /**
     * AppRole secret ID for approle authentication.
     */
    private String secretId;

    /**
     * Mount path of the AppRole auth method.
     */
    private String approlePath = "approle";

    /**
     * Connection timeout.
     */
    private Duration connectionTimeout = Duration.ofSeconds(5);

    /**
     * Read timeout.
     */
    private Duration readTimeout = Duration.ofSeconds(15);

    public enum AuthMethod {
        TOKEN,
        APPROLE
    }

    /**
     * Full URL of an API path, e.g. {@code sys/mounts}.
     */
    public String buildApiUrl(String path) {
        String base = uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri;
        return base + "/v1/" + path;
    }

    // Getters and Setters

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
    }

    public AuthMethod getAuthentication() {
        return authentication;
    }

    public void setAuthentication(AuthMethod authentication) {
        this.authentication = authentication;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getRoleId() {
        return roleId;
    }

    public void setRoleId(String roleId) {
        this.roleId = roleId;
    }

    public String getSecretId() {
        return secretId;
    }

    public void setSecretId(String secretId) {
        this.secretId = secretId;
    }

    public String getApprolePath() {
        return approlePath;
    }

    public void setApprolePath(String approlePath) {
        this.approlePath = approlePath;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public void setConnectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }
}
