package com.z254.strongbox.metrics.source.vault;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.KvMount;
import com.z254.strongbox.metrics.source.KvStorage;
import com.z254.strongbox.metrics.source.StorageListException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Key listings through the KV engines' list endpoints.
 * <p>
 * For a versioned mount the walker starts at {@code metadata/}, which is exactly the
 * engine's list API, so version history is never listed.
 */
public class VaultKvStorage implements KvStorage {

    private final VaultHttpClient client;

    public VaultKvStorage(VaultHttpClient client) {
        this.client = client;
    }

    @Override
    public List<String> listChildren(CollectionContext context, KvMount mount, String key) {
        context.ensureActive();
        JsonNode response;
        try {
            response = client.list(mount.getNamespace(), mount.getMountPoint() + key);
        } catch (HttpClientErrorException.NotFound e) {
            if (VaultHttpClient.isRouteMissing(e)) {
                throw StorageListException.mountMissing(mount, key);
            }
            return List.of();
        } catch (RestClientException | IllegalStateException e) {
            throw new StorageListException(mount, key,
                    "Failed to list '" + key + "' under " + mount, e);
        }

        List<String> children = new ArrayList<>();
        for (JsonNode child : response.path("data").path("keys")) {
            children.add(child.asText());
        }
        return children;
    }
}
