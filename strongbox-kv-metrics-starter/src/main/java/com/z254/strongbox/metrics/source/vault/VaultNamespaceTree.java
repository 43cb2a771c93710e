package com.z254.strongbox.metrics.source.vault;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.Namespace;
import com.z254.strongbox.metrics.source.NamespaceAccessException;
import com.z254.strongbox.metrics.source.NamespaceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Namespace tree read from {@code sys/namespaces}.
 * <p>
 * A 404 means the parent has no child namespaces, which is also what servers without
 * namespace support answer.
 */
public class VaultNamespaceTree implements NamespaceTree {

    private static final Logger log = LoggerFactory.getLogger(VaultNamespaceTree.class);

    static final String NAMESPACES_PATH = "sys/namespaces";

    private final VaultHttpClient client;

    public VaultNamespaceTree(VaultHttpClient client) {
        this.client = client;
    }

    @Override
    public List<Namespace> children(CollectionContext context, Namespace parent) {
        context.ensureActive();
        JsonNode response;
        try {
            response = client.list(parent, NAMESPACES_PATH);
        } catch (HttpClientErrorException.NotFound e) {
            return List.of();
        } catch (RestClientException | IllegalStateException e) {
            throw new NamespaceAccessException(
                    "Failed to list child namespaces of " + parent.metricLabel(), e);
        }

        JsonNode data = response.path("data");
        JsonNode keyInfo = data.path("key_info");
        List<Namespace> children = new ArrayList<>();
        for (JsonNode keyNode : data.path("keys")) {
            String key = keyNode.asText();
            JsonNode info = keyInfo.path(key);
            String path = info.hasNonNull("path") ? info.get("path").asText() : parent.getPath() + key;
            String id = info.hasNonNull("id") ? info.get("id").asText() : path;
            children.add(new Namespace(id, path));
        }
        log.debug("Namespace {} has {} child namespaces", parent.metricLabel(), children.size());
        return children;
    }
}
