package com.z254.strongbox.metrics.source.vault;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.strongbox.metrics.domain.CollectionContext;
import com.z254.strongbox.metrics.domain.MountEntry;
import com.z254.strongbox.metrics.domain.Namespace;
import com.z254.strongbox.metrics.source.MountTable;
import com.z254.strongbox.metrics.source.MountTableException;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Mount table read from {@code sys/mounts}.
 */
public class VaultMountTable implements MountTable {

    static final String MOUNTS_PATH = "sys/mounts";

    private final VaultHttpClient client;

    public VaultMountTable(VaultHttpClient client) {
        this.client = client;
    }

    @Override
    public List<MountEntry> listMounts(CollectionContext context, Namespace namespace) {
        context.ensureActive();
        JsonNode response;
        try {
            response = client.read(namespace, MOUNTS_PATH);
        } catch (RestClientException | IllegalStateException e) {
            throw new MountTableException(namespace,
                    "Failed to read mount table of namespace " + namespace.metricLabel(), e);
        }

        // Older servers return the mounts at the top level next to the response envelope
        JsonNode mounts = response.has("data") ? response.get("data") : response;
        List<MountEntry> entries = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = mounts.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode mount = field.getValue();
            if (!mount.isObject() || !mount.hasNonNull("type")) {
                continue;
            }
            MountEntry.MountEntryBuilder entry = MountEntry.builder()
                    .path(field.getKey())
                    .type(mount.get("type").asText());
            Iterator<Map.Entry<String, JsonNode>> options = mount.path("options").fields();
            while (options.hasNext()) {
                Map.Entry<String, JsonNode> option = options.next();
                if (!option.getValue().isNull()) {
                    entry.option(option.getKey(), option.getValue().asText());
                }
            }
            entries.add(entry.build());
        }
        return entries;
    }
}
