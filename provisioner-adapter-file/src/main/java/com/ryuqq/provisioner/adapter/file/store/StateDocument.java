package com.ryuqq.provisioner.adapter.file.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.RunSuffix;
import com.ryuqq.provisioner.core.statemachine.ResourceStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shape of the state file.
 *
 * <pre>
 * {
 *   "version" : 1,
 *   "runSuffix" : "20240101-abcd1234",
 *   "resources" : {
 *     "STORAGE:uploads" : {
 *       "name" : "inventory-uploads-20240101-abcd1234",
 *       "identifier" : "arn:aws:s3:::inventory-uploads-20240101-abcd1234",
 *       "status" : "CREATED",
 *       "updatedAt" : "2024-01-01T12:00:00Z"
 *     }
 *   },
 *   "outputs" : { "uploads-bucket" : "inventory-uploads-20240101-abcd1234" }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record StateDocument(
    @JsonProperty("version") int version,
    @JsonProperty("runSuffix") String runSuffix,
    @JsonProperty("resources") LinkedHashMap<String, HandleDocument> resources,
    @JsonProperty("outputs") LinkedHashMap<String, String> outputs
) {

    static final int CURRENT_VERSION = 1;

    static StateDocument from(DeploymentRecord record) {
        LinkedHashMap<String, HandleDocument> resources = new LinkedHashMap<>();
        for (ResourceHandle handle : record.resources().values()) {
            resources.put(handle.key().toString(), HandleDocument.from(handle));
        }
        return new StateDocument(CURRENT_VERSION, record.runSuffix().getValue(), resources,
            new LinkedHashMap<>(record.outputs()));
    }

    DeploymentRecord toRecord() {
        if (version > CURRENT_VERSION) {
            throw new IllegalArgumentException("Unsupported state file version: " + version);
        }
        Map<ResourceKey, ResourceHandle> handles = new LinkedHashMap<>();
        if (resources != null) {
            for (Map.Entry<String, HandleDocument> entry : resources.entrySet()) {
                ResourceKey key = ResourceKey.parse(entry.getKey());
                handles.put(key, entry.getValue().toHandle(key));
            }
        }
        return DeploymentRecord.restore(RunSuffix.of(runSuffix), handles,
            outputs == null ? Map.of() : outputs);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HandleDocument(
        @JsonProperty("name") String name,
        @JsonProperty("identifier") String identifier,
        @JsonProperty("status") ResourceStatus status,
        @JsonProperty("updatedAt") Instant updatedAt
    ) {

        static HandleDocument from(ResourceHandle handle) {
            return new HandleDocument(handle.name(), handle.identifier(), handle.status(), handle.updatedAt());
        }

        ResourceHandle toHandle(ResourceKey key) {
            if (key == null) {
                throw new IllegalArgumentException("key cannot be null");
            }
            return new ResourceHandle(key, name, identifier, status, updatedAt);
        }
    }
}
