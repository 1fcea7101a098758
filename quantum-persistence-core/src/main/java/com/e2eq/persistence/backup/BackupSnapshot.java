package com.e2eq.persistence.backup;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * The backup document: the complete store of one backend plus the schema version it was at.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"backend_type", "schema_version", "created_at", "data"})
public class BackupSnapshot {
    @JsonProperty("backend_type")
    protected String backendType;

    @JsonProperty("schema_version")
    protected long schemaVersion;

    /** ISO-8601 local date time. */
    @JsonProperty("created_at")
    protected String createdAt;

    @Builder.Default
    protected Map<String, JsonNode> data = new TreeMap<>();
}
