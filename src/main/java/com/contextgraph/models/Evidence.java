package com.contextgraph.models;

import com.contextgraph.Identifiers;
import com.contextgraph.tools.Payloads;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Map;

/**
 * A read observation. Never authorizes anything by itself.
 *
 * <p>{@code snapshotHash} is always derived from {@code snapshot}: setting a snapshot
 * recomputes it, and a supplied hash is only kept when there is no snapshot to derive
 * it from. The snapshot is held as a frozen copy of plain JSON values, the same form
 * the store writes and reads back, so the hash survives persistence unchanged.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Evidence {

    private String evidenceId = Identifiers.generateId();
    private String source;
    private Instant retrievedAt;
    private EntityRef entityRef;
    private Map<String, Object> snapshot;
    private String snapshotHash;
    private String toolName;
    private Map<String, Object> toolArgs;

    public Evidence() {
    }

    public Evidence(String source, Instant retrievedAt) {
        this.source = source;
        this.retrievedAt = retrievedAt;
    }

    public String getEvidenceId() {
        return evidenceId;
    }

    public void setEvidenceId(String evidenceId) {
        if (evidenceId != null && !evidenceId.isBlank()) {
            this.evidenceId = evidenceId;
        }
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Instant getRetrievedAt() {
        return retrievedAt;
    }

    public void setRetrievedAt(Instant retrievedAt) {
        this.retrievedAt = retrievedAt;
    }

    public EntityRef getEntityRef() {
        return entityRef;
    }

    public void setEntityRef(EntityRef entityRef) {
        this.entityRef = entityRef;
    }

    public Map<String, Object> getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(Map<String, Object> snapshot) {
        this.snapshot = Payloads.asMap(snapshot);
        this.snapshotHash = this.snapshot != null ? Identifiers.generateHash(this.snapshot) : null;
    }

    public String getSnapshotHash() {
        return snapshotHash;
    }

    public void setSnapshotHash(String snapshotHash) {
        if (snapshot == null) {
            this.snapshotHash = snapshotHash;
        }
    }

    public String getToolName() {
        return toolName;
    }

    public void setToolName(String toolName) {
        this.toolName = toolName;
    }

    public Map<String, Object> getToolArgs() {
        return toolArgs;
    }

    public void setToolArgs(Map<String, Object> toolArgs) {
        this.toolArgs = toolArgs;
    }
}
