package com.contextgraph.models;

import com.contextgraph.Identifiers;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Map;

/**
 * A write/commit observation. Only actions make a run auditable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Action {

    private String actionId = Identifiers.generateId();
    private String tool;
    private String operation;
    private EntityRef targetEntity;
    private Instant committedAt;
    private Map<String, Object> params;
    private Map<String, Object> result;
    private boolean success = true;

    public Action() {
    }

    public Action(String tool, Instant committedAt, Map<String, Object> params,
                  Map<String, Object> result, boolean success) {
        this.tool = tool;
        this.committedAt = committedAt;
        this.params = params;
        this.result = result;
        this.success = success;
    }

    public String getActionId() {
        return actionId;
    }

    public void setActionId(String actionId) {
        if (actionId != null && !actionId.isBlank()) {
            this.actionId = actionId;
        }
    }

    public String getTool() {
        return tool;
    }

    public void setTool(String tool) {
        this.tool = tool;
    }

    public String getOperation() {
        return operation;
    }

    public void setOperation(String operation) {
        this.operation = operation;
    }

    public EntityRef getTargetEntity() {
        return targetEntity;
    }

    public void setTargetEntity(EntityRef targetEntity) {
        this.targetEntity = targetEntity;
    }

    public Instant getCommittedAt() {
        return committedAt;
    }

    public void setCommittedAt(Instant committedAt) {
        this.committedAt = committedAt;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public void setParams(Map<String, Object> params) {
        this.params = params;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public void setResult(Map<String, Object> result) {
        this.result = result;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }
}
