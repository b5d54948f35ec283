package com.contextgraph.models;

import com.contextgraph.Identifiers;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Approval {

    private String approvalId = Identifiers.generateId();
    private Actor approver;
    private boolean granted;
    private Instant grantedAt;
    private String reason;

    public Approval() {
    }

    public Approval(Actor approver, boolean granted, Instant grantedAt, String reason) {
        this.approver = approver;
        this.granted = granted;
        this.grantedAt = grantedAt;
        this.reason = reason;
    }

    public String getApprovalId() {
        return approvalId;
    }

    public void setApprovalId(String approvalId) {
        if (approvalId != null && !approvalId.isBlank()) {
            this.approvalId = approvalId;
        }
    }

    public Actor getApprover() {
        return approver;
    }

    public void setApprover(Actor approver) {
        this.approver = approver;
    }

    public boolean isGranted() {
        return granted;
    }

    public void setGranted(boolean granted) {
        this.granted = granted;
    }

    public Instant getGrantedAt() {
        return grantedAt;
    }

    public void setGrantedAt(Instant grantedAt) {
        this.grantedAt = grantedAt;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
