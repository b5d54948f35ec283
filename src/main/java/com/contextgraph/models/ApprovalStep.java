package com.contextgraph.models;

import java.time.Instant;

public final class ApprovalStep extends ChainStep {

    private final String approverId;
    private final ActorType approverType;
    private final boolean granted;
    private final Instant grantedAt;
    private final String reason;

    public ApprovalStep(int step, String approverId, ActorType approverType, boolean granted,
                        Instant grantedAt, String reason) {
        super(step, "approval", (granted ? "Approved" : "Denied") + " by " + approverId);
        this.approverId = approverId;
        this.approverType = approverType;
        this.granted = granted;
        this.grantedAt = grantedAt;
        this.reason = reason;
    }

    public String getApproverId() {
        return approverId;
    }

    public ActorType getApproverType() {
        return approverType;
    }

    public boolean isGranted() {
        return granted;
    }

    public Instant getGrantedAt() {
        return grantedAt;
    }

    public String getReason() {
        return reason;
    }
}
