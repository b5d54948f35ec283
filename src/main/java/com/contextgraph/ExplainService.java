package com.contextgraph;

import com.contextgraph.models.Action;
import com.contextgraph.models.ActionStep;
import com.contextgraph.models.Approval;
import com.contextgraph.models.ApprovalStep;
import com.contextgraph.models.DecisionRecord;
import com.contextgraph.models.Evidence;
import com.contextgraph.models.EvidenceStep;
import com.contextgraph.models.Explanation;
import com.contextgraph.models.PolicyEval;
import com.contextgraph.models.PolicyResult;
import com.contextgraph.models.PolicyStep;
import com.contextgraph.storage.DecisionStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds the reasoning chain of a stored decision.
 */
public class ExplainService {

    private final DecisionStore store;

    public ExplainService(DecisionStore store) {
        this.store = store;
    }

    /**
     * @return null when no decision has that id
     */
    public Explanation explain(String decisionId) {
        DecisionRecord record = store.get(decisionId);
        return record != null ? explain(record) : null;
    }

    public Explanation explain(DecisionRecord record) {
        List<EvidenceStep> evidenceChain = new ArrayList<>();
        int step = 1;
        for (Evidence evidence : record.getEvidence()) {
            evidenceChain.add(new EvidenceStep(step++, evidence.getSource(), evidence.getToolName(),
                evidence.getRetrievedAt(), evidence.getSnapshotHash()));
        }

        List<PolicyStep> policyChain = new ArrayList<>();
        step = 1;
        for (PolicyEval policy : record.getPolicies()) {
            policyChain.add(new PolicyStep(step++, policy.getPolicyId(), policy.getVersion(),
                policy.getResult(), policy.getMessage()));
        }

        List<ApprovalStep> approvalChain = new ArrayList<>();
        step = 1;
        for (Approval approval : record.getApprovals()) {
            String approverId = approval.getApprover() != null ? approval.getApprover().getId() : null;
            approvalChain.add(new ApprovalStep(step++, approverId,
                approval.getApprover() != null ? approval.getApprover().getType() : null,
                approval.isGranted(), approval.getGrantedAt(), approval.getReason()));
        }

        List<ActionStep> actionChain = new ArrayList<>();
        step = 1;
        for (Action action : record.getActions()) {
            actionChain.add(new ActionStep(step++, action.getTool(), action.getOperation(),
                action.getCommittedAt(), action.isSuccess()));
        }

        return new Explanation(record, evidenceChain, policyChain, approvalChain, actionChain, summarize(record));
    }

    /**
     * e.g. {@code "Gathered 2 pieces of evidence. Evaluated 2 policies (1 passed).
     * Executed 1/2 actions. Outcome: denied."}
     */
    static String summarize(DecisionRecord record) {
        List<String> parts = new ArrayList<>();
        if (!record.getEvidence().isEmpty()) {
            parts.add("Gathered " + record.getEvidence().size() + " pieces of evidence");
        }
        if (!record.getPolicies().isEmpty()) {
            long passed = record.getPolicies().stream().filter(p -> p.getResult() == PolicyResult.PASS).count();
            parts.add("Evaluated " + record.getPolicies().size() + " policies (" + passed + " passed)");
        }
        if (!record.getApprovals().isEmpty()) {
            long granted = record.getApprovals().stream().filter(Approval::isGranted).count();
            parts.add("Received " + granted + "/" + record.getApprovals().size() + " approvals");
        }
        if (!record.getActions().isEmpty()) {
            long succeeded = record.getActions().stream().filter(Action::isSuccess).count();
            parts.add("Executed " + succeeded + "/" + record.getActions().size() + " actions");
        }
        parts.add("Outcome: " + record.getOutcome());
        return String.join(". ", parts) + ".";
    }
}
