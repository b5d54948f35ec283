package com.contextgraph.storage;

import com.contextgraph.models.DecisionRecord;
import com.contextgraph.models.Outcome;
import com.contextgraph.models.PrecedentMatch;

import java.io.IOException;
import java.util.List;

/**
 * Durable home of decision records, keyed by {@code decision_id}.
 */
public interface DecisionStore {

    int DEFAULT_PRECEDENT_LIMIT = 10;
    int MAX_PRECEDENT_LIMIT = 50;

    /**
     * Insert, or update the mutable part of an existing record: outcome,
     * outcome_reason, evidence, policies, approvals and actions. Every other field
     * keeps its first-written value.
     *
     * @throws IllegalArgumentException when a required field is missing
     * @throws IOException              when the record cannot be persisted
     */
    UpsertResult upsert(DecisionRecord record) throws IOException;

    DecisionRecord get(String decisionId);

    /**
     * Newest first by record timestamp.
     */
    List<DecisionRecord> list(DecisionQuery query);

    /**
     * Past decisions that evaluated {@code policyId} and/or invoked {@code tool}, newest
     * first. All filters are optional.
     */
    List<PrecedentMatch> searchPrecedents(String policyId, String tool, Outcome outcome, int limit);

    String describe();
}
