package com.contextgraph.storage;

import com.contextgraph.AppLogger;
import com.contextgraph.models.Action;
import com.contextgraph.models.DecisionRecord;
import com.contextgraph.models.Outcome;
import com.contextgraph.models.PolicyEval;
import com.contextgraph.models.PrecedentMatch;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Decision records as one JSON file each under {@code {dataDir}/decisions/}, indexed
 * in memory at startup.
 *
 * Writes are serialized on the store's monitor and go to disk before the index is
 * updated, so a failed write leaves the previous version visible.
 */
public class FileDecisionStore implements DecisionStore {

    private static final Comparator<DecisionRecord> NEWEST_FIRST =
        Comparator.comparing(DecisionRecord::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(DecisionRecord::getDecisionId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Path decisionsDir;
    private final ObjectMapper objectMapper;
    private final Map<String, DecisionRecord> records = new ConcurrentHashMap<>();
    private final AppLogger logger = AppLogger.get();

    public FileDecisionStore(Path dataDir, ObjectMapper objectMapper) throws IOException {
        this.decisionsDir = dataDir.resolve("decisions");
        this.objectMapper = objectMapper;
        Files.createDirectories(decisionsDir);
        loadFromDisk();
    }

    @Override
    public synchronized UpsertResult upsert(DecisionRecord record) throws IOException {
        validate(record);
        DecisionRecord incoming = copyOf(record);
        DecisionRecord existing = records.get(incoming.getDecisionId());

        DecisionRecord stored;
        UpsertResult result;
        if (existing == null) {
            stored = incoming;
            result = UpsertResult.CREATED;
        } else {
            stored = copyOf(existing);
            stored.setOutcome(incoming.getOutcome());
            stored.setOutcomeReason(incoming.getOutcomeReason());
            stored.setEvidence(incoming.getEvidence());
            stored.setPolicies(incoming.getPolicies());
            stored.setApprovals(incoming.getApprovals());
            stored.setActions(incoming.getActions());
            result = UpsertResult.UPDATED;
        }

        JsonStorage.writeJsonAtomic(fileFor(stored.getDecisionId()), stored, objectMapper);
        records.put(stored.getDecisionId(), stored);
        logger.info("[FileDecisionStore] Decision " + result.getValue() + ": " + stored.getDecisionId()
            + " (run " + stored.getRunId() + ", " + stored.getOutcome() + ")");
        return result;
    }

    @Override
    public DecisionRecord get(String decisionId) {
        if (decisionId == null) {
            return null;
        }
        DecisionRecord record = records.get(decisionId);
        return record != null ? copyOf(record) : null;
    }

    @Override
    public List<DecisionRecord> list(DecisionQuery query) {
        DecisionQuery q = query != null ? query : DecisionQuery.all();
        return records.values().stream()
            .filter(r -> q.getRunId() == null || q.getRunId().equals(r.getRunId()))
            .filter(r -> q.getOutcome() == null || q.getOutcome() == r.getOutcome())
            .sorted(NEWEST_FIRST)
            .skip(q.getOffset())
            .limit(q.getLimit())
            .map(this::copyOf)
            .collect(Collectors.toList());
    }

    @Override
    public List<PrecedentMatch> searchPrecedents(String policyId, String tool, Outcome outcome, int limit) {
        if (limit < 1 || limit > MAX_PRECEDENT_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PRECEDENT_LIMIT);
        }
        String policy = blankToNull(policyId);
        String toolName = blankToNull(tool);
        return records.values().stream()
            .filter(r -> outcome == null || outcome == r.getOutcome())
            .filter(r -> policy == null || r.getPolicies().stream().anyMatch(p -> policy.equals(p.getPolicyId())))
            .filter(r -> toolName == null || r.getActions().stream().anyMatch(a -> toolName.equals(a.getTool())))
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .map(FileDecisionStore::toPrecedent)
            .collect(Collectors.toList());
    }

    @Override
    public String describe() {
        return "file:" + decisionsDir;
    }

    public int size() {
        return records.size();
    }

    private static PrecedentMatch toPrecedent(DecisionRecord record) {
        List<String> policies = record.getPolicies().stream()
            .map(PolicyEval::getPolicyId)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
        List<String> tools = record.getActions().stream()
            .map(Action::getTool)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
        return new PrecedentMatch(record.getDecisionId(), record.getRunId(), record.getTimestamp(),
            record.getOutcome(), policies, tools);
    }

    static void validate(DecisionRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("Decision record is required");
        }
        if (record.getDecisionId() == null || record.getDecisionId().isBlank()) {
            throw new IllegalArgumentException("Missing required field: decision_id");
        }
        if (record.getRunId() == null || record.getRunId().isBlank()) {
            throw new IllegalArgumentException("Missing required field: run_id");
        }
        if (record.getTimestamp() == null) {
            throw new IllegalArgumentException("Missing required field: timestamp");
        }
        if (record.getOutcome() == null) {
            throw new IllegalArgumentException("Missing required field: outcome");
        }
    }

    private DecisionRecord copyOf(DecisionRecord record) {
        return objectMapper.convertValue(record, DecisionRecord.class);
    }

    private Path fileFor(String decisionId) {
        return decisionsDir.resolve(sanitize(decisionId) + ".json");
    }

    static String sanitize(String decisionId) {
        return decisionId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private void loadFromDisk() throws IOException {
        records.clear();
        int skipped = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(decisionsDir, "*.json")) {
            for (Path file : stream) {
                try {
                    DecisionRecord record = objectMapper.readValue(
                        Files.readString(file, StandardCharsets.UTF_8), DecisionRecord.class);
                    validate(record);
                    records.put(record.getDecisionId(), record);
                } catch (IOException | IllegalArgumentException e) {
                    skipped++;
                    logger.warn("[FileDecisionStore] Skipping unreadable decision file "
                        + file.getFileName() + " (" + e.getMessage() + ")");
                }
            }
        }
        logger.info("[FileDecisionStore] Loaded " + records.size() + " decisions from " + decisionsDir
            + (skipped > 0 ? " (" + skipped + " skipped)" : ""));
    }
}
