package com.contextgraph.tools;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a named operation is a read (evidence) or a write (action).
 *
 * Rules are evaluated in order and the first one that answers wins:
 * <ol>
 *   <li>exact match in the explicit write set</li>
 *   <li>exact match in the explicit read set</li>
 *   <li>case-insensitive substring match against {@link #WRITE_TOKENS}</li>
 *   <li>otherwise read</li>
 * </ol>
 * Explicit configuration always beats the heuristic, and the heuristic only ever
 * looks for write tokens.
 */
public class ToolClassifier {

    public static final List<String> WRITE_TOKENS = List.of(
        "create", "update", "delete", "send", "post", "put", "patch", "write", "set", "add", "remove"
    );

    private final Set<String> writeTools;
    private final Set<String> readTools;
    private final List<Rule> rules;

    public ToolClassifier() {
        this(Set.of(), Set.of());
    }

    public ToolClassifier(Collection<String> writeTools, Collection<String> readTools) {
        this.writeTools = writeTools != null ? Set.copyOf(writeTools) : Set.of();
        this.readTools = readTools != null ? Set.copyOf(readTools) : Set.of();
        this.rules = List.of(
            name -> this.writeTools.contains(name) ? Optional.of(ToolKind.WRITE) : Optional.empty(),
            name -> this.readTools.contains(name) ? Optional.of(ToolKind.READ) : Optional.empty(),
            ToolClassifier::matchWriteToken
        );
    }

    public static ToolKind classify(String toolName, Collection<String> writeTools, Collection<String> readTools) {
        return new ToolClassifier(writeTools, readTools).classify(toolName);
    }

    public ToolKind classify(String toolName) {
        String name = toolName != null ? toolName : "";
        for (Rule rule : rules) {
            Optional<ToolKind> decided = rule.apply(name);
            if (decided.isPresent()) {
                return decided.get();
            }
        }
        return ToolKind.READ;
    }

    public boolean isWriteTool(String toolName) {
        return classify(toolName) == ToolKind.WRITE;
    }

    public Set<String> getWriteTools() {
        return writeTools;
    }

    public Set<String> getReadTools() {
        return readTools;
    }

    private static Optional<ToolKind> matchWriteToken(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String token : WRITE_TOKENS) {
            if (lower.contains(token)) {
                return Optional.of(ToolKind.WRITE);
            }
        }
        return Optional.empty();
    }

    @FunctionalInterface
    private interface Rule {
        Optional<ToolKind> apply(String toolName);
    }
}
