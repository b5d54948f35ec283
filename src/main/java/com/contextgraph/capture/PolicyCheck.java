package com.contextgraph.capture;

import java.util.Map;

/**
 * Externally supplied policy evaluation run before a tool executes.
 * Policy logic lives with the caller; the accumulator only records the verdict.
 */
@FunctionalInterface
public interface PolicyCheck {

    PolicyVerdict evaluate(String toolName, Map<String, Object> args) throws Exception;
}
