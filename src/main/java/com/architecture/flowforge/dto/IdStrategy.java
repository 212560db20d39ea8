package com.architecture.flowforge.dto;

/**
 * Source of the candidate token a canonical node id is derived from.
 */
public enum IdStrategy {
    LABEL,      // Node label, e.g. "Should Run?" -> should_run
    SOURCE_ID   // Cell id, e.g. "2" -> 2
}
