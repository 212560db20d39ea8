package com.architecture.flowforge.dto.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable mapping from source cell ids to canonical Mermaid node ids for one page.
 */
public class CanonicalIdMap {

    private final Map<String, String> canonicalBySourceId;

    public CanonicalIdMap(Map<String, String> canonicalBySourceId) {
        this.canonicalBySourceId = Collections.unmodifiableMap(new LinkedHashMap<>(canonicalBySourceId));
    }

    public String get(String sourceId) {
        return sourceId == null ? null : canonicalBySourceId.get(sourceId);
    }

    public boolean contains(String sourceId) {
        return sourceId != null && canonicalBySourceId.containsKey(sourceId);
    }

    public int size() {
        return canonicalBySourceId.size();
    }

    public Map<String, String> asMap() {
        return canonicalBySourceId;
    }
}
