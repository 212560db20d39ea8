package com.architecture.flowforge.service.graph;

import com.architecture.flowforge.dto.ConversionOptions;
import com.architecture.flowforge.dto.ErrorKind;
import com.architecture.flowforge.dto.IdStrategy;
import com.architecture.flowforge.dto.graph.CanonicalIdMap;
import com.architecture.flowforge.dto.graph.DiagramNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Generates canonical Mermaid node ids for the nodes of one page.
 *
 * Canonical IDs are:
 * - Deterministic: same nodes in the same order always produce the same ids
 * - Unique: no two nodes of a page share an id
 * - Safe: only [a-z0-9_], never a Mermaid keyword or a configured reserved word
 *
 * Format Rules:
 * - Label strategy: lower-cased label, non-alphanumeric runs collapsed to "_" ("Should Run?" -> should_run)
 * - Source-id strategy: the cell id, normalized the same way ("2" -> 2, "WZ3b-1" -> wz3b_1)
 * - Empty candidate: positional placeholder node_{position}, 1-based creation order
 * - Collision with a keyword or an allocated id: {candidate}_{n}, n = 1, 2, ...
 *
 * Allocation state lives only inside one {@link #allocate} call.
 */
@Service
@Slf4j
public class CanonicalIdGenerator {

    // Keywords that break Mermaid flowchart parsing when used as node ids
    public static final Set<String> MERMAID_RESERVED_WORDS = Set.of(
            "end", "subgraph", "graph", "flowchart", "direction", "style", "classdef",
            "class", "click", "linkstyle", "call", "href", "default");

    // Pattern for runs of characters that are not allowed in an id
    private static final Pattern NON_ALPHANUMERIC_PATTERN = Pattern.compile("[^a-z0-9]+");

    // Pattern for combining marks left over after decomposing accented letters
    private static final Pattern COMBINING_MARK_PATTERN = Pattern.compile("\\p{M}+");

    private static final String SEPARATOR = "_";
    private static final String PLACEHOLDER_PREFIX = "node_";

    /**
     * Allocate ids for all nodes in creation order.
     */
    public CanonicalIdMap allocate(List<DiagramNode> nodes, ConversionOptions options,
                                   ConversionDiagnostics diagnostics) {
        Set<String> reserved = reservedWords(options.getReservedWords());
        Set<String> allocated = new HashSet<>();
        Map<String, String> canonicalBySourceId = new LinkedHashMap<>();

        int position = 0;
        for (DiagramNode node : nodes) {
            position++;
            String raw = options.getIdStrategy() == IdStrategy.SOURCE_ID ? node.getSourceId() : node.getLabel();
            String candidate = normalize(raw);
            if (candidate.isEmpty()) {
                candidate = PLACEHOLDER_PREFIX + position;
            }

            if (reserved.contains(candidate)) {
                String resolved = nextFree(candidate, reserved, allocated);
                diagnostics.report(ErrorKind.RESERVED_WORD_COLLISION, node.getSourceId(),
                        "Identifier '" + candidate + "' is a reserved word; using '" + resolved + "'");
                candidate = resolved;
            } else if (allocated.contains(candidate)) {
                String resolved = nextFree(candidate, reserved, allocated);
                log.debug("Identifier '{}' already allocated; node {} gets '{}'", candidate, node.getSourceId(), resolved);
                candidate = resolved;
            }

            allocated.add(candidate);
            canonicalBySourceId.put(node.getSourceId(), candidate);
        }

        log.debug("Allocated {} canonical ids", canonicalBySourceId.size());
        return new CanonicalIdMap(canonicalBySourceId);
    }

    /**
     * Normalize free text into an id candidate.
     * Examples:
     * - "Should Run?" -> "should_run"
     * - "  Café / Bar  " -> "cafe_bar"
     * - "???" -> ""
     */
    public String normalize(String text) {
        if (text == null) {
            return "";
        }

        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String ascii = COMBINING_MARK_PATTERN.matcher(decomposed).replaceAll("");
        String collapsed = NON_ALPHANUMERIC_PATTERN.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll(SEPARATOR);

        // Trim leading and trailing separators
        int start = 0;
        int end = collapsed.length();
        while (start < end && collapsed.startsWith(SEPARATOR, start)) start++;
        while (end > start && collapsed.startsWith(SEPARATOR, end - 1)) end--;
        return collapsed.substring(start, end);
    }

    /**
     * First {base}_{n} that is neither reserved nor allocated. Terminates because the allocated
     * set is finite and n grows monotonically.
     */
    private String nextFree(String base, Set<String> reserved, Set<String> allocated) {
        int suffix = 1;
        String candidate = base + SEPARATOR + suffix;
        while (reserved.contains(candidate) || allocated.contains(candidate)) {
            suffix++;
            candidate = base + SEPARATOR + suffix;
        }
        return candidate;
    }

    private Set<String> reservedWords(Set<String> configured) {
        Set<String> reserved = new HashSet<>(MERMAID_RESERVED_WORDS);
        if (configured != null) {
            for (String word : configured) {
                if (word != null && !word.isBlank()) {
                    reserved.add(word.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return reserved;
    }
}
