package com.architecture.flowforge.dto;

import com.architecture.flowforge.dto.graph.LayoutDirection;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Options for one conversion run. Application-wide defaults come from
 * {@code flowforge.conversion.*}; API callers may override individual fields.
 */
@Value
@Builder(toBuilder = true)
public class ConversionOptions {

    // Null lets the orientation heuristic decide
    LayoutDirection direction;

    boolean strictMode;

    // Style marker -> shape name or bracket pair, tried before the built-in rules in this order
    @Builder.Default
    Map<String, String> shapeOverrides = Collections.emptyMap();

    @Builder.Default
    Set<String> reservedWords = Collections.emptySet();

    @Builder.Default
    boolean retainContainerEdges = true;

    @Builder.Default
    IdStrategy idStrategy = IdStrategy.LABEL;

    public static ConversionOptions defaults() {
        return ConversionOptions.builder().build();
    }
}
