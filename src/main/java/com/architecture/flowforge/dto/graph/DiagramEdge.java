package com.architecture.flowforge.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An edge cell after classification. {@code arrow} is filled by the style mapper.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagramEdge {

    private String id;
    private String sourceId;    // Source node ID
    private String targetId;    // Target node ID
    private String label;
    private String style;
    private ArrowDescriptor arrow;
}
