package com.architecture.flowforge.dto;

import com.architecture.flowforge.dto.graph.LayoutDirection;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * Request body for converting a draw.io document.
 * Option fields left null fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionRequest {

    @NotBlank(message = "Diagram content is required")
    private String content;

    @Min(value = 0, message = "Page index must not be negative")
    private Integer pageIndex;      // Defaults to 0
    private boolean allPages;

    private LayoutDirection direction;
    private Boolean strictMode;
    private Map<String, String> shapeOverrides;
    private Set<String> reservedWords;
    private Boolean retainContainerEdges;
    private IdStrategy idStrategy;
}
