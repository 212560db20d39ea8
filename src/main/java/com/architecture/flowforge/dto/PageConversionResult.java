package com.architecture.flowforge.dto;

import com.architecture.flowforge.dto.graph.LayoutDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of converting one diagram page: Mermaid text plus warnings, or a single failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageConversionResult {

    private int pageIndex;
    private String pageName;
    private ConversionStatus status;
    private String mermaid;             // Null when the page failed
    private LayoutDirection direction;

    @Builder.Default
    private List<ConversionWarning> warnings = new ArrayList<>();

    private ConversionFailure failure;  // Null when the page succeeded

    public boolean isSuccess() {
        return status == ConversionStatus.SUCCESS;
    }
}
