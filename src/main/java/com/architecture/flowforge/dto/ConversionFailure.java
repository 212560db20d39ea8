package com.architecture.flowforge.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The single error that aborted a page conversion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionFailure {

    private ErrorKind kind;
    private String sourceId;
    private String detail;
}
