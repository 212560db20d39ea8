package com.architecture.flowforge.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionWarning {

    private ErrorKind kind;
    private String sourceId;    // Offending cell id
    private String detail;
}
