package com.architecture.flowforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One decoded page of a draw.io document: its position, display name and the plain
 * {@code mxGraphModel} XML, before cells are parsed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageSource {

    private int index;
    private String name;
    private String modelXml;
}
