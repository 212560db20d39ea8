package com.architecture.flowforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One parsed diagram page: the flat cell collection in document order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagramPage {

    private int index;
    private String name;

    @Builder.Default
    private List<Cell> cells = new ArrayList<>();
}
