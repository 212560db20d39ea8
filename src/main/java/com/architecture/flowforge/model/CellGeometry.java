package com.architecture.flowforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Position and size of a vertex. Coordinates are relative to the parent container.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CellGeometry {

    private double x;
    private double y;
    private double width;
    private double height;
}
