package com.architecture.flowforge.service.graph;

import com.architecture.flowforge.dto.ErrorKind;
import com.architecture.flowforge.dto.graph.ClassifiedCells;
import com.architecture.flowforge.dto.graph.ContainmentForest;
import com.architecture.flowforge.dto.graph.DiagramNode;
import com.architecture.flowforge.dto.graph.NodeShape;
import com.architecture.flowforge.dto.graph.ShapeDescriptor;
import com.architecture.flowforge.exception.ConversionException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HierarchyBuilderTest {

    private final HierarchyBuilder hierarchyBuilder = new HierarchyBuilder();

    @Test
    void nestsChildrenUnderTheirParent_inCreationOrder() {
        ClassifiedCells cells = cellsWith(
                node("group", "1", true),
                node("first", "group", false),
                node("outside", "1", false),
                node("second", "group", false));

        ContainmentForest forest = hierarchyBuilder.build(cells, new ConversionDiagnostics(true));

        int group = forest.indexOf("group");
        assertThat(forest.getRootIndexes()).containsExactly(group, forest.indexOf("outside"));
        assertThat(forest.childrenOf(group)).containsExactly(forest.indexOf("first"), forest.indexOf("second"));
        assertThat(forest.parentOf(forest.indexOf("first"))).isEqualTo(group);
        assertThat(forest.parentOf(group)).isEqualTo(ContainmentForest.NO_PARENT);
        assertThat(forest.node(group).getChildIds()).containsExactly("first", "second");
    }

    @Test
    void marksStyledContainerWithoutChildrenAsContainer() {
        ClassifiedCells cells = cellsWith(node("lane", "1", true), node("leaf", "1", false));

        ContainmentForest forest = hierarchyBuilder.build(cells, new ConversionDiagnostics(true));

        assertThat(forest.node(forest.indexOf("lane")).isContainer()).isTrue();
        assertThat(forest.node(forest.indexOf("lane")).getChildIds()).isEmpty();
        assertThat(forest.node(forest.indexOf("leaf")).isContainer()).isFalse();
    }

    @Test
    void marksPlainNodeWithChildrenAsContainer() {
        ClassifiedCells cells = cellsWith(node("box", "1", false), node("inner", "box", false));

        ContainmentForest forest = hierarchyBuilder.build(cells, new ConversionDiagnostics(true));

        assertThat(forest.node(forest.indexOf("box")).isContainer()).isTrue();
        assertThat(forest.node(forest.indexOf("inner")).isContainer()).isFalse();
    }

    @Test
    void treatsMissingAndStructuralParentsAsTopLevel() {
        ClassifiedCells cells = cellsWith(node("a", null, false), node("b", "0", false), node("c", "", false));

        ContainmentForest forest = hierarchyBuilder.build(cells, new ConversionDiagnostics(true));

        assertThat(forest.getRootIndexes()).hasSize(3);
    }

    @Test
    void placesNodeWithUnknownParentAtTopLevel_inRelaxedMode() {
        ClassifiedCells cells = cellsWith(node("orphan", "ghost", false));
        ConversionDiagnostics diagnostics = new ConversionDiagnostics(false);

        ContainmentForest forest = hierarchyBuilder.build(cells, diagnostics);

        assertThat(forest.getRootIndexes()).containsExactly(forest.indexOf("orphan"));
        assertThat(diagnostics.getWarnings()).singleElement().satisfies(warning -> {
            assertThat(warning.getKind()).isEqualTo(ErrorKind.UNRESOLVED_PARENT);
            assertThat(warning.getSourceId()).isEqualTo("orphan");
        });
    }

    @Test
    void abortsOnUnknownParent_inStrictMode() {
        ClassifiedCells cells = cellsWith(node("orphan", "ghost", false));

        assertThatThrownBy(() -> hierarchyBuilder.build(cells, new ConversionDiagnostics(true)))
                .isInstanceOf(ConversionException.class)
                .extracting("kind")
                .isEqualTo(ErrorKind.UNRESOLVED_PARENT);
    }

    @Test
    void rejectsContainmentCycle_evenInRelaxedMode() {
        ClassifiedCells cells = cellsWith(node("a", "b", true), node("b", "a", true), node("c", "1", false));

        assertThatThrownBy(() -> hierarchyBuilder.build(cells, new ConversionDiagnostics(false)))
                .isInstanceOf(ConversionException.class)
                .hasMessage("Containment cycle: a -> b -> a")
                .satisfies(e -> {
                    assertThat(((ConversionException) e).getKind()).isEqualTo(ErrorKind.CYCLIC_HIERARCHY);
                    assertThat(((ConversionException) e).getSourceId()).isEqualTo("a");
                });
    }

    @Test
    void rejectsNodeThatContainsItself() {
        ClassifiedCells cells = cellsWith(node("self", "self", false));

        assertThatThrownBy(() -> hierarchyBuilder.build(cells, new ConversionDiagnostics(false)))
                .isInstanceOf(ConversionException.class)
                .hasMessage("Containment cycle: self -> self");
    }

    @Test
    void handlesDeepNesting() {
        Map<String, DiagramNode> nodes = new LinkedHashMap<>();
        String parent = "1";
        for (int i = 0; i < 5000; i++) {
            String id = "n" + i;
            nodes.put(id, node(id, parent, false));
            parent = id;
        }
        ClassifiedCells cells = ClassifiedCells.builder()
                .nodesById(nodes)
                .edges(List.of())
                .structuralIds(Set.of("0", "1"))
                .build();

        ContainmentForest forest = hierarchyBuilder.build(cells, new ConversionDiagnostics(true));

        assertThat(forest.getRootIndexes()).containsExactly(0);
        assertThat(forest.parentOf(4999)).isEqualTo(4998);
    }

    private DiagramNode node(String id, String parentId, boolean containerMarker) {
        return DiagramNode.builder()
                .sourceId(id)
                .label(id)
                .parentId(parentId)
                .shape(ShapeDescriptor.builder().shape(NodeShape.RECTANGLE).containerMarker(containerMarker).build())
                .build();
    }

    private ClassifiedCells cellsWith(DiagramNode... nodes) {
        Map<String, DiagramNode> nodesById = new LinkedHashMap<>();
        for (DiagramNode node : nodes) {
            nodesById.put(node.getSourceId(), node);
        }
        return ClassifiedCells.builder()
                .nodesById(nodesById)
                .edges(List.of())
                .structuralIds(Set.of("0", "1"))
                .build();
    }
}
