package com.architecture.flowforge.service.loader;

import com.architecture.flowforge.exception.DiagramLoadException;
import com.architecture.flowforge.model.Cell;
import com.architecture.flowforge.model.CellGeometry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the flat mxCell list of one page's mxGraphModel.
 *
 * Cells carrying custom properties are wrapped in {@code <UserObject>} or {@code <object>};
 * for those the wrapper supplies the id and the label.
 */
@Service
@Slf4j
public class DrawioCellParser {

    private static final String CELL_TAG = "mxCell";
    private static final String GEOMETRY_TAG = "mxGeometry";
    private static final String[] WRAPPER_TAGS = {"UserObject", "object"};

    public List<Cell> parseCells(String modelXml) {
        Document document = DrawioXml.parse(modelXml);
        Element model = document.getDocumentElement();
        if (!"mxGraphModel".equals(model.getTagName())) {
            NodeList models = document.getElementsByTagName("mxGraphModel");
            if (models.getLength() == 0) {
                throw new DiagramLoadException("No <mxGraphModel> element in page XML");
            }
            model = (Element) models.item(0);
        }

        Element root = DrawioXml.firstChildElement(model, "root");
        if (root == null) {
            throw new DiagramLoadException("Diagram model has no <root> element");
        }

        List<Cell> cells = new ArrayList<>();
        for (Element element : DrawioXml.childElements(root)) {
            if (CELL_TAG.equals(element.getTagName())) {
                cells.add(toCell(element, DrawioXml.attribute(element, "id"), element.getAttribute("value")));
            } else if (isWrapper(element)) {
                Element inner = DrawioXml.firstChildElement(element, CELL_TAG);
                if (inner == null) {
                    log.debug("<{}> {} has no mxCell, skipping", element.getTagName(),
                            element.getAttribute("id"));
                    continue;
                }
                cells.add(toCell(inner, DrawioXml.attribute(element, "id"), element.getAttribute("label")));
            } else {
                log.debug("Ignoring <{}> under <root>", element.getTagName());
            }
        }

        log.debug("Parsed {} cells", cells.size());
        return cells;
    }

    private Cell toCell(Element element, String id, String value) {
        return Cell.builder()
                .id(id)
                .value(value)
                .style(element.getAttribute("style"))
                .vertex("1".equals(element.getAttribute("vertex")))
                .edge("1".equals(element.getAttribute("edge")))
                .parentId(DrawioXml.attribute(element, "parent"))
                .sourceId(DrawioXml.attribute(element, "source"))
                .targetId(DrawioXml.attribute(element, "target"))
                .geometry(readGeometry(element))
                .build();
    }

    private CellGeometry readGeometry(Element cell) {
        Element geometry = DrawioXml.firstChildElement(cell, GEOMETRY_TAG);
        if (geometry == null) {
            return null;
        }
        return CellGeometry.builder()
                .x(number(geometry, "x"))
                .y(number(geometry, "y"))
                .width(number(geometry, "width"))
                .height(number(geometry, "height"))
                .build();
    }

    private double number(Element element, String attribute) {
        String value = DrawioXml.attribute(element, attribute);
        if (value == null) {
            return 0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Non-numeric {}='{}' on <{}>, using 0", attribute, value, element.getTagName());
            return 0;
        }
    }

    private boolean isWrapper(Element element) {
        for (String tag : WRAPPER_TAGS) {
            if (tag.equals(element.getTagName())) {
                return true;
            }
        }
        return false;
    }
}
