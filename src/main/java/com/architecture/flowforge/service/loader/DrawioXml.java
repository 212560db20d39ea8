package com.architecture.flowforge.service.loader;

import com.architecture.flowforge.exception.DiagramLoadException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM helpers shared by the document loader and the cell parser.
 * Parsing never resolves DTDs or external entities.
 */
final class DrawioXml {

    private DrawioXml() {
    }

    /**
     * Parse XML text. draw.io writes {@code &nbsp;}, which is not an XML entity, so it is
     * rewritten to its numeric form first.
     */
    static Document parse(String xml) {
        String normalized = xml.replace("&nbsp;", "&#160;");
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(null);
            return builder.parse(new InputSource(new StringReader(normalized)));
        } catch (SAXException | IOException e) {
            throw new DiagramLoadException("Malformed diagram XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    static String serialize(Element element) {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(element), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new DiagramLoadException("Cannot serialize <" + element.getTagName() + ">", e);
        }
    }

    static List<Element> childElements(Element parent, String... tagNames) {
        List<Element> elements = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE && matches((Element) child, tagNames)) {
                elements.add((Element) child);
            }
        }
        return elements;
    }

    static Element firstChildElement(Element parent, String... tagNames) {
        List<Element> elements = childElements(parent, tagNames);
        return elements.isEmpty() ? null : elements.get(0);
    }

    /**
     * Attribute value, or null when the attribute is absent or empty.
     */
    static String attribute(Element element, String name) {
        String value = element.getAttribute(name);
        return value.isEmpty() ? null : value;
    }

    private static boolean matches(Element element, String... tagNames) {
        if (tagNames.length == 0) {
            return true;
        }
        for (String tagName : tagNames) {
            if (tagName.equals(element.getTagName())) {
                return true;
            }
        }
        return false;
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory;
    }
}
