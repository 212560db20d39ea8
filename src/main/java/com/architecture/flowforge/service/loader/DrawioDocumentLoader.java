package com.architecture.flowforge.service.loader;

import com.architecture.flowforge.exception.DiagramLoadException;
import com.architecture.flowforge.model.PageSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;

/**
 * Splits a draw.io document into pages and decodes each page to plain mxGraphModel XML.
 *
 * Accepted inputs:
 * - a bare {@code <mxGraphModel>} document (one page)
 * - an {@code <mxfile>} with one {@code <diagram>} per page, each holding either an inline
 *   model or a compressed text payload
 *
 * Compressed payloads are tried in this order until a model appears:
 * URL-decoding, base64 (standard then URL-safe) followed by raw deflate, zlib and gzip.
 */
@Service
@Slf4j
public class DrawioDocumentLoader {

    private static final String MODEL_TAG = "mxGraphModel";
    private static final String MODEL_MARKER = "<" + MODEL_TAG;
    private static final String DIAGRAM_TAG = "diagram";
    private static final String DEFAULT_PAGE_PREFIX = "Page-";

    private static final int BUFFER_SIZE = 8192;

    public List<PageSource> extractPages(String raw, boolean strict) {
        if (raw == null || raw.isBlank()) {
            throw new DiagramLoadException("Diagram content is empty");
        }

        Document document = DrawioXml.parse(raw.trim());
        Element root = document.getDocumentElement();

        if (MODEL_TAG.equals(root.getTagName())) {
            log.debug("Input is a bare {} document", MODEL_TAG);
            return List.of(PageSource.builder()
                    .index(0)
                    .name(DEFAULT_PAGE_PREFIX + 1)
                    .modelXml(DrawioXml.serialize(root))
                    .build());
        }

        List<Element> diagrams = DIAGRAM_TAG.equals(root.getTagName())
                ? List.of(root)
                : DrawioXml.childElements(root, DIAGRAM_TAG);
        if (diagrams.isEmpty()) {
            throw new DiagramLoadException("No <" + DIAGRAM_TAG + "> or <" + MODEL_TAG
                    + "> found under <" + root.getTagName() + ">");
        }

        List<PageSource> pages = new ArrayList<>();
        for (int position = 0; position < diagrams.size(); position++) {
            Element diagram = diagrams.get(position);
            String name = DrawioXml.attribute(diagram, "name");
            if (name == null) {
                name = DEFAULT_PAGE_PREFIX + (position + 1);
            }

            String modelXml = readDiagram(diagram, name, strict);
            if (modelXml != null) {
                pages.add(PageSource.builder()
                        .index(pages.size())
                        .name(name)
                        .modelXml(modelXml)
                        .build());
            }
        }

        if (pages.isEmpty()) {
            throw new DiagramLoadException("Document contains no decodable diagram pages");
        }

        log.info("Loaded {} of {} diagram pages", pages.size(), diagrams.size());
        return pages;
    }

    /**
     * @return the page's model XML, or null when the page is skipped
     */
    private String readDiagram(Element diagram, String name, boolean strict) {
        Element inlineModel = DrawioXml.firstChildElement(diagram, MODEL_TAG);
        if (inlineModel != null) {
            log.debug("Page '{}' holds an inline model", name);
            return DrawioXml.serialize(inlineModel);
        }

        String payload = diagram.getTextContent() == null ? "" : diagram.getTextContent().trim();
        if (payload.isEmpty()) {
            log.warn("Page '{}' is empty, skipping", name);
            return null;
        }

        String decoded = decodePayload(payload);
        if (decoded != null) {
            return decoded;
        }

        if (strict) {
            throw new DiagramLoadException("Cannot decode diagram page '" + name + "'");
        }
        log.warn("Cannot decode diagram page '{}', skipping", name);
        return null;
    }

    /**
     * Decode a {@code <diagram>} text payload.
     *
     * @return plain model XML, or null when no decoding yields a model
     */
    String decodePayload(String payload) {
        String model = asModel(payload);
        if (model != null) {
            return model;
        }

        byte[] bytes = decodeBase64(payload);
        if (bytes == null) {
            log.debug("Payload is not base64");
            return null;
        }

        model = asModel(new String(bytes, StandardCharsets.UTF_8));
        if (model != null) {
            return model;
        }

        for (byte[] inflated : Arrays.asList(inflate(bytes, true), inflate(bytes, false), gunzip(bytes))) {
            if (inflated != null) {
                model = asModel(new String(inflated, StandardCharsets.UTF_8));
                if (model != null) {
                    return model;
                }
            }
        }
        return null;
    }

    /**
     * The text itself when it already holds a model, else its URL-decoded form when that does.
     */
    private String asModel(String text) {
        if (text.contains(MODEL_MARKER)) {
            return text;
        }
        String unescaped = urlDecode(text);
        return unescaped.contains(MODEL_MARKER) ? unescaped : null;
    }

    /**
     * Percent-decoding as done by JavaScript's decodeURIComponent: "+" is kept literally.
     */
    static String urlDecode(String text) {
        if (text.indexOf('%') < 0) {
            return text;
        }
        try {
            return URLDecoder.decode(text.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Text is not URL-encoded: {}", e.getMessage());
            return text;
        }
    }

    private byte[] decodeBase64(String payload) {
        StringBuilder compact = new StringBuilder(payload.replaceAll("\\s+", ""));
        while (compact.length() % 4 != 0) {
            compact.append('=');
        }
        String padded = compact.toString();

        try {
            return Base64.getDecoder().decode(padded);
        } catch (IllegalArgumentException e) {
            log.debug("Standard base64 decoding failed, trying URL-safe alphabet");
        }
        try {
            return Base64.getUrlDecoder().decode(padded);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Inflate deflate data, raw ({@code nowrap}) or with a zlib header.
     */
    private byte[] inflate(byte[] data, boolean nowrap) {
        Inflater inflater = new Inflater(nowrap);
        try {
            // Raw inflate needs one extra padding byte after the stream
            byte[] input = nowrap ? Arrays.copyOf(data, data.length + 1) : data;
            inflater.setInput(input);

            ByteArrayOutputStream output = new ByteArrayOutputStream();
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!inflater.finished()) {
                int count = inflater.inflate(buffer);
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                output.write(buffer, 0, count);
            }
            return output.size() == 0 ? null : output.toByteArray();
        } catch (DataFormatException e) {
            log.debug("{} inflate failed: {}", nowrap ? "Raw" : "Zlib", e.getMessage());
            return null;
        } finally {
            inflater.end();
        }
    }

    private byte[] gunzip(byte[] data) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        } catch (IOException e) {
            log.debug("Gzip decompression failed: {}", e.getMessage());
            return null;
        }
    }
}
