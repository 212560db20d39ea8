package com.architecture.flowforge.service;

import com.architecture.flowforge.dto.ConversionFailure;
import com.architecture.flowforge.dto.ConversionOptions;
import com.architecture.flowforge.dto.ConversionStatus;
import com.architecture.flowforge.dto.ConversionWarning;
import com.architecture.flowforge.dto.ErrorKind;
import com.architecture.flowforge.dto.PageConversionResult;
import com.architecture.flowforge.dto.PageInfo;
import com.architecture.flowforge.dto.graph.CanonicalIdMap;
import com.architecture.flowforge.dto.graph.ClassifiedCells;
import com.architecture.flowforge.dto.graph.ContainmentForest;
import com.architecture.flowforge.dto.graph.LayoutDirection;
import com.architecture.flowforge.exception.ConversionException;
import com.architecture.flowforge.exception.DiagramLoadException;
import com.architecture.flowforge.model.DiagramPage;
import com.architecture.flowforge.model.PageSource;
import com.architecture.flowforge.service.graph.CanonicalIdGenerator;
import com.architecture.flowforge.service.graph.CellClassifier;
import com.architecture.flowforge.service.graph.ConversionDiagnostics;
import com.architecture.flowforge.service.graph.HierarchyBuilder;
import com.architecture.flowforge.service.graph.MermaidFlowchartEmitter;
import com.architecture.flowforge.service.graph.OrientationHeuristic;
import com.architecture.flowforge.service.graph.StyleMapper;
import com.architecture.flowforge.service.loader.DrawioCellParser;
import com.architecture.flowforge.service.loader.DrawioDocumentLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts draw.io documents to Mermaid flowcharts, one page at a time.
 *
 * Pipeline per page:
 * 1. Classify cells into nodes and edges
 * 2. Map styles to shapes and connectors
 * 3. Build the containment forest (cycles abort the page)
 * 4. Allocate canonical ids
 * 5. Pick the layout direction (configured, else heuristic)
 * 6. Emit the flowchart text
 *
 * Each page gets its own {@link ConversionDiagnostics}; a failed page never affects another.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiagramConversionService {

    private final DrawioDocumentLoader documentLoader;
    private final DrawioCellParser cellParser;
    private final CellClassifier cellClassifier;
    private final StyleMapper styleMapper;
    private final HierarchyBuilder hierarchyBuilder;
    private final CanonicalIdGenerator canonicalIdGenerator;
    private final OrientationHeuristic orientationHeuristic;
    private final MermaidFlowchartEmitter emitter;

    /**
     * List the decodable pages of a document.
     */
    public List<PageInfo> listPages(String rawText) {
        List<PageInfo> pages = new ArrayList<>();
        for (PageSource source : documentLoader.extractPages(rawText, false)) {
            pages.add(PageInfo.builder()
                    .index(source.getIndex())
                    .name(source.getName())
                    .build());
        }
        return pages;
    }

    public PageConversionResult convertPage(String rawText, int pageIndex, ConversionOptions options) {
        List<PageSource> sources = documentLoader.extractPages(rawText, options.isStrictMode());
        if (pageIndex < 0 || pageIndex >= sources.size()) {
            throw new IllegalArgumentException("Page index " + pageIndex + " out of range; document has "
                    + sources.size() + " page(s)");
        }
        return convertSource(sources.get(pageIndex), options);
    }

    public List<PageConversionResult> convertAll(String rawText, ConversionOptions options) {
        List<PageSource> sources = documentLoader.extractPages(rawText, options.isStrictMode());
        log.info("Converting {} pages", sources.size());

        List<PageConversionResult> results = new ArrayList<>();
        for (PageSource source : sources) {
            results.add(convertSource(source, options));
        }

        long failed = results.stream().filter(result -> !result.isSuccess()).count();
        log.info("Converted {} pages, {} failed", results.size(), failed);
        return results;
    }

    /**
     * Convert one parsed page. Never throws for diagram content problems: an aborted run is
     * returned as a FAILED result carrying the warnings collected up to the abort.
     */
    public PageConversionResult convert(DiagramPage page, ConversionOptions options) {
        log.info("Converting page {} '{}' ({} cells)", page.getIndex(), page.getName(), page.getCells().size());
        ConversionDiagnostics diagnostics = new ConversionDiagnostics(options.isStrictMode());

        try {
            ClassifiedCells cells = cellClassifier.classify(page.getCells(), diagnostics);
            styleMapper.applyTo(cells, options, diagnostics);
            ContainmentForest forest = hierarchyBuilder.build(cells, diagnostics);
            CanonicalIdMap ids = canonicalIdGenerator.allocate(forest.getNodes(), options, diagnostics);

            LayoutDirection direction = options.getDirection() != null
                    ? options.getDirection()
                    : orientationHeuristic.suggest(forest);

            String mermaid = emitter.emit(forest, ids, cells.getEdges(), direction, options, diagnostics);

            log.info("Page {} converted: {} nodes, {} edges, {} warnings",
                    page.getIndex(), forest.size(), cells.getEdges().size(), diagnostics.getWarnings().size());

            return PageConversionResult.builder()
                    .pageIndex(page.getIndex())
                    .pageName(page.getName())
                    .status(ConversionStatus.SUCCESS)
                    .mermaid(mermaid)
                    .direction(direction)
                    .warnings(new ArrayList<>(diagnostics.getWarnings()))
                    .build();

        } catch (ConversionException e) {
            log.error("Page {} '{}' failed [{}] at cell {}: {}",
                    page.getIndex(), page.getName(), e.getKind(), e.getSourceId(), e.getMessage());
            return failed(page.getIndex(), page.getName(), e.getKind(), e.getSourceId(), e.getMessage(),
                    diagnostics.getWarnings());
        }
    }

    /**
     * Parse a decoded page and convert it. Unreadable page XML fails that page only.
     */
    private PageConversionResult convertSource(PageSource source, ConversionOptions options) {
        DiagramPage page;
        try {
            page = DiagramPage.builder()
                    .index(source.getIndex())
                    .name(source.getName())
                    .cells(cellParser.parseCells(source.getModelXml()))
                    .build();
        } catch (DiagramLoadException e) {
            log.error("Page {} '{}' is unreadable: {}", source.getIndex(), source.getName(), e.getMessage());
            return failed(source.getIndex(), source.getName(), ErrorKind.MALFORMED_PAGE, null, e.getMessage(),
                    List.of());
        }
        return convert(page, options);
    }

    private PageConversionResult failed(int index, String name, ErrorKind kind, String sourceId, String detail,
                                        List<ConversionWarning> warnings) {
        return PageConversionResult.builder()
                .pageIndex(index)
                .pageName(name)
                .status(ConversionStatus.FAILED)
                .warnings(new ArrayList<>(warnings))
                .failure(ConversionFailure.builder()
                        .kind(kind)
                        .sourceId(sourceId)
                        .detail(detail)
                        .build())
                .build();
    }
}
