package com.architecture.flowforge.controller;

import com.architecture.flowforge.dto.ConversionOptions;
import com.architecture.flowforge.dto.ConversionRequest;
import com.architecture.flowforge.dto.ConversionResponse;
import com.architecture.flowforge.dto.PageConversionResult;
import com.architecture.flowforge.dto.PageInfo;
import com.architecture.flowforge.dto.PageListRequest;
import com.architecture.flowforge.dto.PageListResponse;
import com.architecture.flowforge.service.DiagramConversionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for draw.io to Mermaid conversions.
 * Diagram content is posted as text; nothing is stored between requests.
 */
@RestController
@RequestMapping("/api/conversions")
@RequiredArgsConstructor
@Slf4j
public class ConversionController {

    private final DiagramConversionService conversionService;
    private final ConversionOptions defaultConversionOptions;

    /**
     * Convert one page (default: the first) or every page of a document.
     * Page-level failures are reported in the body with {@code failed=true}, not as HTTP errors.
     */
    @PostMapping
    public ResponseEntity<ConversionResponse> convert(@Valid @RequestBody ConversionRequest request) {
        ConversionOptions options = resolveOptions(request);
        log.info("Conversion request: allPages={}, pageIndex={}, strictMode={}",
                request.isAllPages(), request.getPageIndex(), options.isStrictMode());

        List<PageConversionResult> results;
        if (request.isAllPages()) {
            results = conversionService.convertAll(request.getContent(), options);
        } else {
            int pageIndex = request.getPageIndex() != null ? request.getPageIndex() : 0;
            results = List.of(conversionService.convertPage(request.getContent(), pageIndex, options));
        }

        ConversionResponse response = ConversionResponse.builder()
                .results(results)
                .failed(results.stream().anyMatch(result -> !result.isSuccess()))
                .build();
        return ResponseEntity.ok(response);
    }

    /**
     * List the pages of a document.
     */
    @PostMapping("/pages")
    public ResponseEntity<PageListResponse> listPages(@Valid @RequestBody PageListRequest request) {
        List<PageInfo> pages = conversionService.listPages(request.getContent());
        log.info("Listed {} pages", pages.size());

        return ResponseEntity.ok(PageListResponse.builder()
                .pageCount(pages.size())
                .pages(pages)
                .build());
    }

    /**
     * Request fields that are set replace the configured defaults.
     */
    ConversionOptions resolveOptions(ConversionRequest request) {
        ConversionOptions.ConversionOptionsBuilder builder = defaultConversionOptions.toBuilder();
        if (request.getDirection() != null) {
            builder.direction(request.getDirection());
        }
        if (request.getStrictMode() != null) {
            builder.strictMode(request.getStrictMode());
        }
        if (request.getShapeOverrides() != null) {
            builder.shapeOverrides(request.getShapeOverrides());
        }
        if (request.getReservedWords() != null) {
            builder.reservedWords(request.getReservedWords());
        }
        if (request.getRetainContainerEdges() != null) {
            builder.retainContainerEdges(request.getRetainContainerEdges());
        }
        if (request.getIdStrategy() != null) {
            builder.idStrategy(request.getIdStrategy());
        }
        return builder.build();
    }
}
