package com.architecture.flowforge.cli;

import com.architecture.flowforge.dto.ConversionOptions;
import com.architecture.flowforge.dto.ConversionResponse;
import com.architecture.flowforge.dto.PageConversionResult;
import com.architecture.flowforge.exception.DiagramLoadException;
import com.architecture.flowforge.service.DiagramConversionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Converts a draw.io file from the command line and prints the result to stdout.
 *
 * Enabled by {@code flowforge.cli.input}, e.g.
 * <pre>
 * java -jar flowforge.jar --spring.main.web-application-type=none \
 *     --flowforge.cli.input=diagram.drawio --flowforge.cli.page=all --flowforge.cli.format=json
 * </pre>
 * Exit codes: 0 success, 1 when any page failed, 2 when the input cannot be read.
 */
@Component
@ConditionalOnProperty(prefix = "flowforge.cli", name = "input")
@Slf4j
public class ConversionCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    static final String ALL_PAGES = "all";
    static final String FORMAT_JSON = "json";

    static final int EXIT_PAGE_FAILED = 1;
    static final int EXIT_INPUT_ERROR = 2;

    private final DiagramConversionService conversionService;
    private final ConversionOptions options;
    private final ObjectMapper objectMapper;
    private final String input;
    private final String page;
    private final String format;

    private int exitCode;

    public ConversionCommandLineRunner(DiagramConversionService conversionService,
                                       ConversionOptions options,
                                       ObjectMapper objectMapper,
                                       @Value("${flowforge.cli.input}") String input,
                                       @Value("${flowforge.cli.page:0}") String page,
                                       @Value("${flowforge.cli.format:text}") String format) {
        this.conversionService = conversionService;
        this.options = options;
        this.objectMapper = objectMapper;
        this.input = input;
        this.page = page;
        this.format = format;
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("Converting {} (page: {}, format: {})", input, page, format);

        List<PageConversionResult> results;
        try {
            String content = Files.readString(Path.of(input), StandardCharsets.UTF_8);
            results = ALL_PAGES.equalsIgnoreCase(page.trim())
                    ? conversionService.convertAll(content, options)
                    : List.of(conversionService.convertPage(content, Integer.parseInt(page.trim()), options));
        } catch (IOException | DiagramLoadException | IllegalArgumentException e) {
            log.error("Cannot convert {}: {}", input, e.getMessage());
            exitCode = EXIT_INPUT_ERROR;
            return;
        }

        System.out.println(render(results));
        exitCode = results.stream().allMatch(PageConversionResult::isSuccess) ? 0 : EXIT_PAGE_FAILED;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    String render(List<PageConversionResult> results) throws JsonProcessingException {
        if (FORMAT_JSON.equalsIgnoreCase(format)) {
            ConversionResponse response = ConversionResponse.builder()
                    .results(results)
                    .failed(results.stream().anyMatch(result -> !result.isSuccess()))
                    .build();
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response);
        }

        StringBuilder text = new StringBuilder();
        for (PageConversionResult result : results) {
            if (text.length() > 0) {
                text.append("\n\n");
            }
            if (results.size() > 1) {
                text.append("%% Page ").append(result.getPageIndex()).append(": ").append(result.getPageName()).append('\n');
            }
            if (result.isSuccess()) {
                text.append(result.getMermaid());
            } else {
                text.append("%% Conversion failed: ").append(result.getFailure().getKind());
                if (result.getFailure().getSourceId() != null) {
                    text.append(" at cell ").append(result.getFailure().getSourceId());
                }
                text.append(": ").append(result.getFailure().getDetail());
            }
        }
        return text.toString();
    }
}
