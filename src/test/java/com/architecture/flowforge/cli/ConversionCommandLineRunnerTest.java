package com.architecture.flowforge.cli;

import com.architecture.flowforge.dto.ConversionFailure;
import com.architecture.flowforge.dto.ConversionOptions;
import com.architecture.flowforge.dto.ConversionStatus;
import com.architecture.flowforge.dto.ErrorKind;
import com.architecture.flowforge.dto.PageConversionResult;
import com.architecture.flowforge.exception.DiagramLoadException;
import com.architecture.flowforge.service.DiagramConversionService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversionCommandLineRunnerTest {

    @Mock
    private DiagramConversionService conversionService;

    private final ConversionOptions options = ConversionOptions.defaults();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void convertsRequestedPage_andExitsWithZero() throws Exception {
        Path input = write("<mxfile/>");
        when(conversionService.convertPage("<mxfile/>", 1, options)).thenReturn(success(1, "Groups"));

        ConversionCommandLineRunner runner = runner(input.toString(), "1", "text");
        runner.run();

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void convertsAllPages_andExitsWithOne_whenAnyPageFails() throws Exception {
        Path input = write("<mxfile/>");
        when(conversionService.convertAll("<mxfile/>", options)).thenReturn(List.of(success(0, "Flow"), failure(1)));

        ConversionCommandLineRunner runner = runner(input.toString(), "ALL", "text");
        runner.run();

        verify(conversionService).convertAll("<mxfile/>", options);
        assertThat(runner.getExitCode()).isEqualTo(ConversionCommandLineRunner.EXIT_PAGE_FAILED);
    }

    @Test
    void exitsWithTwo_whenInputIsMissing() throws Exception {
        ConversionCommandLineRunner runner = runner(tempDir.resolve("missing.drawio").toString(), "0", "text");
        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(ConversionCommandLineRunner.EXIT_INPUT_ERROR);
    }

    @Test
    void exitsWithTwo_whenDocumentIsUnreadable() throws Exception {
        Path input = write("<mxfile>");
        when(conversionService.convertPage(anyString(), eq(0), any()))
                .thenThrow(new DiagramLoadException("Malformed diagram XML"));

        ConversionCommandLineRunner runner = runner(input.toString(), "0", "text");
        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(ConversionCommandLineRunner.EXIT_INPUT_ERROR);
    }

    @Test
    void exitsWithTwo_whenPageIsNotANumber() throws Exception {
        Path input = write("<mxfile/>");

        ConversionCommandLineRunner runner = runner(input.toString(), "first", "text");
        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(ConversionCommandLineRunner.EXIT_INPUT_ERROR);
    }

    @Test
    void rendersSinglePageAsPlainMermaid() throws Exception {
        String text = runner("in", "0", "text").render(List.of(success(0, "Flow")));

        assertThat(text).isEqualTo("flowchart TD\n    a[\"A\"]");
    }

    @Test
    void rendersPageHeadersAndFailures_forSeveralPages() throws Exception {
        String text = runner("in", "all", "text").render(List.of(success(0, "Flow"), failure(1)));

        assertThat(text).isEqualTo(String.join("\n",
                "%% Page 0: Flow",
                "flowchart TD",
                "    a[\"A\"]",
                "",
                "%% Page 1: Broken",
                "%% Conversion failed: CYCLIC_HIERARCHY at cell a: Containment cycle: a -> b -> a"));
    }

    @Test
    void rendersPageLevelFailureWithoutCell() throws Exception {
        PageConversionResult unreadable = PageConversionResult.builder()
                .pageIndex(0)
                .pageName("NoRoot")
                .status(ConversionStatus.FAILED)
                .failure(ConversionFailure.builder()
                        .kind(ErrorKind.MALFORMED_PAGE)
                        .detail("Diagram model has no <root> element")
                        .build())
                .build();

        String text = runner("in", "0", "text").render(List.of(unreadable));

        assertThat(text).isEqualTo("%% Conversion failed: MALFORMED_PAGE: Diagram model has no <root> element");
    }

    @Test
    void rendersJson() throws Exception {
        String json = runner("in", "all", "json").render(List.of(success(0, "Flow"), failure(1)));

        JsonNode root = objectMapper.readTree(json);
        assertThat(root.get("failed").asBoolean()).isTrue();
        assertThat(root.get("results").size()).isEqualTo(2);
        assertThat(root.get("results").get(1).get("failure").get("kind").asText()).isEqualTo("CYCLIC_HIERARCHY");
    }

    private ConversionCommandLineRunner runner(String input, String page, String format) {
        return new ConversionCommandLineRunner(conversionService, options, objectMapper, input, page, format);
    }

    private Path write(String content) throws Exception {
        Path file = tempDir.resolve("diagram.drawio");
        Files.writeString(file, content);
        return file;
    }

    private PageConversionResult success(int index, String name) {
        return PageConversionResult.builder()
                .pageIndex(index)
                .pageName(name)
                .status(ConversionStatus.SUCCESS)
                .mermaid("flowchart TD\n    a[\"A\"]")
                .build();
    }

    private PageConversionResult failure(int index) {
        return PageConversionResult.builder()
                .pageIndex(index)
                .pageName("Broken")
                .status(ConversionStatus.FAILED)
                .failure(ConversionFailure.builder()
                        .kind(ErrorKind.CYCLIC_HIERARCHY)
                        .sourceId("a")
                        .detail("Containment cycle: a -> b -> a")
                        .build())
                .build();
    }
}
