package com.architecture.flowforge.controller;

import com.architecture.flowforge.dto.ConversionFailure;
import com.architecture.flowforge.dto.ConversionOptions;
import com.architecture.flowforge.dto.ConversionRequest;
import com.architecture.flowforge.dto.ConversionResponse;
import com.architecture.flowforge.dto.ConversionStatus;
import com.architecture.flowforge.dto.ErrorKind;
import com.architecture.flowforge.dto.IdStrategy;
import com.architecture.flowforge.dto.PageConversionResult;
import com.architecture.flowforge.dto.PageInfo;
import com.architecture.flowforge.dto.graph.LayoutDirection;
import com.architecture.flowforge.exception.DiagramLoadException;
import com.architecture.flowforge.service.DiagramConversionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ConversionControllerTest {

    @Mock
    private DiagramConversionService conversionService;

    private final ConversionOptions defaults = ConversionOptions.builder()
            .reservedWords(Set.of("start"))
            .build();

    private ConversionController controller;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        controller = new ConversionController(conversionService, defaults);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void convertsFirstPageByDefault() {
        when(conversionService.convertPage(eq("<mxfile/>"), eq(0), any())).thenReturn(success(0));

        ResponseEntity<ConversionResponse> response = controller.convert(
                ConversionRequest.builder().content("<mxfile/>").build());

        assertThat(response.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(response.getBody().isFailed()).isFalse();
        assertThat(response.getBody().getResults()).extracting(PageConversionResult::getPageIndex).containsExactly(0);
    }

    @Test
    void convertsAllPages_andFlagsFailures() {
        when(conversionService.convertAll(eq("<mxfile/>"), any())).thenReturn(List.of(success(0), failure(1)));

        ResponseEntity<ConversionResponse> response = controller.convert(
                ConversionRequest.builder().content("<mxfile/>").allPages(true).pageIndex(5).build());

        assertThat(response.getBody().isFailed()).isTrue();
        assertThat(response.getBody().getResults()).hasSize(2);
        verify(conversionService, never()).convertPage(anyString(), anyInt(), any());
    }

    @Test
    void overlaysRequestOptionsOnDefaults() {
        when(conversionService.convertPage(anyString(), anyInt(), any())).thenReturn(success(2));

        controller.convert(ConversionRequest.builder()
                .content("<mxfile/>")
                .pageIndex(2)
                .strictMode(true)
                .direction(LayoutDirection.LR)
                .idStrategy(IdStrategy.SOURCE_ID)
                .build());

        ArgumentCaptor<ConversionOptions> captor = ArgumentCaptor.forClass(ConversionOptions.class);
        verify(conversionService).convertPage(eq("<mxfile/>"), eq(2), captor.capture());
        ConversionOptions options = captor.getValue();
        assertThat(options.isStrictMode()).isTrue();
        assertThat(options.getDirection()).isEqualTo(LayoutDirection.LR);
        assertThat(options.getIdStrategy()).isEqualTo(IdStrategy.SOURCE_ID);
        assertThat(options.getReservedWords()).containsExactly("start");
        assertThat(options.isRetainContainerEdges()).isTrue();
    }

    @Test
    void keepsDefaults_whenRequestSetsNoOptions() {
        ConversionOptions options = controller.resolveOptions(ConversionRequest.builder().content("x").build());

        assertThat(options).isEqualTo(defaults);
    }

    @Test
    void listsPages() throws Exception {
        when(conversionService.listPages("<mxfile/>")).thenReturn(List.of(
                PageInfo.builder().index(0).name("Flow").build(),
                PageInfo.builder().index(1).name("Groups").build()));

        mockMvc.perform(post("/api/conversions/pages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"<mxfile/>\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pageCount").value(2))
                .andExpect(jsonPath("$.pages[1].name").value("Groups"));
    }

    @Test
    void returnsConversionResultsAsJson() throws Exception {
        when(conversionService.convertPage(anyString(), anyInt(), any())).thenReturn(success(0));

        mockMvc.perform(post("/api/conversions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"<mxfile/>\",\"direction\":\"LR\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.failed").value(false))
                .andExpect(jsonPath("$.results[0].mermaid").value("flowchart TD\n    a[\"A\"]"))
                .andExpect(jsonPath("$.results[0].status").value("SUCCESS"));
    }

    @Test
    void rejectsBlankContent() throws Exception {
        mockMvc.perform(post("/api/conversions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"));
    }

    @Test
    void rejectsUnreadableDiagram() throws Exception {
        when(conversionService.convertPage(anyString(), anyInt(), any()))
                .thenThrow(new DiagramLoadException("Malformed diagram XML: boom"));

        mockMvc.perform(post("/api/conversions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"<mxfile>\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unreadable diagram"))
                .andExpect(jsonPath("$.message").value("Malformed diagram XML: boom"));
    }

    @Test
    void rejectsPageIndexOutOfRange() throws Exception {
        when(conversionService.convertPage(anyString(), eq(9), any()))
                .thenThrow(new IllegalArgumentException("Page index 9 out of range; document has 1 page(s)"));

        mockMvc.perform(post("/api/conversions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"<mxfile/>\",\"pageIndex\":9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid request"));
    }

    private PageConversionResult success(int index) {
        return PageConversionResult.builder()
                .pageIndex(index)
                .pageName("Page-" + (index + 1))
                .status(ConversionStatus.SUCCESS)
                .direction(LayoutDirection.TD)
                .mermaid("flowchart TD\n    a[\"A\"]")
                .build();
    }

    private PageConversionResult failure(int index) {
        return PageConversionResult.builder()
                .pageIndex(index)
                .pageName("Page-" + (index + 1))
                .status(ConversionStatus.FAILED)
                .failure(ConversionFailure.builder()
                        .kind(ErrorKind.CYCLIC_HIERARCHY)
                        .sourceId("a")
                        .detail("Containment cycle: a -> b -> a")
                        .build())
                .build();
    }
}
