package com.architecture.flowforge.service.graph;

import com.architecture.flowforge.dto.ErrorKind;
import com.architecture.flowforge.exception.ConversionException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversionDiagnosticsTest {

    @Test
    void recordsRecoverableKindAsWarning_inRelaxedMode() {
        ConversionDiagnostics diagnostics = new ConversionDiagnostics(false);

        diagnostics.report(ErrorKind.DANGLING_EDGE_REFERENCE, "e1", "target missing");

        assertThat(diagnostics.getWarnings()).singleElement().satisfies(warning -> {
            assertThat(warning.getKind()).isEqualTo(ErrorKind.DANGLING_EDGE_REFERENCE);
            assertThat(warning.getSourceId()).isEqualTo("e1");
            assertThat(warning.getDetail()).isEqualTo("target missing");
        });
    }

    @Test
    void abortsOnRecoverableKind_inStrictMode() {
        ConversionDiagnostics diagnostics = new ConversionDiagnostics(true);

        assertThatThrownBy(() -> diagnostics.report(ErrorKind.UNSUPPORTED_ELEMENT, "x", "unknown cell"))
                .isInstanceOf(ConversionException.class)
                .satisfies(e -> {
                    ConversionException conversionException = (ConversionException) e;
                    assertThat(conversionException.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_ELEMENT);
                    assertThat(conversionException.getSourceId()).isEqualTo("x");
                });
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void neverAbortsOnInformationalKind_evenInStrictMode() {
        ConversionDiagnostics diagnostics = new ConversionDiagnostics(true);

        diagnostics.report(ErrorKind.RESERVED_WORD_COLLISION, "n1", "renamed");

        assertThat(diagnostics.getWarnings()).extracting("kind").containsExactly(ErrorKind.RESERVED_WORD_COLLISION);
    }

    @Test
    void alwaysAbortsOnFatalKind() {
        ConversionDiagnostics diagnostics = new ConversionDiagnostics(false);

        assertThatThrownBy(() -> diagnostics.report(ErrorKind.CYCLIC_HIERARCHY, "a", "a -> a"))
                .isInstanceOf(ConversionException.class)
                .hasMessage("a -> a");
    }
}
