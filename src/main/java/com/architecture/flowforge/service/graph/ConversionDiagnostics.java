package com.architecture.flowforge.service.graph;

import com.architecture.flowforge.dto.ConversionWarning;
import com.architecture.flowforge.dto.ErrorKind;
import com.architecture.flowforge.exception.ConversionException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run collector of conversion diagnostics.
 *
 * A fresh instance is created for every page conversion and handed to each pipeline stage,
 * so warnings never leak between pages or requests.
 */
@Slf4j
public class ConversionDiagnostics {

    private final boolean strictMode;
    private final List<ConversionWarning> warnings = new ArrayList<>();

    public ConversionDiagnostics(boolean strictMode) {
        this.strictMode = strictMode;
    }

    /**
     * Record a diagnostic. Throws {@link ConversionException} when the kind is fatal, or when
     * strict mode is on and the kind is not informational; otherwise the caller continues with
     * its fallback.
     */
    public void report(ErrorKind kind, String sourceId, String detail) {
        if (kind.isFatal() || (strictMode && !kind.isInformational())) {
            throw new ConversionException(kind, sourceId, detail);
        }

        if (kind.isInformational()) {
            log.info("[{}] cell {}: {}", kind, sourceId, detail);
        } else {
            log.warn("[{}] cell {}: {}", kind, sourceId, detail);
        }

        warnings.add(ConversionWarning.builder()
                .kind(kind)
                .sourceId(sourceId)
                .detail(detail)
                .build());
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    public List<ConversionWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
