package com.architecture.flowforge.config;

import com.architecture.flowforge.dto.ConversionOptions;
import com.architecture.flowforge.dto.IdStrategy;
import com.architecture.flowforge.dto.graph.LayoutDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Application-wide conversion defaults.
 * Reads {@code flowforge.conversion.*} from application.yml; API requests may override any field.
 */
@Configuration
@Slf4j
public class ConversionConfig {

    @Value("${flowforge.conversion.direction:}")
    private String direction;

    @Value("${flowforge.conversion.strict-mode:false}")
    private boolean strictMode;

    @Value("${flowforge.conversion.retain-container-edges:true}")
    private boolean retainContainerEdges;

    @Value("${flowforge.conversion.id-strategy:LABEL}")
    private String idStrategy;

    // Comma separated, e.g. "start,stop"
    @Value("${flowforge.conversion.reserved-words:}")
    private String reservedWords;

    // Comma separated marker=shape pairs, e.g. "actor=CIRCLE,swimlane=RECTANGLE"
    @Value("${flowforge.conversion.shape-overrides:}")
    private String shapeOverrides;

    @Bean
    public ConversionOptions defaultConversionOptions() {
        ConversionOptions options = ConversionOptions.builder()
                .direction(parseDirection(direction))
                .strictMode(strictMode)
                .retainContainerEdges(retainContainerEdges)
                .idStrategy(parseIdStrategy(idStrategy))
                .reservedWords(parseList(reservedWords))
                .shapeOverrides(parsePairs(shapeOverrides))
                .build();

        log.info("[Conversion Config] direction={}, strictMode={}, idStrategy={}, retainContainerEdges={}",
                options.getDirection() == null ? "auto" : options.getDirection(),
                options.isStrictMode(), options.getIdStrategy(), options.isRetainContainerEdges());
        return options;
    }

    static LayoutDirection parseDirection(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        LayoutDirection parsed = LayoutDirection.fromString(value);
        if (parsed == null) {
            log.warn("[Conversion Config] Unknown direction '{}', using the orientation heuristic", value);
        }
        return parsed;
    }

    static IdStrategy parseIdStrategy(String value) {
        if (value == null || value.isBlank()) {
            return IdStrategy.LABEL;
        }
        try {
            return IdStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("[Conversion Config] Unknown id strategy '{}', using {}", value, IdStrategy.LABEL);
            return IdStrategy.LABEL;
        }
    }

    static Set<String> parseList(String value) {
        Set<String> items = new LinkedHashSet<>();
        if (value == null) {
            return items;
        }
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    static Map<String, String> parsePairs(String value) {
        Map<String, String> pairs = new LinkedHashMap<>();
        for (String item : parseList(value)) {
            int eq = item.indexOf('=');
            if (eq <= 0 || eq == item.length() - 1) {
                log.warn("[Conversion Config] Ignoring malformed shape override '{}'", item);
                continue;
            }
            pairs.put(item.substring(0, eq).trim(), item.substring(eq + 1).trim());
        }
        return pairs;
    }
}
