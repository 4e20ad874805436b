package com.tariffwise.core.tools;

import com.tariffwise.core.reference.TariffCodes;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@code assess_risk}: rule-based import risk flags. Never calls a model.
 * <ul>
 *   <li>dual-use chapters raise risk to medium</li>
 *   <li>sanctioned origins raise risk to high</li>
 *   <li>machinery or electronics declared under 50 raise risk to medium (possible undervaluation)</li>
 * </ul>
 */
@Component
public class AssessRiskTool implements ClassificationTool {

    static final Set<Integer> DUAL_USE_CHAPTERS = Set.of(28, 29, 36, 84, 85, 87, 90, 93);
    static final Set<Integer> LOW_VALUE_CHAPTERS = Set.of(84, 85, 87, 90);
    static final Set<String> HIGH_RISK_ORIGINS = Set.of("iran", "north korea", "syria", "cuba");
    static final BigDecimal LOW_VALUE_THRESHOLD = BigDecimal.valueOf(50);

    @Override
    public String name() {
        return "assess_risk";
    }

    @Override
    public String description() {
        return "Assess import risk for a classified item from its code, origin country and declared value. "
                + "Returns a risk level (low, medium, high) and the reasons.";
    }

    @Override
    public String inputSchema() {
        return """
                {"type":"object","properties":{"code":{"type":"string"},"origin_country":{"type":"string"},"declared_value":{"type":"number"},"item_description":{"type":"string"}}}
                """;
    }

    @Override
    public Map<String, Object> invoke(ToolArguments arguments, RequestScope scope) {
        Optional<String> code = arguments.optionalText("code");
        Optional<String> origin = arguments.optionalText("origin_country");
        Optional<BigDecimal> value = arguments.optionalDecimal("declared_value");
        if (code.isEmpty() && origin.isEmpty()) {
            throw new ToolArgumentException("Provide at least 'code' or 'origin_country'");
        }

        Level level = Level.LOW;
        List<String> reasons = new ArrayList<>();
        int chapter = code.map(TariffCodes::chapter).orElse(-1);

        if (DUAL_USE_CHAPTERS.contains(chapter)) {
            level = level.atLeast(Level.MEDIUM);
            reasons.add("Chapter " + chapter + " may contain dual-use goods");
        }
        if (origin.isPresent() && HIGH_RISK_ORIGINS.contains(origin.get().toLowerCase(Locale.ROOT))) {
            level = level.atLeast(Level.HIGH);
            reasons.add("Origin " + origin.get() + " is subject to trade restrictions");
        }
        if (value.isPresent() && LOW_VALUE_CHAPTERS.contains(chapter)
                && value.get().compareTo(LOW_VALUE_THRESHOLD) < 0) {
            level = level.atLeast(Level.MEDIUM);
            reasons.add("Declared value " + value.get().toPlainString() + " is unusually low for chapter " + chapter);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("risk_level", level.name().toLowerCase(Locale.ROOT));
        result.put("reasons", reasons);
        return result;
    }

    private enum Level {
        LOW, MEDIUM, HIGH;

        Level atLeast(Level other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }
}
