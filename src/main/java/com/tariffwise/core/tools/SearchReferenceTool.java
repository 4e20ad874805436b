package com.tariffwise.core.tools;

import com.tariffwise.core.reference.ReferenceDataset;
import com.tariffwise.core.reference.ReferenceRecord;
import com.tariffwise.core.reference.TariffCodes;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@code search_reference}: structured search of the tariff reference by code prefix or by
 * description keywords.
 */
@Component
public class SearchReferenceTool implements ClassificationTool {

    private static final int DEFAULT_LIMIT = 10;
    private static final int MAX_LIMIT = 50;

    private final ReferenceDataset dataset;

    public SearchReferenceTool(ReferenceDataset dataset) {
        this.dataset = dataset;
    }

    @Override
    public String name() {
        return "search_reference";
    }

    @Override
    public String description() {
        return "Search the tariff reference. Pass code_prefix (e.g. \"8516\") to list codes under a heading, "
                + "or query with English keywords to search descriptions. Returns code, description and duty rate.";
    }

    @Override
    public String inputSchema() {
        return """
                {"type":"object","properties":{"query":{"type":"string","description":"Keywords to find in descriptions"},"code_prefix":{"type":"string","description":"Leading digits of a code"},"limit":{"type":"integer","minimum":1,"maximum":50}}}
                """;
    }

    @Override
    public Map<String, Object> invoke(ToolArguments arguments, RequestScope scope) {
        Optional<String> query = arguments.optionalText("query");
        Optional<String> prefix = arguments.optionalText("code_prefix").map(TariffCodes::normalize);
        if (query.isEmpty() && prefix.isEmpty()) {
            throw new ToolArgumentException("Provide 'query' or 'code_prefix'");
        }
        int limit = arguments.optionalInt("limit", DEFAULT_LIMIT, 1, MAX_LIMIT);

        List<ReferenceRecord> records;
        if (prefix.isPresent()) {
            List<ReferenceRecord> all = scope.cached("prefix:" + prefix.get(), () -> dataset.searchPrefix(prefix.get()));
            records = all.stream()
                    .filter(r -> query.isEmpty() || r.description().toLowerCase(Locale.ROOT).contains(query.get().toLowerCase(Locale.ROOT)))
                    .limit(limit)
                    .toList();
        } else {
            records = scope.cached("query:" + query.get().toLowerCase(Locale.ROOT) + ":" + limit,
                    () -> dataset.searchDescription(query.get(), limit));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("count", records.size());
        result.put("records", records.stream().map(SearchReferenceTool::toMap).toList());
        return result;
    }

    static Map<String, Object> toMap(ReferenceRecord record) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("code", TariffCodes.format(record.code()));
        map.put("description", record.description());
        map.put("duty_rate", record.dutyRate());
        return map;
    }
}
