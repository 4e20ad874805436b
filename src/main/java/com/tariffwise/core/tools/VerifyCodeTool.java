package com.tariffwise.core.tools;

import com.tariffwise.core.reference.ReferenceDataset;
import com.tariffwise.core.reference.ReferenceRecord;
import com.tariffwise.core.reference.TariffCodes;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code verify_code}: checks that a code exists; when it does not, lists a few codes under
 * the same heading so the model can pick a real one.
 */
@Component
public class VerifyCodeTool implements ClassificationTool {

    private static final int HINTS = 5;

    private final ReferenceDataset dataset;

    public VerifyCodeTool(ReferenceDataset dataset) {
        this.dataset = dataset;
    }

    @Override
    public String name() {
        return "verify_code";
    }

    @Override
    public String description() {
        return "Verify that a tariff code exists in the reference. Returns its official description, "
                + "or nearby codes under the same heading when it does not exist.";
    }

    @Override
    public String inputSchema() {
        return """
                {"type":"object","properties":{"code":{"type":"string","description":"Tariff code, separators allowed"}},"required":["code"]}
                """;
    }

    @Override
    public Map<String, Object> invoke(ToolArguments arguments, RequestScope scope) {
        String code = TariffCodes.normalize(arguments.requireText("code"));
        if (code.length() < 4 || !code.chars().allMatch(Character::isDigit)) {
            throw new ToolArgumentException("'code' must contain at least 4 digits");
        }
        Optional<ReferenceRecord> record = scope.cached("code:" + code, () -> dataset.lookupByCode(code));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("code", TariffCodes.format(code));
        if (record.isPresent()) {
            result.put("exists", true);
            result.put("description", record.get().description());
            result.put("duty_rate", record.get().dutyRate());
            return result;
        }
        List<ReferenceRecord> siblings = dataset.searchPrefix(code.substring(0, 4));
        result.put("exists", false);
        result.put("nearby_codes", siblings.stream().limit(HINTS).map(SearchReferenceTool::toMap).toList());
        return result;
    }
}
