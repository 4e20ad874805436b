package com.tariffwise.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.tariffwise.core.llm.LlmParseException;
import com.tariffwise.core.memory.ClassificationMemory;
import com.tariffwise.core.memory.MemoryHit;
import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.CandidateSource;
import com.tariffwise.core.model.Confidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts candidate classifications from free-form model output.
 * <p>
 * Accepts JSON in a code fence, JSON embedded in prose, a bare array, and lenient JSON (single
 * quotes, trailing commas, comments). Truncated output is salvaged object by object.
 * {@link #parse(String)} never throws; {@link #parseStrict(String)} reports failures as
 * {@link LlmParseException}.
 */
@Component
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    private static final Pattern FENCED = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);
    private static final Pattern FLAT_OBJECT = Pattern.compile("\\{[^{}]*}");

    private static final String[] LIST_FIELDS = {"classifications", "items", "candidates", "results"};
    private static final String[] CODE_FIELDS = {"hs_code", "code", "tariff_code"};
    private static final String[] ITEM_FIELDS = {"item_description", "item", "description", "product"};
    private static final String[] REASON_FIELDS = {"reasoning", "explanation", "rationale"};
    private static final String[] SYNTHESIS_FIELDS = {"synthesis", "summary"};

    private final ObjectMapper mapper;

    public ResponseParser() {
        this.mapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }

    /** Lenient entry point: returns an empty payload when nothing can be extracted. */
    public ParsedPayload parse(String raw) {
        try {
            return parseStrict(raw);
        } catch (LlmParseException e) {
            log.warn("Model output could not be parsed, continuing with empty payload: {}", e.getMessage());
            log.debug("Unparseable output: {}", raw);
            return ParsedPayload.empty();
        }
    }

    /** Parses {@code raw} and merges the memory hits resolved before the model was called. */
    public ParsedPayload parse(String raw, List<MemoryHit> memoryHits) {
        return merge(parse(raw), memoryHits);
    }

    public ParsedPayload parseStrict(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new LlmParseException("Model output is empty");
        }
        for (String json : jsonCandidates(raw)) {
            try {
                ParsedPayload payload = fromNode(mapper.readTree(json));
                if (!payload.isEmpty()) {
                    return payload;
                }
            } catch (JsonProcessingException e) {
                log.debug("JSON candidate rejected: {}", e.getOriginalMessage());
            }
        }
        List<CandidateClassification> salvaged = salvage(raw);
        if (!salvaged.isEmpty()) {
            log.info("Salvaged {} candidate(s) from partial JSON", salvaged.size());
            return new ParsedPayload(salvaged, "");
        }
        throw new LlmParseException("No classification JSON found in model output (" + raw.length() + " chars)");
    }

    /**
     * Merges memory hits into the parsed candidates. A memory hit with a code replaces the
     * model's candidate for the same item; items the model did not address are added from memory.
     */
    public ParsedPayload merge(ParsedPayload parsed, List<MemoryHit> memoryHits) {
        if (memoryHits == null || memoryHits.isEmpty()) {
            return parsed;
        }
        List<CandidateClassification> merged = new ArrayList<>(parsed.candidates());
        Set<Integer> claimed = new HashSet<>();
        for (MemoryHit hit : memoryHits) {
            if (hit.code() == null || hit.code().isBlank()) {
                continue;
            }
            int index = indexOfItem(merged, hit.itemDescription(), claimed);
            if (index < 0) {
                claimed.add(merged.size());
                merged.add(fromMemory(hit));
            } else {
                claimed.add(index);
                merged.set(index, fromMemory(hit));
            }
        }
        return new ParsedPayload(merged, parsed.synthesis());
    }

    public static CandidateClassification fromMemory(MemoryHit hit) {
        return new CandidateClassification(hit.itemDescription(), hit.code(), Confidence.fromScore(hit.confidence()),
                CandidateSource.MEMORY, "Matched classification memory (" + hit.level().name().toLowerCase(Locale.ROOT) + ")");
    }

    private List<String> jsonCandidates(String raw) {
        List<String> candidates = new ArrayList<>();
        Matcher fenced = FENCED.matcher(raw);
        while (fenced.find()) {
            candidates.add(fenced.group(1).trim());
        }
        int firstBrace = raw.indexOf('{');
        int lastBrace = raw.lastIndexOf('}');
        int firstBracket = raw.indexOf('[');
        int lastBracket = raw.lastIndexOf(']');
        String object = firstBrace >= 0 && lastBrace > firstBrace ? raw.substring(firstBrace, lastBrace + 1) : null;
        String array = firstBracket >= 0 && lastBracket > firstBracket ? raw.substring(firstBracket, lastBracket + 1) : null;
        // whichever opens first is the outermost value
        if (array != null && (object == null || firstBracket < firstBrace)) {
            candidates.add(array);
        }
        if (object != null) {
            candidates.add(object);
        }
        if (array != null && object != null && firstBrace < firstBracket) {
            candidates.add(array);
        }
        return candidates;
    }

    private ParsedPayload fromNode(JsonNode node) {
        if (node == null) {
            return ParsedPayload.empty();
        }
        if (node.isArray()) {
            return new ParsedPayload(candidatesFrom(node), "");
        }
        if (!node.isObject()) {
            return ParsedPayload.empty();
        }
        String synthesis = text(node, SYNTHESIS_FIELDS);
        for (String field : LIST_FIELDS) {
            JsonNode list = node.get(field);
            if (list != null && list.isArray()) {
                return new ParsedPayload(candidatesFrom(list), synthesis);
            }
        }
        CandidateClassification single = candidateFrom(node);
        return single != null ? new ParsedPayload(List.of(single), synthesis) : new ParsedPayload(List.of(), synthesis);
    }

    private List<CandidateClassification> candidatesFrom(JsonNode array) {
        List<CandidateClassification> candidates = new ArrayList<>();
        for (JsonNode item : array) {
            CandidateClassification candidate = candidateFrom(item);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    private CandidateClassification candidateFrom(JsonNode item) {
        if (item == null || !item.isObject()) {
            return null;
        }
        String code = text(item, CODE_FIELDS);
        String description = text(item, ITEM_FIELDS);
        if (code.isBlank() && description.isBlank()) {
            return null;
        }
        return new CandidateClassification(description, code, confidence(item.get("confidence")),
                CandidateSource.MODEL, text(item, REASON_FIELDS));
    }

    private List<CandidateClassification> salvage(String raw) {
        List<CandidateClassification> salvaged = new ArrayList<>();
        Matcher matcher = FLAT_OBJECT.matcher(raw);
        while (matcher.find()) {
            try {
                CandidateClassification candidate = candidateFrom(mapper.readTree(matcher.group()));
                if (candidate != null && candidate.hasCode()) {
                    salvaged.add(candidate);
                }
            } catch (JsonProcessingException e) {
                log.debug("Skipping unreadable fragment: {}", e.getOriginalMessage());
            }
        }
        return salvaged;
    }

    private static Confidence confidence(JsonNode node) {
        if (node == null || node.isNull()) {
            return Confidence.LOW;
        }
        if (node.isNumber()) {
            double score = node.asDouble();
            return Confidence.fromScore(score > 1 ? score / 100.0 : score);
        }
        return Confidence.fromText(node.asText());
    }

    private static String text(JsonNode node, String[] fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText().strip();
            }
        }
        return "";
    }

    /** First unclaimed candidate whose memory key equals the description's key, or -1. */
    private static int indexOfItem(List<CandidateClassification> candidates, String description,
                                   Set<Integer> claimed) {
        String key = ClassificationMemory.keyOf(description);
        if (key.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < candidates.size(); i++) {
            if (!claimed.contains(i)
                    && key.equals(ClassificationMemory.keyOf(candidates.get(i).getItemDescription()))) {
                return i;
            }
        }
        return -1;
    }
}
