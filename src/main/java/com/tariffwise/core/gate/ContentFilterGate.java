package com.tariffwise.core.gate;

import com.tariffwise.core.model.GateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces disallowed phrases in the final rendered text.
 * <p>
 * Plain case-insensitive substring matching against a fixed table. Longer phrases are tried
 * first so that a phrase containing a shorter one is replaced whole. Hebrew phrases get the
 * Hebrew replacement, everything else the English one.
 */
@Component
public class ContentFilterGate implements ValidationGate {

    private static final Logger log = LoggerFactory.getLogger(ContentFilterGate.class);

    public static final String NAME = "content_filter";

    static final List<String> DEFAULT_PHRASES = List.of(
            "מומלץ לפנות לעמיל מכס",
            "מומלץ להתייעץ עם עמיל מכס",
            "מומלץ להתייעץ עם סוכן מכס",
            "יש לפנות לעמיל מכס",
            "יש להתייעץ עם עמיל מכס",
            "יש לאמת עם עמיל מכס מוסמך",
            "פנה לעמיל מכס",
            "פנו לעמיל מכס",
            "התייעצו עם עמיל מכס",
            "לא ניתן לסווג",
            "לא ניתן לקבוע",
            "consult a licensed customs broker",
            "consult with a customs broker",
            "consult a customs broker",
            "seek professional customs advice",
            "contact a customs agent",
            "I'm not sure",
            "I am not sure",
            "I cannot determine",
            "unable to classify",
            "unclassifiable"
    );

    private static final Pattern HEBREW = Pattern.compile("[\\u0590-\\u05FF]");

    /** Result of one scan. */
    public record FilterOutcome(String cleanedText, List<String> phrasesFound, boolean wasModified) {}

    private record PhraseRule(String phrase, Pattern pattern, String replacement) {}

    private final List<PhraseRule> rules;

    public ContentFilterGate(GateProperties props) {
        GateProperties.ContentFilter filter = props.getContentFilter();
        Set<String> phrases = new LinkedHashSet<>(DEFAULT_PHRASES);
        if (filter.getAdditionalPhrases() != null) {
            filter.getAdditionalPhrases().stream()
                    .filter(p -> p != null && !p.isBlank())
                    .map(String::strip)
                    .forEach(phrases::add);
        }
        List<PhraseRule> built = new ArrayList<>();
        for (String phrase : phrases) {
            String replacement = HEBREW.matcher(phrase).find() ? filter.getReplacementHe() : filter.getReplacementEn();
            built.add(new PhraseRule(phrase,
                    Pattern.compile(Pattern.quote(phrase), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                    replacement));
        }
        built.sort(Comparator.comparingInt((PhraseRule r) -> r.phrase().length()).reversed());
        this.rules = List.copyOf(built);
    }

    @Override
    public String name() {
        return NAME;
    }

    public FilterOutcome filter(String text) {
        if (text == null || text.isEmpty()) {
            return new FilterOutcome(text == null ? "" : text, List.of(), false);
        }
        String cleaned = text;
        List<String> found = new ArrayList<>();
        for (PhraseRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(cleaned);
            if (matcher.find()) {
                found.add(rule.phrase());
                cleaned = matcher.replaceAll(Matcher.quoteReplacement(rule.replacement()));
            }
        }
        return new FilterOutcome(cleaned, found, !found.isEmpty());
    }

    @Override
    public GateResult apply(GateContext context) {
        FilterOutcome outcome = filter(context.renderedText());
        context.setCleanedText(outcome.cleanedText());
        if (!outcome.wasModified()) {
            return GateResult.passed(NAME, List.of());
        }
        context.addPhrasesFound(outcome.phrasesFound());
        for (String phrase : outcome.phrasesFound()) {
            context.audit(NAME, "rendered_text", "replaced_phrase", "Replaced \"" + phrase + "\"");
        }
        log.info("Content filter replaced {} phrase(s)", outcome.phrasesFound().size());
        return GateResult.flagged(NAME, outcome.phrasesFound());
    }
}
