package com.tariffwise.core.gate;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the three validation gates, bound from {@code tariffwise.gates.*}.
 */
@Component
@ConfigurationProperties(prefix = "tariffwise.gates")
public class GateProperties {

    private CodeValidation codeValidation = new CodeValidation();
    private LoopBreaker loopBreaker = new LoopBreaker();
    private ContentFilter contentFilter = new ContentFilter();

    public CodeValidation getCodeValidation() { return codeValidation; }
    public void setCodeValidation(CodeValidation codeValidation) { this.codeValidation = codeValidation; }
    public LoopBreaker getLoopBreaker() { return loopBreaker; }
    public void setLoopBreaker(LoopBreaker loopBreaker) { this.loopBreaker = loopBreaker; }
    public ContentFilter getContentFilter() { return contentFilter; }
    public void setContentFilter(ContentFilter contentFilter) { this.contentFilter = contentFilter; }

    public static class CodeValidation {
        /** Prefix length of a heading, the first sibling level searched. */
        private int headingDigits = 4;
        /** Prefix length of a chapter, the fallback sibling level. */
        private int chapterDigits = 2;

        public int getHeadingDigits() { return headingDigits; }
        public void setHeadingDigits(int headingDigits) { this.headingDigits = headingDigits; }
        public int getChapterDigits() { return chapterDigits; }
        public void setChapterDigits(int chapterDigits) { this.chapterDigits = chapterDigits; }
    }

    public static class LoopBreaker {
        /** Automated attempts allowed per thread before escalation. */
        private int maxAttempts = 2;
        /** Tracking tokens stripped from subjects before hashing, e.g. {@code CLS-20240101-001}. */
        private String trackingTokenPattern = "[A-Z]{2,5}-\\d{8}-\\d{3}(-[A-Z]+)?";

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public String getTrackingTokenPattern() { return trackingTokenPattern; }
        public void setTrackingTokenPattern(String trackingTokenPattern) { this.trackingTokenPattern = trackingTokenPattern; }
    }

    public static class ContentFilter {
        private String replacementEn = "For further details, contact our classification team.";
        private String replacementHe = "לפרטים נוספים, פנו לצוות הסיווג שלנו.";
        /** Extra phrases appended to the built-in list. */
        private List<String> additionalPhrases = new ArrayList<>();

        public String getReplacementEn() { return replacementEn; }
        public void setReplacementEn(String replacementEn) { this.replacementEn = replacementEn; }
        public String getReplacementHe() { return replacementHe; }
        public void setReplacementHe(String replacementHe) { this.replacementHe = replacementHe; }
        public List<String> getAdditionalPhrases() { return additionalPhrases; }
        public void setAdditionalPhrases(List<String> additionalPhrases) { this.additionalPhrases = additionalPhrases; }
    }
}
