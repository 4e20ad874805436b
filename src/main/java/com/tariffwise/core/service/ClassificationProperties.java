package com.tariffwise.core.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tariffwise.classification")
public class ClassificationProperties {

    /** Product lines rendered into one prompt; the rest are listed as omitted. */
    private int maxPromptLines = 10;

    public int getMaxPromptLines() {
        return maxPromptLines;
    }

    public void setMaxPromptLines(int maxPromptLines) {
        this.maxPromptLines = maxPromptLines;
    }
}
