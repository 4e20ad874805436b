package com.tariffwise.core.reference;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tariffwise.reference")
public class ReferenceProperties {

    /** "classpath" to load {@link #resource}, "jdbc" to query the {@code tariff_codes} table. */
    private String source = "classpath";
    private String resource = "classpath:reference/tariff-codes.json";

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getResource() {
        return resource;
    }

    public void setResource(String resource) {
        this.resource = resource;
    }
}
