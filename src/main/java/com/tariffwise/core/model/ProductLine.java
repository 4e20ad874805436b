package com.tariffwise.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * One product line of a classification request.
 *
 * @param description    free-text product description (required)
 * @param quantity       declared quantity; nullable
 * @param declaredOrigin declared country of origin; nullable
 * @param declaredValue  declared value in the invoice currency; nullable
 */
public record ProductLine(
    String description,
    Integer quantity,
    @JsonProperty("declared_origin") String declaredOrigin,
    @JsonProperty("declared_value") BigDecimal declaredValue
) implements Serializable {

    public ProductLine {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Product line description must not be blank");
        }
        description = description.strip();
    }

    public static ProductLine of(String description) {
        return new ProductLine(description, null, null, null);
    }
}
