package com.tariffwise.core.reference;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One entry of the tariff reference dataset.
 *
 * @param code        normalized code (digits only)
 * @param description official description
 * @param dutyRate    customs duty rate as printed in the tariff; nullable
 */
public record ReferenceRecord(
    String code,
    String description,
    @JsonProperty("duty_rate") String dutyRate
) implements Serializable {

    public ReferenceRecord {
        code = TariffCodes.normalize(code);
        description = description == null ? "" : description;
    }
}
