package com.di.useeio.methodology;

import com.di.useeio.gwp.GwpReference;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A characterization factor with the GWP reference row its flow's gas resolved to.
 * {@code gwp} is null when no reference row matched under the requested AR version.
 */
@Value
@Builder
public class ResolvedFactor {

    String modelVersion;
    String indicatorCode;
    String flow;
    /** First path segment of {@code flow}, the gas name looked up in the reference. */
    String substance;
    BigDecimal characterizationValue;
    GwpReference gwp;

    public boolean hasGwp() {
        return gwp != null;
    }
}
