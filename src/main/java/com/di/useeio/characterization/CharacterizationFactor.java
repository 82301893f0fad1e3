package com.di.useeio.characterization;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One cell of the characterization matrix C: the factor converting a flow into an indicator
 * under a model version. Rows are immutable once loaded.
 */
@Value
@Builder
public class CharacterizationFactor {

    String modelVersion;
    String indicatorCode;
    String flow;
    BigDecimal value;
}
