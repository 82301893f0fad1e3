package com.di.useeio.gwp;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One {@code ipcc_ar_gwp} row: the 100-year GWP of a gas under an Assessment Report.
 * {@code gwpValue} is null when the report gives only a bound; {@code gwpDisplay} then holds the text.
 */
@Value
@Builder
public class GwpReference {

    String gasName;
    String arVersion;
    BigDecimal gwpValue;
    String gwpDisplay;
    String category;

    /** Text to show for this factor: the display override if set, else the plain number, else null. */
    public String displayValue() {
        if (gwpDisplay != null && !gwpDisplay.isBlank()) {
            return gwpDisplay;
        }
        return gwpValue != null ? gwpValue.stripTrailingZeros().toPlainString() : null;
    }
}
