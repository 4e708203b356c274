package com.netflexity.anomaly.template;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Values available to alert templates.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Value
public class TemplateData {

    Map<String, String> labels;

    String value;

    String threshold;

    /**
     * Plain decimal rendering, without exponent or trailing zeros
     */
    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
