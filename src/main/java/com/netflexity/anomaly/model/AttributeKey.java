package com.netflexity.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to an attribute (tag, resource attribute or column) in the backend.
 *
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttributeKey {

    private String key;

    private String dataType;

    private String type;

    @JsonProperty("isColumn")
    private boolean column;

    public static AttributeKey of(String key) {
        return new AttributeKey(key, null, null, false);
    }

    public AttributeKey copy() {
        return new AttributeKey(key, dataType, type, column);
    }
}
