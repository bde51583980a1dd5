package com.fw24.framework.model.filter;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * A clause value that carries a type tag. A {@link ComplexValueType#PROP_REF} value names
 * another attribute of the same record instead of a literal, which allows comparisons
 * such as {@code endDate > startDate}.
 */
@Value
@Builder
public class ComplexFilterValue {
    public static final String VAL = "val";
    public static final String VAL_TYPE = "valType";
    public static final String VAL_LABEL = "valLabel";

    Object val;
    @Builder.Default
    ComplexValueType valType = ComplexValueType.LITERAL;
    String valLabel;

    public boolean isPropertyReference() {
        return valType == ComplexValueType.PROP_REF;
    }

    public static ComplexFilterValue propRef(String attribute) {
        return ComplexFilterValue.builder().val(attribute).valType(ComplexValueType.PROP_REF).build();
    }

    /**
     * Recognizes both typed instances and raw maps carrying a {@code val} key.
     */
    public static Optional<ComplexFilterValue> detect(Object value) {
        if (value instanceof ComplexFilterValue complex) {
            return Optional.of(complex);
        }
        if (value instanceof Map<?, ?> map && map.containsKey(VAL)) {
            Object label = map.get(VAL_LABEL);
            return Optional.of(ComplexFilterValue.builder()
                    .val(map.get(VAL))
                    .valType(ComplexValueType.fromValue(map.get(VAL_TYPE)))
                    .valLabel(label == null ? null : label.toString())
                    .build());
        }
        return Optional.empty();
    }
}
