package com.fw24.framework.crud;

import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.Map;

@Getter
@SuperBuilder
public class UpdateEntityArgs extends CrudArgs {
    /** Identifier value or map of the record to patch. */
    private final Object id;
    /** Attributes to set; identifier attributes are ignored. */
    private final Map<String, Object> data;
}
