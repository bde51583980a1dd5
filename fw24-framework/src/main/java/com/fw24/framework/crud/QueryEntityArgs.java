package com.fw24.framework.crud;

import com.fw24.framework.model.query.EntityQuery;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

/**
 * Arguments of {@code listEntity} and {@code queryEntity}. A missing query lists
 * everything.
 */
@Getter
@SuperBuilder
public class QueryEntityArgs extends CrudArgs {
    private final EntityQuery query;
}
