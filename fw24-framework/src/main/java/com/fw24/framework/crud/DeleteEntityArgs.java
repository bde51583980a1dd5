package com.fw24.framework.crud;

import lombok.Getter;
import lombok.experimental.SuperBuilder;

@Getter
@SuperBuilder
public class DeleteEntityArgs extends CrudArgs {
    private final Object id;
}
