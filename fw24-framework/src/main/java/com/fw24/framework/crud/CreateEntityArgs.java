package com.fw24.framework.crud;

import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.Map;

@Getter
@SuperBuilder
public class CreateEntityArgs extends CrudArgs {
    private final Map<String, Object> data;
}
