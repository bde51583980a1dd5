package com.fw24.framework.repository;

/**
 * Handle on a record attribute, as handed to a where callback by the repository.
 */
public record AttributeRef(String name) {
}
