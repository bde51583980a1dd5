package com.fw24.framework.repository;

/**
 * Condition primitives a repository exposes to a where callback. Every method returns
 * an expression fragment. A value that is itself an {@link AttributeRef} refers to
 * another attribute of the same record rather than to a literal.
 */
public interface WhereOperations {

    String eq(AttributeRef attribute, Object value);

    String ne(AttributeRef attribute, Object value);

    String gt(AttributeRef attribute, Object value);

    String gte(AttributeRef attribute, Object value);

    String lt(AttributeRef attribute, Object value);

    String lte(AttributeRef attribute, Object value);

    String between(AttributeRef attribute, Object from, Object to);

    String begins(AttributeRef attribute, Object value);

    String exists(AttributeRef attribute);

    String notExists(AttributeRef attribute);

    String contains(AttributeRef attribute, Object value);

    String notContains(AttributeRef attribute, Object value);

    AttributeRef name(String path);
}
