package com.fw24.framework.model.filter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Comparison operators a filter clause may use, each with the full set of accepted
 * aliases. Alias lookup is case sensitive.
 */
public enum FilterOperator {
    EQ(false, "eq", "equal", "equalTo", "==", "==="),
    NE(false, "ne", "neq", "notEqual", "notEqualTo", "!=", "!==", "<>"),
    GT(false, "gt", "greaterThan", "greaterThen", ">"),
    GTE(false, "gte", "greaterThanOrEqualTo", "greaterThenOrEqualTo", ">=", ">=="),
    LT(false, "lt", "lessThan", "lessThen", "<"),
    LTE(false, "lte", "lessThanOrEqualTo", "lessThenOrEqualTo", "<=", "<=="),
    BETWEEN(false, "between", "bt", "bw", "><"),
    BEGINS(false, "begins", "beginsWith", "startsWith", "like"),
    ENDS_WITH(false, "endsWith"),
    CONTAINS(true, "contains", "has", "includes"),
    CONTAINS_SOME(true, "containsSome", "hasSome", "includesSome"),
    NOT_CONTAINS(true, "notContains", "notHas", "notIncludes"),
    IN(true, "in", "inList"),
    NIN(true, "nin", "notIn", "notInList"),
    EXISTS(false, "exists"),
    IS_NULL(false, "isNull"),
    IS_EMPTY(false, "isEmpty");

    private static final Map<String, FilterOperator> BY_ALIAS = new HashMap<>();

    static {
        for (FilterOperator operator : values()) {
            for (String alias : operator.aliases) {
                BY_ALIAS.put(alias, operator);
            }
        }
    }

    private final boolean arrayValued;
    private final List<String> aliases;

    FilterOperator(boolean arrayValued, String... aliases) {
        this.arrayValued = arrayValued;
        this.aliases = List.of(aliases);
    }

    /**
     * Membership and containment operators take a list of values; a scalar is treated
     * as a one element list.
     */
    public boolean isArrayValued() {
        return arrayValued;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public String getCanonicalName() {
        return aliases.get(0);
    }

    public static Optional<FilterOperator> fromAlias(String alias) {
        return Optional.ofNullable(alias == null ? null : BY_ALIAS.get(alias));
    }

    public static boolean isOperatorKey(String key) {
        return key != null && BY_ALIAS.containsKey(key);
    }
}
