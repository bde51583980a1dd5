package com.fw24.framework.repository.query;

import com.fw24.framework.model.filter.AttributeFilter;
import com.fw24.framework.model.filter.FilterGroup;
import com.fw24.framework.model.filter.FilterKind;
import com.fw24.framework.model.filter.LogicalOperator;
import com.fw24.framework.repository.AttributeRef;
import com.fw24.framework.repository.filter.DynamoConditionRenderer;
import com.fw24.framework.repository.filter.FilterCompiler;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class QueryStringParserTest {

    private final QueryStringParser parser = new QueryStringParser();

    private static Map<String, String> params(String... keyValues) {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put(keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    @Test
    public void testPlainValuesBecomeEquality() {
        FilterGroup group = parser.parse(params("status", "active", "age[gte]", "18"));
        assertEquals(QueryStringParser.FILTER_ID, group.getFilterId());
        assertEquals(2, group.getAnd().size());
        AttributeFilter status = (AttributeFilter) group.getAnd().get(0);
        assertEquals("status", status.getAttribute());
        assertEquals(Map.of("eq", "active"), status.getClauses());
        AttributeFilter age = (AttributeFilter) group.getAnd().get(1);
        assertEquals(Map.of("gte", 18), age.getClauses());
    }

    @Test
    public void testParseThenCompileRequiresBothConditions() {
        FilterGroup group = parser.parse(params("status", "active", "age[gte]", "18"));
        Map<String, AttributeRef> attributes = Map.of("status", new AttributeRef("status"), "age", new AttributeRef("age"));
        DynamoConditionRenderer renderer = new DynamoConditionRenderer();
        String expression = new FilterCompiler().compile(group, attributes, renderer);
        assertEquals("( #status = :status0 AND #age >= :age0 )", expression);
        assertEquals("active", renderer.getExpressionAttributeValues().get(":status0"));
        assertEquals(18, renderer.getExpressionAttributeValues().get(":age0"));
    }

    @Test
    public void testArrayOperatorsSplitOnDelimiters() {
        FilterGroup group = parser.parse(params("status[in]", "active,pending+archived", "tags[containsSome]", "a;b:c"));
        AttributeFilter status = (AttributeFilter) group.getAnd().get(0);
        assertEquals(List.of("active", "pending", "archived"), status.getClauses().get("in"));
        AttributeFilter tags = (AttributeFilter) group.getAnd().get(1);
        assertEquals(List.of("a", "b", "c"), tags.getClauses().get("containsSome"));

        FilterGroup numbers = parser.parse(params("age[nin]", "1,2"));
        assertEquals(List.of(1, 2), ((AttributeFilter) numbers.getAnd().get(0)).getClauses().get("nin"));
    }

    @Test
    public void testNonArrayOperatorsKeepDelimiters() {
        FilterGroup group = parser.parse(params("name[begins]", "a,b", "price[gt]", "9.5", "enabled", "true", "deletedAt", "null"));
        assertEquals("a,b", ((AttributeFilter) group.getAnd().get(0)).getClauses().get("begins"));
        assertEquals(9.5d, ((AttributeFilter) group.getAnd().get(1)).getClauses().get("gt"));
        assertEquals(Boolean.TRUE, ((AttributeFilter) group.getAnd().get(2)).getClauses().get("eq"));
        Map<String, Object> deletedAt = ((AttributeFilter) group.getAnd().get(3)).getClauses();
        assertTrue(deletedAt.containsKey("eq"));
        assertNull(deletedAt.get("eq"));
    }

    @Test
    public void testGroupBranches() {
        FilterGroup group = parser.parse(params(
                "or[0][status]", "active",
                "or[1][status][eq]", "pending",
                "not[0][type]", "system",
                "and[0][or][0][age][lt]", "18"));
        assertEquals(2, group.getOr().size());
        assertEquals(1, group.getNot().size());
        assertEquals(1, group.getAnd().size());
        assertEquals(FilterKind.GROUP, group.getAnd().get(0).getKind());
        FilterGroup nested = (FilterGroup) group.getAnd().get(0);
        assertEquals(Map.of("lt", 18), ((AttributeFilter) nested.getOr().get(0)).getClauses());
    }

    @Test
    public void testDottedKeysStayAttributeNames() {
        FilterGroup group = parser.parse(params("address.city", "Berlin"));
        assertEquals("address.city", ((AttributeFilter) group.getAnd().get(0)).getAttribute());
    }

    @Test
    public void testNestedInputAndLogicalOp() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("age", Map.of("logicalOp", "or", "lt", "18"));
        nested.put("and", List.of(Map.of("status", "active")));
        FilterGroup group = parser.toFilterGroup(nested);
        AttributeFilter age = (AttributeFilter) group.getAnd().get(0);
        assertEquals(LogicalOperator.OR, age.getLogicalOp());
        assertEquals(Map.of("lt", 18), age.getClauses());
        assertEquals(2, group.getAnd().size());
        assertTrue(parser.parse(Map.of()).isEmpty());
    }

    @Test
    public void testFoldBuildsListsFromIndexes() {
        Map<String, Object> folded = parser.fold(params("and[1][b]", "2", "and[0][a]", "1"));
        assertEquals(List.of(Map.of("a", "1"), Map.of("b", "2")), folded.get("and"));
    }
}
