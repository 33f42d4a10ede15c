package com.vidnyan.rpax.domain.xaml;

import com.vidnyan.rpax.domain.model.Expression;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionExtractorTest {

    @Test
    void isExpression_ShouldDetectIndicatorsCallsAndAssignments() {
        assertTrue(ExpressionExtractor.isExpression("[Path.Combine(dir, \"Sub.xaml\")]"));
        assertTrue(ExpressionExtractor.isExpression("New List(Of String)"));
        assertTrue(ExpressionExtractor.isExpression("name.Trim()"));
        assertTrue(ExpressionExtractor.isExpression("total = 1"));

        assertFalse(ExpressionExtractor.isExpression("Hello world"));
        assertFalse(ExpressionExtractor.isExpression("x"));
        assertFalse(ExpressionExtractor.isExpression("a == b"));
        assertFalse(ExpressionExtractor.isExpression(null));
    }

    @Test
    void classifyRole_ShouldFollowAttributeName() {
        assertEquals(Expression.ROLE_CONDITION, ExpressionExtractor.classifyRole("Condition"));
        assertEquals(Expression.ROLE_ASSIGNMENT, ExpressionExtractor.classifyRole("Value"));
        assertEquals(Expression.ROLE_ASSIGNMENT, ExpressionExtractor.classifyRole("Result"));
        assertEquals(Expression.ROLE_MESSAGE, ExpressionExtractor.classifyRole("Message"));
        assertEquals(Expression.ROLE_TIMEOUT, ExpressionExtractor.classifyRole("TimeoutMS"));
        assertEquals(Expression.ROLE_GENERAL, ExpressionExtractor.classifyRole("Level"));
    }

    @Test
    void referencedVariables_ShouldFindNamesAndFilterKeywords() {
        assertEquals(List.of("customerName"), ExpressionExtractor.referencedVariables("[customerName.Trim()]"));
        assertEquals(List.of("total"), ExpressionExtractor.referencedVariables("[String.Format(\"{0}\", total)]"));
        assertEquals(List.of("counter"), ExpressionExtractor.referencedVariables("counter = counter + 1"));
        assertEquals(List.of("invoice"), ExpressionExtractor.referencedVariables("[invoice]"));
    }

    @Test
    void referencedVariables_ShouldDropSingleLetters() {
        assertTrue(ExpressionExtractor.referencedVariables("[a]").isEmpty());
        assertTrue(ExpressionExtractor.referencedVariables("").isEmpty());
    }

    @Test
    void methodCalls_ShouldListCalledMembers() {
        assertEquals(List.of("Trim", "ToLower"), ExpressionExtractor.methodCalls("[name.Trim().ToLower()]"));
    }

    @Test
    void extract_ShouldBuildExpressionsFromAttributesAndText() {
        // Arrange
        ExpressionExtractor extractor = new ExpressionExtractor("VisualBasic");
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("DisplayName", "Check");
        attributes.put("Condition", "[invoice.Amount > limit]");

        // Act
        List<Expression> expressions = extractor.extract(attributes, "[customer.Name]");

        // Assert
        assertEquals(2, expressions.size());
        Expression condition = expressions.get(0);
        assertEquals(Expression.ROLE_CONDITION, condition.role());
        assertEquals("Condition", condition.context());
        assertEquals("VisualBasic", condition.language());
        assertTrue(condition.variables().contains("invoice"));
        assertEquals(Expression.ROLE_GENERAL, expressions.get(1).role());
        assertEquals(ExpressionExtractor.TEXT_CONTEXT, expressions.get(1).context());
        assertEquals(List.of("customer"), expressions.get(1).variables());
    }
}
