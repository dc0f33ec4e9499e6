package io.lighting.stencil.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.stencil.TemplateEvaluationException;
import io.lighting.stencil.TemplateSyntaxException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExpressionTest {
    private static Object eval(String expression, Map<String, Object> data) {
        return Expression.parse(expression).evaluate(TemplateContext.of(data));
    }

    private static Object eval(String expression) {
        return eval(expression, Map.of());
    }

    @Test
    void respectsOperatorPrecedence() {
        assertEquals(7L, eval("1 + 2 * 3"));
        assertEquals(9L, eval("(1 + 2) * 3"));
        assertEquals(true, eval("1 + 1 == 2 & 3 > 2"));
        assertEquals(true, eval("false | 2 >= 2"));
        assertEquals(-3L, eval("-1 - 2"));
        assertEquals(1L, eval("7 % 3"));
    }

    @Test
    void acceptsDoubledLogicalOperators() {
        assertEquals(true, eval("a && b || c", Map.of("a", true, "b", false, "c", true)));
    }

    @Test
    void concatenatesStrings() {
        assertEquals("Total: 3", eval("'Total: ' + (1 + 2)"));
        assertEquals("a1.5", eval("\"a\" + 1.5"));
        assertEquals("x", eval("missing + 'x'"));
    }

    @Test
    void dividesExactIntegersToIntegers() {
        assertEquals(2L, eval("6 / 3"));
        assertEquals(2.5d, eval("5 / 2"));
        assertEquals(0.5d, eval(".5"));
    }

    @Test
    void comparesNumbersAcrossTypes() {
        assertEquals(true, eval("i > 0", Map.of("i", 1)));
        assertEquals(true, eval("x == 2", Map.of("x", 2.0d)));
        assertEquals(true, eval("'abc' < 'abd'"));
    }

    @Test
    void treatsEmptyValuesAsFalsy() {
        Map<String, Object> data = new HashMap<>();
        data.put("nothing", null);
        data.put("zero", 0);
        data.put("blank", "");
        data.put("none", List.of());
        data.put("noMap", Map.of());
        data.put("some", List.of(1));

        assertEquals(true, eval("!nothing & !zero & !blank & !none & !noMap & !missing", data));
        assertEquals(true, eval("!!some", data));
    }

    @Test
    void resolvesUnknownVariablesToNull() {
        assertNull(eval("customer.address.city"));
    }

    @Test
    void readsFieldsAndIndexes() {
        Map<String, Object> data = Map.of(
            "customer", Map.of("name", "Ada", "tags", List.of("a", "b", "c")),
            "order", new Order("A-1", 3)
        );

        assertEquals("Ada", eval("customer.name", data));
        assertEquals("c", eval("customer.tags[-1]", data));
        assertEquals("b", eval("customer.tags[1.0]", data));
        assertEquals("a", eval("customer.tags['0']", data));
        assertNull(eval("customer.tags[5]", data));
        assertNull(eval("customer.tags[4294967296]", data));
        assertNull(eval("customer.tags[-4294967297]", data));
        assertEquals("Ada", eval("customer['name']", data));
        assertEquals(3, eval("order.quantity", data));
        assertNull(eval("order.unknown", data));
    }

    @Test
    void callsFunctionsAndDataLiteral() {
        assertEquals("HELLO", eval("uppercase('hello')"));
        Object data = eval("data()", Map.of("a", 1));
        assertEquals(Map.of("a", 1), data);
    }

    @Test
    void parsesQuotedStrings() {
        assertEquals("say \"hi\"", eval("\"say \\\"hi\\\"\""));
        assertEquals("Grüße", eval("„Grüße\""));
        assertEquals("salut", eval("»salut«"));
        assertEquals("a\nb", eval("'a\\nb'"));
    }

    @Test
    void rejectsMalformedExpressions() {
        TemplateSyntaxException unbalanced = assertThrows(TemplateSyntaxException.class, () -> Expression.parse("(a + b"));
        assertTrue(unbalanced.getMessage().contains("Expected ')'"));
        assertThrows(TemplateSyntaxException.class, () -> Expression.parse("a b"));
        assertThrows(TemplateSyntaxException.class, () -> Expression.parse("'open"));
        assertThrows(TemplateSyntaxException.class, () -> Expression.parse(""));
        assertThrows(TemplateSyntaxException.class, () -> Expression.parse("a ="));
    }

    @Test
    void wrapsEvaluationErrorsWithExpressionText() {
        TemplateEvaluationException ex = assertThrows(
            TemplateEvaluationException.class,
            () -> eval("x > 5", Map.of("x", "ten"))
        );
        assertEquals("x > 5", ex.expression());
        assertTrue(ex.getMessage().startsWith("evaluation error for expression 'x > 5': cannot compare"));

        assertThrows(TemplateEvaluationException.class, () -> eval("1 / 0"));
        assertThrows(TemplateEvaluationException.class, () -> eval("1.5 % 2"));
        assertThrows(TemplateEvaluationException.class, () -> eval("nope(1)"));
        assertThrows(TemplateEvaluationException.class, () -> eval("uppercase()"));
    }

    @Test
    void shortCircuitsLogicalOperators() {
        assertFalse((Boolean) eval("false & nope()"));
    }

    record Order(String number, int quantity) {
    }

    @Test
    void reportsIntegerOverflow() {
        Map<String, Object> data = Map.of("min", Long.MIN_VALUE);

        TemplateEvaluationException ex = assertThrows(TemplateEvaluationException.class, () -> eval("min / -1", data));

        assertTrue(ex.getMessage().endsWith("long overflow"));
        assertEquals(Long.MIN_VALUE / 2, eval("min / 2", data));
    }
}
