package com.inboxflow.service.flow;

import com.inboxflow.model.flow.ConditionNode;
import com.inboxflow.model.flow.ConditionOperator;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Evaluates a Condition node against the execution variables.
 *
 * Supported operators:
 *   - equals / contains / starts_with / ends_with → string, case-insensitive
 *   - greater_than / less_than                    → numeric (both sides parsed as double)
 *
 * HOW IT WORKS:
 *   1. Resolve the node's field from the variables (dotted paths walk nested maps)
 *   2. A missing field compares as the empty string
 *   3. Compare actual vs the node's value using the operator
 *
 * Example:
 *   field = "messageBody", operator = contains, value = "price"
 *   variables = {"messageBody": "What is the PRICE?"}
 *   → "what is the price?" contains "price" → true
 */
@Component
public class ConditionEvaluator {

    public boolean evaluate(ConditionNode condition, Map<String, Object> variables) {
        Object resolved = resolveField(condition.getField(), variables);
        String actual = resolved == null ? "" : resolved.toString();
        String expected = condition.getValue() == null ? "" : condition.getValue();
        return compare(actual, expected, condition.getOperator());
    }

    /**
     * Resolves a dotted field path like "triggerData.buttonId" from the variable map.
     * Strips a leading "variables." since we're already given the variables.
     */
    Object resolveField(String fieldPath, Map<String, Object> variables) {
        if (fieldPath == null || fieldPath.isBlank()) {
            return null;
        }
        String path = fieldPath.startsWith("variables.")
                ? fieldPath.substring("variables.".length())
                : fieldPath;

        // A flat key wins over path walking: "contact.name" may be stored as-is
        if (variables.containsKey(path)) {
            return variables.get(path);
        }

        String[] keys = path.split("\\.");
        Object current = variables;
        for (String key : keys) {
            if (current instanceof Map) {
                current = ((Map<?, ?>) current).get(key);
            } else {
                return null;
            }
        }
        return current;
    }

    private boolean compare(String actual, String expected, ConditionOperator operator) {
        String a = actual.toLowerCase(Locale.ROOT);
        String e = expected.toLowerCase(Locale.ROOT);
        return switch (operator) {
            case EQUALS -> a.equals(e);
            case CONTAINS -> a.contains(e);
            case STARTS_WITH -> a.startsWith(e);
            case ENDS_WITH -> a.endsWith(e);
            case GREATER_THAN, LESS_THAN -> compareNumeric(actual, expected, operator);
        };
    }

    private boolean compareNumeric(String actual, String expected, ConditionOperator operator) {
        try {
            double a = Double.parseDouble(actual.trim());
            double e = Double.parseDouble(expected.trim());
            if (Double.isNaN(a) || Double.isNaN(e)) {
                return false;
            }
            return operator == ConditionOperator.GREATER_THAN ? a > e : a < e;
        } catch (NumberFormatException ex) {
            return false;
        }
    }
}
