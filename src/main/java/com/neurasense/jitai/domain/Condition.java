package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A leaf comparison of a tailoring variable against a literal.
 *
 * <p>Conditions compare the value found at a dotted path of the tailoring context
 * (for example {@code checkin.mood}) with a literal using an operator.
 * Example: checkin.mood &lt; 3, time.period == 'late_night', trend.direction in ('stable', 'worsening')
 *
 * <p>The operator is resolved to an enum when the rule document is loaded, so an unknown
 * operator is rejected at load time instead of silently evaluating to false.
 */
public final class Condition {

    @JsonProperty("field")
    private final String field;

    @JsonProperty("op")
    private final Operator operator;

    @JsonProperty("value")
    private final Object value;

    public Condition(String field, Operator operator, Object value) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Condition field is required");
        }
        this.field = field;
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = freeze(value);
    }

    public Condition(String field, String operator, Object value) {
        this(field, Operator.fromString(operator), value);
    }

    /**
     * Copies list and map literals into unmodifiable collections so a condition never
     * changes after it is built.
     */
    private static Object freeze(Object value) {
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }

    public String getField() {
        return field;
    }

    public Operator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Splits the field into path segments for context resolution.
     *
     * @return the path segments, e.g. ["checkin", "mood"]
     */
    public String[] path() {
        return field.split("\\.");
    }

    /**
     * Applies the operator to an already-resolved context value.
     * <p>
     * Type mismatches (a string compared with a number, a malformed range) evaluate
     * to false and never throw.
     *
     * @param actual the value resolved from the tailoring context, may be null
     * @return true if the comparison holds
     */
    public boolean test(Object actual) {
        if (actual == null) {
            return false;
        }
        return switch (operator) {
            case LT -> ordered(actual, value) && compare(actual, value) < 0;
            case LTE -> ordered(actual, value) && compare(actual, value) <= 0;
            case GT -> ordered(actual, value) && compare(actual, value) > 0;
            case GTE -> ordered(actual, value) && compare(actual, value) >= 0;
            case EQ -> isEqual(actual, value);
            case NE -> !isEqual(actual, value);
            case IN -> isIn(actual);
            case BETWEEN -> isBetween(actual);
        };
    }

    private boolean isIn(Object actual) {
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (isEqual(actual, item)) {
                    return true;
                }
            }
            return false;
        }
        if (value instanceof String text && actual instanceof String needle) {
            return text.contains(needle);
        }
        return false;
    }

    private boolean isBetween(Object actual) {
        if (!(value instanceof List<?> range) || range.size() != 2) {
            return false;
        }
        int lower = compare(range.get(0), actual);
        int upper = compare(actual, range.get(1));
        return lower != INCOMPARABLE && upper != INCOMPARABLE && lower <= 0 && upper <= 0;
    }

    private static final int INCOMPARABLE = Integer.MIN_VALUE;

    private static boolean ordered(Object left, Object right) {
        return compare(left, right) != INCOMPARABLE;
    }

    /**
     * Orders two values of the same kind. Numbers compare numerically regardless of
     * boxing type, strings lexicographically. Anything else is incomparable, which makes
     * every ordering operator false.
     */
    private static int compare(Object left, Object right) {
        if (isNumber(left) && isNumber(right)) {
            return Integer.signum(Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue()));
        }
        if (left instanceof String l && right instanceof String r) {
            return Integer.signum(l.compareTo(r));
        }
        return INCOMPARABLE;
    }

    private static boolean isEqual(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (isNumber(left) && isNumber(right)) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue()) == 0;
        }
        return left.equals(right);
    }

    private static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Condition condition = (Condition) o;
        return Objects.equals(field, condition.field) &&
               operator == condition.operator &&
               Objects.equals(value, condition.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return field + " " + operator.symbol() + " " + value;
    }

    // ========== Inner Classes ==========

    /**
     * Closed set of comparison operators.
     * <p>
     * Accepted spellings:
     * <ul>
     *   <li>LT: "&lt;", "lt"</li>
     *   <li>LTE: "&lt;=", "lte"</li>
     *   <li>GT: "&gt;", "gt"</li>
     *   <li>GTE: "&gt;=", "gte"</li>
     *   <li>EQ: "==", "=", "eq"</li>
     *   <li>NE: "!=", "ne"</li>
     *   <li>IN: "in"</li>
     *   <li>BETWEEN: "between" (inclusive, value is a two-element [low, high] list)</li>
     * </ul>
     */
    public enum Operator {
        LT("<"),
        LTE("<="),
        GT(">"),
        GTE(">="),
        EQ("=="),
        NE("!="),
        IN("in"),
        BETWEEN("between");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        @JsonValue
        public String symbol() {
            return symbol;
        }

        /**
         * Parses an operator spelling.
         *
         * @param value the operator as written in the rule document
         * @return the operator
         * @throws IllegalArgumentException if the spelling is not recognized
         */
        public static Operator fromString(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Operator is required");
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "<", "lt" -> LT;
                case "<=", "lte" -> LTE;
                case ">", "gt" -> GT;
                case ">=", "gte" -> GTE;
                case "==", "=", "eq" -> EQ;
                case "!=", "ne" -> NE;
                case "in" -> IN;
                case "between" -> BETWEEN;
                default -> throw new IllegalArgumentException("Unknown operator: " + value);
            };
        }
    }
}
