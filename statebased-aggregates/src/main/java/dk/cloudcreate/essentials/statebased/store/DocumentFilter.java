package dk.cloudcreate.essentials.statebased.store;

import java.math.BigDecimal;
import java.util.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Immutable document filter that's evaluated by the {@link DocumentStore}.<br>
 * All criteria must match (AND). Field paths are persisted (snake_case) field names where nested fields are separated
 * by a dot, e.g. <code>delivery_address.zip_code</code>.<br>
 * Values are compared the way JSON values compare: numbers by numeric value regardless of their Java type, everything else by
 * equality, so a number never matches a string.<br>
 * A missing field is treated as <code>null</code>, so:
 * <ul>
 *     <li><code>where("x", null)</code> matches documents where <code>x</code> is missing or null</li>
 *     <li><code>whereIn("x", List.of(0, null))</code> matches documents where <code>x</code> is 0, missing or null</li>
 *     <li><code>whereNotIn("x", values)</code> matches documents where <code>x</code> is missing</li>
 * </ul>
 * Example:
 * <pre>{@code
 * DocumentFilter.where("customer_id", customerId)
 *               .andNotIn("status", List.of(OrderStatus.DELIVERED, OrderStatus.CANCELLED))
 * }</pre>
 */
public final class DocumentFilter {
    private static final DocumentFilter ALL = new DocumentFilter(List.of());

    private final List<Criterion> criteria;

    private DocumentFilter(List<Criterion> criteria) {
        this.criteria = Collections.unmodifiableList(criteria);
    }

    /**
     * A filter that matches all documents
     */
    public static DocumentFilter all() {
        return ALL;
    }

    public static DocumentFilter where(String fieldPath, Object value) {
        return ALL.and(fieldPath, value);
    }

    public static DocumentFilter whereIn(String fieldPath, Collection<?> values) {
        return ALL.andIn(fieldPath, values);
    }

    public static DocumentFilter whereNotIn(String fieldPath, Collection<?> values) {
        return ALL.andNotIn(fieldPath, values);
    }

    public DocumentFilter and(String fieldPath, Object value) {
        return with(new Criterion(fieldPath, Operator.EQUALS, Collections.singletonList(value)));
    }

    public DocumentFilter andIn(String fieldPath, Collection<?> values) {
        requireNonNull(values, "No values provided");
        return with(new Criterion(fieldPath, Operator.IN, new ArrayList<>(values)));
    }

    public DocumentFilter andNotIn(String fieldPath, Collection<?> values) {
        requireNonNull(values, "No values provided");
        return with(new Criterion(fieldPath, Operator.NOT_IN, new ArrayList<>(values)));
    }

    private DocumentFilter with(Criterion criterion) {
        var newCriteria = new ArrayList<>(criteria);
        newCriteria.add(criterion);
        return new DocumentFilter(newCriteria);
    }

    public List<Criterion> criteria() {
        return criteria;
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    /**
     * Create a new filter where every criterion value has been converted using the <code>valueMapper</code>.<br>
     * Used to convert query values into the form they have inside the persisted documents
     *
     * @param valueMapper the value mapper
     * @return a new filter with the mapped values
     */
    public DocumentFilter mapValues(Function<Object, Object> valueMapper) {
        requireNonNull(valueMapper, "No valueMapper provided");
        var mapped = new ArrayList<Criterion>(criteria.size());
        for (Criterion criterion : criteria) {
            var values = new ArrayList<>(criterion.values.size());
            for (Object value : criterion.values) {
                values.add(value != null ? valueMapper.apply(value) : null);
            }
            mapped.add(new Criterion(criterion.fieldPath, criterion.operator, values));
        }
        return new DocumentFilter(mapped);
    }

    /**
     * Evaluate the filter against a document
     *
     * @param document the document
     * @return true if all criteria match the document
     */
    public boolean matches(Map<String, Object> document) {
        requireNonNull(document, "No document provided");
        for (Criterion criterion : criteria) {
            if (!criterion.matches(document)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolve a dotted field path inside a document
     *
     * @param document  the document
     * @param fieldPath the field path
     * @return the value or null if the field (or any of its parents) is missing
     */
    @SuppressWarnings("unchecked")
    public static Object resolveFieldValue(Map<String, Object> document, String fieldPath) {
        Object current = document;
        for (String fieldName : fieldPath.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(fieldName);
        }
        return current;
    }

    /**
     * Compare a stored value with a query value using JSON equality: numbers are compared by numeric value, so
     * <code>3</code>, <code>3L</code> and <code>3.0</code> are all considered equal, while a number never equals a string
     * (<code>3</code> doesn't match <code>"3"</code>)
     */
    static boolean valuesEqual(Object storedValue, Object queryValue) {
        if (storedValue == null || queryValue == null) {
            return storedValue == queryValue;
        }
        if (storedValue instanceof Number && queryValue instanceof Number) {
            return toBigDecimal((Number) storedValue).compareTo(toBigDecimal((Number) queryValue)) == 0;
        }
        return storedValue.equals(queryValue);
    }

    private static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(value.doubleValue());
        }
        return new BigDecimal(value.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return criteria.equals(((DocumentFilter) o).criteria);
    }

    @Override
    public int hashCode() {
        return criteria.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentFilter" + criteria;
    }

    public enum Operator {
        EQUALS,
        IN,
        NOT_IN
    }

    public static final class Criterion {
        public final String       fieldPath;
        public final Operator     operator;
        /**
         * For {@link Operator#EQUALS} the list contains exactly one value (which may be null)
         */
        public final List<Object> values;

        private Criterion(String fieldPath, Operator operator, List<Object> values) {
            requireNonNull(fieldPath, "No fieldPath provided");
            if (fieldPath.isBlank()) {
                throw new IllegalArgumentException("fieldPath must not be blank");
            }
            this.fieldPath = fieldPath;
            this.operator = requireNonNull(operator, "No operator provided");
            this.values = Collections.unmodifiableList(values);
        }

        /**
         * The single value used with {@link Operator#EQUALS}
         */
        public Object value() {
            return values.get(0);
        }

        public boolean matches(Map<String, Object> document) {
            var storedValue = resolveFieldValue(document, fieldPath);
            switch (operator) {
                case EQUALS:
                    return valuesEqual(storedValue, value());
                case IN:
                    return containsValue(storedValue);
                case NOT_IN:
                    return storedValue == null || !containsValue(storedValue);
                default:
                    throw new IllegalStateException("Unsupported operator " + operator);
            }
        }

        private boolean containsValue(Object storedValue) {
            for (Object value : values) {
                if (valuesEqual(storedValue, value)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Criterion criterion = (Criterion) o;
            return fieldPath.equals(criterion.fieldPath) && operator == criterion.operator && values.equals(criterion.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fieldPath, operator, values);
        }

        @Override
        public String toString() {
            return fieldPath + " " + operator + " " + (operator == Operator.EQUALS ? value() : values);
        }
    }
}
