package dk.cloudcreate.essentials.statebased.store;

import java.util.*;

/**
 * Document helpers shared by the {@link DocumentStore} implementations
 */
public final class Documents {
    private Documents() {
    }

    /**
     * Deep copy a document, so neither the caller nor the store can change the other's copy
     *
     * @param document the document to copy
     * @return a deep copy, preserving field order
     */
    public static Map<String, Object> deepCopy(Map<String, Object> document) {
        var copy = new LinkedHashMap<String, Object>(document.size());
        document.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<String, Object>) value);
        }
        if (value instanceof Collection) {
            var copy = new ArrayList<>(((Collection<?>) value).size());
            for (Object element : (Collection<?>) value) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        return value;
    }
}
