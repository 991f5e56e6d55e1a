package org.pragmatica.descent.action;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Semantic values passed to reducers.
 * Provides access to the matched text and the value of every body element.
 */
public final class SemanticValues<R> {
    private final String matchedText;
    private final List<R> values;

    private SemanticValues(String matchedText, List<R> values) {
        this.matchedText = matchedText;
        this.values = values;
    }

    public static <R> SemanticValues<R> of(String matchedText, List<R> values) {
        // values may contain nulls
        return new SemanticValues<>(matchedText, Collections.unmodifiableList(values));
    }

    /**
     * Get the source text spanned by the matched tokens, including inner whitespace.
     */
    public String token() {
        return matchedText;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Get the value of the body element at the given index.
     */
    public R get(int index) {
        return values.get(index);
    }

    /**
     * Get a value by index with type checking.
     * Returns empty if the index is out of bounds or the value has another type.
     */
    public <T> Optional<T> get(int index, Class<T> type) {
        if (index < 0 || index >= values.size()) {
            return Optional.empty();
        }
        var value = values.get(index);
        return type.isInstance(value)
               ? Optional.of(type.cast(value))
               : Optional.empty();
    }

    public List<R> values() {
        return values;
    }

    @Override
    public String toString() {
        return "SemanticValues{token='" + matchedText + "', values=" + values + "}";
    }
}
