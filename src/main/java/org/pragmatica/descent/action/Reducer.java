package org.pragmatica.descent.action;

/**
 * Combines the values matched for a production body into the value of the production.
 *
 * <p>A reducer rejects a match by throwing, usually {@link org.pragmatica.descent.error.ParseException#semantic(String)}.
 * Such an exception is never backtracked: it aborts the whole parse unchanged.
 */
@FunctionalInterface
public interface Reducer<R> {
    /**
     * Execute the reducer with semantic values.
     *
     * @param sv one value per body element, in body order
     * @return the computed semantic value
     */
    R reduce(SemanticValues<R> sv);

    /**
     * Reducer returning the value matched for one body element.
     */
    static <R> Reducer<R> pick(int index) {
        return sv -> sv.get(index);
    }
}
