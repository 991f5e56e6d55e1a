package org.pragmatica.descent.grammar;

import com.google.common.collect.ImmutableList;
import org.pragmatica.descent.action.Reducer;

import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A grammar rule: head -> body, with the reducer combining the values matched for the body.
 */
public record Production<K, S, R>(
 S head,
 List<GrammarElement<K, S>> body,
 Reducer<R> reducer) {

    public Production {
        checkNotNull(head, "head");
        checkNotNull(reducer, "reducer");
        body = ImmutableList.copyOf(checkNotNull(body, "body"));
    }

    @Override
    public String toString() {
        return head + " -> " + body.stream()
                                   .map(String::valueOf)
                                   .collect(Collectors.joining(" "));
    }
}
