package org.pragmatica.descent.grammar;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import org.pragmatica.descent.action.Reducer;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An ordered collection of productions. Declaration order is the priority among
 * productions sharing a head.
 *
 * <p>Every production is assigned a body id: the index of the first production whose body
 * is equal to its own. Two productions with equal bodies share an id, even across heads.
 */
public final class Grammar<K, S, R> {
    private final ImmutableList<Production<K, S, R>> productions;
    private final ImmutableListMultimap<S, Integer> byHead;
    private final int[] bodyIds;

    private Grammar(ImmutableList<Production<K, S, R>> productions) {
        this.productions = productions;
        this.byHead = indexByHead(productions);
        this.bodyIds = assignBodyIds(productions);
    }

    public static <K, S, R> Grammar<K, S, R> of(List<Production<K, S, R>> productions) {
        checkNotNull(productions, "productions");
        checkArgument(!productions.isEmpty(), "Grammar must contain at least one production");
        return new Grammar<>(ImmutableList.copyOf(productions));
    }

    public static <K, S, R> Builder<K, S, R> builder() {
        return new Builder<>();
    }

    private static <K, S, R> ImmutableListMultimap<S, Integer> indexByHead(List<Production<K, S, R>> productions) {
        var builder = ImmutableListMultimap.<S, Integer>builder();
        for (int i = 0; i < productions.size(); i++) {
            builder.put(productions.get(i).head(), i);
        }
        return builder.build();
    }

    private static int[] assignBodyIds(List<? extends Production<?, ?, ?>> productions) {
        var firstByBody = new HashMap<List<?>, Integer>();
        var ids = new int[productions.size()];
        for (int i = 0; i < productions.size(); i++) {
            int index = i;
            ids[i] = firstByBody.computeIfAbsent(productions.get(i).body(), body -> index);
        }
        return ids;
    }

    public List<Production<K, S, R>> productions() {
        return productions;
    }

    public Production<K, S, R> production(int index) {
        return productions.get(index);
    }

    public int size() {
        return productions.size();
    }

    /**
     * Indices of the productions headed by the symbol, in declaration order.
     */
    public List<Integer> productionsFor(S head) {
        return byHead.get(head);
    }

    public boolean defines(S head) {
        return byHead.containsKey(head);
    }

    public Set<S> heads() {
        return byHead.keySet();
    }

    public int bodyId(int index) {
        return bodyIds[index];
    }

    @Override
    public String toString() {
        return "Grammar" + productions + " bodyIds=" + Arrays.toString(bodyIds);
    }

    public static final class Builder<K, S, R> {
        private final ImmutableList.Builder<Production<K, S, R>> productions = ImmutableList.builder();

        private Builder() {}

        public Builder<K, S, R> production(S head, List<GrammarElement<K, S>> body, Reducer<R> reducer) {
            productions.add(new Production<>(head, body, reducer));
            return this;
        }

        @SafeVarargs
        public final Builder<K, S, R> production(S head, Reducer<R> reducer, GrammarElement<K, S>... body) {
            return production(head, Arrays.asList(body), reducer);
        }

        public Builder<K, S, R> production(Production<K, S, R> production) {
            productions.add(checkNotNull(production, "production"));
            return this;
        }

        public Grammar<K, S, R> build() {
            return Grammar.of(productions.build());
        }
    }
}
