package com.charter.core.validation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed status changes of one enumerated lifecycle, held as data.
 * Only listed edges are legal; staying in the same state is not a transition.
 *
 * @param <S> the status enum
 */
public final class TransitionTable<S extends Enum<S>> {

    private final Class<S> type;
    private final Map<S, Set<S>> edges;

    private TransitionTable(Class<S> type, Map<S, Set<S>> edges) {
        this.type = type;
        this.edges = edges;
    }

    public static <S extends Enum<S>> Builder<S> of(Class<S> type) {
        return new Builder<>(type);
    }

    public boolean allows(S from, S to) {
        return edges.getOrDefault(from, Set.of()).contains(to);
    }

    public Set<S> targets(S from) {
        Set<S> targets = edges.get(from);
        return targets == null ? Collections.unmodifiableSet(EnumSet.noneOf(type)) : targets;
    }

    public static final class Builder<S extends Enum<S>> {

        private final Class<S> type;
        private final Map<S, Set<S>> edges;

        private Builder(Class<S> type) {
            this.type = type;
            this.edges = new EnumMap<>(type);
        }

        @SafeVarargs
        public final Builder<S> allow(S from, S... to) {
            Set<S> targets = edges.computeIfAbsent(from, k -> EnumSet.noneOf(type));
            for (S target : to) {
                targets.add(target);
            }
            return this;
        }

        public TransitionTable<S> build() {
            Map<S, Set<S>> frozen = new EnumMap<>(type);
            edges.forEach((from, targets) -> frozen.put(from, Collections.unmodifiableSet(EnumSet.copyOf(targets))));
            return new TransitionTable<>(type, Collections.unmodifiableMap(frozen));
        }
    }
}
