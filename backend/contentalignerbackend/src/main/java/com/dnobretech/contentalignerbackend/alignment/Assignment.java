package com.dnobretech.contentalignerbackend.alignment;

import com.dnobretech.contentalignerbackend.dto.ContentRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Atribuição parcial reference → target, 1-para-1 nos pares aceitos.
 * Os índices são posições nas listas filtradas (só com embedding).
 */
public final class Assignment {

    public record Match(int referenceIndex, int targetIndex, ContentRecord target, double score) {}

    private final Map<Integer, Match> byReference;
    private final Set<Integer> usedTargets;

    private Assignment(Map<Integer, Match> byReference, Set<Integer> usedTargets) {
        this.byReference = Collections.unmodifiableMap(byReference);
        this.usedTargets = Collections.unmodifiableSet(usedTargets);
    }

    public static Assignment empty() {
        return new Assignment(new LinkedHashMap<>(), new LinkedHashSet<>());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Match> forReference(int referenceIndex) {
        return Optional.ofNullable(byReference.get(referenceIndex));
    }

    public boolean isTargetUsed(int targetIndex) {
        return usedTargets.contains(targetIndex);
    }

    public Set<Integer> usedTargetIndices() {
        return usedTargets;
    }

    /** na ordem em que foram aceitos */
    public Collection<Match> matches() {
        return byReference.values();
    }

    public int size() {
        return byReference.size();
    }

    public static final class Builder {
        private final Map<Integer, Match> byReference = new LinkedHashMap<>();
        private final Set<Integer> usedTargets = new LinkedHashSet<>();

        private Builder() {
        }

        /** aceita o par só se a reference e o target ainda estiverem livres */
        public boolean tryAccept(ScoredPair pair, ContentRecord target) {
            if (byReference.containsKey(pair.referenceIndex()) || usedTargets.contains(pair.targetIndex())) {
                return false;
            }
            byReference.put(pair.referenceIndex(),
                    new Match(pair.referenceIndex(), pair.targetIndex(), target, pair.score()));
            usedTargets.add(pair.targetIndex());
            return true;
        }

        public Assignment build() {
            return new Assignment(new LinkedHashMap<>(byReference), new LinkedHashSet<>(usedTargets));
        }
    }
}
