package com.vidnyan.pde.domain.pattern;

import com.vidnyan.pde.domain.heuristic.Heuristic;
import com.vidnyan.pde.domain.signature.Signature;

import java.util.ArrayList;
import java.util.List;

/**
 * A named design idiom: the signatures and heuristics that evidence it and the
 * confidence a node needs to count as a match.
 * Immutable; built once at registry setup and shared read-only.
 */
public record PatternDefinition(
    String name,
    String description,
    PatternCategory category,
    List<Signature> signatures,
    List<Heuristic> heuristics,
    double minimumConfidence
) {

    public PatternDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pattern name is required");
        }
        if (!(minimumConfidence >= 0.0 && minimumConfidence <= 1.0)) {
            throw new IllegalArgumentException(
                    "Minimum confidence must be in [0, 1], got " + minimumConfidence + " for " + name);
        }
        description = description == null ? "" : description;
        category = category == null ? PatternCategory.CUSTOM : category;
        signatures = signatures == null ? List.of() : List.copyOf(signatures);
        heuristics = heuristics == null ? List.of() : List.copyOf(heuristics);
    }

    /**
     * A definition with neither signatures nor heuristics can never be decided.
     */
    public boolean isUndecidable() {
        return signatures.isEmpty() && heuristics.isEmpty();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String description;
        private PatternCategory category = PatternCategory.CUSTOM;
        private final List<Signature> signatures = new ArrayList<>();
        private final List<Heuristic> heuristics = new ArrayList<>();
        private double minimumConfidence = 0.5;

        public Builder(String name) { this.name = name; }

        public Builder description(String desc) { this.description = desc; return this; }
        public Builder category(PatternCategory cat) { this.category = cat; return this; }
        public Builder signature(Signature signature) { this.signatures.add(signature); return this; }
        public Builder signature(Signature.Builder signature) { return signature(signature.build()); }
        public Builder heuristic(Heuristic heuristic) { this.heuristics.add(heuristic); return this; }
        public Builder minimumConfidence(double min) { this.minimumConfidence = min; return this; }

        public PatternDefinition build() {
            return new PatternDefinition(name, description, category, signatures, heuristics, minimumConfidence);
        }
    }
}
