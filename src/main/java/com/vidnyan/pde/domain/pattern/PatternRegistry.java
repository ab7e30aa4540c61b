package com.vidnyan.pde.domain.pattern;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owned registry of pattern definitions.
 *
 * Single writer, many readers: registrations publish a new immutable snapshot,
 * readers take the current snapshot without locking. Once {@link #freeze()} is
 * called no more definitions are accepted.
 */
@Slf4j
public class PatternRegistry {

    private final Object writeLock = new Object();
    private volatile List<PatternDefinition> definitions = List.of();
    private volatile boolean frozen;

    /**
     * Register a definition, replacing any earlier one with the same name.
     *
     * @throws IllegalStateException when the registry is frozen
     */
    public PatternRegistry register(PatternDefinition definition) {
        synchronized (writeLock) {
            if (frozen) {
                throw new IllegalStateException(
                        "Pattern registry is frozen, cannot register " + definition.name());
            }
            List<PatternDefinition> next = new ArrayList<>(definitions.size() + 1);
            boolean replaced = false;
            for (PatternDefinition existing : definitions) {
                if (existing.name().equals(definition.name())) {
                    next.add(definition);
                    replaced = true;
                } else {
                    next.add(existing);
                }
            }
            if (!replaced) {
                next.add(definition);
            } else {
                log.info("Replaced pattern definition: {}", definition.name());
            }
            definitions = List.copyOf(next);
        }
        return this;
    }

    public PatternRegistry registerAll(List<PatternDefinition> more) {
        more.forEach(this::register);
        return this;
    }

    /**
     * Stop accepting registrations. Idempotent.
     *
     * @return true when this call froze the registry
     */
    public boolean freeze() {
        synchronized (writeLock) {
            if (frozen) {
                return false;
            }
            frozen = true;
            return true;
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Current snapshot, in registration order.
     */
    public List<PatternDefinition> definitions() {
        return definitions;
    }

    public Optional<PatternDefinition> find(String name) {
        return definitions.stream()
                .filter(d -> d.name().equals(name))
                .findFirst();
    }

    public int size() {
        return definitions.size();
    }
}
