package com.vidnyan.pde.application.port.out;

import com.vidnyan.pde.domain.pattern.PatternDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Port for loading caller-supplied pattern definitions.
 * Implemented by adapters that read from files, databases, etc.
 */
public interface PatternDefinitionRepository {

    /**
     * Load all available definitions.
     */
    List<PatternDefinition> findAll();

    /**
     * Load a specific definition by name.
     */
    Optional<PatternDefinition> findByName(String name);
}
