package com.vidnyan.pde.adapter.out.definition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.pde.application.port.out.PatternDefinitionRepository;
import com.vidnyan.pde.domain.heuristic.Heuristic;
import com.vidnyan.pde.domain.heuristic.Heuristics;
import com.vidnyan.pde.domain.pattern.PatternCategory;
import com.vidnyan.pde.domain.pattern.PatternDefinition;
import com.vidnyan.pde.domain.signature.Signature;
import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * File system based definition repository.
 * Loads custom pattern definitions from JSON files in the classpath.
 *
 * Heuristics are declarative: a {@code check} name with string {@code args}.
 * Supported checks: nameContains, nameMatches, hasChild, hasChildNamed,
 * fieldTypeContains, procedureBodyContains, hasProperty.
 * A file that fails to load is logged and skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemDefinitionRepository implements PatternDefinitionRepository {

    private final ObjectMapper objectMapper;

    @Value("${pde.patterns.path:classpath*:patterns/*.json}")
    private String patternsPath;

    private final Map<String, PatternDefinition> definitions = new LinkedHashMap<>();

    @PostConstruct
    public void loadDefinitions() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(patternsPath);

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    PatternDefinition definition = load(in);
                    definitions.put(definition.name(), definition);
                    log.info("Loaded pattern definition: {} ({} signatures, {} heuristics)",
                            definition.name(), definition.signatures().size(), definition.heuristics().size());
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("Failed to load pattern definition from {}: {}", resource.getFilename(), e.getMessage());
                }
            }

            log.info("Loaded {} custom pattern definitions from {}", definitions.size(), patternsPath);
        } catch (IOException e) {
            log.error("Failed to load pattern definitions", e);
        }
    }

    /**
     * Read one definition document.
     *
     * @throws IllegalArgumentException when the document describes an invalid definition
     */
    public PatternDefinition load(InputStream in) throws IOException {
        DefinitionDto dto = objectMapper.readValue(in, DefinitionDto.class);
        return mapToDefinition(dto);
    }

    void setPatternsPath(String patternsPath) {
        this.patternsPath = patternsPath;
    }

    @Override
    public List<PatternDefinition> findAll() {
        return List.copyOf(definitions.values());
    }

    @Override
    public Optional<PatternDefinition> findByName(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    private PatternDefinition mapToDefinition(DefinitionDto dto) {
        PatternDefinition.Builder builder = PatternDefinition.builder(dto.name)
                .description(dto.description)
                .category(PatternCategory.parse(dto.category))
                .minimumConfidence(dto.minimumConfidence != null ? dto.minimumConfidence : 0.5);
        if (dto.signatures != null) {
            dto.signatures.forEach(s -> builder.signature(mapSignature(s)));
        }
        if (dto.heuristics != null) {
            dto.heuristics.forEach(h -> builder.heuristic(mapHeuristic(h)));
        }
        return builder.build();
    }

    private Signature mapSignature(SignatureDto dto) {
        Signature.Builder builder = Signature.of(mapKind(dto.kind))
                .named(dto.name)
                .optional(dto.optional);
        if (dto.properties != null) {
            dto.properties.forEach(builder::property);
        }
        if (dto.children != null) {
            dto.children.forEach(c -> builder.child(mapSignature(c)));
        }
        return builder.build();
    }

    private Heuristic mapHeuristic(HeuristicDto dto) {
        if (dto.weight == null) {
            throw new IllegalArgumentException("Heuristic '" + dto.description + "' has no weight");
        }
        return Heuristic.of(dto.description, dto.weight, mapCheck(dto.check, dto.args != null ? dto.args : List.of()));
    }

    private Predicate<TreeNode> mapCheck(String check, List<String> args) {
        if (check == null) {
            throw new IllegalArgumentException("Heuristic check is required");
        }
        return switch (check) {
            case "nameContains" -> Heuristics.nameContains(args.toArray(String[]::new));
            case "nameMatches" -> Heuristics.nameMatches(arg(check, args, 0));
            case "hasChild" -> Heuristics.hasChild(mapKind(arg(check, args, 0)));
            case "hasChildNamed" -> Heuristics.hasChildNamed(mapKind(arg(check, args, 0)), arg(check, args, 1));
            case "fieldTypeContains" -> {
                String fragment = arg(check, args, 0);
                yield Heuristics.anyChild(Heuristics.onKind(NodeKind.FIELD,
                        node -> node.typeText() != null && node.typeText().contains(fragment)));
            }
            case "procedureBodyContains" -> Heuristics.anyChild(Heuristics.onKind(NodeKind.PROCEDURE,
                    Heuristics.bodyContainsAnywhere(args.stream().map(this::mapKind).toArray(NodeKind[]::new))));
            case "hasProperty" -> Heuristics.hasProperty(arg(check, args, 0), arg(check, args, 1));
            default -> throw new IllegalArgumentException("Unknown heuristic check: " + check);
        };
    }

    private String arg(String check, List<String> args, int index) {
        if (args.size() <= index) {
            throw new IllegalArgumentException("Check '" + check + "' needs at least " + (index + 1) + " argument(s)");
        }
        return args.get(index);
    }

    private NodeKind mapKind(String kind) {
        NodeKind parsed = NodeKind.parse(kind);
        if (parsed == NodeKind.OTHER && !"OTHER".equalsIgnoreCase(kind)) {
            throw new IllegalArgumentException("Unknown node kind: " + kind);
        }
        return parsed;
    }

    // DTO classes for JSON deserialization
    static class DefinitionDto {
        public String name;
        public String description;
        public String category;
        public Double minimumConfidence;
        public List<SignatureDto> signatures = new ArrayList<>();
        public List<HeuristicDto> heuristics = new ArrayList<>();
    }

    static class SignatureDto {
        public String kind;
        public String name;
        public Map<String, String> properties;
        public boolean optional;
        public List<SignatureDto> children;
    }

    static class HeuristicDto {
        public String description;
        public Double weight;
        public String check;
        public List<String> args;
    }
}
