package com.vidnyan.pde.adapter.out.parser;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.pde.application.port.out.SourceTreeParser;
import com.vidnyan.pde.domain.tree.Location;
import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.domain.tree.Visibility;
import com.vidnyan.pde.exception.ParseFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads trees that an external parser serialized as JSON ({@code *.ast.json}).
 *
 * <pre>
 * { "kind": "TYPE_DECL", "name": "Config", "visibility": "public",
 *   "properties": { "static": "true" }, "line": 3, "column": 1,
 *   "children": [ { "kind": "FIELD", "name": "instance", "type": "Config" } ] }
 * </pre>
 * Unknown kinds map to OTHER so documents from richer grammars still load.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class JsonTreeAdapter implements SourceTreeParser {

    public static final String SUFFIX = ".ast.json";

    private final ObjectMapper objectMapper;

    @Override
    public boolean supports(Path file) {
        return file.toString().endsWith(SUFFIX);
    }

    @Override
    public TreeNode parse(Path file) {
        NodeDto root;
        try {
            root = objectMapper.readValue(file.toFile(), NodeDto.class);
        } catch (JsonProcessingException e) {
            throw new ParseFailureException(file, e.getOriginalMessage() != null ? e.getOriginalMessage() : e.toString(), e);
        } catch (IOException e) {
            throw new ParseFailureException(file, "cannot read file", e);
        }
        if (root == null || root.kind == null) {
            throw new ParseFailureException(file, "document has no root node kind");
        }
        TreeNode tree = toNode(root, file.toString());
        log.debug("Loaded {} nodes from {}", tree.size(), file);
        return tree;
    }

    private TreeNode toNode(NodeDto dto, String fileName) {
        NodeKind kind = NodeKind.parse(dto.kind);
        TreeNode.Builder builder = TreeNode.builder(kind)
                .name(dto.name)
                .typeText(dto.type)
                .visibility(dto.visibility != null ? Visibility.parse(dto.visibility) : null)
                .location(dto.line > 0 ? Location.at(fileName, dto.line, dto.column) : Location.UNKNOWN.inFile(fileName));
        if (dto.properties != null) {
            dto.properties.forEach((k, v) -> {
                if (v != null) {
                    builder.property(k, String.valueOf(v));
                }
            });
        }
        if (kind == NodeKind.OTHER && !"OTHER".equalsIgnoreCase(dto.kind)) {
            builder.property("syntax", dto.kind);
        }
        if (dto.children != null) {
            for (NodeDto child : dto.children) {
                if (child != null) {
                    builder.child(toNode(child, fileName));
                }
            }
        }
        return builder.build();
    }

    // DTO class for JSON deserialization
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class NodeDto {
        public String kind;
        public String name;
        public String type;
        public String visibility;
        public Map<String, Object> properties;
        public int line;
        public int column;
        public List<NodeDto> children;
    }
}
