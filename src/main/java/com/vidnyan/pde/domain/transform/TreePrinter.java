package com.vidnyan.pde.domain.transform;

import com.vidnyan.pde.domain.tree.TreeNode;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders a tree as an indented S-expression:
 * <pre>
 * (TYPE_DECL "Config" :visibility public
 *   (FIELD "instance" :type "Config" :static true))
 * </pre>
 * Deterministic: equal trees render to equal text; properties are printed in key order.
 */
public class TreePrinter {

    public String print(TreeNode root) {
        StringBuilder sb = new StringBuilder();
        sb.append(";; pattern engine tree\n");
        print(root, sb, 0);
        sb.append('\n');
        return sb.toString();
    }

    private void print(TreeNode node, StringBuilder sb, int depth) {
        sb.append('(').append(node.kind().name());
        if (node.name() != null) {
            sb.append(' ').append(quote(node.name()));
        }
        if (node.visibility() != null) {
            sb.append(" :visibility ").append(node.visibility().name().toLowerCase(Locale.ROOT));
        }
        if (node.typeText() != null) {
            sb.append(" :type ").append(quote(node.typeText()));
        }
        for (Map.Entry<String, String> property : new TreeMap<>(node.properties()).entrySet()) {
            sb.append(" :").append(property.getKey()).append(' ').append(atom(property.getValue()));
        }
        String indent = "  ".repeat(depth + 1);
        for (TreeNode child : node.children()) {
            sb.append('\n').append(indent);
            print(child, sb, depth + 1);
        }
        sb.append(')');
    }

    private String atom(String value) {
        if (value == null) {
            return "nil";
        }
        if ("true".equals(value) || "false".equals(value)) {
            return value;
        }
        return quote(value);
    }

    private String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
    }
}
