package com.vidnyan.pde.domain.signature;

import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.domain.tree.Visibility;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Built-in property extractors.
 * <ul>
 *   <li>{@code public}, {@code private}: "true"/"false" against the declared visibility</li>
 *   <li>{@code visibility}: visibility name, case-insensitive</li>
 *   <li>{@code type}: regular expression searched in the type text, fails closed without type text</li>
 *   <li>{@code name}: exact name comparison</li>
 * </ul>
 * Any other property name falls back to the node's parser-supplied properties
 * (see {@link #generic(String)}).
 */
public final class PropertyExtractors {

    private PropertyExtractors() {
    }

    public static Map<String, PropertyExtractor> builtIns() {
        Map<String, PropertyExtractor> extractors = new LinkedHashMap<>();
        extractors.put("public", visibilityFlag(Visibility.PUBLIC));
        extractors.put("private", visibilityFlag(Visibility.PRIVATE));
        extractors.put("visibility", (node, value) ->
                node.visibility() != null && node.visibility() == Visibility.parse(value));
        extractors.put(Signature.TYPE_PROPERTY, new TypeTextExtractor());
        extractors.put("name", (node, value) -> value.equals(node.name()));
        return extractors;
    }

    /**
     * Compares a parser-supplied property case-insensitively.
     * An absent property reads as "false", so boolean modifiers such as
     * {@code static=false} hold on nodes that do not declare them.
     */
    public static PropertyExtractor generic(String propertyName) {
        return (node, value) -> {
            String actual = node.properties().get(propertyName);
            if (actual == null) {
                return "false".equalsIgnoreCase(value);
            }
            return actual.equalsIgnoreCase(value);
        };
    }

    /**
     * Uses the pattern compiled on the signature; the bare two-argument form
     * compiles on each call and is only reached by callers without a signature.
     */
    static final class TypeTextExtractor implements PropertyExtractor {

        @Override
        public boolean satisfies(TreeNode node, String requiredValue) {
            return find(node, Pattern.compile(requiredValue));
        }

        @Override
        public boolean satisfies(TreeNode node, String requiredValue, Signature signature) {
            Pattern pattern = signature.typePattern();
            return pattern != null ? find(node, pattern) : satisfies(node, requiredValue);
        }

        private static boolean find(TreeNode node, Pattern pattern) {
            return node.typeText() != null && pattern.matcher(node.typeText()).find();
        }
    }

    private static PropertyExtractor visibilityFlag(Visibility expected) {
        return (TreeNode node, String value) -> {
            boolean actual = node.visibility() == expected;
            return actual == Boolean.parseBoolean(value);
        };
    }
}
