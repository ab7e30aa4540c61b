package com.vidnyan.pde.domain.heuristic;

import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.domain.tree.Visibility;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Reusable node predicates for building heuristics.
 * All predicates are total: nodes without a name or type text simply do not match.
 */
public final class Heuristics {

    private Heuristics() {
    }

    /**
     * Name contains any of the fragments (case-sensitive).
     */
    public static Predicate<TreeNode> nameContains(String... fragments) {
        return node -> node.name() != null
                && Arrays.stream(fragments).anyMatch(node.name()::contains);
    }

    public static Predicate<TreeNode> nameMatches(String regex) {
        Pattern pattern = Pattern.compile(regex);
        return node -> node.name() != null && pattern.matcher(node.name()).find();
    }

    public static Predicate<TreeNode> typeMatches(String regex) {
        Pattern pattern = Pattern.compile(regex);
        return node -> node.typeText() != null && pattern.matcher(node.typeText()).find();
    }

    public static Predicate<TreeNode> ofKind(NodeKind kind) {
        return node -> node.kind() == kind;
    }

    /**
     * Restrict a predicate to nodes of one kind.
     */
    public static Predicate<TreeNode> onKind(NodeKind kind, Predicate<TreeNode> predicate) {
        return node -> node.kind() == kind && predicate.test(node);
    }

    public static Predicate<TreeNode> hasProperty(String key, String value) {
        return node -> value.equalsIgnoreCase(node.properties().get(key));
    }

    public static Predicate<TreeNode> hasVisibility(Visibility visibility) {
        return node -> node.visibility() == visibility;
    }

    /**
     * Some direct child satisfies the predicate.
     */
    public static Predicate<TreeNode> anyChild(Predicate<TreeNode> predicate) {
        return node -> node.children().stream().anyMatch(predicate);
    }

    public static Predicate<TreeNode> hasChild(NodeKind kind) {
        return anyChild(ofKind(kind));
    }

    public static Predicate<TreeNode> hasChildNamed(NodeKind kind, String regex) {
        return anyChild(onKind(kind, nameMatches(regex)));
    }

    /**
     * Procedure whose body directly contains a statement of one of the kinds.
     */
    public static Predicate<TreeNode> bodyContains(NodeKind... kinds) {
        Set<NodeKind> wanted = kinds.length == 0 ? EnumSet.noneOf(NodeKind.class) : EnumSet.copyOf(Arrays.asList(kinds));
        return node -> body(node)
                .map(b -> b.children().stream().anyMatch(s -> wanted.contains(s.kind())))
                .orElse(false);
    }

    /**
     * Procedure whose body contains a node of one of the kinds at any depth.
     */
    public static Predicate<TreeNode> bodyContainsAnywhere(NodeKind... kinds) {
        Set<NodeKind> wanted = kinds.length == 0 ? EnumSet.noneOf(NodeKind.class) : EnumSet.copyOf(Arrays.asList(kinds));
        return node -> body(node)
                .map(b -> b.preOrder().stream().anyMatch(n -> wanted.contains(n.kind())))
                .orElse(false);
    }

    /**
     * Procedure whose body, at any depth, calls a method on a receiver matching the expression.
     */
    public static Predicate<TreeNode> bodyCallsOn(String scopeRegex) {
        Pattern pattern = Pattern.compile(scopeRegex);
        return node -> body(node)
                .map(b -> b.preOrder().stream().anyMatch(n -> n.kind() == NodeKind.CALL
                        && n.property("scope").map(s -> pattern.matcher(s).find()).orElse(false)))
                .orElse(false);
    }

    /**
     * Body block of a procedure or constructor.
     */
    public static Optional<TreeNode> body(TreeNode node) {
        if (node.kind() != NodeKind.PROCEDURE && node.kind() != NodeKind.CONSTRUCTOR) {
            return Optional.empty();
        }
        return node.firstChild(NodeKind.BLOCK);
    }
}
