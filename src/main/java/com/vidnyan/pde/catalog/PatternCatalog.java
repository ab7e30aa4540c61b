package com.vidnyan.pde.catalog;

import com.vidnyan.pde.domain.heuristic.Heuristic;
import com.vidnyan.pde.domain.heuristic.Heuristics;
import com.vidnyan.pde.domain.pattern.PatternCategory;
import com.vidnyan.pde.domain.pattern.PatternDefinition;
import com.vidnyan.pde.domain.signature.Signature;
import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.domain.tree.Visibility;

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import static com.vidnyan.pde.domain.heuristic.Heuristics.anyChild;
import static com.vidnyan.pde.domain.heuristic.Heuristics.hasVisibility;
import static com.vidnyan.pde.domain.heuristic.Heuristics.nameContains;
import static com.vidnyan.pde.domain.heuristic.Heuristics.nameMatches;
import static com.vidnyan.pde.domain.heuristic.Heuristics.ofKind;
import static com.vidnyan.pde.domain.heuristic.Heuristics.onKind;
import static com.vidnyan.pde.domain.heuristic.Heuristics.typeMatches;

/**
 * Standard design pattern definitions.
 *
 * Every definition is anchored at TYPE_DECL nodes and reads the tree shape the
 * parser adapters produce: members are direct children of the type, procedure
 * bodies are BLOCK children, modifiers are {@code static}/{@code final} flags.
 */
public final class PatternCatalog {

    public static final String SINGLETON = "Singleton";
    public static final String FACTORY = "Factory";
    public static final String OBSERVER = "Observer";
    public static final String STRATEGY = "Strategy";
    public static final String COMMAND = "Command";

    private static final String COLLECTION_TYPE = "(List|Set|Collection|Queue|Deque|Iterable)<";
    private static final String STRATEGY_TYPE = "(Strategy|Policy|Algorithm)";

    private PatternCatalog() {
    }

    public static List<PatternDefinition> standardDefinitions() {
        return List.of(singleton(), factory(), observer(), strategy(), command());
    }

    /**
     * One shared instance behind a private constructor and a static accessor.
     */
    public static PatternDefinition singleton() {
        return PatternDefinition.builder(SINGLETON)
                .description("Ensures a class has only one instance and provides a global access point")
                .category(PatternCategory.CREATIONAL)
                .signature(typeWith(Signature.of(NodeKind.CONSTRUCTOR).property("private", "true")))
                .signature(typeWith(Signature.of(NodeKind.FIELD).named("(?i)instance").property("static", "true")))
                .signature(typeWith(Signature.of(NodeKind.PROCEDURE)
                        .named("^(getInstance|instance|get)$")
                        .property("static", "true")
                        .child(Signature.of(NodeKind.RETURN))))
                .heuristic(onType("Class name contains 'Singleton'", 0.2, nameContains("Singleton")))
                .heuristic(onType("Has private constructor", 0.3,
                        anyChild(onKind(NodeKind.CONSTRUCTOR, hasVisibility(Visibility.PRIVATE)))))
                .heuristic(onType("Has static field of its own type", 0.3, PatternCatalog::holdsOwnInstance))
                .minimumConfidence(0.7)
                .build();
    }

    /**
     * Creation methods that pick the concrete product at run time.
     */
    public static PatternDefinition factory() {
        Predicate<TreeNode> creationMethod = onKind(NodeKind.PROCEDURE, nameMatches("^(create|make|new|build|of|from)"));
        return PatternDefinition.builder(FACTORY)
                .description("Creates objects without specifying their concrete classes")
                .category(PatternCategory.CREATIONAL)
                .signature(typeWith(Signature.of(NodeKind.PROCEDURE).named("^(create|make|new|build)")))
                .heuristic(onType("Class name contains 'Factory'", 0.3, nameContains("Factory")))
                .heuristic(onType("Creation method returns an abstraction", 0.3,
                        anyChild(creationMethod.and(PatternCatalog::returnsWiderThanItCreates))))
                .heuristic(onType("Conditional object creation", 0.4,
                        anyChild(creationMethod
                                .and(Heuristics.bodyContainsAnywhere(NodeKind.IF, NodeKind.SWITCH))
                                .and(Heuristics.bodyContainsAnywhere(NodeKind.NEW)))))
                .minimumConfidence(0.6)
                .build();
    }

    /**
     * A subject keeping a collection of listeners and notifying them in turn.
     */
    public static PatternDefinition observer() {
        String observerName = "(?i)(observer|listener|subscriber|handler)s?$";
        return PatternDefinition.builder(OBSERVER)
                .description("Notifies dependents automatically when an object's state changes")
                .category(PatternCategory.BEHAVIORAL)
                .signature(typeWith(Signature.of(NodeKind.FIELD).named(observerName)))
                .signature(typeWith(Signature.of(NodeKind.PROCEDURE).named("^(add|register|subscribe|attach)")))
                .signature(typeWith(Signature.of(NodeKind.PROCEDURE).named("^(notify|fire|publish|emit)")))
                .heuristic(onType("Class name suggests a subject", 0.2, nameContains("Subject", "Observable", "Publisher")))
                .heuristic(onType("References observer or listener types", 0.2,
                        anyChild(onKind(NodeKind.FIELD, typeMatches("(Observer|Listener|Subscriber)")))))
                .heuristic(onType("Keeps a collection of observers", 0.3,
                        anyChild(onKind(NodeKind.FIELD, typeMatches(COLLECTION_TYPE).and(nameMatches(observerName))))))
                .heuristic(onType("Notifies observers in a loop", 0.3,
                        anyChild(onKind(NodeKind.PROCEDURE, nameMatches("^(notify|fire|publish|emit)")
                                .and(Heuristics.bodyContainsAnywhere(NodeKind.LOOP)
                                        .or(Heuristics.bodyCallsOn(observerName.replace("$", ""))))))))
                .minimumConfidence(0.6)
                .build();
    }

    /**
     * A context delegating to an interchangeable algorithm object.
     */
    public static PatternDefinition strategy() {
        Predicate<TreeNode> acceptsStrategy = ofKind(NodeKind.CONSTRUCTOR).or(ofKind(NodeKind.PROCEDURE))
                .and(anyChild(onKind(NodeKind.PARAMETER, typeMatches(STRATEGY_TYPE))));
        return PatternDefinition.builder(STRATEGY)
                .description("Defines a family of interchangeable algorithms")
                .category(PatternCategory.BEHAVIORAL)
                .signature(typeWith(Signature.of(NodeKind.FIELD).property("type", STRATEGY_TYPE).property("static", "false")))
                .heuristic(onType("Class name contains 'Context'", 0.2, nameContains("Context")))
                .heuristic(onType("Refers to a strategy abstraction by name", 0.2,
                        nameContains("Strategy", "Algorithm", "Policy").or(anyChild(acceptsStrategy))))
                .heuristic(onType("Holds a strategy field", 0.3,
                        anyChild(onKind(NodeKind.FIELD, typeMatches(STRATEGY_TYPE)))))
                .heuristic(onType("Delegates to the strategy field", 0.3, PatternCatalog::delegatesToStrategy))
                .minimumConfidence(0.6)
                .build();
    }

    /**
     * Requests as objects with an execute operation.
     */
    public static PatternDefinition command() {
        return PatternDefinition.builder(COMMAND)
                .description("Encapsulates a request as an object")
                .category(PatternCategory.BEHAVIORAL)
                .signature(typeWith(Signature.of(NodeKind.PROCEDURE).named("^(execute|perform|undo|redo)$")))
                .heuristic(onType("Class name contains 'Command', 'Action' or 'Operation'", 0.3,
                        nameContains("Command", "Action", "Operation")))
                .heuristic(onType("Has an execute method", 0.3,
                        anyChild(onKind(NodeKind.PROCEDURE, nameMatches("^(execute|perform)$")))))
                .heuristic(onType("Keeps a collection of commands", 0.3,
                        anyChild(onKind(NodeKind.FIELD, typeMatches(COLLECTION_TYPE + "\\w*(Command|Action)")))))
                .heuristic(onType("Class name suggests an invoker", 0.1, nameContains("Invoker", "Executor")))
                .minimumConfidence(0.6)
                .build();
    }

    private static Signature typeWith(Signature.Builder member) {
        return Signature.of(NodeKind.TYPE_DECL).child(member).build();
    }

    private static Heuristic onType(String description, double weight, Predicate<TreeNode> check) {
        return Heuristic.of(description, weight, onKind(NodeKind.TYPE_DECL, check));
    }

    private static boolean holdsOwnInstance(TreeNode type) {
        if (type.name() == null) {
            return false;
        }
        Pattern ownType = Pattern.compile("\\b" + Pattern.quote(type.name()) + "\\b");
        return type.childrenOfKind(NodeKind.FIELD).stream()
                .anyMatch(f -> f.flag("static") && f.typeText() != null && ownType.matcher(f.typeText()).find());
    }

    private static boolean returnsWiderThanItCreates(TreeNode procedure) {
        String returnType = procedure.typeText();
        if (returnType == null || "void".equals(returnType)) {
            return false;
        }
        return Heuristics.body(procedure)
                .map(body -> body.preOrder().stream()
                        .filter(n -> n.kind() == NodeKind.NEW && n.name() != null)
                        .anyMatch(n -> !n.name().equals(returnType)))
                .orElse(false);
    }

    private static boolean delegatesToStrategy(TreeNode type) {
        Pattern strategyType = Pattern.compile(STRATEGY_TYPE);
        List<String> fieldNames = type.childrenOfKind(NodeKind.FIELD).stream()
                .filter(f -> f.typeText() != null && strategyType.matcher(f.typeText()).find())
                .map(TreeNode::name)
                .toList();
        if (fieldNames.isEmpty()) {
            return false;
        }
        return type.childrenOfKind(NodeKind.PROCEDURE).stream()
                .flatMap(p -> p.preOrder().stream())
                .filter(n -> n.kind() == NodeKind.CALL)
                .map(n -> n.property("scope").orElse(""))
                .map(scope -> scope.startsWith("this.") ? scope.substring(5) : scope)
                .anyMatch(fieldNames::contains);
    }
}
