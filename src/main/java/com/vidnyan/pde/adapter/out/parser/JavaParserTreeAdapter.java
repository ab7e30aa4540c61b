package com.vidnyan.pde.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.github.javaparser.ast.nodeTypes.modifiers.NodeWithAccessModifiers;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.vidnyan.pde.application.port.out.SourceTreeParser;
import com.vidnyan.pde.domain.tree.Location;
import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.domain.tree.Visibility;
import com.vidnyan.pde.exception.ParseFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JavaParser-based implementation of SourceTreeParser.
 * Parses Java source files and maps the JavaParser AST onto generic node kinds.
 *
 * Conventions of the produced tree:
 * <ul>
 *   <li>one FIELD per declared variable, carrying {@code static}/{@code final} flags,
 *       with the initializer as child</li>
 *   <li>PROCEDURE and CONSTRUCTOR children are their PARAMETERs followed by the body BLOCK</li>
 *   <li>expression statements are unwrapped to their expression</li>
 *   <li>CALL nodes carry the receiver text in the {@code scope} property</li>
 *   <li>anything without a generic counterpart becomes OTHER</li>
 * </ul>
 */
@Slf4j
@Component
@Order(1)
public class JavaParserTreeAdapter implements SourceTreeParser {

    private static final String JAVA_SUFFIX = ".java";

    private final ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    @Override
    public boolean supports(Path file) {
        return file.toString().endsWith(JAVA_SUFFIX);
    }

    @Override
    public TreeNode parse(Path file) {
        // JavaParser instances keep per-parse state; one per call keeps workers independent
        JavaParser parser = new JavaParser(configuration);
        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(file);
        } catch (IOException e) {
            throw new ParseFailureException(file, "cannot read file", e);
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .limit(3)
                    .collect(Collectors.joining("; "));
            throw new ParseFailureException(file, problems.isEmpty() ? "no compilation unit" : problems);
        }
        TreeNode tree = new TreeMapper(file.toString()).compilationUnit(result.getResult().get());
        log.debug("Parsed {} into {} nodes", file, tree.size());
        return tree;
    }

    /**
     * Parse source text directly; used for in-memory trees.
     */
    public TreeNode parseSource(String source, String fileName) {
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new ParseFailureException(Path.of(fileName), result.getProblems().toString());
        }
        return new TreeMapper(fileName).compilationUnit(result.getResult().get());
    }

    private static final class TreeMapper {

        private final String fileName;

        private TreeMapper(String fileName) {
            this.fileName = fileName;
        }

        /**
         * File name without directories or the {@code .java} suffix, whichever entry point parsed it.
         */
        private String unitName() {
            Path base = Path.of(fileName).getFileName();
            String name = base != null ? base.toString() : fileName;
            return name.endsWith(JAVA_SUFFIX) ? name.substring(0, name.length() - JAVA_SUFFIX.length()) : name;
        }

        TreeNode compilationUnit(CompilationUnit cu) {
            TreeNode.Builder builder = TreeNode.builder(NodeKind.COMPILATION_UNIT)
                    .name(unitName())
                    .location(location(cu));
            cu.getPackageDeclaration().ifPresent(pd -> builder.property("package", pd.getNameAsString()));
            for (TypeDeclaration<?> type : cu.getTypes()) {
                builder.child(map(type));
            }
            return builder.build();
        }

        private TreeNode map(Node node) {
            if (node instanceof TypeDeclaration<?> type) {
                return typeDeclaration(type);
            } else if (node instanceof MethodDeclaration method) {
                return method(method);
            } else if (node instanceof ConstructorDeclaration constructor) {
                return constructor(constructor);
            } else if (node instanceof Parameter parameter) {
                return TreeNode.builder(NodeKind.PARAMETER)
                        .name(parameter.getNameAsString())
                        .typeText(parameter.getTypeAsString())
                        .location(location(parameter))
                        .build();
            } else if (node instanceof BlockStmt block) {
                return block(block.getStatements(), block);
            } else if (node instanceof ExpressionStmt statement) {
                return map(statement.getExpression());
            } else if (node instanceof IfStmt ifStmt) {
                TreeNode.Builder builder = TreeNode.builder(NodeKind.IF).location(location(ifStmt))
                        .child(map(ifStmt.getCondition()))
                        .child(map(ifStmt.getThenStmt()));
                ifStmt.getElseStmt().ifPresent(e -> builder.child(map(e)));
                return builder.build();
            } else if (node instanceof SwitchStmt switchStmt) {
                return switchNode(switchStmt.getSelector(), switchStmt.getEntries(), switchStmt);
            } else if (node instanceof SwitchExpr switchExpr) {
                return switchNode(switchExpr.getSelector(), switchExpr.getEntries(), switchExpr);
            } else if (node instanceof ForStmt || node instanceof ForEachStmt
                    || node instanceof WhileStmt || node instanceof DoStmt) {
                return loop((Statement) node);
            } else if (node instanceof ReturnStmt returnStmt) {
                TreeNode.Builder builder = TreeNode.builder(NodeKind.RETURN).location(location(returnStmt));
                returnStmt.getExpression().ifPresent(e -> builder.child(map(e)));
                return builder.build();
            } else if (node instanceof ThrowStmt throwStmt) {
                return TreeNode.builder(NodeKind.THROW).location(location(throwStmt))
                        .child(map(throwStmt.getExpression()))
                        .build();
            } else if (node instanceof TryStmt tryStmt) {
                return tryNode(tryStmt);
            } else if (node instanceof MethodCallExpr call) {
                TreeNode.Builder builder = TreeNode.builder(NodeKind.CALL)
                        .name(call.getNameAsString())
                        .location(location(call));
                call.getScope().ifPresent(scope -> builder.property("scope", scope.toString()));
                call.getArguments().forEach(arg -> builder.child(map(arg)));
                return builder.build();
            } else if (node instanceof ObjectCreationExpr creation) {
                TreeNode.Builder builder = TreeNode.builder(NodeKind.NEW)
                        .name(creation.getType().getNameAsString())
                        .typeText(creation.getTypeAsString())
                        .location(location(creation));
                creation.getArguments().forEach(arg -> builder.child(map(arg)));
                creation.getAnonymousClassBody().ifPresent(body -> {
                    builder.flag("anonymous");
                    body.forEach(member -> builder.child(map(member)));
                });
                return builder.build();
            } else if (node instanceof AssignExpr assign) {
                return TreeNode.builder(NodeKind.ASSIGN)
                        .name(assign.getTarget().toString())
                        .property("operator", assign.getOperator().asString())
                        .location(location(assign))
                        .child(map(assign.getValue()))
                        .build();
            } else if (node instanceof VariableDeclarationExpr declaration) {
                return localVariables(declaration);
            } else if (node instanceof NameExpr name) {
                return identifier(name.getNameAsString(), null, name);
            } else if (node instanceof FieldAccessExpr access) {
                return identifier(access.getNameAsString(), access.getScope().toString(), access);
            } else if (node instanceof ThisExpr thisExpr) {
                return identifier("this", null, thisExpr);
            } else if (node instanceof LiteralExpr literal) {
                return TreeNode.builder(NodeKind.LITERAL)
                        .property("value", literal.toString())
                        .location(location(literal))
                        .build();
            } else if (node instanceof LambdaExpr lambda) {
                TreeNode.Builder builder = TreeNode.builder(NodeKind.LAMBDA).location(location(lambda));
                lambda.getParameters().forEach(p -> builder.child(map(p)));
                builder.child(map(lambda.getBody()));
                return builder.build();
            }
            return other(node);
        }

        private TreeNode typeDeclaration(TypeDeclaration<?> type) {
            TreeNode.Builder builder = TreeNode.builder(NodeKind.TYPE_DECL)
                    .name(type.getNameAsString())
                    .visibility(visibility(type))
                    .location(location(type));
            if (type.hasModifier(Modifier.Keyword.STATIC)) {
                builder.flag("static");
            }
            if (type instanceof ClassOrInterfaceDeclaration declaration) {
                builder.property("declaration", declaration.isInterface() ? "interface" : "class");
                if (declaration.isInterface() || declaration.isAbstract()) {
                    builder.flag("abstract");
                }
                if (declaration.isFinal()) {
                    builder.flag("final");
                }
                if (declaration.getExtendedTypes().isNonEmpty()) {
                    builder.property("extends", joined(declaration.getExtendedTypes()));
                }
                if (declaration.getImplementedTypes().isNonEmpty()) {
                    builder.property("implements", joined(declaration.getImplementedTypes()));
                }
            } else if (type instanceof EnumDeclaration) {
                builder.property("declaration", "enum");
            } else if (type instanceof RecordDeclaration record) {
                builder.property("declaration", "record");
                record.getParameters().forEach(p -> builder.child(map(p)));
            } else {
                builder.property("declaration", "annotation");
            }
            annotations(type, builder);
            for (BodyDeclaration<?> member : type.getMembers()) {
                if (member instanceof FieldDeclaration field) {
                    fields(field).forEach(builder::child);
                } else {
                    builder.child(map(member));
                }
            }
            return builder.build();
        }

        private List<TreeNode> fields(FieldDeclaration field) {
            List<TreeNode> nodes = new ArrayList<>();
            for (VariableDeclarator variable : field.getVariables()) {
                TreeNode.Builder builder = TreeNode.builder(NodeKind.FIELD)
                        .name(variable.getNameAsString())
                        .typeText(variable.getTypeAsString())
                        .visibility(visibility(field))
                        .location(location(variable));
                if (field.isStatic()) {
                    builder.flag("static");
                }
                if (field.isFinal()) {
                    builder.flag("final");
                }
                annotations(field, builder);
                variable.getInitializer().ifPresent(init -> builder.child(map(init)));
                nodes.add(builder.build());
            }
            return nodes;
        }

        private TreeNode method(MethodDeclaration method) {
            TreeNode.Builder builder = TreeNode.builder(NodeKind.PROCEDURE)
                    .name(method.getNameAsString())
                    .typeText(method.getTypeAsString())
                    .visibility(visibility(method))
                    .location(location(method));
            if (method.isStatic()) {
                builder.flag("static");
            }
            if (method.isAbstract() || method.getBody().isEmpty()) {
                builder.flag("abstract");
            }
            if (method.hasModifier(Modifier.Keyword.SYNCHRONIZED)) {
                builder.flag("synchronized");
            }
            annotations(method, builder);
            method.getParameters().forEach(p -> builder.child(map(p)));
            method.getBody().ifPresent(body -> builder.child(map(body)));
            return builder.build();
        }

        private TreeNode constructor(ConstructorDeclaration constructor) {
            TreeNode.Builder builder = TreeNode.builder(NodeKind.CONSTRUCTOR)
                    .name(constructor.getNameAsString())
                    .visibility(visibility(constructor))
                    .location(location(constructor));
            annotations(constructor, builder);
            constructor.getParameters().forEach(p -> builder.child(map(p)));
            builder.child(map(constructor.getBody()));
            return builder.build();
        }

        private TreeNode block(NodeList<Statement> statements, Node origin) {
            TreeNode.Builder builder = TreeNode.builder(NodeKind.BLOCK).location(location(origin));
            statements.forEach(s -> builder.child(map(s)));
            return builder.build();
        }

        private TreeNode switchNode(Expression selector, NodeList<SwitchEntry> entries, Node origin) {
            TreeNode.Builder builder = TreeNode.builder(NodeKind.SWITCH)
                    .location(location(origin))
                    .child(map(selector));
            for (SwitchEntry entry : entries) {
                TreeNode.Builder caseBlock = TreeNode.builder(NodeKind.BLOCK)
                        .property("case", entry.getLabels().isEmpty() ? "default" : joined(entry.getLabels()))
                        .location(location(entry));
                entry.getStatements().forEach(s -> caseBlock.child(map(s)));
                builder.child(caseBlock);
            }
            return builder.build();
        }

        private TreeNode loop(Statement statement) {
            TreeNode.Builder builder = TreeNode.builder(NodeKind.LOOP).location(location(statement));
            if (statement instanceof ForStmt forStmt) {
                builder.property("loop", "for");
                forStmt.getCompare().ifPresent(c -> builder.child(map(c)));
                builder.child(map(forStmt.getBody()));
            } else if (statement instanceof ForEachStmt forEach) {
                builder.property("loop", "foreach")
                        .property("variable", forEach.getVariableDeclarator().getNameAsString())
                        .child(map(forEach.getIterable()))
                        .child(map(forEach.getBody()));
            } else if (statement instanceof WhileStmt whileStmt) {
                builder.property("loop", "while")
                        .child(map(whileStmt.getCondition()))
                        .child(map(whileStmt.getBody()));
            } else if (statement instanceof DoStmt doStmt) {
                builder.property("loop", "do")
                        .child(map(doStmt.getBody()))
                        .child(map(doStmt.getCondition()));
            }
            return builder.build();
        }

        private TreeNode tryNode(TryStmt tryStmt) {
            TreeNode.Builder builder = TreeNode.builder(NodeKind.TRY)
                    .location(location(tryStmt))
                    .child(map(tryStmt.getTryBlock()));
            for (CatchClause clause : tryStmt.getCatchClauses()) {
                TreeNode catchBlock = map(clause.getBody()).toBuilder()
                        .property("catch", clause.getParameter().getTypeAsString())
                        .build();
                builder.child(catchBlock);
            }
            tryStmt.getFinallyBlock().ifPresent(f -> builder.child(
                    map(f).toBuilder().flag("finally").build()));
            return builder.build();
        }

        private TreeNode localVariables(VariableDeclarationExpr declaration) {
            List<TreeNode> assignments = new ArrayList<>();
            for (VariableDeclarator variable : declaration.getVariables()) {
                TreeNode.Builder builder = TreeNode.builder(NodeKind.ASSIGN)
                        .name(variable.getNameAsString())
                        .typeText(variable.getTypeAsString())
                        .flag("declaration")
                        .location(location(variable));
                variable.getInitializer().ifPresent(init -> builder.child(map(init)));
                assignments.add(builder.build());
            }
            if (assignments.size() == 1) {
                return assignments.get(0);
            }
            return TreeNode.builder(NodeKind.OTHER)
                    .property("syntax", declaration.getClass().getSimpleName())
                    .children(assignments)
                    .location(location(declaration))
                    .build();
        }

        private TreeNode identifier(String name, String scope, Node origin) {
            TreeNode.Builder builder = TreeNode.builder(NodeKind.IDENTIFIER)
                    .name(name)
                    .location(location(origin));
            if (scope != null) {
                builder.property("scope", scope);
            }
            return builder.build();
        }

        private TreeNode other(Node node) {
            TreeNode.Builder builder = TreeNode.builder(NodeKind.OTHER)
                    .property("syntax", node.getClass().getSimpleName())
                    .location(location(node));
            for (Node child : node.getChildNodes()) {
                if (child instanceof Statement || child instanceof Expression || child instanceof BodyDeclaration<?>) {
                    builder.child(map(child));
                }
            }
            return builder.build();
        }

        private void annotations(NodeWithAnnotations<?> node, TreeNode.Builder builder) {
            NodeList<AnnotationExpr> annotations = node.getAnnotations();
            if (annotations.isNonEmpty()) {
                builder.property("annotations", annotations.stream()
                        .map(AnnotationExpr::getNameAsString)
                        .collect(Collectors.joining(",")));
            }
        }

        private Visibility visibility(NodeWithAccessModifiers<?> node) {
            if (node.isPublic()) {
                return Visibility.PUBLIC;
            } else if (node.isProtected()) {
                return Visibility.PROTECTED;
            } else if (node.isPrivate()) {
                return Visibility.PRIVATE;
            }
            return Visibility.PACKAGE;
        }

        private String joined(NodeList<? extends Node> nodes) {
            return nodes.stream().map(Node::toString).collect(Collectors.joining(","));
        }

        private Location location(Node node) {
            return node.getRange()
                    .map(r -> new Location(fileName, r.begin.line, r.begin.column, r.end.line, r.end.column))
                    .orElse(Location.UNKNOWN.inFile(fileName));
        }
    }
}
