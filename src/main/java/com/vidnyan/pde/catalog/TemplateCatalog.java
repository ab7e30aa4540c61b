package com.vidnyan.pde.catalog;

import com.vidnyan.pde.domain.transform.PatternTemplate;
import com.vidnyan.pde.domain.transform.TemplateSubstitutor;
import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.domain.tree.Visibility;

import java.util.List;

/**
 * Standard rewrite templates, registered under the name of the pattern they produce.
 * Each template re-satisfies its own pattern definition once applied.
 */
public final class TemplateCatalog {

    private TemplateCatalog() {
    }

    public static List<PatternTemplate> standardTemplates() {
        return List.of(singleton(), factory());
    }

    /**
     * Lazily initialized singleton; existing members are kept, a public
     * constructor of the same name is replaced by a private one.
     */
    public static PatternTemplate singleton() {
        TreeNode root = TreeNode.builder(NodeKind.TYPE_DECL)
                .name("${name}")
                .visibility(Visibility.PUBLIC)
                .property("declaration", "class")
                .flag("final")
                .child(TreeNode.builder(NodeKind.FIELD)
                        .name("instance")
                        .typeText("${name}")
                        .visibility(Visibility.PRIVATE)
                        .flag("static"))
                .child(TreeNode.builder(NodeKind.CONSTRUCTOR)
                        .name("${name}")
                        .visibility(Visibility.PRIVATE)
                        .child(TreeNode.builder(NodeKind.BLOCK)))
                .child(TreeNode.builder(NodeKind.PROCEDURE)
                        .name("getInstance")
                        .typeText("${name}")
                        .visibility(Visibility.PUBLIC)
                        .flag("static")
                        .flag("synchronized")
                        .child(TreeNode.builder(NodeKind.BLOCK)
                                .child(TreeNode.builder(NodeKind.IF)
                                        .child(TreeNode.builder(NodeKind.OTHER)
                                                .property("syntax", "BinaryExpr")
                                                .property("operator", "==")
                                                .child(TreeNode.leaf(NodeKind.IDENTIFIER, "instance"))
                                                .child(TreeNode.builder(NodeKind.LITERAL).property("value", "null")))
                                        .child(TreeNode.builder(NodeKind.BLOCK)
                                                .child(TreeNode.builder(NodeKind.ASSIGN)
                                                        .name("instance")
                                                        .property("operator", "=")
                                                        .child(TreeNode.builder(NodeKind.NEW)
                                                                .name("${name}")
                                                                .typeText("${name}")))))
                                .child(TreeNode.builder(NodeKind.RETURN)
                                        .child(TreeNode.leaf(NodeKind.IDENTIFIER, "instance")))))
                .child(TreeNode.leaf(NodeKind.PLACEHOLDER, TemplateSubstitutor.MEMBERS_SLOT))
                .build();
        return new PatternTemplate(PatternCatalog.SINGLETON,
                "Private constructor with a lazily created shared instance", root);
    }

    /**
     * Non-instantiable factory holder: final class, private constructor,
     * creation methods kept as they are.
     */
    public static PatternTemplate factory() {
        TreeNode root = TreeNode.builder(NodeKind.TYPE_DECL)
                .name("${name}")
                .visibility(Visibility.PUBLIC)
                .property("declaration", "class")
                .flag("final")
                .child(TreeNode.builder(NodeKind.CONSTRUCTOR)
                        .name("${name}")
                        .visibility(Visibility.PRIVATE)
                        .child(TreeNode.builder(NodeKind.BLOCK)))
                .child(TreeNode.leaf(NodeKind.PLACEHOLDER, TemplateSubstitutor.MEMBERS_SLOT))
                .build();
        return new PatternTemplate(PatternCatalog.FACTORY,
                "Final factory class with a private constructor", root);
    }
}
