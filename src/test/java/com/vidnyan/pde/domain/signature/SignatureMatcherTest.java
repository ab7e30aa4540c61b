package com.vidnyan.pde.domain.signature;

import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.domain.tree.Visibility;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignatureMatcherTest {

    private final SignatureMatcher matcher = new SignatureMatcher();

    @Test
    void matches_LeafSignatureWithoutNamePattern_ShouldDependOnKindOnly() {
        Signature signature = Signature.of(NodeKind.TYPE_DECL).build();

        assertTrue(matcher.matches(TreeNode.leaf(NodeKind.TYPE_DECL, "Anything"), signature));
        assertTrue(matcher.matches(TreeNode.leaf(NodeKind.TYPE_DECL, null), signature));
        assertTrue(matcher.matches(TreeNode.builder(NodeKind.TYPE_DECL)
                .child(TreeNode.leaf(NodeKind.FIELD, "x")).build(), signature));
        assertFalse(matcher.matches(TreeNode.leaf(NodeKind.PROCEDURE, "Anything"), signature));
    }

    @Test
    void matches_NamePattern_ShouldSearchWithinName() {
        Signature signature = Signature.of(NodeKind.TYPE_DECL).named("Singleton").build();

        assertTrue(matcher.matches(TreeNode.leaf(NodeKind.TYPE_DECL, "ConfigSingleton"), signature));
        assertFalse(matcher.matches(TreeNode.leaf(NodeKind.TYPE_DECL, "Widget"), signature));
    }

    @Test
    void matches_NamePatternOnNodeWithoutName_ShouldFailClosed() {
        Signature blockSignature = Signature.of(NodeKind.BLOCK).named(".*").build();
        Signature typeSignature = Signature.of(NodeKind.TYPE_DECL).named(".*").build();

        assertFalse(matcher.matches(TreeNode.builder(NodeKind.BLOCK).build(), blockSignature));
        assertFalse(matcher.matches(TreeNode.leaf(NodeKind.TYPE_DECL, null), typeSignature));
    }

    @Test
    void matches_RequiredChildren_ShouldBeOrderIndependent() {
        TreeNode type = TreeNode.builder(NodeKind.TYPE_DECL).name("Config")
                .child(TreeNode.leaf(NodeKind.PROCEDURE, "getInstance"))
                .child(TreeNode.leaf(NodeKind.FIELD, "instance"))
                .build();
        Signature signature = Signature.of(NodeKind.TYPE_DECL)
                .child(Signature.of(NodeKind.FIELD).named("instance"))
                .child(Signature.of(NodeKind.PROCEDURE).named("getInstance"))
                .build();

        assertTrue(matcher.matches(type, signature));
    }

    @Test
    void matches_MissingRequiredChild_ShouldFail() {
        TreeNode type = TreeNode.builder(NodeKind.TYPE_DECL).name("Config")
                .child(TreeNode.leaf(NodeKind.FIELD, "instance"))
                .build();
        Signature signature = Signature.of(NodeKind.TYPE_DECL)
                .child(Signature.of(NodeKind.FIELD))
                .child(Signature.of(NodeKind.CONSTRUCTOR))
                .build();

        assertFalse(matcher.matches(type, signature));
    }

    @Test
    void matches_OptionalChildAbsent_ShouldBeForgiven() {
        TreeNode type = TreeNode.builder(NodeKind.TYPE_DECL).name("Config")
                .child(TreeNode.leaf(NodeKind.FIELD, "instance"))
                .build();
        Signature signature = Signature.of(NodeKind.TYPE_DECL)
                .child(Signature.of(NodeKind.FIELD))
                .child(Signature.of(NodeKind.CONSTRUCTOR).optional())
                .build();

        assertTrue(matcher.matches(type, signature));
        assertTrue(matcher.matches(null, Signature.of(NodeKind.FIELD).optional().build()));
        assertFalse(matcher.matches(null, Signature.of(NodeKind.FIELD).build()));
    }

    @Test
    void matches_ChildBehindTransparentBlock_ShouldDescendOneLevel() {
        TreeNode procedure = TreeNode.builder(NodeKind.PROCEDURE).name("getInstance")
                .child(TreeNode.builder(NodeKind.BLOCK)
                        .child(TreeNode.builder(NodeKind.RETURN)))
                .build();
        Signature signature = Signature.of(NodeKind.PROCEDURE)
                .child(Signature.of(NodeKind.RETURN))
                .build();

        assertTrue(matcher.matches(procedure, signature));
        assertFalse(new SignatureMatcher(EnumSet.noneOf(NodeKind.class)).matches(procedure, signature));
    }

    @Test
    void matches_TransparentParent_ShouldSearchAllGrandchildren() {
        TreeNode block = TreeNode.builder(NodeKind.BLOCK)
                .child(TreeNode.builder(NodeKind.IF)
                        .child(TreeNode.builder(NodeKind.RETURN)))
                .build();
        Signature signature = Signature.of(NodeKind.BLOCK)
                .child(Signature.of(NodeKind.RETURN))
                .build();

        assertTrue(matcher.matches(block, signature));
    }

    @Test
    void matches_ChildTwoLevelsDown_ShouldNotBeFound() {
        TreeNode procedure = TreeNode.builder(NodeKind.PROCEDURE).name("run")
                .child(TreeNode.builder(NodeKind.BLOCK)
                        .child(TreeNode.builder(NodeKind.IF)
                                .child(TreeNode.builder(NodeKind.RETURN))))
                .build();
        Signature signature = Signature.of(NodeKind.PROCEDURE)
                .child(Signature.of(NodeKind.RETURN))
                .build();

        assertFalse(matcher.matches(procedure, signature));
    }

    @Test
    void matches_BuiltInProperties_ShouldReadVisibilityAndType() {
        TreeNode constructor = TreeNode.builder(NodeKind.CONSTRUCTOR).name("Config")
                .visibility(Visibility.PRIVATE).build();
        TreeNode field = TreeNode.builder(NodeKind.FIELD).name("instance")
                .typeText("Config").flag("static").build();

        assertTrue(matcher.matches(constructor, Signature.of(NodeKind.CONSTRUCTOR).property("private", "true").build()));
        assertFalse(matcher.matches(constructor, Signature.of(NodeKind.CONSTRUCTOR).property("public", "true").build()));
        assertTrue(matcher.matches(constructor, Signature.of(NodeKind.CONSTRUCTOR).property("visibility", "private").build()));
        assertTrue(matcher.matches(field, Signature.of(NodeKind.FIELD).property("type", "^Conf").build()));
        assertTrue(matcher.matches(field, Signature.of(NodeKind.FIELD).property("static", "true").build()));
    }

    @Test
    void matches_OptionalChild_ShouldGiveSameResultPresentOrAbsent() {
        Signature signature = Signature.of(NodeKind.TYPE_DECL)
                .child(Signature.of(NodeKind.FIELD))
                .child(Signature.of(NodeKind.CONSTRUCTOR).property("private", "true").optional())
                .build();
        TreeNode absent = TreeNode.builder(NodeKind.TYPE_DECL).name("Config")
                .child(TreeNode.leaf(NodeKind.FIELD, "instance"))
                .build();
        TreeNode presentMatching = TreeNode.builder(NodeKind.TYPE_DECL).name("Config")
                .child(TreeNode.leaf(NodeKind.FIELD, "instance"))
                .child(TreeNode.builder(NodeKind.CONSTRUCTOR).name("Config").visibility(Visibility.PRIVATE))
                .build();
        TreeNode presentOther = TreeNode.builder(NodeKind.TYPE_DECL).name("Config")
                .child(TreeNode.leaf(NodeKind.FIELD, "instance"))
                .child(TreeNode.builder(NodeKind.CONSTRUCTOR).name("Config").visibility(Visibility.PUBLIC))
                .build();

        boolean withoutChild = matcher.matches(absent, signature);

        assertTrue(withoutChild);
        assertEquals(withoutChild, matcher.matches(presentMatching, signature));
        assertEquals(withoutChild, matcher.matches(presentOther, signature));
    }

    @Test
    void matches_TypePattern_ShouldBeCompiledOnceOnTheSignature() {
        Signature signature = Signature.of(NodeKind.FIELD).property("type", "List<.*>$").build();
        TreeNode field = TreeNode.builder(NodeKind.FIELD).name("listeners").typeText("List<Listener>").build();

        assertNotNull(signature.typePattern());
        assertEquals("List<.*>$", signature.typePattern().pattern());
        assertTrue(matcher.matches(field, signature));
        assertNull(Signature.of(NodeKind.FIELD).build().typePattern());
    }

    @Test
    void build_InvalidTypePattern_ShouldBeRejected() {
        Signature.Builder builder = Signature.of(NodeKind.FIELD).property("type", "(Strategy");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(error.getMessage().contains("(Strategy"));
    }

    @Test
    void matches_UnknownProperty_ShouldReadAsFalseWhenAbsent() {
        TreeNode field = TreeNode.leaf(NodeKind.FIELD, "count");

        assertTrue(matcher.matches(field, Signature.of(NodeKind.FIELD).property("volatile", "false").build()));
        assertFalse(matcher.matches(field, Signature.of(NodeKind.FIELD).property("volatile", "true").build()));
    }

    @Test
    void matches_CustomExtractor_ShouldOverrideBuiltIn() {
        PropertyExtractor alwaysPublic = (node, value) -> true;
        SignatureMatcher custom = new SignatureMatcher(SignatureMatcher.DEFAULT_TRANSPARENT_KINDS,
                Map.of("public", alwaysPublic));
        TreeNode constructor = TreeNode.builder(NodeKind.CONSTRUCTOR).name("Config")
                .visibility(Visibility.PRIVATE).build();

        assertTrue(custom.matches(constructor, Signature.of(NodeKind.CONSTRUCTOR).property("public", "true").build()));
    }
}
