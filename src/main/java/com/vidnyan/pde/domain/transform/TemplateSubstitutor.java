package com.vidnyan.pde.domain.transform;

import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Instantiates a template tree for a matched node.
 *
 * Text slots: {@code ${name}}, {@code ${type}}, {@code ${visibility}} and
 * {@code ${kind}} inside names, type texts and property values. A token whose
 * slot has no value is left as is.
 *
 * Node slots: a {@link NodeKind#PLACEHOLDER} named {@code members} is replaced
 * by the matched node's children, except those a template sibling already
 * declares (same kind and name); one named {@code node} is replaced by the
 * matched node itself. Other placeholders are dropped.
 *
 * Always builds a new tree; neither input is modified.
 */
@Slf4j
public class TemplateSubstitutor {

    public static final String MEMBERS_SLOT = "members";
    public static final String NODE_SLOT = "node";

    private static final Pattern TOKEN = Pattern.compile("\\$\\{([A-Za-z]+)}");

    public TreeNode substitute(TreeNode template, TreeNode matched) {
        Map<String, String> slots = slotValues(matched);
        TreeNode result = instantiate(template, matched, slots);
        return result.toBuilder().location(matched.location()).build();
    }

    /**
     * Values extracted from the matched node.
     */
    public Map<String, String> slotValues(TreeNode matched) {
        Map<String, String> slots = new LinkedHashMap<>();
        if (matched.name() != null) {
            slots.put("name", matched.name());
        }
        if (matched.typeText() != null) {
            slots.put("type", matched.typeText());
        }
        if (matched.visibility() != null) {
            slots.put("visibility", matched.visibility().name().toLowerCase(Locale.ROOT));
        }
        slots.put("kind", matched.kind().name());
        return slots;
    }

    private TreeNode instantiate(TreeNode template, TreeNode matched, Map<String, String> slots) {
        List<TreeNode> declared = new ArrayList<>();
        for (TreeNode child : template.children()) {
            if (child.kind() != NodeKind.PLACEHOLDER) {
                declared.add(instantiate(child, matched, slots));
            }
        }
        Set<String> declaredKeys = new HashSet<>();
        for (TreeNode node : declared) {
            declaredKeys.add(memberKey(node));
        }

        List<TreeNode> children = new ArrayList<>();
        int next = 0;
        for (TreeNode child : template.children()) {
            if (child.kind() != NodeKind.PLACEHOLDER) {
                children.add(declared.get(next++));
                continue;
            }
            String slot = child.name();
            if (MEMBERS_SLOT.equals(slot)) {
                for (TreeNode member : matched.children()) {
                    if (!declaredKeys.contains(memberKey(member))) {
                        children.add(member);
                    }
                }
            } else if (NODE_SLOT.equals(slot)) {
                children.add(matched);
            } else {
                log.debug("Dropping unknown placeholder slot '{}'", slot);
            }
        }

        Map<String, String> properties = new LinkedHashMap<>();
        template.properties().forEach((k, v) -> properties.put(k, fill(v, slots)));

        return TreeNode.builder(template.kind())
                .name(fill(template.name(), slots))
                .typeText(fill(template.typeText(), slots))
                .visibility(template.visibility())
                .properties(properties)
                .children(children)
                .location(template.location())
                .build();
    }

    private String memberKey(TreeNode node) {
        return node.kind() + ":" + Objects.toString(node.name(), "");
    }

    private String fill(String text, Map<String, String> slots) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }
        Matcher m = TOKEN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = slots.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
