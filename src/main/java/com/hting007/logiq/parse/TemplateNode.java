package com.hting007.logiq.parse;

import lombok.Getter;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Node of the template prefix tree. Children are keyed by token or by the wildcard
 * marker. The template is fixed when the node is created; only the root has none.
 * Not thread safe on its own; {@link TemplateMiner} guards every access.
 */
@Getter
class TemplateNode {

    private final int depth;
    private final Map<String, TemplateNode> children = new HashMap<>();
    private final String template;
    private long count;

    TemplateNode(int depth) {
        this(depth, null);
    }

    TemplateNode(int depth, String template) {
        this.depth = depth;
        this.template = template;
    }

    TemplateNode getChild(String token) {
        return children.get(token);
    }

    TemplateNode addChild(String token, String template) {
        TemplateNode child = new TemplateNode(depth + 1, template);
        children.put(token, child);
        return child;
    }

    Collection<TemplateNode> childNodes() {
        return children.values();
    }

    boolean hasTemplate() {
        return template != null && !template.isEmpty();
    }

    void increment() {
        count++;
    }
}
