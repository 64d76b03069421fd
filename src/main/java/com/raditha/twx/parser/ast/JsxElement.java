package com.raditha.twx.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A JSX element or fragment ({@code name} is empty for {@code <>...</>}).
 * Attributes are {@link JsxAttribute}s or spread {@link GenericNode}s.
 */
public class JsxElement extends JsNode {

    private final String name;
    private final List<JsNode> attributes;
    private final List<JsNode> children;
    private final boolean selfClosing;

    public JsxElement(int start, int end, String name, List<JsNode> attributes, List<JsNode> children,
            boolean selfClosing) {
        super(start, end);
        this.name = name;
        this.attributes = List.copyOf(attributes);
        this.children = List.copyOf(children);
        this.selfClosing = selfClosing;
    }

    public String getName() {
        return name;
    }

    public boolean isFragment() {
        return name.isEmpty();
    }

    public boolean isSelfClosing() {
        return selfClosing;
    }

    public List<JsNode> getAttributes() {
        return attributes;
    }

    public List<JsNode> getElementChildren() {
        return children;
    }

    @Override
    public List<JsNode> getChildren() {
        List<JsNode> all = new ArrayList<>(attributes);
        all.addAll(children);
        return all;
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
