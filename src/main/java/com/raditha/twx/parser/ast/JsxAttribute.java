package com.raditha.twx.parser.ast;

import java.util.List;

/**
 * {@code name="value"}, {@code name={expr}} or a bare {@code name}. The value
 * is a {@link StringLiteral}, a {@link JsxExpressionContainer}, a
 * {@link JsxElement} or {@code null}.
 */
public class JsxAttribute extends JsNode {

    private final String name;
    private final JsNode value;

    public JsxAttribute(int start, int end, String name, JsNode value) {
        super(start, end);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public JsNode getValue() {
        return value;
    }

    @Override
    public List<JsNode> getChildren() {
        return present(value);
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
