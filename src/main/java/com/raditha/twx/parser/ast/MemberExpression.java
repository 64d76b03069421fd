package com.raditha.twx.parser.ast;

import java.util.List;

/**
 * {@code object.property}, {@code object?.property} or {@code object[expr]}.
 */
public class MemberExpression extends JsNode {

    private final JsNode object;
    private final String propertyName;
    private final JsNode computedProperty;

    public MemberExpression(int start, int end, JsNode object, String propertyName, JsNode computedProperty) {
        super(start, end);
        this.object = object;
        this.propertyName = propertyName;
        this.computedProperty = computedProperty;
    }

    public JsNode getObject() {
        return object;
    }

    /**
     * Name of a non-computed property, {@code null} for {@code object[expr]}.
     */
    public String getPropertyName() {
        return propertyName;
    }

    public JsNode getComputedProperty() {
        return computedProperty;
    }

    @Override
    public List<JsNode> getChildren() {
        return present(object, computedProperty);
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
