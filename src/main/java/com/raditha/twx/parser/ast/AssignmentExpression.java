package com.raditha.twx.parser.ast;

import java.util.List;

/**
 * {@code target = value}, compound assignments, and default values in binding
 * patterns ({@code {size = 'sm'}}).
 */
public class AssignmentExpression extends JsNode {

    private final String operator;
    private final JsNode target;
    private final JsNode value;

    public AssignmentExpression(int start, int end, String operator, JsNode target, JsNode value) {
        super(start, end);
        this.operator = operator;
        this.target = target;
        this.value = value;
    }

    public String getOperator() {
        return operator;
    }

    public JsNode getTarget() {
        return target;
    }

    public JsNode getValue() {
        return value;
    }

    /**
     * Name assigned to: the identifier, or the property of a member target.
     */
    public String getTargetName() {
        if (target instanceof Identifier id) {
            return id.getName();
        }
        if (target instanceof MemberExpression member) {
            return member.getPropertyName();
        }
        return null;
    }

    @Override
    public List<JsNode> getChildren() {
        return List.of(target, value);
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
