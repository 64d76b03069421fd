package com.raditha.twx.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A call or a {@code new} expression.
 */
public class CallExpression extends JsNode {

    private final JsNode callee;
    private final List<JsNode> arguments;
    private final boolean construct;

    public CallExpression(int start, int end, JsNode callee, List<JsNode> arguments, boolean construct) {
        super(start, end);
        this.callee = callee;
        this.arguments = List.copyOf(arguments);
        this.construct = construct;
    }

    public JsNode getCallee() {
        return callee;
    }

    public List<JsNode> getArguments() {
        return arguments;
    }

    public boolean isConstruct() {
        return construct;
    }

    /**
     * The identifier being called, or the last property name of a member
     * callee ({@code utils.cn(...)} gives {@code cn}). {@code null} otherwise.
     */
    public String getCalleeName() {
        if (callee instanceof Identifier id) {
            return id.getName();
        }
        if (callee instanceof MemberExpression member) {
            return member.getPropertyName();
        }
        return null;
    }

    @Override
    public List<JsNode> getChildren() {
        List<JsNode> children = new ArrayList<>(arguments.size() + 1);
        children.add(callee);
        children.addAll(arguments);
        return children;
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
