package com.raditha.twx.parser.ast;

import java.util.List;

/**
 * {@code {expression}} inside JSX. The expression is {@code null} for empty
 * containers and comment-only containers.
 */
public class JsxExpressionContainer extends JsNode {

    private final JsNode expression;

    public JsxExpressionContainer(int start, int end, JsNode expression) {
        super(start, end);
        this.expression = expression;
    }

    public JsNode getExpression() {
        return expression;
    }

    @Override
    public List<JsNode> getChildren() {
        return present(expression);
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
