package com.raditha.twx.parser.ast;

import java.util.List;

public class BinaryExpression extends JsNode {

    private final String operator;
    private final JsNode left;
    private final JsNode right;

    public BinaryExpression(int start, int end, String operator, JsNode left, JsNode right) {
        super(start, end);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }

    public JsNode getLeft() {
        return left;
    }

    public JsNode getRight() {
        return right;
    }

    @Override
    public List<JsNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
