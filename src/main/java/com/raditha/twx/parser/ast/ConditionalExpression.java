package com.raditha.twx.parser.ast;

import java.util.List;

public class ConditionalExpression extends JsNode {

    private final JsNode test;
    private final JsNode consequent;
    private final JsNode alternate;

    public ConditionalExpression(int start, int end, JsNode test, JsNode consequent, JsNode alternate) {
        super(start, end);
        this.test = test;
        this.consequent = consequent;
        this.alternate = alternate;
    }

    public JsNode getTest() {
        return test;
    }

    public JsNode getConsequent() {
        return consequent;
    }

    public JsNode getAlternate() {
        return alternate;
    }

    @Override
    public List<JsNode> getChildren() {
        return List.of(test, consequent, alternate);
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
