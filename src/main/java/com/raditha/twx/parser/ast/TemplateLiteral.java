package com.raditha.twx.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code `quasi ${expr} quasi`}. There is always one more quasi than there are
 * expressions.
 */
public class TemplateLiteral extends JsNode {

    private final List<TemplateElement> quasis;
    private final List<JsNode> expressions;

    public TemplateLiteral(int start, int end, List<TemplateElement> quasis, List<JsNode> expressions) {
        super(start, end);
        this.quasis = List.copyOf(quasis);
        this.expressions = List.copyOf(expressions);
    }

    public List<TemplateElement> getQuasis() {
        return quasis;
    }

    public List<JsNode> getExpressions() {
        return expressions;
    }

    @Override
    public List<JsNode> getChildren() {
        List<JsNode> children = new ArrayList<>();
        for (int i = 0; i < quasis.size(); i++) {
            children.add(quasis.get(i));
            if (i < expressions.size()) {
                children.add(expressions.get(i));
            }
        }
        return children;
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
