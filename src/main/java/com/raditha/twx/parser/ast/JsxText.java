package com.raditha.twx.parser.ast;

import java.util.List;

public class JsxText extends JsNode {

    private final String text;

    public JsxText(int start, int end, String text) {
        super(start, end);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public List<JsNode> getChildren() {
        return List.of();
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
