package com.raditha.twx.parser.ast;

import java.util.List;

public class Program extends JsNode {

    private final List<JsNode> body;

    public Program(int start, int end, List<JsNode> body) {
        super(start, end);
        this.body = List.copyOf(body);
    }

    public List<JsNode> getBody() {
        return body;
    }

    @Override
    public List<JsNode> getChildren() {
        return body;
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
