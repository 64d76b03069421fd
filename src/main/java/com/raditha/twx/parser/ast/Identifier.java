package com.raditha.twx.parser.ast;

import java.util.List;

public class Identifier extends JsNode {

    private final String name;

    public Identifier(int start, int end, String name) {
        super(start, end);
        this.name = name;
    }

    public String getName() {
        return name;
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
