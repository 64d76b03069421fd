package com.raditha.twx.parser.ast;

import java.util.List;

public class ArrayLiteral extends JsNode {

    private final List<JsNode> elements;

    public ArrayLiteral(int start, int end, List<JsNode> elements) {
        super(start, end);
        this.elements = List.copyOf(elements);
    }

    /**
     * Elements without holes.
     */
    public List<JsNode> getElements() {
        return elements;
    }

    @Override
    public List<JsNode> getChildren() {
        return elements;
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
