package com.raditha.twx.parser.ast;

import java.util.List;

/**
 * Object literal or object destructuring pattern. Members are
 * {@link Property} nodes or spread {@link GenericNode}s.
 */
public class ObjectLiteral extends JsNode {

    private final List<JsNode> members;

    public ObjectLiteral(int start, int end, List<JsNode> members) {
        super(start, end);
        this.members = List.copyOf(members);
    }

    public List<JsNode> getMembers() {
        return members;
    }

    @Override
    public List<JsNode> getChildren() {
        return members;
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
