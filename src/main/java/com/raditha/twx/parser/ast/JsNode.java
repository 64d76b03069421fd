package com.raditha.twx.parser.ast;

import java.util.List;

/**
 * Base of every syntax tree node. Offsets are UTF-16 indexes into the source
 * text, end exclusive.
 */
public abstract class JsNode {

    private final int start;
    private final int end;

    protected JsNode(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * Direct children in source order.
     */
    public abstract List<JsNode> getChildren();

    public abstract void accept(JsVisitor visitor);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + start + ".." + end + "]";
    }

    static List<JsNode> present(JsNode... nodes) {
        java.util.ArrayList<JsNode> list = new java.util.ArrayList<>(nodes.length);
        for (JsNode node : nodes) {
            if (node != null) {
                list.add(node);
            }
        }
        return list;
    }
}
