package com.raditha.twx.parser.ast;

import java.util.List;

/**
 * Any construct the extractor has no special interest in. Only its children
 * matter, so they are kept in source order and visited.
 */
public class GenericNode extends JsNode {

    public enum Kind {
        BLOCK,
        STATEMENT,
        DECLARATION,
        FUNCTION,
        PARAMETERS,
        CLASS,
        UNARY,
        SEQUENCE,
        SPREAD,
        LITERAL,
        TAGGED_TEMPLATE,
        DECORATOR,
        ENUM,
        OTHER
    }

    private final Kind kind;
    private final List<JsNode> children;

    public GenericNode(int start, int end, Kind kind, List<JsNode> children) {
        super(start, end);
        this.kind = kind;
        this.children = List.copyOf(children);
    }

    public static GenericNode leaf(int start, int end, Kind kind) {
        return new GenericNode(start, end, kind, List.of());
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * A nested scope (function or class body): class-bearing context does not
     * carry into it.
     */
    public boolean isScope() {
        return kind == Kind.FUNCTION || kind == Kind.CLASS;
    }

    @Override
    public List<JsNode> getChildren() {
        return children;
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return kind + "[" + getStart() + ".." + getEnd() + "]";
    }
}
