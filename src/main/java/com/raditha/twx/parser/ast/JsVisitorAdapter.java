package com.raditha.twx.parser.ast;

/**
 * Visits every child of every node in source order. Subclasses override the
 * node types they care about and call {@code super.visit(n)} (or
 * {@link #visitChildren(JsNode)}) to keep descending.
 */
public abstract class JsVisitorAdapter implements JsVisitor {

    protected void visitChildren(JsNode n) {
        for (JsNode child : n.getChildren()) {
            child.accept(this);
        }
    }

    @Override
    public void visit(Program n) {
        visitChildren(n);
    }

    @Override
    public void visit(StringLiteral n) {
        // leaf
    }

    @Override
    public void visit(TemplateLiteral n) {
        visitChildren(n);
    }

    @Override
    public void visit(TemplateElement n) {
        // leaf
    }

    @Override
    public void visit(Identifier n) {
        // leaf
    }

    @Override
    public void visit(MemberExpression n) {
        visitChildren(n);
    }

    @Override
    public void visit(CallExpression n) {
        visitChildren(n);
    }

    @Override
    public void visit(ConditionalExpression n) {
        visitChildren(n);
    }

    @Override
    public void visit(LogicalExpression n) {
        visitChildren(n);
    }

    @Override
    public void visit(BinaryExpression n) {
        visitChildren(n);
    }

    @Override
    public void visit(AssignmentExpression n) {
        visitChildren(n);
    }

    @Override
    public void visit(VariableDeclarator n) {
        visitChildren(n);
    }

    @Override
    public void visit(ObjectLiteral n) {
        visitChildren(n);
    }

    @Override
    public void visit(Property n) {
        visitChildren(n);
    }

    @Override
    public void visit(ArrayLiteral n) {
        visitChildren(n);
    }

    @Override
    public void visit(JsxElement n) {
        visitChildren(n);
    }

    @Override
    public void visit(JsxAttribute n) {
        visitChildren(n);
    }

    @Override
    public void visit(JsxExpressionContainer n) {
        visitChildren(n);
    }

    @Override
    public void visit(JsxText n) {
        // leaf
    }

    @Override
    public void visit(GenericNode n) {
        visitChildren(n);
    }
}
