package com.raditha.twx.parser.ast;

/**
 * Double-dispatch visitor over the syntax tree.
 */
public interface JsVisitor {

    void visit(Program n);

    void visit(StringLiteral n);

    void visit(TemplateLiteral n);

    void visit(TemplateElement n);

    void visit(Identifier n);

    void visit(MemberExpression n);

    void visit(CallExpression n);

    void visit(ConditionalExpression n);

    void visit(LogicalExpression n);

    void visit(BinaryExpression n);

    void visit(AssignmentExpression n);

    void visit(VariableDeclarator n);

    void visit(ObjectLiteral n);

    void visit(Property n);

    void visit(ArrayLiteral n);

    void visit(JsxElement n);

    void visit(JsxAttribute n);

    void visit(JsxExpressionContainer n);

    void visit(JsxText n);

    void visit(GenericNode n);
}
