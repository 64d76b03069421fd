package com.raditha.twx.parser.ast;

import java.util.List;

/**
 * One binding of a {@code var}/{@code let}/{@code const} declaration.
 */
public class VariableDeclarator extends JsNode {

    private final JsNode target;
    private final JsNode init;

    public VariableDeclarator(int start, int end, JsNode target, JsNode init) {
        super(start, end);
        this.target = target;
        this.init = init;
    }

    /**
     * The bound name, or {@code null} when the target is a destructuring pattern.
     */
    public String getName() {
        return target instanceof Identifier id ? id.getName() : null;
    }

    public JsNode getTarget() {
        return target;
    }

    public JsNode getInit() {
        return init;
    }

    @Override
    public List<JsNode> getChildren() {
        return present(target, init);
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
