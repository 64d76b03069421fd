package com.raditha.twx.parser.ast;

import java.util.List;

/**
 * Object member or class field: {@code key: value}, shorthand {@code key},
 * method {@code key() {}} (value is the function) or field {@code key = value}.
 */
public class Property extends JsNode {

    private final JsNode key;
    private final JsNode value;
    private final boolean computed;
    private final boolean shorthand;

    public Property(int start, int end, JsNode key, JsNode value, boolean computed, boolean shorthand) {
        super(start, end);
        this.key = key;
        this.value = value;
        this.computed = computed;
        this.shorthand = shorthand;
    }

    public JsNode getKey() {
        return key;
    }

    public JsNode getValue() {
        return value;
    }

    public boolean isComputed() {
        return computed;
    }

    public boolean isShorthand() {
        return shorthand;
    }

    /**
     * Static key name: identifier name or string key value. {@code null} for
     * computed and numeric keys.
     */
    public String getKeyName() {
        if (computed) {
            return null;
        }
        if (key instanceof Identifier id) {
            return id.getName();
        }
        if (key instanceof StringLiteral literal) {
            return literal.getOriginalValue();
        }
        return null;
    }

    @Override
    public List<JsNode> getChildren() {
        if (shorthand) {
            return present(value);
        }
        return present(key, value);
    }

    @Override
    public void accept(JsVisitor visitor) {
        visitor.visit(this);
    }
}
