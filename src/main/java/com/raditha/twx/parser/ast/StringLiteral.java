package com.raditha.twx.parser.ast;

import java.util.List;

/**
 * A quoted string, either a JavaScript string literal or a JSX attribute value.
 * JSX attribute values have no escape sequences, so they are re-quoted rather
 * than escaped when rewritten.
 */
public class StringLiteral extends JsNode implements MutableLiteral {

    private final String originalValue;
    private final char quote;
    private final boolean jsxAttribute;
    private final int[] offsets;
    private String value;

    /**
     * @param offsets source offset of each cooked character, or {@code null}
     *                when the raw text contains no escapes
     */
    public StringLiteral(int start, int end, String value, char quote, boolean jsxAttribute, int[] offsets) {
        super(start, end);
        this.originalValue = value;
        this.value = value;
        this.quote = quote;
        this.jsxAttribute = jsxAttribute;
        this.offsets = offsets;
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public void setValue(String value) {
        this.value = value;
    }

    public String getOriginalValue() {
        return originalValue;
    }

    public char getQuote() {
        return quote;
    }

    public boolean isJsxAttribute() {
        return jsxAttribute;
    }

    @Override
    public boolean isModified() {
        return !value.equals(originalValue);
    }

    @Override
    public int patchStart() {
        return getStart();
    }

    @Override
    public int patchEnd() {
        return getEnd();
    }

    @Override
    public String render() {
        if (!jsxAttribute) {
            return LiteralEscapes.quoted(value, quote);
        }
        if (value.indexOf(quote) < 0) {
            return quote + value + quote;
        }
        char other = quote == '"' ? '\'' : '"';
        if (value.indexOf(other) < 0) {
            return other + value + other;
        }
        return "{" + LiteralEscapes.quoted(value, '"') + "}";
    }

    @Override
    public int sourceOffset(int index) {
        if (offsets == null) {
            return getStart() + 1 + index;
        }
        return index < offsets.length ? offsets[index] : getEnd() - 1;
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
