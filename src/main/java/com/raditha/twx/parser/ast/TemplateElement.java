package com.raditha.twx.parser.ast;

import java.util.List;

/**
 * One literal segment (quasi) of a template literal. Its span covers only the
 * text between the delimiters, so a rewrite never touches {@code `}, {@code ${}
 * or {@code }}.
 */
public class TemplateElement extends JsNode implements MutableLiteral {

    private final String originalValue;
    private final int[] offsets;
    private final boolean tail;
    private String value;

    public TemplateElement(int contentStart, int contentEnd, String value, int[] offsets, boolean tail) {
        super(contentStart, contentEnd);
        this.originalValue = value;
        this.value = value;
        this.offsets = offsets;
        this.tail = tail;
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public void setValue(String value) {
        this.value = value;
    }

    public boolean isTail() {
        return tail;
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
        return LiteralEscapes.template(value);
    }

    @Override
    public int sourceOffset(int index) {
        if (offsets == null) {
            return getStart() + index;
        }
        return index < offsets.length ? offsets[index] : getEnd();
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
