package com.raditha.twx.parser.ast;

/**
 * A literal whose text value can be replaced in place. The serializer patches
 * {@link #patchStart()}..{@link #patchEnd()} of the original source with
 * {@link #render()} for every modified literal and copies everything else
 * verbatim.
 */
public interface MutableLiteral {

    String getValue();

    void setValue(String value);

    boolean isModified();

    int patchStart();

    int patchEnd();

    String render();

    /**
     * Source offset of character {@code index} of the cooked value.
     */
    int sourceOffset(int index);
}
