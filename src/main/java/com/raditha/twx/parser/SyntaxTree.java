package com.raditha.twx.parser;

import com.raditha.twx.model.SourceUnit;
import com.raditha.twx.parser.ast.MutableLiteral;
import com.raditha.twx.parser.ast.Program;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A parsed source unit. Literal nodes may be rewritten in place;
 * {@link #serialize()} then reproduces the original text with only the
 * changed literal spans replaced, so comments, formatting and quote style
 * survive untouched.
 */
public class SyntaxTree {

    private final SourceUnit unit;
    private final Program root;
    private final List<MutableLiteral> literals;
    private final LineMap lineMap;

    public SyntaxTree(SourceUnit unit, Program root, List<MutableLiteral> literals, LineMap lineMap) {
        this.unit = unit;
        this.root = root;
        this.literals = List.copyOf(literals);
        this.lineMap = lineMap;
    }

    public SourceUnit getUnit() {
        return unit;
    }

    public Program getRoot() {
        return root;
    }

    public List<MutableLiteral> getLiterals() {
        return literals;
    }

    public int line(int offset) {
        return lineMap.line(offset);
    }

    public int column(int offset) {
        return lineMap.column(offset);
    }

    public boolean isModified() {
        return literals.stream().anyMatch(MutableLiteral::isModified);
    }

    public String serialize() {
        String source = unit.content();
        List<MutableLiteral> changed = new ArrayList<>();
        for (MutableLiteral literal : literals) {
            if (literal.isModified()) {
                changed.add(literal);
            }
        }
        if (changed.isEmpty()) {
            return source;
        }
        changed.sort(Comparator.comparingInt(MutableLiteral::patchStart));

        StringBuilder out = new StringBuilder(source.length() + 64);
        int cursor = 0;
        for (MutableLiteral literal : changed) {
            out.append(source, cursor, literal.patchStart());
            out.append(literal.render());
            cursor = literal.patchEnd();
        }
        out.append(source, cursor, source.length());
        return out.toString();
    }
}
