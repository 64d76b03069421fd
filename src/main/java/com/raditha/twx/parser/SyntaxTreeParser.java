package com.raditha.twx.parser;

import com.raditha.twx.exceptions.ParseException;
import com.raditha.twx.model.SourceUnit;

/**
 * Turns a source unit into a syntax tree. Implementations must be safe to call
 * from several worker threads at once; the returned tree belongs to the
 * caller.
 */
public interface SyntaxTreeParser {

    SyntaxTree parse(SourceUnit unit) throws ParseException;
}
