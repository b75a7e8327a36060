package com.mcr.core.reasoner;

import com.mcr.core.error.ValidationFailedException;

/**
 * Thrown by {@link TermParser} for malformed clauses or queries.
 */
public class ClauseSyntaxException extends ValidationFailedException {

    private final int line;
    private final int column;

    public ClauseSyntaxException(String message, int line, int column) {
        super("Syntax error at line " + line + ", column " + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
