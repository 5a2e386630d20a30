package com.herzen.audit.parser;

import com.herzen.audit.parser.ParserDtos.SourcePosition;

/**
 * Lexical or grammatical problem in block source, always tied to a source position.
 */
public abstract class RuleSyntaxException extends RuntimeException {
    private final SourcePosition position;

    protected RuleSyntaxException(String message, SourcePosition position) {
        super(message + " at " + position);
        this.position = position;
    }

    public SourcePosition position() {
        return position;
    }

    public abstract String code();
}
