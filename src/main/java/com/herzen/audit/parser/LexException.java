package com.herzen.audit.parser;

import com.herzen.audit.parser.ParserDtos.SourcePosition;

public class LexException extends RuleSyntaxException {
    private final String unexpected;

    public LexException(SourcePosition position, String unexpected, String message) {
        super(message, position);
        this.unexpected = unexpected;
    }

    public String unexpected() {
        return unexpected;
    }

    @Override
    public String code() {
        return "LEX_ERROR";
    }
}
