package com.herzen.audit.parser;

import com.herzen.audit.parser.ParserDtos.SourcePosition;

public class ParseException extends RuleSyntaxException {
    private final String expected;
    private final String found;

    public ParseException(SourcePosition position, String expected, String found) {
        super("Expected " + expected + " but found " + found, position);
        this.expected = expected;
        this.found = found;
    }

    public String expected() {
        return expected;
    }

    public String found() {
        return found;
    }

    @Override
    public String code() {
        return "PARSE_ERROR";
    }
}
