package com.herzen.audit.parser;

import com.herzen.audit.rule.RuleModels.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ParserDtos {
    public enum TokenType {
        KEYWORD, IDENT, NUMBER, COMPARATOR, STRING, WILDCARD,
        LBRACE, RBRACE, LPAREN, RPAREN, COMMA, SEMICOLON, EQUALS, DASH,
        EOF
    }

    public record SourcePosition(int offset, int line, int column) {
        @Override
        public String toString() {
            return line + ":" + column;
        }
    }

    public record Token(TokenType type, String text, SourcePosition position) {
        public boolean is(TokenType expected) {
            return type == expected;
        }

        public boolean isKeyword(String keyword) {
            return type == TokenType.KEYWORD && text.equals(keyword);
        }

        public String describe() {
            return type == TokenType.EOF ? "end of input" : "'" + text + "'";
        }
    }

    /** Root block plus the named sub-blocks declared after it in the same source. */
    public record ParsedSource(Block root, Map<String, Block> subBlocks, String contentHash) {
        public List<Block> allBlocks() {
            List<Block> all = new ArrayList<>();
            all.add(root);
            all.addAll(subBlocks.values());
            return all;
        }
    }
}
