package com.herzen.audit.parser;

import com.herzen.audit.config.AuditProperties;
import com.herzen.audit.domain.DomainModels.BlockType;
import com.herzen.audit.domain.DomainModels.Grade;
import com.herzen.audit.parser.ParserDtos.ParsedSource;
import com.herzen.audit.parser.ParserDtos.Token;
import com.herzen.audit.parser.ParserDtos.TokenType;
import com.herzen.audit.rule.RuleModels.*;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;

/**
 * Recursive-descent parser for block source. The first block in a source is the root;
 * any further blocks form the sub-block table used for reference resolution.
 * Node ids are assigned in parse order and are unique within a block.
 */
@Component
public class BlockParser {
    private static final Set<String> FLOOR_GRADES = Set.of("A", "B", "C", "D");

    private final int maxDepth;

    public BlockParser(AuditProperties properties) {
        this.maxDepth = properties.maxRuleDepth();
    }

    public ParsedSource parse(String content) {
        Cursor cursor = new Cursor(new BlockLexer(content).tokenize());

        List<Block> blocks = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        do {
            Token header = cursor.peek();
            Block block = parseBlock(cursor);
            if (!ids.add(block.id())) {
                throw new ParseException(header.position(), "a unique block id", "duplicate '" + block.id() + "'");
            }
            blocks.add(block);
        } while (!cursor.peek().is(TokenType.EOF));

        Map<String, Block> subBlocks = new LinkedHashMap<>();
        blocks.stream().skip(1).forEach(b -> subBlocks.put(b.id(), b));
        return new ParsedSource(blocks.get(0), Collections.unmodifiableMap(subBlocks), contentHash(content));
    }

    public static String contentHash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Block parseBlock(Cursor cursor) {
        cursor.expectKeyword("block");
        String id = cursor.expect(TokenType.IDENT, "block id").text();
        BlockType type = parseBlockType(cursor);
        String title = cursor.peek().is(TokenType.STRING) ? cursor.next().text() : id;
        cursor.expect(TokenType.EQUALS, "'='");

        Context ctx = new Context();
        Rule rule = parseRule(cursor, ctx);
        return new Block(id, type, title, rule, ctx.nextId);
    }

    private BlockType parseBlockType(Cursor cursor) {
        Token token = cursor.next();
        if (token.is(TokenType.KEYWORD)) {
            switch (token.text()) {
                case "major" -> { return BlockType.MAJOR; }
                case "minor" -> { return BlockType.MINOR; }
                case "core" -> { return BlockType.CORE; }
                case "concentration" -> { return BlockType.CONCENTRATION; }
                default -> { }
            }
        }
        throw new ParseException(token.position(), "block type (major, minor, core, concentration)", token.describe());
    }

    private Rule parseRule(Cursor cursor, Context ctx) {
        enter(cursor.peek(), ctx);

        Rule rule = parsePrimary(cursor, ctx);
        while (cursor.peek().isKeyword("max")) {
            cursor.next();
            Ceiling ceiling = parseAmount(cursor, "max");
            rule = new Maximum(ctx.nextId++, null, rule, ceiling);
        }
        if (cursor.peek().isKeyword("label")) {
            cursor.next();
            rule = withLabel(rule, cursor.expect(TokenType.STRING, "label text").text());
        }

        ctx.depth--;
        return rule;
    }

    private Rule parsePrimary(Cursor cursor, Context ctx) {
        Token token = cursor.peek();
        if (token.isKeyword("all-of")) {
            cursor.next();
            return parseGroup(cursor, ctx, GroupMode.ALL, 0, token);
        }
        if (token.isKeyword("any-of")) {
            cursor.next();
            return parseGroup(cursor, ctx, GroupMode.ANY, 1, token);
        }
        if (token.is(TokenType.NUMBER)) {
            int mark = cursor.mark();
            cursor.next();
            if (cursor.peek().is(TokenType.DASH)) {
                cursor.next();
                if (cursor.peek().isKeyword("of")) {
                    cursor.next();
                    return parseGroup(cursor, ctx, GroupMode.N_OF, wholeNumber(token), token);
                }
            }
            cursor.reset(mark);
        }
        if (token.isKeyword("courses")) {
            cursor.next();
            return parseCourseSet(cursor, ctx);
        }
        if (token.isKeyword("if")) {
            cursor.next();
            return parseConditional(cursor, ctx);
        }
        if (token.isKeyword("ref")) {
            cursor.next();
            return parseReference(cursor, ctx);
        }
        if (token.is(TokenType.LPAREN)) {
            cursor.next();
            Rule inner = parseRule(cursor, ctx);
            cursor.expect(TokenType.RPAREN, "')'");
            return inner;
        }
        throw new ParseException(token.position(), "a rule (all-of, any-of, N-of, courses, if, ref)", token.describe());
    }

    private Rule parseGroup(Cursor cursor, Context ctx, GroupMode mode, int required, Token modeToken) {
        int id = ctx.nextId++;
        cursor.expect(TokenType.LBRACE, "'{'");
        List<Rule> children = new ArrayList<>();
        children.add(parseRule(cursor, ctx));
        while (cursor.peek().is(TokenType.SEMICOLON)) {
            cursor.next();
            if (cursor.peek().is(TokenType.RBRACE)) break;
            children.add(parseRule(cursor, ctx));
        }
        cursor.expect(TokenType.RBRACE, "';' or '}'");

        if (mode == GroupMode.ALL) {
            required = children.size();
        } else if (mode == GroupMode.N_OF && (required < 1 || required > children.size())) {
            throw new ParseException(modeToken.position(),
                    "a count between 1 and " + children.size(), modeToken.describe());
        }
        return new Group(id, null, mode, required, children);
    }

    private Rule parseCourseSet(Cursor cursor, Context ctx) {
        int id = ctx.nextId++;
        List<CoursePattern> patterns = parsePatterns(cursor);

        Integer minCount = null;
        BigDecimal minCredits = null;
        Grade floor = null;
        while (true) {
            Token token = cursor.peek();
            if (token.isKeyword("min")) {
                cursor.next();
                Ceiling amount = parseAmount(cursor, "min");
                if (amount.unit() == Unit.COURSES) {
                    if (minCount != null) throw new ParseException(token.position(), "one 'min ... courses' clause", "a second one");
                    minCount = amount.limit().intValueExact();
                } else {
                    if (minCredits != null) throw new ParseException(token.position(), "one 'min ... credits' clause", "a second one");
                    minCredits = amount.limit();
                }
            } else if (token.isKeyword("grade")) {
                cursor.next();
                cursor.expectKeyword("at-least");
                Token grade = cursor.expect(TokenType.IDENT, "grade letter");
                if (!FLOOR_GRADES.contains(grade.text())) {
                    throw new ParseException(grade.position(), "grade letter A, B, C or D", grade.describe());
                }
                floor = Grade.valueOf(grade.text());
            } else {
                break;
            }
        }

        if (minCount == null && minCredits == null) {
            minCount = 1;
        }
        return new CourseSet(id, null, patterns,
                minCount == null ? 0 : minCount,
                minCredits == null ? BigDecimal.ZERO : minCredits,
                floor);
    }

    private List<CoursePattern> parsePatterns(Cursor cursor) {
        List<CoursePattern> patterns = new ArrayList<>();
        patterns.add(parsePattern(cursor));
        while (cursor.peek().is(TokenType.COMMA)) {
            cursor.next();
            patterns.add(parsePattern(cursor));
        }
        return patterns;
    }

    private CoursePattern parsePattern(Cursor cursor) {
        Token subject = cursor.next();
        String prefix;
        boolean wildcard;
        if (subject.is(TokenType.WILDCARD)) {
            prefix = subject.text().substring(0, subject.text().length() - 1).toUpperCase(Locale.ROOT);
            wildcard = true;
        } else if (subject.is(TokenType.IDENT)) {
            prefix = subject.text().toUpperCase(Locale.ROOT);
            wildcard = false;
        } else {
            throw new ParseException(subject.position(), "course subject or wildcard", subject.describe());
        }

        int low = CoursePattern.ANY_LOW;
        int high = CoursePattern.ANY_HIGH;
        Token next = cursor.peek();
        if (next.is(TokenType.WILDCARD) && next.text().equals("*")) {
            cursor.next();
        } else if (next.is(TokenType.NUMBER)) {
            cursor.next();
            low = wholeNumber(next);
            high = low;
            if (cursor.peek().is(TokenType.DASH)) {
                cursor.next();
                Token upper = cursor.expect(TokenType.NUMBER, "upper bound of course number range");
                high = wholeNumber(upper);
                if (high < low) {
                    throw new ParseException(upper.position(), "upper bound >= " + low, upper.describe());
                }
            }
        }
        return new CoursePattern(prefix, wildcard, low, high);
    }

    private Rule parseConditional(Cursor cursor, Context ctx) {
        int id = ctx.nextId++;
        Condition condition = parseOr(cursor, ctx);
        cursor.expectKeyword("then");
        Rule thenRule = parseRule(cursor, ctx);
        Rule elseRule = null;
        if (cursor.peek().isKeyword("else")) {
            cursor.next();
            elseRule = parseRule(cursor, ctx);
        }
        return new Conditional(id, null, condition, thenRule, elseRule);
    }

    private Condition parseOr(Cursor cursor, Context ctx) {
        Condition left = parseAnd(cursor, ctx);
        while (cursor.peek().isKeyword("or")) {
            cursor.next();
            left = new Or(left, parseAnd(cursor, ctx));
        }
        return left;
    }

    private Condition parseAnd(Cursor cursor, Context ctx) {
        Condition left = parseNot(cursor, ctx);
        while (cursor.peek().isKeyword("and")) {
            cursor.next();
            left = new And(left, parseNot(cursor, ctx));
        }
        return left;
    }

    private Condition parseNot(Cursor cursor, Context ctx) {
        Token token = cursor.peek();
        if (token.isKeyword("not")) {
            enter(token, ctx);
            cursor.next();
            Condition operand = parseNot(cursor, ctx);
            ctx.depth--;
            return new Not(operand);
        }
        if (token.is(TokenType.LPAREN)) {
            enter(token, ctx);
            cursor.next();
            Condition inner = parseOr(cursor, ctx);
            cursor.expect(TokenType.RPAREN, "')'");
            ctx.depth--;
            return inner;
        }
        Aggregate aggregate = parseAggregate(cursor);
        Token op = cursor.expect(TokenType.COMPARATOR, "comparison operator");
        Token value = cursor.expect(TokenType.NUMBER, "number");
        return new Comparison(aggregate, Operator.fromSymbol(op.text()), decimal(value));
    }

    private Aggregate parseAggregate(Cursor cursor) {
        Token token = cursor.next();
        if (token.isKeyword("total-credits")) return new Aggregate(AggregateKind.TOTAL_CREDITS, List.of());
        if (token.isKeyword("gpa")) return new Aggregate(AggregateKind.GPA, List.of());
        if (token.isKeyword("count-of") || token.isKeyword("credits-of")) {
            AggregateKind kind = token.isKeyword("count-of") ? AggregateKind.COUNT_OF : AggregateKind.CREDITS_OF;
            cursor.expect(TokenType.LPAREN, "'('");
            List<CoursePattern> patterns = parsePatterns(cursor);
            cursor.expect(TokenType.RPAREN, "')'");
            return new Aggregate(kind, patterns);
        }
        throw new ParseException(token.position(), "total-credits, gpa, count-of(...) or credits-of(...)", token.describe());
    }

    private Rule parseReference(Cursor cursor, Context ctx) {
        int id = ctx.nextId++;
        String target = cursor.expect(TokenType.IDENT, "referenced block id").text();
        SharePolicy share = SharePolicy.EXCLUSIVE;
        if (cursor.peek().isKeyword("shared")) {
            cursor.next();
            share = SharePolicy.SHARED;
        } else if (cursor.peek().isKeyword("exclusive")) {
            cursor.next();
        }
        return new BlockReference(id, null, target, share);
    }

    // rules and condition operators share one nesting budget
    private void enter(Token at, Context ctx) {
        if (++ctx.depth > maxDepth) {
            throw new ParseException(at.position(), "nesting at most " + maxDepth + " levels deep", at.describe());
        }
    }

    private Ceiling parseAmount(Cursor cursor, String clause) {
        Token amount = cursor.expect(TokenType.NUMBER, "amount after '" + clause + "'");
        Token unit = cursor.next();
        if (unit.isKeyword("course") || unit.isKeyword("courses")) {
            return new Ceiling(Unit.COURSES, BigDecimal.valueOf(wholeNumber(amount)));
        }
        if (unit.isKeyword("credit") || unit.isKeyword("credits")) {
            return new Ceiling(Unit.CREDITS, decimal(amount));
        }
        throw new ParseException(unit.position(), "'courses' or 'credits'", unit.describe());
    }

    private Rule withLabel(Rule rule, String label) {
        if (rule instanceof CourseSet c) return new CourseSet(c.id(), label, c.patterns(), c.minCount(), c.minCredits(), c.gradeFloor());
        if (rule instanceof Group g) return new Group(g.id(), label, g.mode(), g.required(), g.children());
        if (rule instanceof Maximum m) return new Maximum(m.id(), label, m.child(), m.ceiling());
        if (rule instanceof Conditional c) return new Conditional(c.id(), label, c.condition(), c.thenRule(), c.elseRule());
        BlockReference r = (BlockReference) rule;
        return new BlockReference(r.id(), label, r.blockId(), r.share());
    }

    private int wholeNumber(Token token) {
        if (token.text().contains(".")) {
            throw new ParseException(token.position(), "whole number", token.describe());
        }
        try {
            return Integer.parseInt(token.text());
        } catch (NumberFormatException e) {
            throw new ParseException(token.position(), "number in integer range", token.describe());
        }
    }

    private BigDecimal decimal(Token token) {
        return new BigDecimal(token.text()).stripTrailingZeros();
    }

    private static final class Context {
        private int nextId;
        private int depth;
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int index;

        private Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.EOF)) index++;
            return token;
        }

        int mark() {
            return index;
        }

        void reset(int mark) {
            index = mark;
        }

        Token expect(TokenType type, String description) {
            Token token = peek();
            if (!token.is(type)) {
                throw new ParseException(token.position(), description, token.describe());
            }
            return next();
        }

        void expectKeyword(String keyword) {
            Token token = peek();
            if (!token.isKeyword(keyword)) {
                throw new ParseException(token.position(), "'" + keyword + "'", token.describe());
            }
            next();
        }
    }
}
