package com.herzen.audit.parser;

import com.herzen.audit.parser.ParserDtos.ParsedSource;
import com.herzen.audit.rule.RuleModels.*;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Prints blocks back to canonical source. Parsing the output yields an equal block.
 */
@Component
public class RulePrinter {

    public String print(ParsedSource source) {
        return source.allBlocks().stream().map(this::print).collect(Collectors.joining("\n\n"));
    }

    public String print(Block block) {
        StringBuilder sb = new StringBuilder();
        sb.append("block ").append(block.id())
                .append(' ').append(block.type().name().toLowerCase(Locale.ROOT))
                .append(' ').append(quote(block.title()))
                .append(" =\n");
        appendRule(sb, block.rule(), 1);
        sb.append('\n');
        return sb.toString();
    }

    private void appendRule(StringBuilder sb, Rule rule, int indent) {
        indent(sb, indent);
        boolean wrap = rule.label() != null && rule instanceof Conditional;
        if (wrap) sb.append('(');
        appendBody(sb, rule, indent);
        if (wrap) sb.append(')');
        if (rule.label() != null) {
            sb.append(" label ").append(quote(rule.label()));
        }
    }

    private void appendBody(StringBuilder sb, Rule rule, int indent) {
        if (rule instanceof CourseSet c) {
            sb.append("courses ").append(c.patterns().stream().map(this::pattern).collect(Collectors.joining(", ")));
            if (c.minCount() > 0 || c.minCredits().signum() == 0) {
                sb.append(" min ").append(c.minCount()).append(" courses");
            }
            if (c.minCredits().signum() > 0) {
                sb.append(" min ").append(number(c.minCredits())).append(" credits");
            }
            if (c.gradeFloor() != null) {
                sb.append(" grade at-least ").append(c.gradeFloor().name());
            }
        } else if (rule instanceof Group g) {
            String mode = switch (g.mode()) {
                case ALL -> "all-of";
                case ANY -> "any-of";
                case N_OF -> g.required() + "-of";
            };
            sb.append(mode).append(" {\n");
            for (int i = 0; i < g.children().size(); i++) {
                appendRule(sb, g.children().get(i), indent + 1);
                sb.append(i + 1 < g.children().size() ? ";\n" : "\n");
            }
            indent(sb, indent);
            sb.append('}');
        } else if (rule instanceof Maximum m) {
            Rule child = m.child();
            boolean wrap = child.label() != null || child instanceof Maximum || child instanceof Conditional;
            if (wrap) {
                sb.append("(\n");
                appendRule(sb, child, indent + 1);
                sb.append('\n');
                indent(sb, indent);
                sb.append(')');
            } else {
                appendBody(sb, child, indent);
            }
            sb.append(" max ").append(number(m.ceiling().limit()))
                    .append(m.ceiling().unit() == Unit.COURSES ? " courses" : " credits");
        } else if (rule instanceof Conditional c) {
            sb.append("if ").append(condition(c.condition(), 0)).append(" then\n");
            appendBranch(sb, c.thenRule(), indent + 1, c.elseRule() != null);
            if (c.elseRule() != null) {
                sb.append('\n');
                indent(sb, indent);
                sb.append("else\n");
                appendBranch(sb, c.elseRule(), indent + 1, false);
            }
        } else if (rule instanceof BlockReference r) {
            sb.append("ref ").append(r.blockId());
            if (r.share() == SharePolicy.SHARED) sb.append(" shared");
        }
    }

    // an inner if without else would otherwise capture the outer else
    private void appendBranch(StringBuilder sb, Rule branch, int indent, boolean elseFollows) {
        if (elseFollows && branch instanceof Conditional && branch.label() == null) {
            indent(sb, indent);
            sb.append("(\n");
            appendRule(sb, branch, indent + 1);
            sb.append('\n');
            indent(sb, indent);
            sb.append(')');
        } else {
            appendRule(sb, branch, indent);
        }
    }

    public String describe(Condition condition) {
        return condition(condition, 0);
    }

    private String condition(Condition condition, int parentPrecedence) {
        int precedence = precedence(condition);
        String text;
        if (condition instanceof Or o) {
            text = condition(o.left(), precedence - 1) + " or " + condition(o.right(), precedence);
        } else if (condition instanceof And a) {
            text = condition(a.left(), precedence - 1) + " and " + condition(a.right(), precedence);
        } else if (condition instanceof Not n) {
            text = "not " + condition(n.operand(), precedence - 1);
        } else {
            Comparison c = (Comparison) condition;
            text = aggregate(c.aggregate()) + " " + c.operator().symbol() + " " + number(c.value());
        }
        return precedence <= parentPrecedence ? "(" + text + ")" : text;
    }

    private int precedence(Condition condition) {
        if (condition instanceof Or) return 1;
        if (condition instanceof And) return 2;
        return 3;
    }

    private String aggregate(Aggregate aggregate) {
        String keyword = aggregate.kind().keyword();
        if (aggregate.patterns().isEmpty()) return keyword;
        return keyword + "(" + aggregate.patterns().stream().map(this::pattern).collect(Collectors.joining(", ")) + ")";
    }

    private String pattern(CoursePattern pattern) {
        return pattern.anyNumber() ? pattern.subjectText() : pattern.subjectText() + " " + pattern.numberText();
    }

    private String number(BigDecimal value) {
        return value.toPlainString();
    }

    private String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"")
                .replace("\n", "\\n").replace("\t", "\\t") + "\"";
    }

    private void indent(StringBuilder sb, int level) {
        sb.append("    ".repeat(level));
    }
}
