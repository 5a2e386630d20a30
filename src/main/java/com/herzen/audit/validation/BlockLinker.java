package com.herzen.audit.validation;

import com.herzen.audit.rule.RuleModels.*;
import com.herzen.audit.validation.LinkException.LinkIssue;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class BlockLinker {

    public LinkedCatalog link(Collection<Block> blocks) {
        List<LinkIssue> issues = validate(blocks);
        if (!issues.isEmpty()) {
            throw new LinkException(issues);
        }
        return new LinkedCatalog(new ArrayList<>(blocks));
    }

    public List<LinkIssue> validate(Collection<Block> blocks) {
        List<LinkIssue> issues = new ArrayList<>();

        Map<String, Long> counts = blocks.stream().collect(Collectors.groupingBy(Block::id, Collectors.counting()));
        counts.forEach((id, count) -> {
            if (count > 1) {
                issues.add(new LinkIssue("DUPLICATE_BLOCK", id, id, "Block defined more than once: " + id));
            }
        });

        Map<String, List<String>> adj = new LinkedHashMap<>();
        for (Block block : blocks) {
            List<String> targets = adj.computeIfAbsent(block.id(), k -> new ArrayList<>());
            for (BlockReference ref : references(block.rule())) {
                if (!counts.containsKey(ref.blockId())) {
                    issues.add(new LinkIssue("MISSING_BLOCK", block.id(), ref.blockId(),
                            "Block " + block.id() + " references unknown block " + ref.blockId()));
                } else {
                    targets.add(ref.blockId());
                }
            }
        }

        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String node : adj.keySet()) {
            findCycles(node, adj, visiting, visited, issues);
        }
        return issues;
    }

    public static List<BlockReference> references(Rule rule) {
        List<BlockReference> out = new ArrayList<>();
        collect(rule, out);
        return out;
    }

    private static void collect(Rule rule, List<BlockReference> out) {
        if (rule instanceof BlockReference r) {
            out.add(r);
        } else if (rule instanceof Group g) {
            g.children().forEach(child -> collect(child, out));
        } else if (rule instanceof Maximum m) {
            collect(m.child(), out);
        } else if (rule instanceof Conditional c) {
            collect(c.thenRule(), out);
            if (c.elseRule() != null) collect(c.elseRule(), out);
        }
    }

    private void findCycles(String node, Map<String, List<String>> adj, Set<String> visiting, Set<String> visited,
                            List<LinkIssue> issues) {
        if (visited.contains(node)) return;

        visiting.add(node);
        for (String next : adj.getOrDefault(node, List.of())) {
            if (visiting.contains(next)) {
                issues.add(new LinkIssue("CYCLE_DETECTED", node, next,
                        "Reference from " + node + " to " + next + " closes a cycle"));
            } else {
                findCycles(next, adj, visiting, visited, issues);
            }
        }
        visiting.remove(node);
        visited.add(node);
    }
}
