package com.herzen.audit.service;

import com.herzen.audit.domain.DomainModels.BlockType;
import com.herzen.audit.parser.BlockParser;
import com.herzen.audit.parser.ParserDtos.ParsedSource;
import com.herzen.audit.parser.RulePrinter;
import com.herzen.audit.parser.RuleSyntaxException;
import com.herzen.audit.rule.RuleModels.Block;
import com.herzen.audit.rule.RuleModels.BlockReference;
import com.herzen.audit.validation.BlockLinker;
import com.herzen.audit.validation.LinkException.LinkIssue;
import com.herzen.audit.validation.LinkedCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiles block sources and keeps the linked catalog that audits run against.
 * Parsed sources are cached by content hash; registration is single-writer and readers
 * always see a complete, linked snapshot.
 */
@Service
public class BlockCatalogService {
    private static final Logger log = LoggerFactory.getLogger(BlockCatalogService.class);

    private final BlockParser parser;
    private final BlockLinker linker;
    private final RulePrinter printer;

    private final Map<String, ParsedSource> parseCache = new ConcurrentHashMap<>();
    private final Map<String, Block> registered = new LinkedHashMap<>();
    private volatile LinkedCatalog catalog = LinkedCatalog.empty();

    public BlockCatalogService(BlockParser parser, BlockLinker linker, RulePrinter printer) {
        this.parser = parser;
        this.linker = linker;
        this.printer = printer;
    }

    public CompileResult compile(String content, boolean dryRun) {
        ParsedSource parsed;
        try {
            parsed = parse(content);
        } catch (RuleSyntaxException e) {
            log.warn("Rejected block source: {}", e.getMessage());
            CompileError error = new CompileError(e.code(), e.getMessage(), e.position().line(), e.position().column(), null);
            return new CompileResult(dryRun, false, List.of(), List.of(error));
        }

        List<BlockSummary> summaries = parsed.allBlocks().stream().map(this::summary).toList();
        List<LinkIssue> issues;
        synchronized (this) {
            Map<String, Block> candidate = new LinkedHashMap<>(registered);
            parsed.allBlocks().forEach(b -> candidate.put(b.id(), b));
            issues = linker.validate(candidate.values());
            if (issues.isEmpty() && !dryRun) {
                catalog = linker.link(candidate.values());
                registered.clear();
                registered.putAll(candidate);
                log.info("Registered block(s) {}; catalog holds {} block(s)",
                        summaries.stream().map(BlockSummary::id).toList(), registered.size());
            }
        }

        if (!issues.isEmpty()) {
            log.warn("Block source {} failed linking: {}", parsed.root().id(), issues);
        }
        List<CompileError> errors = issues.stream()
                .map(i -> new CompileError(i.code(), i.message(), 0, 0, i.blockId()))
                .toList();
        return new CompileResult(dryRun, errors.isEmpty(), summaries, errors);
    }

    /** Parses source, reusing the cached tree when identical text was parsed before. */
    public ParsedSource parse(String content) {
        String hash = BlockParser.contentHash(content);
        ParsedSource cached = parseCache.get(hash);
        if (cached != null) {
            log.debug("Parse cache hit for {}", hash);
            return cached;
        }
        return parseCache.computeIfAbsent(hash, h -> parser.parse(content));
    }

    public LinkedCatalog catalog() {
        return catalog;
    }

    public List<BlockSummary> blocks() {
        return catalog.blocks().stream().map(this::summary).toList();
    }

    public String source(String blockId) {
        Block block = catalog.find(blockId).orElseThrow(() -> new UnknownBlockException(blockId));
        return printer.print(block);
    }

    private BlockSummary summary(Block block) {
        List<String> references = BlockLinker.references(block.rule()).stream()
                .map(BlockReference::blockId)
                .distinct()
                .toList();
        return new BlockSummary(block.id(), block.type(), block.title(), block.nodeCount(), references);
    }

    public record CompileResult(boolean dryRun,
                                boolean valid,
                                List<BlockSummary> blocks,
                                List<CompileError> errors) {}

    public record CompileError(String code, String message, int line, int column, String blockId) {}

    public record BlockSummary(String id, BlockType type, String title, int nodeCount, List<String> references) {}
}
