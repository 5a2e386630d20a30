package com.herzen.audit.api;

import com.herzen.audit.service.BlockCatalogService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/blocks")
public class BlockController {
    private final BlockCatalogService catalogService;

    public BlockController(BlockCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @PostMapping("/compile")
    public ResponseEntity<BlockCatalogService.CompileResult> compile(@RequestBody CompileRequest request) {
        return ResponseEntity.ok(catalogService.compile(request.content(), request.dryRun()));
    }

    @GetMapping
    public ResponseEntity<List<BlockCatalogService.BlockSummary>> blocks() {
        return ResponseEntity.ok(catalogService.blocks());
    }

    @GetMapping("/{blockId}/source")
    public ResponseEntity<String> source(@PathVariable String blockId) {
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(catalogService.source(blockId));
    }

    public record CompileRequest(String content, boolean dryRun) {}
}
