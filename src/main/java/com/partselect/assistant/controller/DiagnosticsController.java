package com.partselect.assistant.controller;

import com.partselect.assistant.dto.HealthResponse;
import com.partselect.assistant.dto.LookupResponse;
import com.partselect.assistant.model.CatalogEntry;
import com.partselect.assistant.service.BedrockAnswerService;
import com.partselect.assistant.service.CatalogSearchService;
import com.partselect.assistant.service.KnowledgeRetrievalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@Tag(name = "Diagnostics", description = "Liveness, readiness and raw catalog lookups")
public class DiagnosticsController {

    static final int MAX_LOOKUP_HITS = 10;

    private final CatalogSearchService catalogSearchService;
    private final KnowledgeRetrievalService knowledgeRetrievalService;
    private final BedrockAnswerService bedrockAnswerService;

    public DiagnosticsController(CatalogSearchService catalogSearchService,
                                 KnowledgeRetrievalService knowledgeRetrievalService,
                                 BedrockAnswerService bedrockAnswerService) {
        this.catalogSearchService = catalogSearchService;
        this.knowledgeRetrievalService = knowledgeRetrievalService;
        this.bedrockAnswerService = bedrockAnswerService;
    }

    @Operation(summary = "Liveness check")
    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("status", "ok", "message", "Backend is alive");
    }

    @Operation(summary = "Readiness counters",
            description = "Catalog item count, knowledge chunk count and whether the language model is configured.")
    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("ok", catalogSearchService.size(), knowledgeRetrievalService.size(),
                bedrockAnswerService.isAvailable());
    }

    @Operation(summary = "Raw catalog search", description = "Runs the catalog search directly; returns at most 10 hits.")
    @GetMapping("/debug/lookup")
    public LookupResponse lookup(@Parameter(description = "Free-text query or part number", required = true)
                                 @RequestParam String q) {
        List<CatalogEntry> hits = catalogSearchService.search(q);
        return new LookupResponse(q, hits.subList(0, Math.min(MAX_LOOKUP_HITS, hits.size())), hits.size());
    }

    @Operation(summary = "Featured parts", description = "First entries of the catalog, for the landing view.")
    @GetMapping("/debug/featured")
    public List<CatalogEntry> featured() {
        return catalogSearchService.featured();
    }
}
