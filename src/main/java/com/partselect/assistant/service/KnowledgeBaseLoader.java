package com.partselect.assistant.service;

import com.partselect.assistant.model.CatalogEntry;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the static knowledge corpus: a text file split on blank lines, the main
 * text of any configured HTML pages, and optionally one summary per catalog entry.
 */
@Component
public class KnowledgeBaseLoader {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseLoader.class);

    private final ResourcePatternResolver resourceResolver;
    private final String baseLocation;
    private final List<String> htmlLocations;
    private final boolean includeCatalog;

    public KnowledgeBaseLoader(ResourceLoader resourceLoader,
                               @Value("${app.knowledge.base-location:classpath:knowledge/knowledge_base.txt}") String baseLocation,
                               @Value("${app.knowledge.html-locations:}") List<String> htmlLocations,
                               @Value("${app.knowledge.include-catalog:true}") boolean includeCatalog) {
        this.resourceResolver = ResourcePatternUtils.getResourcePatternResolver(resourceLoader);
        this.baseLocation = baseLocation;
        this.htmlLocations = htmlLocations == null ? List.of() : htmlLocations;
        this.includeCatalog = includeCatalog;
    }

    public List<String> load(List<CatalogEntry> catalog) {
        List<String> docs = new ArrayList<>();
        docs.addAll(readTextCorpus());
        docs.addAll(readHtmlPages());
        if (includeCatalog && catalog != null) {
            catalog.stream().map(KnowledgeBaseLoader::describe).forEach(docs::add);
        }
        if (docs.isEmpty()) {
            logger.warn("Knowledge corpus is empty. No documents loaded from '{}'.", baseLocation);
        } else {
            logger.info("Knowledge corpus loaded with {} documents.", docs.size());
        }
        return List.copyOf(docs);
    }

    /**
     * Splits on blank lines, dropping empty paragraphs.
     */
    static List<String> splitParagraphs(String text) {
        List<String> paragraphs = new ArrayList<>();
        if (text == null) {
            return paragraphs;
        }
        for (String paragraph : text.replace("\r\n", "\n").split("\n\n")) {
            String trimmed = paragraph.trim();
            if (!trimmed.isEmpty()) {
                paragraphs.add(trimmed);
            }
        }
        return paragraphs;
    }

    static String describe(CatalogEntry entry) {
        StringBuilder sb = new StringBuilder();
        sb.append(entry.getName()).append(" (").append(entry.getPartNumber()).append(")");
        sb.append(" - ").append(entry.getBrand()).append(' ').append(entry.getAppliance())
                .append(' ').append(entry.getCategory()).append(" part.");
        if (StringUtils.hasText(entry.getDescription())) {
            sb.append(' ').append(entry.getDescription());
        }
        if (!entry.getModels().isEmpty()) {
            sb.append(" Models: ").append(String.join(", ", entry.getModels())).append('.');
        }
        if (StringUtils.hasText(entry.getInstallGuide())) {
            sb.append(' ').append(entry.getInstallGuide());
        }
        return sb.toString();
    }

    private List<String> readTextCorpus() {
        if (!StringUtils.hasText(baseLocation)) {
            return List.of();
        }
        Resource resource = resourceResolver.getResource(baseLocation);
        if (!resource.exists()) {
            logger.warn("Knowledge base file '{}' not found.", baseLocation);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            return splitParagraphs(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.error("Failed to read knowledge base '{}': {}", baseLocation, e.getMessage(), e);
            return List.of();
        }
    }

    private List<String> readHtmlPages() {
        List<String> pages = new ArrayList<>();
        for (String location : htmlLocations) {
            if (!StringUtils.hasText(location)) {
                continue;
            }
            Resource[] resources;
            try {
                resources = resourceResolver.getResources(location.trim());
            } catch (IOException e) {
                logger.warn("Could not resolve knowledge HTML pattern '{}': {}", location, e.getMessage());
                continue;
            }
            logger.info("Found {} HTML files with pattern '{}'", resources.length, location);
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    Document document = Jsoup.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
                    Element main = document.selectFirst("main");
                    if (main == null) {
                        main = document.body();
                    }
                    String text = main != null ? main.text().trim() : "";
                    if (text.isEmpty()) {
                        logger.warn("Could not find <main> or <body> content in '{}'", resource.getDescription());
                        continue;
                    }
                    pages.add(text);
                } catch (IOException e) {
                    logger.error("Error parsing knowledge HTML {}: {}", resource.getDescription(), e.getMessage());
                }
            }
        }
        return pages;
    }
}
