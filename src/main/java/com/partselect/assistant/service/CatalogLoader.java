package com.partselect.assistant.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.partselect.assistant.model.CatalogEntry;
import com.partselect.assistant.model.CatalogSnapshot;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

import static com.partselect.assistant.service.CatalogVocabulary.lower;

/**
 * Builds the immutable catalog once at startup: from the persisted JSON snapshot when
 * it has items, otherwise by parsing the saved catalog HTML pages.
 */
@Component
public class CatalogLoader {

    private static final Logger logger = LoggerFactory.getLogger(CatalogLoader.class);

    private static final String BLOCK_SELECTOR = ".partlist-item, .ps-part, .product, div.nf__part, li";
    private static final String PART_NUMBER_SELECTOR = ".part-number, .ps-part-number, .sku";
    private static final String NAME_SELECTOR = ".part-title, .part-name, .title, h3, h4, a";
    private static final String DESCRIPTION_SELECTOR = ".part-description, .ps-part-desc, .desc";

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String snapshotLocation;
    private final Map<String, String> htmlSources;
    private final String rebuildOutput;

    public CatalogLoader(ObjectMapper objectMapper,
                         ResourceLoader resourceLoader,
                         @Value("${app.catalog.snapshot-location:classpath:data/parts_catalog.json}") String snapshotLocation,
                         @Value("${app.catalog.dishwasher-html:}") String dishwasherHtml,
                         @Value("${app.catalog.refrigerator-html:}") String refrigeratorHtml,
                         @Value("${app.catalog.rebuild-output:}") String rebuildOutput) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.snapshotLocation = snapshotLocation;
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put(CatalogVocabulary.DISHWASHER, dishwasherHtml);
        sources.put(CatalogVocabulary.REFRIGERATOR, refrigeratorHtml);
        this.htmlSources = sources;
        this.rebuildOutput = rebuildOutput;
    }

    /**
     * @return normalised, de-duplicated entries in catalog order, never empty
     * @throws IllegalStateException when neither the snapshot nor the HTML pages yield any entry
     */
    public List<CatalogEntry> load() {
        List<CatalogEntry> raw = readSnapshot();
        boolean rebuilt = false;
        if (raw.isEmpty()) {
            logger.warn("Catalog snapshot '{}' is missing or empty; rebuilding from HTML sources.", snapshotLocation);
            raw = parseHtmlSources();
            rebuilt = true;
        }

        List<CatalogEntry> items = deduplicate(raw.stream().map(this::normalize).toList());
        if (items.isEmpty()) {
            throw new IllegalStateException("Catalog could not be built: snapshot '" + snapshotLocation
                    + "' is empty and no parts were parsed from the HTML sources.");
        }
        if (rebuilt) {
            persist(items);
        }
        logger.info("Catalog ready with {} items ({}).", items.size(), rebuilt ? "rebuilt from HTML" : "snapshot");
        return List.copyOf(items);
    }

    List<CatalogEntry> readSnapshot() {
        if (!StringUtils.hasText(snapshotLocation)) {
            return List.of();
        }
        Resource resource = resourceLoader.getResource(snapshotLocation);
        if (!resource.exists()) {
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            CatalogSnapshot snapshot = objectMapper.readValue(in, CatalogSnapshot.class);
            return snapshot != null && snapshot.getItems() != null ? snapshot.getItems() : List.of();
        } catch (IOException e) {
            logger.warn("Failed to read catalog snapshot '{}': {}", snapshotLocation, e.getMessage());
            return List.of();
        }
    }

    List<CatalogEntry> parseHtmlSources() {
        List<CatalogEntry> items = new ArrayList<>();
        for (Map.Entry<String, String> source : htmlSources.entrySet()) {
            String location = source.getValue();
            if (!StringUtils.hasText(location)) {
                continue;
            }
            Resource resource = resourceLoader.getResource(location);
            if (!resource.exists()) {
                logger.warn("Missing catalog HTML for {}: {}", source.getKey(), location);
                continue;
            }
            try (InputStream in = resource.getInputStream()) {
                String html = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                List<CatalogEntry> parsed = parseHtml(html, source.getKey());
                logger.info("Parsed {} {} parts from {}", parsed.size(), source.getKey(), location);
                items.addAll(parsed);
            } catch (IOException e) {
                logger.error("Error parsing catalog HTML {}: {}", location, e.getMessage(), e);
            }
        }
        return items;
    }

    /**
     * Extracts part entries from one saved catalog listing page.
     */
    List<CatalogEntry> parseHtml(String html, String appliance) {
        Document document = Jsoup.parse(html);
        String pageBrand = brandOrNull(document.text());
        if (pageBrand == null) {
            pageBrand = "Generic";
        }

        List<CatalogEntry> out = new ArrayList<>();
        for (Element block : document.select(BLOCK_SELECTOR)) {
            String text = block.text();
            if (!StringUtils.hasText(text)) {
                continue;
            }

            String partNumber = firstText(block, PART_NUMBER_SELECTOR);
            if (!StringUtils.hasText(partNumber)) {
                Matcher matcher = CatalogVocabulary.CATALOG_PART_PATTERN.matcher(text);
                partNumber = matcher.find() ? matcher.group().toUpperCase(Locale.ROOT) : "";
            }

            String name = firstText(block, NAME_SELECTOR);
            if (!StringUtils.hasText(name)) {
                String[] words = text.trim().split("\\s+");
                name = String.join(" ", Arrays.copyOfRange(words, 0, Math.min(10, words.length)));
            }
            if (!StringUtils.hasText(partNumber) && !StringUtils.hasText(name)) {
                continue;
            }

            String description = firstText(block, DESCRIPTION_SELECTOR);
            String brand = brandOrNull(text);

            out.add(CatalogEntry.builder()
                    .partNumber(partNumber)
                    .name(name)
                    .brand(brand != null ? brand : pageBrand)
                    .appliance(CatalogVocabulary.guessAppliance(name + " " + description, appliance))
                    .category(categoryFor(name, description))
                    .description(description)
                    .officialURL(CatalogVocabulary.searchUrl(StringUtils.hasText(partNumber) ? partNumber : name))
                    .models(List.of())
                    .brands(List.of(brand != null ? brand : pageBrand))
                    .build());
        }
        return out;
    }

    /**
     * Fills fields older snapshots leave blank. Snapshots that store the appliance in
     * {@code category} get it moved to {@code appliance} and the category re-derived.
     */
    CatalogEntry normalize(CatalogEntry entry) {
        String partNumber = entry.getPartNumber() == null ? "" : entry.getPartNumber().trim();
        String name = StringUtils.hasText(entry.getName())
                ? entry.getName().trim()
                : (partNumber.isEmpty() ? "Unknown Part" : partNumber);
        String description = entry.getDescription() == null ? "" : entry.getDescription().trim();
        String rawCategory = lower(entry.getCategory());

        String appliance = lower(entry.getAppliance());
        if (!StringUtils.hasText(appliance)) {
            appliance = CatalogVocabulary.guessAppliance(name + " " + description,
                    CatalogVocabulary.guessAppliance(rawCategory, CatalogVocabulary.OTHER_APPLIANCE));
        }

        String category = rawCategory;
        if (!StringUtils.hasText(category) || CatalogVocabulary.guessAppliance(category, null) != null) {
            category = categoryFor(name, description);
        }

        String brand = StringUtils.hasText(entry.getBrand()) ? entry.getBrand().trim() : brandOrNull(name + " " + description);
        if (brand == null) {
            brand = "Generic";
        }

        return entry.toBuilder()
                .partNumber(partNumber)
                .name(name)
                .description(description)
                .appliance(appliance)
                .category(category)
                .brand(brand)
                .brands(entry.getBrands().isEmpty() ? List.of(brand) : entry.getBrands())
                .models(entry.getModels())
                .aliases(entry.getAliases())
                .symptoms(entry.getSymptoms())
                .officialURL(StringUtils.hasText(entry.getOfficialURL())
                        ? entry.getOfficialURL()
                        : CatalogVocabulary.searchUrl(partNumber.isEmpty() ? name : partNumber))
                .build();
    }

    static List<CatalogEntry> deduplicate(List<CatalogEntry> entries) {
        Set<String> seen = new LinkedHashSet<>();
        List<CatalogEntry> unique = new ArrayList<>();
        for (CatalogEntry entry : entries) {
            String key = lower(entry.getPartNumber()) + "::" + lower(entry.getName());
            if (seen.add(key)) {
                unique.add(entry);
            }
        }
        return unique;
    }

    private void persist(List<CatalogEntry> items) {
        if (!StringUtils.hasText(rebuildOutput)) {
            return;
        }
        try {
            Path target = Path.of(rebuildOutput);
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("total_parts", items.size());
            meta.put("generated_at", OffsetDateTime.now().toString());
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(target.toFile(), new CatalogSnapshot(meta, items));
            logger.info("Catalog snapshot written to {}", target.toAbsolutePath());
        } catch (IOException e) {
            logger.warn("Could not persist rebuilt catalog to {}: {}", rebuildOutput, e.getMessage());
        }
    }

    private static String categoryFor(String name, String description) {
        String category = CatalogVocabulary.guessCategory(name);
        if (category == null) {
            category = CatalogVocabulary.guessCategory(description);
        }
        return category != null ? category : CatalogVocabulary.GENERAL_CATEGORY;
    }

    private static String brandOrNull(String text) {
        String brand = CatalogVocabulary.findBrand(text);
        return brand == null ? null : CatalogVocabulary.capitalize(brand);
    }

    private static String firstText(Element block, String selector) {
        Elements found = block.select(selector);
        Element first = found.first();
        return first != null ? first.text().trim() : "";
    }
}
