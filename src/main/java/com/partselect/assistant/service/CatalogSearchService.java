package com.partselect.assistant.service;

import com.partselect.assistant.model.CatalogEntry;
import com.partselect.assistant.model.CompatibilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.partselect.assistant.service.CatalogVocabulary.lower;

/**
 * Lexical search over the in-memory parts catalog, plus installation-guide and
 * compatibility answers. The catalog is loaded once and never mutated.
 */
@Service
public class CatalogSearchService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogSearchService.class);

    static final int MAX_RESULTS = 5;
    static final double BASE_SCORE = 0.05;
    static final double BRAND_WEIGHT = 2.0;
    static final double APPLIANCE_WEIGHT = 2.5;
    static final double CATEGORY_WEIGHT = 2.0;
    static final double NAME_TOKEN_WEIGHT = 0.6;
    static final double DESCRIPTION_TOKEN_WEIGHT = 0.3;
    static final double RACK_NAME_BONUS = 0.8;
    static final double MIN_SCORE = 0.6;

    private static final String GENERIC_STEPS =
            "1) Disconnect power/water\n2) Remove the faulty component\n3) Install replacement; restore and test";
    private static final String RACK_STEPS =
            "1) Disconnect power\n2) Remove rack; release clips/rollers/adjusters\n3) Seat and align replacement; test slide";

    private final List<CatalogEntry> items;
    private final Set<String> scopeKeywords;

    @Autowired
    public CatalogSearchService(CatalogLoader catalogLoader) {
        this(catalogLoader.load());
    }

    public CatalogSearchService(List<CatalogEntry> items) {
        this.items = items == null ? List.of() : List.copyOf(items);
        this.scopeKeywords = deriveScopeKeywords(this.items);
        logger.info("CatalogSearchService initialized with {} items and {} scope keywords.",
                this.items.size(), scopeKeywords.size());
    }

    public int size() {
        return items.size();
    }

    public List<CatalogEntry> entries() {
        return items;
    }

    public List<CatalogEntry> featured() {
        return items.subList(0, Math.min(6, items.size()));
    }

    /**
     * Lower-cased part numbers and names of every entry, computed once after load.
     */
    public Set<String> scopeKeywords() {
        return scopeKeywords;
    }

    public List<CatalogEntry> search(String query) {
        return search(query, null, null);
    }

    /**
     * Exact part-number hits win outright; otherwise entries are scored on brand,
     * appliance, category and token overlap.
     *
     * @param model accepted for call-site symmetry; scoring does not use it
     * @return at most five entries, a single synthetic no-match entry, or empty for a blank query
     */
    public List<CatalogEntry> search(String query, String part, String model) {
        String q = StringUtils.hasText(part) ? part.trim() : (query == null ? "" : query.trim());
        if (q.isEmpty()) {
            return List.of();
        }

        String partNumber = StringUtils.hasText(part) ? part.trim() : null;
        if (partNumber == null) {
            Matcher matcher = CatalogVocabulary.CATALOG_PART_PATTERN.matcher(q);
            partNumber = matcher.find() ? matcher.group() : null;
        }
        if (partNumber != null) {
            String code = partNumber;
            List<CatalogEntry> exact = items.stream()
                    .filter(p -> code.equalsIgnoreCase(nullToEmpty(p.getPartNumber())))
                    .limit(MAX_RESULTS)
                    .toList();
            if (!exact.isEmpty()) {
                return exact;
            }
        }

        String brand = CatalogVocabulary.findBrand(q);
        String appliance = CatalogVocabulary.guessAppliance(q, null);
        String category = CatalogVocabulary.guessCategory(q);
        Set<String> tokens = new LinkedHashSet<>(CatalogVocabulary.tokens(q));

        List<ScoredEntry> scored = new ArrayList<>();
        for (CatalogEntry entry : items) {
            double score = score(entry, brand, appliance, category, tokens);
            if (score >= MIN_SCORE) {
                scored.add(new ScoredEntry(entry, score));
            }
        }
        // List.sort is stable, so equal scores keep catalog order
        scored.sort(Comparator.comparingDouble(ScoredEntry::score).reversed());

        List<CatalogEntry> results = scored.stream().limit(MAX_RESULTS).map(ScoredEntry::entry).toList();
        if (results.isEmpty()) {
            logger.debug("No local catalog match for '{}'", q);
            return List.of(CatalogEntry.noMatch(query == null ? q : query, CatalogVocabulary.searchUrl(q)));
        }
        return results;
    }

    double score(CatalogEntry entry, String brand, String appliance, String category, Set<String> tokens) {
        double score = BASE_SCORE;
        if (brand != null && sameBrand(entry, brand)) {
            score += BRAND_WEIGHT;
        }
        if (appliance != null && lower(entry.getAppliance()).contains(appliance)) {
            score += APPLIANCE_WEIGHT;
        }
        if (category != null && lower(entry.getCategory()).contains(category)) {
            score += CATEGORY_WEIGHT;
        }
        String name = lower(entry.getName());
        String description = lower(entry.getDescription());
        for (String token : tokens) {
            if (name.contains(token)) {
                score += NAME_TOKEN_WEIGHT;
            }
            if (description.contains(token)) {
                score += DESCRIPTION_TOKEN_WEIGHT;
            }
        }
        if ("rack".equals(category) && name.contains("rack")) {
            score += RACK_NAME_BONUS;
        }
        return score;
    }

    /**
     * Searches with the hints folded into the query, then narrows the hits to those
     * matching every supplied hint. Falls back to the unfiltered hits rather than
     * returning nothing.
     */
    public List<CatalogEntry> findParts(String applianceHint, String brand, String category, String query) {
        String combined = Stream.of(query, brand, applianceHint, category)
                .filter(StringUtils::hasText)
                .collect(Collectors.joining(" "))
                .trim();
        List<CatalogEntry> results = search(combined.isEmpty() ? nullToEmpty(category) : combined);
        if (results.isEmpty() || results.get(0).isNoMatch()) {
            return results;
        }

        List<CatalogEntry> filtered = results.stream()
                .filter(p -> !StringUtils.hasText(applianceHint) || lower(p.getAppliance()).contains(lower(applianceHint)))
                .filter(p -> !StringUtils.hasText(brand) || sameBrand(p, brand))
                .filter(p -> !StringUtils.hasText(category) || lower(p.getCategory()).contains(lower(category)))
                .toList();
        return filtered.isEmpty() ? results : filtered;
    }

    public String installGuide(String part) {
        String partNumber = part == null ? "" : part.trim().toUpperCase(Locale.ROOT);
        if (partNumber.isEmpty()) {
            return "Please provide a part number (e.g., 'How to install WP2188656').";
        }
        CatalogEntry hit = exactMatch(partNumber);
        if (hit != null && StringUtils.hasText(hit.getInstallGuide())) {
            return hit.getInstallGuide();
        }
        String steps = hit != null && lower(hit.getCategory()).contains("rack") ? RACK_STEPS : GENERIC_STEPS;
        return "General guide for " + partNumber + ":\n" + steps
                + "\nFull instructions: " + CatalogVocabulary.installationUrl(partNumber);
    }

    public CompatibilityResult isCompatible(String part, String model) {
        String partNumber = part == null ? "" : part.trim().toUpperCase(Locale.ROOT);
        String modelNumber = model == null ? "" : model.trim().toUpperCase(Locale.ROOT);
        if (partNumber.isEmpty() || modelNumber.isEmpty()) {
            return new CompatibilityResult(false, "Please provide both a part number and a full model number.");
        }

        CatalogEntry hit = exactMatch(partNumber);
        if (hit != null && hit.getModels().stream().anyMatch(modelNumber::equalsIgnoreCase)) {
            return new CompatibilityResult(true, partNumber + " fits model " + modelNumber + ".");
        }

        String url = CatalogVocabulary.modelSearchUrl(modelNumber, partNumber);
        if (hit != null) {
            String brands = String.join(", ", hit.getBrands());
            return new CompatibilityResult(false, "Compatibility for " + modelNumber + " not confirmed locally (known brand(s): "
                    + (brands.isEmpty() ? "N/A" : brands) + "). Check: " + url
                    + "\nTip: model numbers are on the rating tag; include all suffix letters.");
        }
        return new CompatibilityResult(false, "I couldn't find " + partNumber + " locally. Verify here: " + url);
    }

    /**
     * Looks a code up as part number, manufacturer number or alias, then as a substring
     * of those fields and the name.
     */
    public CatalogEntry findByPartNumber(String code) {
        if (!StringUtils.hasText(code)) {
            return null;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (CatalogEntry entry : items) {
            if (normalized.equalsIgnoreCase(nullToEmpty(entry.getPartNumber()).trim())
                    || normalized.equalsIgnoreCase(nullToEmpty(entry.getManufacturerPart()).trim())
                    || entry.getAliases().stream().anyMatch(a -> normalized.equalsIgnoreCase(nullToEmpty(a).trim()))) {
                return entry;
            }
        }
        for (CatalogEntry entry : items) {
            String haystack = String.join(" ", nullToEmpty(entry.getPartNumber()), nullToEmpty(entry.getManufacturerPart()),
                    nullToEmpty(entry.getName())).toUpperCase(Locale.ROOT);
            if (haystack.contains(normalized)) {
                return entry;
            }
        }
        return null;
    }

    private CatalogEntry exactMatch(String partNumber) {
        return items.stream()
                .filter(p -> partNumber.equalsIgnoreCase(nullToEmpty(p.getPartNumber())))
                .findFirst()
                .orElse(null);
    }

    private static Set<String> deriveScopeKeywords(List<CatalogEntry> entries) {
        Set<String> keywords = new LinkedHashSet<>();
        for (CatalogEntry entry : entries) {
            if (StringUtils.hasText(entry.getPartNumber())) {
                keywords.add(lower(entry.getPartNumber()));
            }
            if (StringUtils.hasText(entry.getName())) {
                keywords.add(lower(entry.getName()));
            }
        }
        return Collections.unmodifiableSet(keywords);
    }

    /**
     * Whole-word brand comparison, so "ge" never matches "Generic".
     */
    static boolean sameBrand(CatalogEntry entry, String brand) {
        return lower(brand).equals(CatalogVocabulary.findBrand(entry.getBrand()));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record ScoredEntry(CatalogEntry entry, double score) {
    }
}
