package com.partselect.assistant.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Soft topic check. A negative answer is only logged; the turn continues either way.
 */
@Service
public class ScopeGuardService {

    private static final Logger logger = LoggerFactory.getLogger(ScopeGuardService.class);

    static final Set<String> OUT_OF_SCOPE_KEYWORDS = Set.of("car", "auto", "truck", "boat", "computer", "phone", "tv");

    static final Set<String> CORE_KEYWORDS = Set.of(
            "part", "parts", "model", "number", "serial", "replacement", "repair",
            "fix", "broken", "install", "installation", "guide", "steps",
            "compatible", "fit", "compatibility", "buy", "order", "find",
            "partselect", "oem"
    );

    static final Set<String> APPLIANCE_KEYWORDS = Set.of(
            "appliance", "appliances",
            "dishwasher", "dish", "washer",
            "refrigerator", "fridge", "freezer", "ice", "icemaker"
    );

    private final Set<String> inScopeKeywords;

    public ScopeGuardService(CatalogSearchService catalogSearchService) {
        Set<String> keywords = new HashSet<>(CORE_KEYWORDS);
        keywords.addAll(APPLIANCE_KEYWORDS);
        keywords.addAll(IntentClassificationService.PART_NAME_VOCABULARY);
        keywords.addAll(catalogSearchService.scopeKeywords());
        keywords.remove("");
        this.inScopeKeywords = Set.copyOf(keywords);
        logger.info("Scope guard extended with {} catalog keywords.", catalogSearchService.scopeKeywords().size());
    }

    public boolean isInScope(String query, String applianceContext) {
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        if (containsAny(q, OUT_OF_SCOPE_KEYWORDS)) {
            logger.warn("Query '{}' flagged as out-of-scope (out-of-scope keyword).", q);
            return false;
        }
        if (containsAny(q, contextKeywords(applianceContext)) || containsAny(q, inScopeKeywords)) {
            return true;
        }
        logger.warn("Query '{}' flagged as out-of-scope (no keywords matched).", q);
        return false;
    }

    static Set<String> contextKeywords(String applianceContext) {
        String context = applianceContext == null ? "" : applianceContext.toLowerCase(Locale.ROOT);
        Set<String> keywords = new HashSet<>(List.of("part", "parts", "model"));
        if (!context.isEmpty()) {
            keywords.add(context);
        }
        if (CatalogVocabulary.DISHWASHER.equals(context)) {
            keywords.addAll(List.of("dishwasher", "dish", "rack", "pump"));
        } else if (CatalogVocabulary.REFRIGERATOR.equals(context)) {
            keywords.addAll(List.of("refrigerator", "fridge", "filter", "ice", "drawer", "bin"));
        }
        return keywords;
    }

    // substring containment: "car" also hits "card"
    private static boolean containsAny(String text, Set<String> words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
