package com.partselect.assistant.service;

import org.springframework.util.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Closed vocabularies shared by catalog loading and catalog search: brands,
 * appliance kinds, and the category keyword clusters.
 */
public final class CatalogVocabulary {

    public static final String DISHWASHER = "dishwasher";
    public static final String REFRIGERATOR = "refrigerator";
    public static final String OTHER_APPLIANCE = "other";
    public static final String GENERAL_CATEGORY = "general";

    public static final List<String> BRANDS = List.of(
            "whirlpool", "maytag", "ge", "frigidaire", "samsung", "lg", "bosch", "kitchenaid", "amana", "kenmore"
    );

    /** Catalog-style part numbers, broader than the conversational part pattern. */
    public static final Pattern CATALOG_PART_PATTERN = Pattern.compile("\\b[A-Z]{1,3}\\d{4,8}[A-Z]?\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern BRAND_PATTERN =
            Pattern.compile("\\b(" + String.join("|", BRANDS) + ")\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOKEN_PATTERN = Pattern.compile("[a-z0-9\\-]+");

    /** Insertion order is the tie-break order when two clusters hit equally often. */
    public static final Map<String, Set<String>> CATEGORY_KEYS;

    static {
        Map<String, Set<String>> keys = new LinkedHashMap<>();
        keys.put("rack", orderedSet("rack", "dishrack", "upper", "lower", "basket", "silverware", "cutlery",
                "adjuster", "roller", "track", "clip", "drawer", "tray"));
        keys.put("pump", orderedSet("pump", "drain", "wash", "circulation"));
        keys.put("filter", orderedSet("filter"));
        keys.put("hose", orderedSet("hose", "inlet", "drain", "line"));
        keys.put("valve", orderedSet("valve", "inlet", "water"));
        keys.put("door", orderedSet("door", "gasket", "seal", "latch", "hinge"));
        keys.put("tray", orderedSet("tray", "shelf", "bin", "drawer", "crisper"));
        keys.put("ice", orderedSet("ice", "icemaker", "ice-maker", "auger", "bucket"));
        CATEGORY_KEYS = Collections.unmodifiableMap(keys);
    }

    private CatalogVocabulary() {
    }

    public static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(lower(text));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /**
     * @return the first known brand named as a whole word, lower-cased, or null
     */
    public static String findBrand(String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        Matcher matcher = BRAND_PATTERN.matcher(text);
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
    }

    public static String guessAppliance(String text, String defaultValue) {
        String lowered = lower(text);
        if (lowered.contains("dishwasher") || lowered.contains("dish washer")) {
            return DISHWASHER;
        }
        if (lowered.contains("refrigerator") || lowered.contains("fridge") || lowered.contains("freezer")) {
            return REFRIGERATOR;
        }
        return defaultValue;
    }

    /**
     * Picks the category cluster with the most keyword hits; the earlier cluster wins ties.
     */
    public static String guessCategory(String text) {
        String lowered = lower(text);
        if (lowered.isEmpty()) {
            return null;
        }
        String best = null;
        int bestHits = 0;
        for (Map.Entry<String, Set<String>> cluster : CATEGORY_KEYS.entrySet()) {
            int hits = 0;
            for (String keyword : cluster.getValue()) {
                if (lowered.contains(keyword)) {
                    hits++;
                }
            }
            if (hits > bestHits) {
                best = cluster.getKey();
                bestHits = hits;
            }
        }
        return best;
    }

    public static String capitalize(String value) {
        if (!StringUtils.hasText(value)) {
            return "";
        }
        String lowered = value.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lowered.charAt(0)) + lowered.substring(1);
    }

    public static String searchUrl(String term) {
        return "https://www.partselect.com/Search.aspx?SearchTerm=" + encode(term);
    }

    public static String modelSearchUrl(String model, String part) {
        return "https://www.partselect.com/ModelSearch.aspx?SearchTerm=" + encode(model) + "+" + encode(part);
    }

    public static String installationUrl(String part) {
        return "https://www.partselect.com/Installation/" + encode(part) + ".htm";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value.trim(), StandardCharsets.UTF_8);
    }

    private static Set<String> orderedSet(String... values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(values)));
    }
}
