package com.partselect.assistant.service;

import com.partselect.assistant.model.ConversationTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Weighted keyword retrieval over the knowledge corpus, with a Jaccard fallback,
 * and assembly of the prompt sent to the language model.
 */
@Service
public class KnowledgeRetrievalService {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeRetrievalService.class);

    public static final String NO_CONTEXT = "(No context available.)";

    static final double CONTEXT_WEIGHT = 5.0;
    static final double DEFAULT_WEIGHT = 1.0;
    static final double MIN_SIMILARITY = 0.05;
    static final int PROMPT_DOCS = 3;
    static final int PROMPT_HISTORY = 8;

    static final Map<String, Double> TERM_WEIGHTS = Map.ofEntries(
            Map.entry("dishwasher", 3.0),
            Map.entry("refrigerator", 3.0),
            Map.entry("rack", 1.8),
            Map.entry("filter", 1.8),
            Map.entry("drawer", 1.8),
            Map.entry("bin", 1.8),
            Map.entry("ice maker", 2.0),
            Map.entry("pump", 1.5),
            Map.entry("hose", 1.2),
            Map.entry("basket", 1.2),
            Map.entry("whirlpool", 2.5),
            Map.entry("kenmore", 2.5),
            Map.entry("maytag", 2.5),
            Map.entry("lg", 2.5)
    );

    private static final String TEMPLATE_LOCATION = "prompts/assistant_prompt.txt";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

    private static final String FALLBACK_TEMPLATE = """
            # Role
            You are a friendly and expert appliance repair assistant for PartSelect.
            You are currently helping a customer with their {appliance_upper}.

            # Rules
            - Only answer about the user's {appliance_upper} and its parts.
            - When listing parts, always include the part number (e.g., PS11752778).
            - For any installation or repair, always include a safety warning: unplug the appliance and shut off the water supply first.

            # Detected Intent: {intent}

            # Conversation History
            {history}

            # Context (retrieved from parts database)
            {context}

            # User Query
            {query}
            """;

    private final List<String> docs;
    private final String promptTemplate;

    @Autowired
    public KnowledgeRetrievalService(KnowledgeBaseLoader knowledgeBaseLoader, CatalogSearchService catalogSearchService) {
        this(knowledgeBaseLoader.load(catalogSearchService.entries()), loadPromptTemplate());
    }

    public KnowledgeRetrievalService(List<String> docs, String promptTemplate) {
        this.docs = docs == null ? List.of() : List.copyOf(docs);
        this.promptTemplate = StringUtils.hasText(promptTemplate) ? promptTemplate : FALLBACK_TEMPLATE;
        logger.info("KnowledgeRetrievalService initialized with {} docs.", this.docs.size());
    }

    public int size() {
        return docs.size();
    }

    /**
     * Scores every document by term occurrence counts times term weight. The appliance
     * context is appended as an extra term weighted {@value #CONTEXT_WEIGHT}.
     *
     * @return at most {@code k} documents, or a single {@link #NO_CONTEXT} sentinel
     */
    public List<String> search(String query, String applianceContext, int k) {
        if (docs.isEmpty()) {
            logger.warn("Knowledge search requested but no documents are loaded.");
            return List.of(NO_CONTEXT);
        }
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<String> terms = new ArrayList<>(whitespaceTokens(q));
        String context = applianceContext == null ? "" : applianceContext.trim().toLowerCase(Locale.ROOT);
        if (!context.isEmpty()) {
            terms.add(context);
        }

        List<Scored> scored = new ArrayList<>();
        for (String doc : docs) {
            String lowered = doc.toLowerCase(Locale.ROOT);
            double score = 0;
            for (String term : terms) {
                double weight = term.equals(context) ? CONTEXT_WEIGHT : TERM_WEIGHTS.getOrDefault(term, DEFAULT_WEIGHT);
                score += countOccurrences(lowered, term) * weight;
            }
            if (score > 0) {
                scored.add(new Scored(doc, score));
            }
        }
        List<String> top;
        if (scored.isEmpty()) {
            top = similarDocuments(q, k);
        } else {
            scored.sort(Comparator.comparingDouble(Scored::score).reversed());
            top = scored.stream().limit(Math.max(k, 0)).map(Scored::doc).toList();
        }
        logger.info("Retrieved {} relevant docs for query '{}'", top.size(), abbreviate(q));
        return top.isEmpty() ? List.of(NO_CONTEXT) : top;
    }

    /**
     * Coarser intent used only to annotate the prompt.
     */
    public String classifyPromptIntent(String query) {
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        if (containsAny(q, "compatible", "fit", "works with")) {
            return "compatibility";
        }
        if (containsAny(q, "how to", "replace", "install", "fix", "repair", "broken")) {
            return "repair_guide";
        }
        if (containsAny(q, "rack", "filter", "pump", "hose", "basket", "drawer", "bin", "ice maker")) {
            return "part_lookup";
        }
        if (containsAny(q, "clean", "maintain", "how often", "smell")) {
            return "maintenance";
        }
        return "general_help";
    }

    public String buildPrompt(String query, List<String> retrieved, List<ConversationTurn> history, String appliance) {
        String applianceName = StringUtils.hasText(appliance) ? appliance.trim() : "appliance";
        String context = retrieved == null || retrieved.isEmpty()
                ? NO_CONTEXT
                : String.join("\n\n", retrieved.subList(0, Math.min(PROMPT_DOCS, retrieved.size())));

        List<ConversationTurn> turns = history == null ? List.of() : history;
        String historyText = turns.subList(Math.max(0, turns.size() - PROMPT_HISTORY), turns.size()).stream()
                .map(t -> t.role() + ": " + t.content())
                .collect(Collectors.joining("\n"));

        Map<String, String> values = new HashMap<>();
        values.put("appliance", applianceName);
        values.put("appliance_upper", applianceName.toUpperCase(Locale.ROOT));
        values.put("intent", classifyPromptIntent(query));
        values.put("history", historyText);
        values.put("context", context);
        values.put("query", query == null ? "" : query);
        return render(promptTemplate, values);
    }

    // Single pass, so substituted text is never re-scanned for placeholders
    static String render(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    static int countOccurrences(String haystack, String needle) {
        if (needle.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = 0;
        while ((from = haystack.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }

    /**
     * Jaccard similarity over whitespace token sets; keeps documents above {@value #MIN_SIMILARITY}.
     */
    List<String> similarDocuments(String query, int k) {
        Set<String> querySet = new HashSet<>(whitespaceTokens(query == null ? "" : query.toLowerCase(Locale.ROOT)));
        List<Scored> scored = new ArrayList<>();
        for (String doc : docs) {
            Set<String> docSet = new HashSet<>(whitespaceTokens(doc.toLowerCase(Locale.ROOT)));
            Set<String> union = new HashSet<>(querySet);
            union.addAll(docSet);
            if (union.isEmpty()) {
                continue;
            }
            Set<String> intersection = new HashSet<>(querySet);
            intersection.retainAll(docSet);
            double similarity = (double) intersection.size() / union.size();
            if (similarity > MIN_SIMILARITY) {
                scored.add(new Scored(doc, similarity));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        return scored.stream().limit(Math.max(k, 0)).map(Scored::doc).toList();
    }

    private static List<String> whitespaceTokens(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
    }

    private static boolean containsAny(String text, String... cues) {
        for (String cue : cues) {
            if (text.contains(cue)) {
                return true;
            }
        }
        return false;
    }

    private static String abbreviate(String text) {
        return text.length() <= 40 ? text : text.substring(0, 40) + "...";
    }

    private static String loadPromptTemplate() {
        ClassPathResource resource = new ClassPathResource(TEMPLATE_LOCATION);
        if (!resource.exists()) {
            logger.warn("Prompt template {} not found; using built-in template.", TEMPLATE_LOCATION);
            return FALLBACK_TEMPLATE;
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Failed to read prompt template {}: {}", TEMPLATE_LOCATION, e.getMessage());
            return FALLBACK_TEMPLATE;
        }
    }

    private record Scored(String doc, double score) {
    }
}
