package com.partselect.assistant.service;

import com.partselect.assistant.dto.ChatRequest;
import com.partselect.assistant.dto.ChatResponse;
import com.partselect.assistant.model.CatalogEntry;
import com.partselect.assistant.model.CompatibilityResult;
import com.partselect.assistant.model.ConversationTurn;
import com.partselect.assistant.model.Entities;
import com.partselect.assistant.model.GuardDecision;
import com.partselect.assistant.model.IntentResult;
import com.partselect.assistant.model.IntentType;
import com.partselect.assistant.model.PartSearchOutcome;
import com.partselect.assistant.model.SessionSnapshot;
import com.partselect.assistant.model.SessionUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Runs one chat turn through the fallback chain: refusal marker, appliance guard,
 * keyword-triggered part search, installation guide, compatibility check and
 * finally retrieval plus the language model. The first stage that answers ends the turn.
 */
@Service
public class DialogueRouterService {

    private static final Logger logger = LoggerFactory.getLogger(DialogueRouterService.class);

    static final String DEFAULT_APPLIANCE = CatalogVocabulary.DISHWASHER;
    static final int FALLBACK_DOCS = 6;
    static final int LISTED_PARTS = 5;
    static final String EMPTY_REPLY = "(LLM returned no content.)";
    static final String LLM_UNAVAILABLE = "LLM unavailable.";

    /** Any of these (substring match) forces the part search stage, whatever the classified intent. */
    static final List<String> PART_SEARCH_TRIGGERS = List.of(
            "show me", "find", "replacement", "rack", "pump", "valve", "filter",
            "tray", "basket", "drawer", "bin", "door", "crisper", "shelf", "track", "roller", "adjuster"
    );

    /** First entry contained in the message wins. */
    static final List<String> PART_SEARCH_CATEGORIES = List.of(
            "rack", "pump", "filter", "hose", "tray", "door", "handle",
            "drawer", "basket", "bin", "valve", "crisper", "shelf", "track", "roller", "adjuster"
    );

    private static final Pattern BRAND_HINT =
            Pattern.compile("\\b(" + String.join("|", CatalogVocabulary.BRANDS) + ")\\b", Pattern.CASE_INSENSITIVE);

    private static final Set<String> NULLISH_REPLIES = Set.of("none", "null", "nan");

    private final SessionMemoryService sessionMemory;
    private final ConversationHistoryService conversationHistory;
    private final ApplianceGuardService applianceGuard;
    private final ScopeGuardService scopeGuard;
    private final EntityExtractionService entityExtraction;
    private final IntentClassificationService intentClassification;
    private final CatalogSearchService catalogSearch;
    private final KnowledgeRetrievalService knowledgeRetrieval;
    private final BedrockAnswerService answerService;

    public DialogueRouterService(SessionMemoryService sessionMemory,
                                 ConversationHistoryService conversationHistory,
                                 ApplianceGuardService applianceGuard,
                                 ScopeGuardService scopeGuard,
                                 EntityExtractionService entityExtraction,
                                 IntentClassificationService intentClassification,
                                 CatalogSearchService catalogSearch,
                                 KnowledgeRetrievalService knowledgeRetrieval,
                                 BedrockAnswerService answerService) {
        this.sessionMemory = sessionMemory;
        this.conversationHistory = conversationHistory;
        this.applianceGuard = applianceGuard;
        this.scopeGuard = scopeGuard;
        this.entityExtraction = entityExtraction;
        this.intentClassification = intentClassification;
        this.catalogSearch = catalogSearch;
        this.knowledgeRetrieval = knowledgeRetrieval;
        this.answerService = answerService;
    }

    public ChatResponse handleTurn(ChatRequest request, String sessionId) {
        String q = request.getMessage() == null ? "" : request.getMessage().trim();
        String current = StringUtils.hasText(request.getAppliance())
                ? request.getAppliance().trim().toLowerCase(Locale.ROOT)
                : DEFAULT_APPLIANCE;
        logger.info("=== New chat turn [{}] === appliance={} query='{}'", sessionId, current, q);

        conversationHistory.append(sessionId, ConversationTurn.user(q));
        SessionSnapshot memory = sessionMemory.get(sessionId);

        GuardDecision decision = applianceGuard.evaluate(q, current, memory);
        if (decision.outcome() == GuardDecision.Outcome.REFUSAL_ACK) {
            SessionSnapshot updated = sessionMemory.update(sessionId, SessionUpdate.create().lastSwitchRefusedFor(current));
            return respond(applianceGuard.acknowledgement(current), IntentType.ACK_REFUSE, updated);
        }
        if (decision.outcome() == GuardDecision.Outcome.SWITCH_SUGGESTION) {
            return respond(applianceGuard.switchSuggestion(decision.otherAppliance()), IntentType.SWITCH_SUGGESTION, memory);
        }
        String stayNote = decision.proceedsSilently() ? applianceGuard.stayNote(decision.otherAppliance()) : "";

        if (!scopeGuard.isInScope(q, current)) {
            logger.info("Question outside the current context; continuing anyway.");
        }

        Entities entities = entityExtraction.extract(q)
                .orElse(request.getPart(), request.getModel())
                .orElse(memory.lastPart(), memory.lastModel());
        entities = new Entities(canonicalPart(entities.part()), entities.model());
        logger.info("Extracted entities: part={} model={}", entities.part(), entities.model());

        IntentResult intent = intentClassification.classify(q);
        IntentType type = intent.type();
        logger.info("Intent classified as '{}' (confidence={})", type, String.format(Locale.ROOT, "%.2f", intent.confidence()));

        if (containsAny(q.toLowerCase(Locale.ROOT), PART_SEARCH_TRIGGERS)) {
            type = IntentType.PART_SEARCH;
            PartSearchOutcome outcome = searchParts(q, current, decision, stayNote);
            if (outcome.isTerminal()) {
                return respond(outcome.response(), IntentType.PART_SEARCH, sessionMemory.get(sessionId));
            }
        }

        if (type == IntentType.INSTALLATION) {
            String guide = catalogSearch.installGuide(entities.part());
            SessionUpdate update = SessionUpdate.create().lastIntent(IntentType.INSTALLATION);
            if (entities.hasPart()) {
                update.lastPart(entities.part());
            }
            return respond(guide + stayNote, IntentType.INSTALLATION, sessionMemory.update(sessionId, update));
        }

        if (type == IntentType.COMPATIBILITY && entities.hasPart() && entities.hasModel()) {
            CompatibilityResult result = catalogSearch.isCompatible(entities.part(), entities.model());
            SessionSnapshot updated = sessionMemory.update(sessionId, SessionUpdate.create()
                    .lastPart(entities.part())
                    .lastModel(entities.model())
                    .lastIntent(IntentType.COMPATIBILITY));
            return respond(result.message() + stayNote, IntentType.COMPATIBILITY, updated);
        }

        logger.info("Falling back to knowledge retrieval for intent: {}", type);
        List<String> docs = knowledgeRetrieval.search(q, current, FALLBACK_DOCS);
        String prompt = knowledgeRetrieval.buildPrompt(q, docs, conversationHistory.recent(sessionId), current);
        String reply = answerService.isAvailable() ? neverEmpty(answerService.answer(prompt)) : LLM_UNAVAILABLE;
        conversationHistory.append(sessionId, ConversationTurn.assistant(reply));
        SessionSnapshot updated = sessionMemory.update(sessionId, SessionUpdate.create().lastIntent(type));
        return respond(reply + stayNote, type, updated);
    }

    /**
     * Keyword-triggered catalog search. Unexpected errors come back as {@link PartSearchOutcome.Status#FAILED}
     * so the turn can continue with the next stage.
     */
    PartSearchOutcome searchParts(String q, String current, GuardDecision decision, String stayNote) {
        try {
            Matcher brandMatcher = BRAND_HINT.matcher(q);
            String brand = brandMatcher.find() ? brandMatcher.group(1) : null;
            String lowered = q.toLowerCase(Locale.ROOT);
            String category = PART_SEARCH_CATEGORIES.stream().filter(lowered::contains).findFirst().orElse(null);
            String applianceHint = decision.applianceHint();

            List<CatalogEntry> results = catalogSearch.findParts(applianceHint, brand, category, q);
            if (!results.isEmpty() && !results.get(0).isNoMatch()) {
                String response = "Here are some " + (category != null ? category : "relevant") + " parts I found for "
                        + (brand != null ? brand : titleCase(applianceHint)) + ":" + stayNote + "\n" + formatPartList(results);
                return PartSearchOutcome.found(response);
            }

            String fallbackUrl = results.isEmpty() ? null : results.get(0).getOfficialURL();
            String link = StringUtils.hasText(fallbackUrl) ? "\nTry the official catalog: " + fallbackUrl : "";
            return PartSearchOutcome.noMatch("I couldn’t find specific " + (category != null ? category : "replacement")
                    + " parts locally for " + (brand != null ? brand : "this brand") + " " + current + "." + stayNote + link);
        } catch (RuntimeException e) {
            logger.warn("Part search failed, continuing with the next stage: {}", e.getMessage(), e);
            return PartSearchOutcome.failed();
        }
    }

    /**
     * Maps a manufacturer number or alias onto the catalog part number. Unknown codes are kept as given.
     */
    String canonicalPart(String part) {
        if (!StringUtils.hasText(part)) {
            return part;
        }
        CatalogEntry hit = catalogSearch.findByPartNumber(part);
        if (hit == null || !StringUtils.hasText(hit.getPartNumber()) || hit.getPartNumber().equalsIgnoreCase(part)) {
            return part;
        }
        logger.info("Resolved '{}' to catalog part {}", part, hit.getPartNumber());
        return hit.getPartNumber().toUpperCase(Locale.ROOT);
    }

    static String formatPartList(List<CatalogEntry> parts) {
        return parts.stream()
                .limit(LISTED_PARTS)
                .map(p -> "• " + orDefault(p.getPartNumber(), "Unknown") + " – " + orDefault(p.getName(), "Unnamed")
                        + " (" + CatalogVocabulary.capitalize(p.getAppliance()) + ", " + orDefault(p.getBrand(), "") + ")")
                .collect(Collectors.joining("\n"));
    }

    /**
     * Null, blank and the literal strings none/null/nan all count as no answer.
     */
    static String neverEmpty(String text) {
        if (text == null) {
            return EMPTY_REPLY;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || NULLISH_REPLIES.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return EMPTY_REPLY;
        }
        return trimmed;
    }

    private static ChatResponse respond(String response, IntentType intent, SessionSnapshot memory) {
        return new ChatResponse(response, intent.label(), memory);
    }

    private static boolean containsAny(String text, List<String> cues) {
        return cues.stream().anyMatch(text::contains);
    }

    private static String titleCase(String value) {
        return CatalogVocabulary.capitalize(value);
    }

    private static String orDefault(String value, String fallback) {
        return StringUtils.hasText(value) ? value : fallback;
    }
}
