package com.ai.commerce.conversation;

import com.ai.commerce.exception.InvalidStateException;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Per-conversation record carried through every pipeline stage of a turn and persisted at the end of it.
 * Serialized with snake_case keys; orchestration-only fields never reach storage.
 */
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class ConversationState {

    /** Keys produced by older pipeline versions for per-turn bookkeeping; dropped on read and write. */
    public static final Set<String> TRANSIENT_KEYS = Set.of(
            "needs_clarification",
            "clarification_reason",
            "clarification_metadata",
            "escalation_metadata",
            "routing_metadata",
            "routing_decision",
            "routing_confidence",
            "journey_transition_reason",
            "journey_transition_confidence",
            "journey_transition_metadata",
            "previous_journey",
            "governance_decision",
            "failed_stage"
    );

    private static final List<String> REQUIRED_KEYS = List.of("tenant_id", "conversation_id", "request_id");

    public static final String DEFAULT_TONE_STYLE = "friendly_concise";
    public static final int DEFAULT_CHATTINESS_LEVEL = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private String tenantId;
    private String conversationId;
    private String requestId;
    private String customerId;
    private String phone;

    private String tenantName;
    private String botName;
    private String toneStyle = DEFAULT_TONE_STYLE;
    private ResponseLanguage defaultLanguage = ResponseLanguage.EN;
    @Setter(AccessLevel.NONE)
    private List<ResponseLanguage> allowedLanguages =
            new ArrayList<>(List.of(ResponseLanguage.EN, ResponseLanguage.SW, ResponseLanguage.SHENG));
    private int maxChattinessLevel = DEFAULT_CHATTINESS_LEVEL;
    private String catalogLinkBase;

    private ResponseLanguage customerLanguagePref;
    private Boolean marketingOptIn;

    @Setter(AccessLevel.NONE)
    private Intent intent = Intent.UNKNOWN;
    @Setter(AccessLevel.NONE)
    private double intentConfidence;
    private Journey journey = Journey.UNKNOWN;
    @Setter(AccessLevel.NONE)
    private ResponseLanguage responseLanguage = ResponseLanguage.EN;
    @Setter(AccessLevel.NONE)
    private double languageConfidence;
    @Setter(AccessLevel.NONE)
    private GovernorClassification governorClassification = GovernorClassification.BUSINESS;
    @Setter(AccessLevel.NONE)
    private double governorConfidence;

    private String lastCatalogQuery;
    private Integer catalogTotalMatchesEstimate;
    private int catalogClarifications;
    private List<String> selectedItemIds = new ArrayList<>();
    private int shortlistRejections;

    @Setter(AccessLevel.NONE)
    private boolean escalationRequired;
    @Setter(AccessLevel.NONE)
    private String escalationReason;
    @Setter(AccessLevel.NONE)
    private String handoffTicketId;

    private int turnCount;
    private int casualTurns;
    private int spamTurns;
    private int clarificationRounds;

    private String incomingMessage;
    private String responseText;

    // Per-turn orchestration data, never persisted.
    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private RouteDecision routeDecision;

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private RouteDecision governanceDecision;

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private Journey previousJourney;

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private String failedStage;

    public ConversationState() {
    }

    public static ConversationState createInitial(String tenantId, String conversationId, String requestId) {
        ConversationState state = new ConversationState();
        state.tenantId = tenantId;
        state.conversationId = conversationId;
        state.requestId = requestId;
        state.validate();
        return state;
    }

    public void setAllowedLanguages(List<ResponseLanguage> allowedLanguages) {
        this.allowedLanguages = allowedLanguages == null ? null : new ArrayList<>(allowedLanguages);
    }

    public boolean isLanguageAllowed(ResponseLanguage language) {
        return language != null && allowedLanguages != null && allowedLanguages.contains(language);
    }

    public boolean needsClarification() {
        return routeDecision != null && routeDecision.isShouldClarify();
    }

    /**
     * Checks every invariant and fails on the first violation.
     *
     * @throws InvalidStateException naming the offending field
     */
    public void validate() {
        requireText("tenant_id", tenantId);
        requireText("conversation_id", conversationId);
        requireText("request_id", requestId);

        requirePresent("intent", intent);
        requirePresent("journey", journey);
        requirePresent("response_language", responseLanguage);
        requirePresent("governor_classification", governorClassification);
        requirePresent("default_language", defaultLanguage);

        requireConfidence("intent_confidence", intentConfidence);
        requireConfidence("language_confidence", languageConfidence);
        requireConfidence("governor_confidence", governorConfidence);

        if (maxChattinessLevel < 0 || maxChattinessLevel > 3) {
            throw new InvalidStateException("max_chattiness_level", "must be between 0 and 3, got " + maxChattinessLevel);
        }

        requireNonNegative("turn_count", turnCount);
        requireNonNegative("casual_turns", casualTurns);
        requireNonNegative("spam_turns", spamTurns);
        requireNonNegative("clarification_rounds", clarificationRounds);
        requireNonNegative("shortlist_rejections", shortlistRejections);
        requireNonNegative("catalog_clarifications", catalogClarifications);
        if (catalogTotalMatchesEstimate != null) {
            requireNonNegative("catalog_total_matches_estimate", catalogTotalMatchesEstimate);
        }

        if (allowedLanguages == null || allowedLanguages.isEmpty()) {
            throw new InvalidStateException("allowed_languages", "must list at least one language");
        }
        if (allowedLanguages.contains(null) || allowedLanguages.contains(ResponseLanguage.MIXED)) {
            throw new InvalidStateException("allowed_languages", "must contain only en, sw or sheng");
        }
        if (!allowedLanguages.contains(defaultLanguage)) {
            throw new InvalidStateException("default_language", defaultLanguage.getValue() + " is not an allowed language");
        }
        if (customerLanguagePref == ResponseLanguage.MIXED) {
            throw new InvalidStateException("customer_language_pref", "mixed cannot be a preference");
        }
    }

    public void updateIntent(Intent intent, double confidence) {
        requirePresent("intent", intent);
        requireConfidence("intent_confidence", confidence);
        this.intent = intent;
        this.intentConfidence = confidence;
    }

    public void updateLanguage(ResponseLanguage language, double confidence) {
        requirePresent("response_language", language);
        requireConfidence("language_confidence", confidence);
        this.responseLanguage = language;
        this.languageConfidence = confidence;
    }

    public void updateGovernor(GovernorClassification classification, double confidence) {
        requirePresent("governor_classification", classification);
        requireConfidence("governor_confidence", confidence);
        this.governorClassification = classification;
        this.governorConfidence = confidence;
    }

    /** Resets per-turn fields for the next inbound message. */
    public void beginTurn(String requestId, String message) {
        requireText("request_id", requestId);
        this.requestId = requestId;
        this.incomingMessage = message;
        this.responseText = null;
        this.previousJourney = journey;
        this.routeDecision = null;
        this.governanceDecision = null;
        this.failedStage = null;
    }

    public void incrementTurn() {
        turnCount++;
    }

    public void incrementCasualTurns() {
        casualTurns++;
    }

    public void incrementSpamTurns() {
        spamTurns++;
    }

    public void incrementClarificationRounds() {
        clarificationRounds++;
    }

    public void resetClarificationRounds() {
        clarificationRounds = 0;
    }

    public void incrementShortlistRejections() {
        shortlistRejections++;
    }

    public void resetShortlistRejections() {
        shortlistRejections = 0;
    }

    public void incrementCatalogClarifications() {
        catalogClarifications++;
    }

    public void setEscalation(String reason, String ticketId) {
        this.escalationRequired = true;
        this.escalationReason = reason;
        if (ticketId != null) {
            this.handoffTicketId = ticketId;
        }
    }

    public void clearEscalation() {
        this.escalationRequired = false;
        this.escalationReason = null;
        this.handoffTicketId = null;
    }

    public String toJson() {
        validate();
        ObjectNode node = MAPPER.valueToTree(this);
        TRANSIENT_KEYS.forEach(node::remove);
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize conversation " + conversationId, e);
        }
    }

    /**
     * Reads a stored state. Transient keys are dropped; missing ids, unknown enum values and
     * out-of-range numbers are rejected.
     */
    public static ConversationState fromJson(String json) {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidStateException("$", "payload is not valid JSON", e);
        }
        if (tree == null || !tree.isObject()) {
            throw new InvalidStateException("$", "payload must be a JSON object");
        }
        ObjectNode node = (ObjectNode) tree;
        TRANSIENT_KEYS.forEach(node::remove);
        for (String key : REQUIRED_KEYS) {
            if (!node.hasNonNull(key) || StringUtils.isBlank(node.get(key).asText())) {
                throw new InvalidStateException(key, "is required");
            }
        }

        ConversationState state;
        try {
            state = MAPPER.treeToValue(node, ConversationState.class);
        } catch (JsonProcessingException e) {
            throw new InvalidStateException(fieldOf(e), e.getOriginalMessage(), e);
        }
        state.validate();
        return state;
    }

    private static String fieldOf(JsonProcessingException e) {
        if (e instanceof JsonMappingException) {
            List<JsonMappingException.Reference> path = ((JsonMappingException) e).getPath();
            if (!path.isEmpty() && path.get(0).getFieldName() != null) {
                return path.get(0).getFieldName();
            }
        }
        return "$";
    }

    private static void requireText(String field, String value) {
        if (StringUtils.isBlank(value)) {
            throw new InvalidStateException(field, "is required");
        }
    }

    private static void requirePresent(String field, Object value) {
        if (value == null) {
            throw new InvalidStateException(field, "must not be null");
        }
    }

    private static void requireConfidence(String field, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidStateException(field, "must be within [0, 1], got " + value);
        }
    }

    private static void requireNonNegative(String field, int value) {
        if (value < 0) {
            throw new InvalidStateException(field, "must not be negative, got " + value);
        }
    }
}
