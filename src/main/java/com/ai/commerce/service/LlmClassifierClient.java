package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.GovernanceResult;
import com.ai.commerce.conversation.IntentResult;
import com.ai.commerce.conversation.LanguageResult;
import com.ai.commerce.exception.ClassifierFailureException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured intent, language and governance classification over OpenAI Chat Completions.
 * Every reply is parsed into its result type here or rejected with {@link ClassifierFailureException}.
 */
@Service
public class LlmClassifierClient {

    private static final Logger log = LoggerFactory.getLogger(LlmClassifierClient.class);

    private static final String INTENT_PROMPT =
            "You classify customer messages for a commerce chat assistant.\n"
            + "Intents: sales_discovery, product_question, support_question, order_status, discounts_offers, "
            + "preferences_consent, payment_help, human_request, spam_casual, unknown.\n"
            + "Reply with JSON only: {\"intent\": string, \"confidence\": 0.0-1.0, \"notes\": string (max 100 chars)}.\n"
            + "Use confidence >= 0.70 only when the intent is clear; 0.50-0.69 when it is plausible but ambiguous.";

    private static final String LANGUAGE_PROMPT =
            "Detect the language a customer wrote in. Options: en, sw (Swahili), sheng (Kenyan Sheng), "
            + "mixed (code-switching).\n"
            + "Explicit requests such as \"speak Swahili\" or \"in English please\" decide with high confidence.\n"
            + "Reply with JSON only: {\"response_language\": string, \"confidence\": 0.0-1.0, "
            + "\"should_ask_language_question\": boolean}.";

    private static final String GOVERNANCE_PROMPT =
            "Tag a customer message for a commerce assistant as business, casual, spam or abuse.\n"
            + "business: shopping, orders, payments, support, preferences. casual: greetings and small talk. "
            + "spam: tests, gibberish, repeated characters. abuse: insults, threats, profanity.\n"
            + "Reply with JSON only: {\"classification\": string, \"confidence\": 0.0-1.0, "
            + "\"recommended_action\": \"proceed\"|\"redirect\"|\"limit\"|\"stop\"|\"handoff\"}.";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiKey;
    private final String model;
    private final String baseUrl;

    public LlmClassifierClient(RestTemplateBuilder builder,
                               @Value("${openai.api-key:}") String apiKey,
                               @Value("${openai.model:gpt-4o-mini}") String model,
                               @Value("${openai.base-url:https://api.openai.com/v1}") String baseUrl,
                               @Value("${openai.timeout-seconds:10}") long timeoutSeconds) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        this.apiKey = apiKey;
        this.model = model;
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
    }

    public IntentResult classifyIntent(String message, ConversationState state) {
        String context = "Previous intent: " + state.getIntent().getValue()
                + "\nTurn: " + state.getTurnCount()
                + "\nMessage: " + StringUtils.defaultString(message);
        JsonNode reply = complete(INTENT_PROMPT, context, 150);
        requireFields(reply, "intent", "confidence");
        return IntentResult.sanitized(reply.path("intent").asText(), reply.path("confidence").asDouble(),
                reply.path("notes").asText(null));
    }

    public LanguageResult classifyLanguage(String message, ConversationState state) {
        String context = "Current language: " + state.getResponseLanguage().getValue()
                + "\nMessage: " + StringUtils.defaultString(message);
        JsonNode reply = complete(LANGUAGE_PROMPT, context, 100);
        requireFields(reply, "response_language", "confidence");
        return LanguageResult.sanitized(reply.path("response_language").asText(), reply.path("confidence").asDouble(),
                reply.path("should_ask_language_question").asBoolean(false));
    }

    public GovernanceResult classifyGovernance(String message, ConversationState state) {
        String context = "Casual turns so far: " + state.getCasualTurns()
                + "\nSpam turns so far: " + state.getSpamTurns()
                + "\nMessage: " + StringUtils.defaultString(message);
        JsonNode reply = complete(GOVERNANCE_PROMPT, context, 100);
        requireFields(reply, "classification", "confidence");
        return GovernanceResult.sanitized(reply.path("classification").asText(), reply.path("confidence").asDouble(),
                reply.path("recommended_action").asText(null));
    }

    private JsonNode complete(String systemPrompt, String userContent, int maxTokens) {
        if (StringUtils.isBlank(apiKey)) {
            throw new ClassifierFailureException("OpenAI API key is not configured", false);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", 0.1);
        body.put("max_tokens", maxTokens);
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userContent)));

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(baseUrl + "/chat/completions", new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException ex) {
            throw new ClassifierFailureException("Classifier call failed: " + ex.getMessage(), false, ex);
        }

        try {
            JsonNode root = mapper.readTree(response.getBody());
            String content = root.path("choices").path(0).path("message").path("content").asText("").trim();
            if (content.isEmpty()) {
                throw new ClassifierFailureException("Classifier returned an empty reply", true);
            }
            JsonNode parsed = mapper.readTree(content);
            if (!parsed.isObject()) {
                throw new ClassifierFailureException("Classifier reply is not a JSON object", true);
            }
            return parsed;
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.debug("Unparseable classifier reply: {}", response.getBody());
            throw new ClassifierFailureException("Classifier reply is not valid JSON", true, ex);
        }
    }

    private static void requireFields(JsonNode reply, String... fields) {
        for (String field : fields) {
            if (!reply.hasNonNull(field)) {
                throw new ClassifierFailureException("Classifier reply is missing " + field, true);
            }
        }
    }
}
