package com.ai.commerce.service;

import com.ai.commerce.conversation.Intent;
import com.ai.commerce.conversation.IntentJourneyTable;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.conversation.RouteDecision;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Confidence-threshold routing of intent to journey. A pure function of intent and confidence.
 */
@Service
public class IntentRouter {

    public static final double HIGH_CONFIDENCE = 0.70;
    public static final double MEDIUM_CONFIDENCE = 0.50;

    public RouteDecision route(Intent intent, double confidence) {
        Journey mapped = IntentJourneyTable.journeyFor(intent);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(RouteDecision.INTENT, intent.getValue());

        if (confidence >= HIGH_CONFIDENCE) {
            metadata.put(RouteDecision.ROUTING_THRESHOLD, "high_confidence");
            metadata.put(RouteDecision.THRESHOLD_MET, true);
            return RouteDecision.of(mapped,
                    "High confidence intent " + intent.getValue() + " routed to " + mapped.getValue(),
                    confidence, false, metadata);
        }

        if (confidence >= MEDIUM_CONFIDENCE) {
            // suggestion only, the journey is not committed until the customer confirms
            metadata.put(RouteDecision.ROUTING_THRESHOLD, "medium_confidence");
            metadata.put(RouteDecision.THRESHOLD_MET, false);
            metadata.put(RouteDecision.SUGGESTED_JOURNEY, mapped.getValue());
            metadata.put(RouteDecision.NEEDS_CLARIFICATION, true);
            metadata.put(RouteDecision.CLARIFICATION_TYPE, "intent_disambiguation");
            return RouteDecision.of(Journey.UNKNOWN,
                    "Medium confidence intent " + intent.getValue() + ", asking to clarify",
                    confidence, true, metadata);
        }

        metadata.put(RouteDecision.ROUTING_THRESHOLD, "low_confidence");
        metadata.put(RouteDecision.THRESHOLD_MET, false);
        return RouteDecision.of(Journey.UNKNOWN,
                "Low confidence intent " + intent.getValue(), confidence, false, metadata);
    }
}
