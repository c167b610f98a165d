package com.ai.commerce.service;

import com.ai.commerce.conversation.ConversationState;
import com.ai.commerce.conversation.EscalationTrigger;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.conversation.RouteDecision;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Priority-ordered escalation rules, first match wins. Runs before intent routing and overrides it.
 * Order: already flagged, explicit human request, payment dispute, sensitive content, frustration.
 */
@Service
public class EscalationDetector {

    public static final int FRUSTRATION_MIN_TURNS = 3;

    private static final Pattern HUMAN_REQUEST = Pattern.compile(
            "\\b(agents?|human|person|call me|speak to (someone|somebody)|representative|manager|supervisor|real person|customer service|support agent|live chat|connect me|transfer me|escalate)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PAYMENT_DISPUTE = Pattern.compile(
            "\\b(i paid but|already paid|charged twice|wrong amount|refund|chargeback|dispute|fraud|unauthori[sz]ed|delivery problem|never received|damaged|broken on arrival|wrong item|defective|not working|poor quality|missing parts|late delivery|delayed shipment|lost package|stolen package|return policy|warranty claim|money back|cancel order)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SENSITIVE = Pattern.compile(
            "\\b(legal|lawyer|attorney|court|sue|lawsuit|medical|doctor|hospital|emergency|urgent|death|died|suicide|depression|mental health|harassment|discrimination|abuse|threat|violence|privacy violation|data breach|gdpr|compliance|regulatory|investigation|audit|subpoena)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern FRUSTRATION = Pattern.compile(
            "\\b(frustrated|angry|upset|terrible|awful|horrible|useless|stupid|waste of time|not helping|doesn'?t work|fed up|sick of|enough|ridiculous|pathetic|incompetent|worst|hate this|give up|cancel everything)\\b",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * @return an escalation decision for the governance journey, or empty when normal routing proceeds
     */
    public Optional<RouteDecision> detect(ConversationState state, String message) {
        if (state.isEscalationRequired()) {
            String reason = StringUtils.defaultIfBlank(state.getEscalationReason(), "Conversation already flagged for escalation");
            return Optional.of(decisionFor(EscalationTrigger.STATE_FLAGGED, reason));
        }

        String text = StringUtils.defaultString(message);
        if (HUMAN_REQUEST.matcher(text).find()) {
            return Optional.of(decisionFor(EscalationTrigger.EXPLICIT_HUMAN_REQUEST, "Customer explicitly requested human assistance"));
        }
        if (PAYMENT_DISPUTE.matcher(text).find()) {
            return Optional.of(decisionFor(EscalationTrigger.PAYMENT_DISPUTE, "Payment dispute or delivery complaint"));
        }
        if (SENSITIVE.matcher(text).find()) {
            return Optional.of(decisionFor(EscalationTrigger.SENSITIVE_CONTENT, "Sensitive content requires human review"));
        }
        if (state.getTurnCount() >= FRUSTRATION_MIN_TURNS && FRUSTRATION.matcher(text).find()) {
            return Optional.of(decisionFor(EscalationTrigger.USER_FRUSTRATION, "Customer frustration detected"));
        }
        return Optional.empty();
    }

    public RouteDecision decisionFor(EscalationTrigger trigger, String reason) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(RouteDecision.ESCALATION_REQUIRED, true);
        metadata.put(RouteDecision.ESCALATION_TRIGGER, trigger.getValue());
        metadata.put(RouteDecision.ESCALATION_REASON, reason);
        metadata.put(RouteDecision.ESCALATION_PRIORITY, trigger.getPriority().name().toLowerCase());
        metadata.put(RouteDecision.ESCALATION_CATEGORY, trigger.getCategory());
        return RouteDecision.of(Journey.GOVERNANCE, reason, trigger.getConfidence(), false, metadata);
    }
}
