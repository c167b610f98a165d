package com.ai.commerce.component;

import com.ai.commerce.conversation.EscalationTrigger;
import com.ai.commerce.conversation.HandoffPriority;
import com.ai.commerce.conversation.Journey;
import com.ai.commerce.dto.CatalogItem;
import com.ai.commerce.service.CatalogFallbackReason;
import com.ai.commerce.service.RateLimitStatus;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Customer-facing wording. Variants of the same message rotate by turn so replies do not repeat verbatim.
 */
@Component
public class ResponsePhrases {

    private static final List<String> STRICT_REDIRECT = List.of(
            "I'm here to help with your shopping. What can I find for you today?",
            "What products or services can I help you with?",
            "Tell me what you're shopping for and I'll take it from there.");

    private static final List<String> EARLY_REDIRECT = List.of(
            "Thanks for the chat! What can I help you find today?",
            "Nice talking to you! Is there a product or order I can help with?",
            "Good to hear from you! What are you shopping for today?");

    private static final List<String> LATE_REDIRECT = List.of(
            "I can help with products, orders, payments, offers and support. Which one do you need?",
            "Let's get you sorted. Are you shopping, checking an order or after support?",
            "I'm best at shopping help. What are you looking for?");

    private static final List<String> FIRST_CASUAL = List.of(
            "Hi there! What are you shopping for today?",
            "Hello! I can help you find products or answer questions. What interests you?",
            "Great to meet you! What can I help you with?");

    private static final List<String> LATER_CASUAL = List.of(
            "Nice chatting! Anything I can help you find?",
            "Thanks for the friendly chat! What can I show you today?",
            "Always happy to talk. Is there a product I can help you with?");

    private static final List<String> FIRST_SPAM_WARNING = List.of(
            "I'd be glad to help you find something. What are you looking for?",
            "Let me help with something specific. What would you like to shop for?",
            "I can find products, check orders or answer questions. What do you need?");

    private static final List<String> DISENGAGE = List.of(
            "I'm here to help with your shopping needs. Please let me know if you have any questions about our products or services.",
            "Whenever you're ready to shop or need support, I'll be here.",
            "Feel free to ask about our products or services anytime.");

    public String greeting(String botName) {
        if (StringUtils.isNotBlank(botName)) {
            return "Hello! I'm " + botName + ". I can help you with shopping, orders and support. What can I do for you today?";
        }
        return "Hello! I can help you with shopping, orders and support. What can I do for you today?";
    }

    public String unknownRequest() {
        return "I'm not sure I can help with that yet. I can find products, check orders, answer questions or connect you with our team. What would you like to do?";
    }

    public String businessRedirect(int chattinessLevel, int casualTurns, int turnCount) {
        if (chattinessLevel == 0) {
            return pick(STRICT_REDIRECT, turnCount);
        }
        return pick(casualTurns <= 2 ? EARLY_REDIRECT : LATE_REDIRECT, turnCount);
    }

    public String friendlyCasual(int casualTurns, int turnCount) {
        return pick(casualTurns <= 1 ? FIRST_CASUAL : LATER_CASUAL, turnCount);
    }

    public String spamWarning(int turnCount) {
        return pick(FIRST_SPAM_WARNING, turnCount);
    }

    public String disengage(int turnCount) {
        return pick(DISENGAGE, turnCount);
    }

    public String abuseStop() {
        return "I'm unable to continue this conversation. If you need assistance, please contact our support team.";
    }

    public String rateLimited(String reason) {
        if (RateLimitStatus.SPAM_COOLDOWN.equals(reason)) {
            return "Please wait before sending more messages. I'll be here when you're ready to talk about our products or services.";
        }
        if (RateLimitStatus.ABUSE_COOLDOWN.equals(reason)) {
            return "This conversation has been temporarily restricted. Please contact our support team if you need assistance.";
        }
        return "You're sending messages too quickly. Please wait a moment before continuing.";
    }

    public String handoff(EscalationTrigger trigger, String ticketNumber) {
        HandoffPriority priority = trigger.getPriority();
        String opening;
        switch (trigger) {
            case EXPLICIT_HUMAN_REQUEST:
                opening = "Sure, I'm connecting you with a member of our team.";
                break;
            case PAYMENT_DISPUTE:
                opening = "I'm sorry about the trouble with your payment or delivery. I've passed this to our team so they can sort it out.";
                break;
            case SENSITIVE_CONTENT:
                opening = "This needs a person's attention, so I've passed it to our team right away.";
                break;
            case USER_FRUSTRATION:
                opening = "I'm sorry this has been frustrating. Someone from our team will take over from here.";
                break;
            case REPEATED_FAILURES:
                opening = "I'm having trouble understanding what you need, so I've asked a member of our team to help.";
                break;
            case STATE_FLAGGED:
            default:
                opening = "Your conversation is with our team.";
                break;
        }
        String reference = StringUtils.isNotBlank(ticketNumber) ? " Your reference is " + ticketNumber + "." : "";
        return opening + reference + " Expect a reply " + priority.getDisplayText() + ".";
    }

    public String awaitingAgent(String ticketNumber) {
        String reference = StringUtils.isNotBlank(ticketNumber) ? " (reference " + ticketNumber + ")" : "";
        return "Thanks, I've added this to your request" + reference + ". A member of our team will reply here soon.";
    }

    public String clarification(String intentValue, String suggestedJourney) {
        String question;
        switch (StringUtils.defaultString(intentValue)) {
            case "sales_discovery":
                question = "Are you browsing, or do you have something specific in mind?";
                break;
            case "product_question":
                question = "Which product would you like to know more about? A name or short description is enough.";
                break;
            case "support_question":
                question = "What do you need help with? Is it a product, a service or an order?";
                break;
            case "order_status":
                question = "Are you checking on an existing order? If so, please share the order number.";
                break;
            case "discounts_offers":
                question = "Are you after current promotions, or do you have a coupon code to use?";
                break;
            case "preferences_consent":
                question = "Would you like to change your language or your marketing message settings?";
                break;
            case "payment_help":
                question = "Is this about a payment that failed, how to pay, or checking a transaction?";
                break;
            default:
                question = "Could you tell me a bit more about what you're looking for?";
                break;
        }
        if (Journey.SALES.getValue().equals(suggestedJourney)) {
            question += " I can help you find products, check availability or place an order.";
        } else if (Journey.SUPPORT.getValue().equals(suggestedJourney)) {
            question += " I can help with product questions, troubleshooting or account issues.";
        } else if (Journey.ORDERS.getValue().equals(suggestedJourney)) {
            question += " I can track orders, check delivery status or help with order changes.";
        }
        return question;
    }

    public String catalogLink(CatalogFallbackReason reason, String url) {
        String intro;
        switch (reason) {
            case SEE_ALL_REQUESTED:
                intro = "Here's our full catalog so you can browse everything:";
                break;
            case VISUAL_SELECTION_REQUIRED:
                intro = "These are easier to choose when you can see them. Have a look here:";
                break;
            case REPEATED_SHORTLIST_REJECTIONS:
                intro = "Let's try another way. You can browse all options here:";
                break;
            case LOW_CONFIDENCE_RESULTS:
            case LARGE_CATALOG_VAGUE_QUERY:
            default:
                intro = "We have quite a few options that might suit you. Browse them here:";
                break;
        }
        return intro + " " + url + "\nPick an item there and I'll help you with the rest.";
    }

    public String shortlist(List<CatalogItem> items) {
        StringBuilder sb = new StringBuilder("Here are some options:");
        for (int i = 0; i < items.size(); i++) {
            CatalogItem item = items.get(i);
            sb.append("\n").append(i + 1).append(". ").append(item.getName());
            if (item.getPrice() != null) {
                sb.append(" (").append(item.getPrice().toPlainString()).append(")");
            }
        }
        sb.append("\nReply with a number to see more, or tell me what you'd like instead.");
        return sb.toString();
    }

    public String askWhatToShopFor() {
        return "What are you looking for today? Tell me a product, a category or a budget.";
    }

    public String catalogSelectionReceived(int count) {
        return count == 1
                ? "Great choice! Would you like details, sizes or to place an order?"
                : "Great, I have your " + count + " picks. Which one would you like to start with?";
    }

    public String journeyAcknowledgement(Journey journey) {
        switch (journey) {
            case SUPPORT:
                return "I'm sorry you're having trouble. Could you describe the issue, and which product or order it's about?";
            case ORDERS:
                return "I can check on that. Please share your order number or the phone number used for the order.";
            case OFFERS:
                return "We've got some offers running. Are you looking for something in particular, or should I share what's on now?";
            default:
                return "How can I help you with that?";
        }
    }

    public String languageUpdated(String languageValue) {
        switch (languageValue) {
            case "sw":
                return "Sawa! Nitaendelea kwa Kiswahili.";
            case "sheng":
                return "Poa! Tutaongea sheng.";
            default:
                return "Sure, I'll continue in English.";
        }
    }

    public String marketingOptOut() {
        return "Done. You won't receive marketing messages from us anymore. You can still chat with me anytime.";
    }

    public String marketingOptIn() {
        return "Done. We'll keep you posted on offers and news.";
    }

    public String preferencesMenu() {
        return "You can change your language (English, Swahili or Sheng) or opt in or out of marketing messages. What would you like to update?";
    }

    public String systemFallback() {
        return "Sorry, something went wrong on our side. I've let our team know and someone will follow up with you shortly.";
    }

    private static String pick(List<String> options, int turnCount) {
        int index = Math.floorMod(turnCount - 1, options.size());
        return options.get(index);
    }
}
