package com.atlas.core.intent;

import com.atlas.core.model.IntentType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Canned replies for conversational intents, so that chatter can be answered
 * without an LLM round trip.
 */
@Component
public class ResponseCatalog {

    static final String DEFAULT_RESPONSE = "What can I help you with?";

    private static final Map<IntentType, List<String>> RESPONSES = new EnumMap<>(IntentType.class);

    static {
        RESPONSES.put(IntentType.GREETING, List.of(
                "Hey! 👋 What can I help you with today?",
                "Hello! Ready to help. What do you need?",
                "Hi there! What would you like me to do?",
                "Hey! I'm here and ready. What's the task?"));
        RESPONSES.put(IntentType.FAREWELL, List.of(
                "Goodbye! Let me know if you need anything else. 👋",
                "See you later! I'll be here when you need me.",
                "Take care! Come back anytime."));
        RESPONSES.put(IntentType.GRATITUDE, List.of(
                "You're welcome! Let me know if you need anything else.",
                "Happy to help! Anything else?",
                "No problem! I'm here if you need more help."));
        RESPONSES.put(IntentType.AFFIRMATION, List.of(
                "Got it! What would you like me to do?",
                "Okay! Ready when you are - just tell me what you need.",
                "Sure thing! What's the task?"));
        RESPONSES.put(IntentType.NEGATION, List.of(
                "No worries! Let me know if you change your mind or need something else.",
                "Okay, cancelled. What else can I help with?",
                "Understood. I'm here when you're ready."));
        RESPONSES.put(IntentType.SMALL_TALK, List.of(
                "I'm doing great, thanks for asking! 🤖 Ready to help with any tasks you have.",
                "All good here! What can I do for you today?",
                "Running smoothly! Got something for me to work on?"));
        RESPONSES.put(IntentType.AGENT_QUESTION, List.of(
                "I'm your AI assistant! I can help you with:\n"
                        + "• **Git/GitHub** - Clone repos, create branches, push code\n"
                        + "• **Trello** - Manage boards, cards, and tasks\n"
                        + "• **Deployment** - Deploy to Hetzner or Vercel\n"
                        + "• **Containers** - Manage Docker containers\n"
                        + "• **General tasks** - Run commands, manage files\n\n"
                        + "Just tell me what you need!"));
        RESPONSES.put(IntentType.CLARIFICATION, List.of(
                "Could you tell me more about what you'd like me to do?",
                "I want to make sure I understand - what would you like me to help with?",
                "Let me know what task you have in mind and I'll get right on it!"));
        RESPONSES.put(IntentType.TASK, List.of());
    }

    private final Random random;

    public ResponseCatalog() {
        this(new Random());
    }

    public ResponseCatalog(Random random) {
        this.random = random;
    }

    /**
     * Picks one reply for the intent, or a generic prompt when the intent has none.
     */
    public String responseFor(IntentType intent) {
        List<String> candidates = RESPONSES.getOrDefault(intent, List.of());
        if (candidates.isEmpty()) {
            return DEFAULT_RESPONSE;
        }
        return candidates.get(random.nextInt(candidates.size()));
    }

    List<String> candidatesFor(IntentType intent) {
        return RESPONSES.getOrDefault(intent, List.of());
    }
}
