package com.atlas.core.intent;

import com.atlas.core.model.ClassificationResult;
import com.atlas.core.model.Confidence;
import com.atlas.core.model.IntentType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a message is conversational chatter or an actionable task,
 * using pattern matching only. Used as a gate in front of the planners so that
 * "thanks!" never costs an LLM call.
 * <p>
 * Rules are evaluated in declaration order and the first matching rule wins.
 * Several categories overlap on purpose (a bare "no" must be a negation, not a
 * clarification), so the order of {@link #RULES} is behaviour.
 */
@Service
public class IntentClassifier {

    private static final String TAIL = "[\\s!.,?]*$";

    private record IntentRule(IntentType intent, List<Pattern> patterns, String reasoning) {

        boolean matches(String text) {
            return patterns.stream().anyMatch(p -> p.matcher(text).find());
        }
    }

    private static final List<IntentRule> RULES = List.of(
            rule(IntentType.GREETING, "Matched greeting pattern",
                    "^(hi|hey|hello|yo|sup|hiya|howdy|greetings)" + TAIL,
                    "^(good\\s*(morning|afternoon|evening|night))" + TAIL,
                    "^(what'?s?\\s*up|wassup|wazzup)" + TAIL),
            rule(IntentType.FAREWELL, "Matched farewell pattern",
                    "^(bye|goodbye|see\\s*ya|later|cya|peace|ttyl|take\\s*care)" + TAIL,
                    "^(good\\s*night|gn|have\\s*a\\s*good\\s*(one|day|night))" + TAIL),
            rule(IntentType.GRATITUDE, "Matched gratitude pattern",
                    "^(thanks|thank\\s*you|thx|ty|appreciate\\s*it|cheers)" + TAIL,
                    "^(thanks\\s*(a\\s*lot|so\\s*much|buddy|man|dude))" + TAIL),
            rule(IntentType.AFFIRMATION, "Matched affirmation pattern",
                    "^(yes|yeah|yep|yup|ok|okay|sure|alright|sounds\\s*good|perfect|great|cool|nice|awesome|got\\s*it)" + TAIL,
                    "^(right|correct|exactly|absolutely|definitely)" + TAIL),
            rule(IntentType.NEGATION, "Matched negation pattern",
                    "^(no|nope|nah|never\\s*mind|nevermind|cancel|stop|forget\\s*it|don'?t)" + TAIL),
            rule(IntentType.SMALL_TALK, "Matched small talk pattern",
                    "^how\\s*(are\\s*you|'?s\\s*it\\s*going|you\\s*doing|have\\s*you\\s*been)" + TAIL,
                    "^what'?s\\s*(going\\s*on|new|happening)" + TAIL,
                    "^you\\s*(good|okay|alright)" + TAIL),
            rule(IntentType.AGENT_QUESTION, "Matched agent meta-question pattern",
                    "^(who|what)\\s*(are\\s*you|is\\s*this)" + TAIL,
                    "^what\\s*(can\\s*you\\s*do|are\\s*you(r)?\\s*capabilities|do\\s*you\\s*do)" + TAIL,
                    "^(help|help\\s*me|what\\s*commands)" + TAIL,
                    "^(are\\s*you\\s*(a\\s*bot|an?\\s*ai|real))" + TAIL),
            rule(IntentType.CLARIFICATION, "Matched clarification pattern",
                    "^(what|huh|sorry|pardon|excuse\\s*me)" + TAIL,
                    "^(can\\s*you\\s*(repeat|say\\s*that\\s*again|explain))" + TAIL,
                    "^(i\\s*don'?t\\s*(understand|get\\s*it))" + TAIL)
    );

    /** Action verbs and domain nouns that mark a message as work to do. */
    static final List<String> TASK_INDICATORS = List.of(
            "create", "make", "build", "add", "remove", "delete", "update", "modify", "change",
            "deploy", "start", "stop", "restart", "run", "execute", "install", "setup",
            "clone", "push", "pull", "commit", "merge", "check", "analyze", "find", "search",
            "list", "show", "display", "get", "fetch", "send", "move", "copy", "rename",
            "file", "folder", "directory", "repo", "repository", "server", "container",
            "card", "board", "task", "issue", "branch", "project", "workspace",
            "database", "table", "function", "endpoint", "api"
    );

    static final String SHORT_MESSAGE_RESPONSE =
            "I'm not sure what you mean. Could you give me a bit more detail about what you'd like me to do?";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ResponseCatalog responses;

    public IntentClassifier() {
        this(new ResponseCatalog());
    }

    @Autowired
    public IntentClassifier(ResponseCatalog responses) {
        this.responses = responses;
    }

    /**
     * Classifies a message. Total over all inputs: null, empty and blank
     * messages are clarification requests.
     */
    public ClassificationResult classify(String message) {
        String trimmed = message != null ? message.strip() : "";
        if (trimmed.isEmpty()) {
            return ClassificationResult.conversational(IntentType.CLARIFICATION, Confidence.HIGH,
                    responses.responseFor(IntentType.CLARIFICATION), "Empty message");
        }

        for (IntentRule rule : RULES) {
            if (rule.matches(trimmed)) {
                return ClassificationResult.conversational(rule.intent(), Confidence.HIGH,
                        responses.responseFor(rule.intent()), rule.reasoning());
            }
        }

        String lower = trimmed.toLowerCase();
        boolean hasTaskIndicator = TASK_INDICATORS.stream().anyMatch(lower::contains);
        int wordCount = WHITESPACE.split(trimmed).length;

        if (wordCount <= 3 && !hasTaskIndicator) {
            return ClassificationResult.conversational(IntentType.CLARIFICATION, Confidence.MEDIUM,
                    SHORT_MESSAGE_RESPONSE, "Short message without task indicators");
        }

        return hasTaskIndicator
                ? ClassificationResult.task(Confidence.HIGH, "Contains task action keywords")
                : ClassificationResult.task(Confidence.MEDIUM, "Longer message likely describing a task");
    }

    /**
     * Whether the message can be answered without running a task.
     */
    public boolean isConversational(String message) {
        return !classify(message).shouldExecuteTask();
    }

    /**
     * One-line description of the classification, for logs.
     */
    public String describe(String message) {
        ClassificationResult result = classify(message);
        return String.format("Intent: %s (%s confidence) - %s",
                result.intent().wireName(), result.confidence().wireName(), result.reasoning());
    }

    private static IntentRule rule(IntentType intent, String reasoning, String... regexes) {
        var patterns = java.util.Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
        return new IntentRule(intent, patterns, reasoning);
    }
}
