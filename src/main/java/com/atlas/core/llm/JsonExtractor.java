package com.atlas.core.llm;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls an embedded JSON object out of free-form model output.
 * <p>
 * Models frequently wrap JSON in prose or markdown fences. The extractor takes
 * the greedy span from the first {@code '{'} to the last {@code '}'}, which
 * tolerates both, and leaves validation to the JSON parser.
 */
public final class JsonExtractor {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private JsonExtractor() {}

    public static Optional<String> extractObject(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = JSON_OBJECT.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }
}
