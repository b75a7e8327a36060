package com.mcr.core.router;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic, case-insensitive request classification. Text ending in a
 * question mark or containing an interrogative keyword bounded by whitespace
 * (or the start or end of the text) is a query; anything else is an assertion.
 * "I can't swim" is an assertion because "can't" is not the keyword "can".
 */
@Component
public class InputClassifier {

    private static final Pattern INTERROGATIVE = Pattern.compile(
            "(^|\\s)(who|what|where|when|why|how|are|does|do|can|could|would|should)(?=\\s|$)");

    public InputClass classify(String text) {
        if (text == null) {
            return InputClass.ASSERT;
        }
        String normalized = text.strip().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("?") || INTERROGATIVE.matcher(normalized).find()) {
            return InputClass.QUERY;
        }
        return InputClass.ASSERT;
    }
}
