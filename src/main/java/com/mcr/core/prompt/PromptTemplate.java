package com.mcr.core.prompt;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named system/user prompt pair with {@code {{variable}}} placeholders.
 * Placeholders without a value are replaced by the empty string.
 */
public record PromptTemplate(String name, String system, String user) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_]+)\\s*}}");

    public String renderSystem(Map<String, String> vars) {
        return fill(system, vars);
    }

    public String renderUser(Map<String, String> vars) {
        return fill(user, vars);
    }

    static String fill(String text, Map<String, String> vars) {
        if (text == null) {
            return "";
        }
        Matcher m = PLACEHOLDER.matcher(text);
        var sb = new StringBuilder();
        while (m.find()) {
            String value = vars.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : value));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
