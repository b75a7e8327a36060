package com.mcr.core.strategy.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.mcr.core.error.ValidationFailedException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts the structured intermediate representation (SIR) of a statement
 * into Prolog clauses.
 * <p>
 * A SIR object has a {@code statementType} of {@code fact} or {@code rule}. A
 * fact carries a {@code predicate}, its {@code arguments} and an optional
 * {@code isNegative} flag; a rule carries a {@code head} fact and a non-empty
 * {@code body} of facts. An {@code error} field marks input the generator could
 * not translate.
 */
public final class SirConverter {

    private static final Pattern PREDICATE = Pattern.compile("^[a-z_][a-zA-Z0-9_]*$");
    private static final Pattern VARIABLE = Pattern.compile("^[A-Z_][a-zA-Z0-9_]*$");
    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern SIMPLE_ATOM = Pattern.compile("^[a-z][a-zA-Z0-9_]*$");

    private SirConverter() {}

    /**
     * @throws ValidationFailedException when the SIR is malformed or reports an error
     */
    public static List<String> toClauses(JsonNode sir) {
        if (sir == null || sir.isNull() || sir.isMissingNode()) {
            throw new ValidationFailedException("SIR is empty");
        }
        if (sir.isArray()) {
            List<String> clauses = new ArrayList<>();
            for (JsonNode statement : sir) {
                clauses.addAll(toClauses(statement));
            }
            return clauses;
        }
        if (!sir.isObject()) {
            throw new ValidationFailedException("SIR must be a JSON object, found " + sir.getNodeType());
        }
        JsonNode error = sir.get("error");
        if (error != null && !error.isNull() && !error.asText().isBlank()) {
            throw new ValidationFailedException("SIR reports an error: " + error.asText());
        }
        String type = sir.path("statementType").asText("");
        return switch (type) {
            case "fact" -> List.of(fact(sir.get("fact")) + ".");
            case "rule" -> List.of(rule(sir.get("rule")));
            default -> throw new ValidationFailedException("Unsupported SIR statementType: '" + type + "'");
        };
    }

    private static String rule(JsonNode rule) {
        if (rule == null || !rule.isObject()) {
            throw new ValidationFailedException("SIR rule is missing");
        }
        JsonNode body = rule.get("body");
        if (body == null || !body.isArray() || body.isEmpty()) {
            throw new ValidationFailedException("SIR rule body must be a non-empty array");
        }
        List<String> goals = new ArrayList<>();
        for (JsonNode goal : body) {
            goals.add(fact(goal));
        }
        return fact(rule.get("head")) + " :- " + String.join(", ", goals) + ".";
    }

    static String fact(JsonNode fact) {
        if (fact == null || !fact.isObject()) {
            throw new ValidationFailedException("SIR fact is missing");
        }
        String predicate = fact.path("predicate").asText("");
        if (!PREDICATE.matcher(predicate).matches()) {
            throw new ValidationFailedException("Invalid SIR predicate name: '" + predicate + "'");
        }
        JsonNode args = fact.get("arguments");
        String literal;
        if (args == null || args.isNull() || (args.isArray() && args.isEmpty())) {
            literal = predicate;
        } else if (!args.isArray()) {
            throw new ValidationFailedException("SIR arguments of '" + predicate + "' must be an array");
        } else {
            List<String> rendered = new ArrayList<>();
            for (JsonNode arg : args) {
                rendered.add(argument(arg));
            }
            literal = predicate + "(" + String.join(", ", rendered) + ")";
        }
        return fact.path("isNegative").asBoolean(false) ? "not(" + literal + ")" : literal;
    }

    static String argument(JsonNode arg) {
        if (arg.isArray()) {
            List<String> items = new ArrayList<>();
            for (JsonNode item : arg) {
                items.add(argument(item));
            }
            return "[" + String.join(", ", items) + "]";
        }
        if (arg.isNumber()) {
            return arg.asText();
        }
        if (!arg.isTextual()) {
            throw new ValidationFailedException("Unsupported SIR argument: " + arg);
        }
        String text = arg.asText();
        if (VARIABLE.matcher(text).matches() || NUMBER.matcher(text).matches()
                || SIMPLE_ATOM.matcher(text).matches()) {
            return text;
        }
        return quote(text);
    }

    static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }
}
