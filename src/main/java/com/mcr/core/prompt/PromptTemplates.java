package com.mcr.core.prompt;

import com.mcr.core.error.StrategyDefinitionException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Registry of the prompt templates that strategies and the engine refer to by name.
 */
@Component
public class PromptTemplates {

    public static final PromptTemplate NL_TO_LOGIC = new PromptTemplate("NL_TO_LOGIC", """
            You translate natural language statements into Prolog facts and rules.
            - Output only Prolog clauses, one per line, each ending with a period.
            - Constants are lowercase_snake_case atoms. Variables start with an uppercase letter.
            - Reuse the predicate names and arities listed in the lexicon whenever they apply.
            - Specific statements become facts: "John is Mary's father." -> father(john, mary).
            - General statements become rules: "All humans are mortal." -> mortal(X) :- is_a(X, human).
            - Do not add comments, explanations or code fences.
            """, """
            EXISTING FACTS (context only, do not repeat them):
            {{existingFacts}}

            ONTOLOGY RULES (context only):
            {{ontologyRules}}

            LEXICON SUMMARY:
            {{lexiconSummary}}

            Translate this text into Prolog clauses:
            {{naturalLanguageText}}
            """);

    public static final PromptTemplate NL_TO_SIR_ASSERT = new PromptTemplate("NL_TO_SIR_ASSERT", """
            You translate a natural language statement into a structured JSON representation
            that is later converted to Prolog. Output a single JSON object and nothing else.

            Schema:
            {
              "statementType": "fact" | "rule",
              "fact": {"predicate": "snake_case", "arguments": ["const", "VAR", ["list"]], "isNegative": false},
              "rule": {"head": <fact>, "body": [<fact>, ...]},
              "error": "optional, when the input cannot be translated"
            }

            - Specific statements are facts: "The Moon orbits the Earth." ->
              {"statementType": "fact", "fact": {"predicate": "orbits", "arguments": ["moon", "earth"]}}
            - General statements are rules: "Birds fly." ->
              {"statementType": "rule", "rule": {"head": {"predicate": "flies", "arguments": ["X"]},
               "body": [{"predicate": "is_a", "arguments": ["X", "bird"]}]}}
            - Negation: "Paris is not in Germany." -> isNegative true.
            - Constants are lowercase_snake_case, variables are ALL CAPS.
            - Prefer predicates from the lexicon summary.
            """, """
            EXISTING FACTS:
            {{existingFacts}}

            ONTOLOGY RULES:
            {{ontologyRules}}

            LEXICON SUMMARY:
            {{lexiconSummary}}

            Translate ONLY this statement into SIR JSON:
            {{naturalLanguageText}}
            """);

    public static final PromptTemplate NL_TO_QUERY = new PromptTemplate("NL_TO_QUERY", """
            You translate natural language questions into a single Prolog query.
            - Use the predicate names and argument order established by the existing facts and lexicon.
            - Use variables (X, Who, Color) for the unknown parts of the question.
            - The query is one goal or a conjunction of goals ending with a period.
            - Never output rules, ":-", comments or explanations.
            Examples:
              Facts: father(john, mary).  Question: "Who is Mary's father?" -> father(X, mary).
              Facts: is_color(sky, blue). Question: "Is the sky blue?" -> is_color(sky, blue).
            """, """
            EXISTING FACTS:
            {{existingFacts}}

            ONTOLOGY RULES:
            {{ontologyRules}}

            LEXICON SUMMARY:
            {{lexiconSummary}}

            Question: {{naturalLanguageQuestion}}
            Prolog query:
            """);

    public static final PromptTemplate REFINE_FOR_CONSISTENCY = new PromptTemplate("REFINE_FOR_CONSISTENCY",
            "You refine generated Prolog so that it passes validation. Output only the corrected Prolog.", """
            The original input was: "{{originalInput}}"
            The generated output failed validation:
            ---
            {{failedOutput}}
            ---
            Validation error: {{validationError}}
            Iteration: {{iteration}}

            Most similar existing fact in the knowledge base:
            {{similarContext}}

            Provide a corrected version of the output that addresses the validation error.
            """);

    public static final PromptTemplate HYPOTHESIZE_QUERIES = new PromptTemplate("HYPOTHESIZE_QUERIES", """
            You propose candidate Prolog queries that could answer a question against a knowledge base.
            - Output up to {{maxHypotheses}} queries, one per line, each ending with a period.
            - Use only predicates that appear in the knowledge base.
            - Order them from most to least likely.
            - No numbering, comments or explanations.
            """, """
            KNOWLEDGE BASE:
            {{knowledgeBase}}

            Question: {{naturalLanguageQuestion}}
            Candidate queries:
            """);

    public static final PromptTemplate LOGIC_TO_NL_ANSWER = new PromptTemplate("LOGIC_TO_NL_ANSWER", """
            You explain Prolog query results as a short natural language answer to the user's question.
            - "true" means the question was affirmed.
            - "No results" means nothing in the knowledge base supports it.
            - Variable bindings such as "Who = pete" name the answers.
            - Be direct and {{style}}. Never mention Prolog or variables.
            """, """
            Original question: "{{naturalLanguageQuestion}}"
            Query results:
            {{prologResults}}

            Answer:
            """);

    public static final PromptTemplate SEMANTIC_SIMILARITY_CHECK = new PromptTemplate("SEMANTIC_SIMILARITY_CHECK", """
            You judge whether two texts state the same meaning.
            Answer with exactly one word: SIMILAR or DIFFERENT.
            """, """
            Text A:
            {{textA}}

            Text B:
            {{textB}}
            """);

    private static final Map<String, PromptTemplate> BY_NAME = Map.of(
            NL_TO_LOGIC.name(), NL_TO_LOGIC,
            NL_TO_SIR_ASSERT.name(), NL_TO_SIR_ASSERT,
            NL_TO_QUERY.name(), NL_TO_QUERY,
            REFINE_FOR_CONSISTENCY.name(), REFINE_FOR_CONSISTENCY,
            HYPOTHESIZE_QUERIES.name(), HYPOTHESIZE_QUERIES,
            LOGIC_TO_NL_ANSWER.name(), LOGIC_TO_NL_ANSWER,
            SEMANTIC_SIMILARITY_CHECK.name(), SEMANTIC_SIMILARITY_CHECK);

    public PromptTemplate get(String name) {
        PromptTemplate template = BY_NAME.get(name);
        if (template == null) {
            throw new StrategyDefinitionException("Unknown prompt template: " + name);
        }
        return template;
    }

    public boolean contains(String name) {
        return BY_NAME.containsKey(name);
    }

    public Set<String> names() {
        return BY_NAME.keySet();
    }
}
