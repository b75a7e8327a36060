package com.mcr.core.session;

import com.mcr.core.reasoner.ClauseSyntaxException;
import com.mcr.core.reasoner.HornClauseReasoner;
import com.mcr.core.reasoner.Term;
import com.mcr.core.reasoner.TermParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives the {@code predicate/arity} lexicon from a list of clauses.
 */
@Component
public class LexiconExtractor {

    private static final Logger log = LoggerFactory.getLogger(LexiconExtractor.class);

    public Set<String> extract(List<String> facts) {
        var lexicon = new LinkedHashSet<String>();
        for (String fact : facts) {
            try {
                List<Term> clauses = TermParser.parseClauses(fact);
                lexicon.addAll(HornClauseReasoner.predicateIndicators(clauses));
            } catch (ClauseSyntaxException e) {
                log.debug("Skipping unparsable fact for lexicon: {}", fact);
            }
        }
        return lexicon;
    }

    public String summarize(Set<String> lexicon) {
        if (lexicon.isEmpty()) {
            return "No predicates defined yet.";
        }
        return String.join("\n", lexicon);
    }
}
