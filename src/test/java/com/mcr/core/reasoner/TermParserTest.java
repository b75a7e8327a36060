package com.mcr.core.reasoner;

import com.mcr.core.reasoner.Term.Atom;
import com.mcr.core.reasoner.Term.Struct;
import com.mcr.core.reasoner.Term.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TermParserTest {

    @Test
    @DisplayName("parses facts and rules, skipping comments")
    void clauses() {
        List<Term> clauses = TermParser.parseClauses("""
                % family
                father(tom, bob).
                parent(X, Y) :- father(X, Y).
                """);

        assertEquals(2, clauses.size());
        assertEquals(new Struct("father", new Atom("tom"), new Atom("bob")), clauses.get(0));
        assertInstanceOf(Struct.class, clauses.get(1));
        assertEquals(":-", ((Struct) clauses.get(1)).name());
    }

    @Test
    @DisplayName("quoted atoms keep spaces and render quoted")
    void quotedAtoms() {
        Term term = TermParser.parseQuery("name(x, 'New York').");

        assertEquals("name(x,'New York')", term.toString());
    }

    @Test
    @DisplayName("lists render in bracket notation")
    void lists() {
        Term term = TermParser.parseQuery("members([a, b | T]).");

        assertEquals("members([a,b|T])", term.toString());
    }

    @Test
    @DisplayName("conjunction binds tighter than the rule neck")
    void operatorPriority() {
        Struct rule = (Struct) TermParser.parseClauses("g(X) :- a(X), b(X).").get(0);

        assertEquals(":-", rule.name());
        assertEquals(",", ((Struct) rule.args().get(1)).name());
        assertEquals(new Variable("X"), ((Struct) rule.args().get(0)).args().get(0));
    }

    @Test
    @DisplayName("syntax errors report line and column")
    void syntaxErrorPosition() {
        var e = assertThrows(ClauseSyntaxException.class,
                () -> TermParser.parseClauses("a.\nb(.\n"));

        assertEquals(2, e.getLine());
        assertTrue(e.getColumn() >= 1);
    }

    @Test
    @DisplayName("empty query is rejected")
    void emptyQuery() {
        assertThrows(ClauseSyntaxException.class, () -> TermParser.parseQuery("  "));
    }

    @Test
    @DisplayName("two terms in one query are rejected")
    void multipleQueryTerms() {
        assertThrows(ClauseSyntaxException.class, () -> TermParser.parseQuery("a. b."));
    }
}
