package com.mcr.core.reasoner;

import com.mcr.core.reasoner.Term.Atom;
import com.mcr.core.reasoner.Term.Num;
import com.mcr.core.reasoner.Term.Struct;
import com.mcr.core.reasoner.Term.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Embedded {@link ReasonerBackend} performing depth-first SLD resolution over
 * Horn clauses.
 * <p>
 * Supported built-ins: {@code true}, {@code fail}/{@code false}, conjunction,
 * disjunction, {@code \+}/{@code not}, {@code =}, {@code \=}, {@code ==},
 * {@code \==} and numeric comparison. Calls to predicates without clauses fail
 * quietly. Branches deeper than {@link ReasonerProperties#getMaxDepth()} are
 * pruned and logged.
 */
@Service
public class HornClauseReasoner implements ReasonerBackend {

    private static final Logger log = LoggerFactory.getLogger(HornClauseReasoner.class);

    private static final Set<String> CONTROL = Set.of(
            "true/0", "fail/0", "false/0", "!/0", ",/2", ";/2", "->/2", "\\+/1", "not/1",
            "=/2", "\\=/2", "==/2", "\\==/2", "</2", ">/2", "=</2", ">=/2", "=:=/2", "=\\=/2");

    private final ReasonerProperties properties;

    public HornClauseReasoner(ReasonerProperties properties) {
        this.properties = properties;
    }

    @Override
    public ReasonerResult query(String knowledgeBase, String query) {
        Map<String, List<Clause>> program = consult(knowledgeBase);
        Term goal = TermParser.parseQuery(query);
        List<Variable> queryVars = namedVariables(goal);

        var search = new Search(program, properties.getMaxDepth());
        var results = new ArrayList<String>();
        var proofs = new ArrayList<String>();
        int limit = Math.max(1, properties.getMaxSolutions());

        search.solve(List.of(goal), Map.of(), 0, bindings -> {
            results.add(renderSolution(queryVars, bindings));
            proofs.add(resolveFully(goal, bindings).toString());
            return results.size() < limit;
        });

        if (search.depthExceeded) {
            log.warn("Query '{}' hit the resolution depth limit of {}; some branches were pruned",
                    query, properties.getMaxDepth());
        }
        log.debug("Query '{}' produced {} solution(s)", query, results.size());
        return new ReasonerResult(results, proofs.isEmpty() ? null : String.join("\n", proofs));
    }

    @Override
    public ValidationResult validate(String knowledgeBase) {
        try {
            for (Term clause : TermParser.parseClauses(knowledgeBase)) {
                Term head = clause instanceof Struct s && s.name().equals(":-") && s.arity() == 2
                        ? s.args().get(0) : clause;
                if (clause instanceof Struct s && s.name().equals(":-") && s.arity() == 1) {
                    return ValidationResult.invalid("Directives are not supported: " + clause);
                }
                if (!(head instanceof Atom) && !(head instanceof Struct)) {
                    return ValidationResult.invalid("Clause head must be an atom or compound term: " + clause);
                }
                if (CONTROL.contains(Term.indicatorOf(head))) {
                    return ValidationResult.invalid("Cannot redefine built-in " + Term.indicatorOf(head));
                }
            }
            return ValidationResult.ok();
        } catch (ClauseSyntaxException e) {
            return ValidationResult.invalid(e.getMessage());
        }
    }

    @Override
    public ValidationResult validateQuery(String query) {
        try {
            Term goal = TermParser.parseQuery(query);
            if (goal instanceof Variable || goal instanceof Num) {
                return ValidationResult.invalid("Query must be callable: " + goal);
            }
            return ValidationResult.ok();
        } catch (ClauseSyntaxException e) {
            return ValidationResult.invalid(e.getMessage());
        }
    }

    /**
     * Predicate indicators defined or called by the given clauses, excluding
     * control constructs, in order of first appearance.
     */
    public static Set<String> predicateIndicators(List<Term> clauses) {
        var out = new LinkedHashSet<String>();
        for (Term clause : clauses) {
            if (clause instanceof Struct s && s.name().equals(":-") && s.arity() == 2) {
                collectGoals(s.args().get(0), out);
                collectGoals(s.args().get(1), out);
            } else {
                collectGoals(clause, out);
            }
        }
        return out;
    }

    private static void collectGoals(Term goal, Set<String> out) {
        if (goal instanceof Struct s && (s.name().equals(",") || s.name().equals(";") || s.name().equals("->"))
                && s.arity() == 2) {
            collectGoals(s.args().get(0), out);
            collectGoals(s.args().get(1), out);
            return;
        }
        if (goal instanceof Struct s && (s.name().equals("\\+") || s.name().equals("not")) && s.arity() == 1) {
            collectGoals(s.args().get(0), out);
            return;
        }
        String indicator = Term.indicatorOf(goal);
        if (indicator != null && !CONTROL.contains(indicator)) {
            out.add(indicator);
        }
    }

    // ── Program loading ──────────────────────────────────────────────

    private record Clause(Term head, Term body) {}

    private Map<String, List<Clause>> consult(String knowledgeBase) {
        Map<String, List<Clause>> program = new HashMap<>();
        for (Term t : TermParser.parseClauses(knowledgeBase)) {
            Clause clause;
            if (t instanceof Struct s && s.name().equals(":-") && s.arity() == 2) {
                clause = new Clause(s.args().get(0), s.args().get(1));
            } else if (t instanceof Struct s && s.name().equals(":-") && s.arity() == 1) {
                log.debug("Skipping directive {}", t);
                continue;
            } else {
                clause = new Clause(t, Term.TRUE);
            }
            String indicator = Term.indicatorOf(clause.head());
            if (indicator == null) {
                log.warn("Skipping clause with non-callable head: {}", t);
                continue;
            }
            program.computeIfAbsent(indicator, k -> new ArrayList<>()).add(clause);
        }
        return program;
    }

    // ── Resolution ───────────────────────────────────────────────────

    @FunctionalInterface
    private interface SolutionSink {
        /** Returns {@code false} to stop the search. */
        boolean accept(Map<Variable, Term> bindings);
    }

    private static final class Search {

        private final Map<String, List<Clause>> program;
        private final int maxDepth;
        private int renameCounter;
        private boolean depthExceeded;

        Search(Map<String, List<Clause>> program, int maxDepth) {
            this.program = program;
            this.maxDepth = maxDepth;
        }

        /** Returns {@code false} once the sink asked to stop. */
        boolean solve(List<Term> goals, Map<Variable, Term> bindings, int depth, SolutionSink sink) {
            if (goals.isEmpty()) {
                return sink.accept(bindings);
            }
            if (depth > maxDepth) {
                depthExceeded = true;
                return true;
            }
            Term goal = resolve(goals.get(0), bindings);
            List<Term> rest = goals.subList(1, goals.size());

            if (goal instanceof Variable || goal instanceof Num) {
                return true;
            }
            if (goal instanceof Atom a) {
                switch (a.name()) {
                    case "true", "!":
                        return solve(rest, bindings, depth, sink);
                    case "fail", "false":
                        return true;
                    default:
                        break;
                }
            }
            if (goal instanceof Struct s) {
                List<Term> args = s.args();
                switch (s.indicator()) {
                    case ",/2":
                        return solve(prepend(rest, args.get(0), args.get(1)), bindings, depth, sink);
                    case ";/2":
                        return solve(prepend(rest, args.get(0)), bindings, depth, sink)
                                && solve(prepend(rest, args.get(1)), bindings, depth, sink);
                    case "->/2": {
                        Map<Variable, Term> first = firstSolution(args.get(0), bindings, depth);
                        return first == null || solve(prepend(rest, args.get(1)), first, depth, sink);
                    }
                    case "\\+/1":
                    case "not/1":
                        if (firstSolution(args.get(0), bindings, depth) == null) {
                            return solve(rest, bindings, depth, sink);
                        }
                        return true;
                    case "=/2": {
                        Map<Variable, Term> unified = unify(args.get(0), args.get(1), bindings);
                        return unified == null || solve(rest, unified, depth, sink);
                    }
                    case "\\=/2":
                        if (unify(args.get(0), args.get(1), bindings) == null) {
                            return solve(rest, bindings, depth, sink);
                        }
                        return true;
                    case "==/2":
                        if (resolveFully(args.get(0), bindings).equals(resolveFully(args.get(1), bindings))) {
                            return solve(rest, bindings, depth, sink);
                        }
                        return true;
                    case "\\==/2":
                        if (!resolveFully(args.get(0), bindings).equals(resolveFully(args.get(1), bindings))) {
                            return solve(rest, bindings, depth, sink);
                        }
                        return true;
                    case "</2":
                    case ">/2":
                    case "=</2":
                    case ">=/2":
                    case "=:=/2":
                    case "=\\=/2":
                        if (compare(s.name(), resolveFully(args.get(0), bindings),
                                resolveFully(args.get(1), bindings))) {
                            return solve(rest, bindings, depth, sink);
                        }
                        return true;
                    default:
                        break;
                }
            }

            List<Clause> candidates = program.getOrDefault(Term.indicatorOf(goal), List.of());
            for (Clause clause : candidates) {
                Clause renamed = rename(clause);
                Map<Variable, Term> unified = unify(goal, renamed.head(), bindings);
                if (unified == null) {
                    continue;
                }
                List<Term> next = Term.TRUE.equals(renamed.body()) ? rest : prepend(rest, renamed.body());
                if (!solve(next, unified, depth + 1, sink)) {
                    return false;
                }
            }
            return true;
        }

        private Map<Variable, Term> firstSolution(Term goal, Map<Variable, Term> bindings, int depth) {
            List<Map<Variable, Term>> found = new ArrayList<>(1);
            solve(List.of(goal), bindings, depth + 1, b -> {
                found.add(b);
                return false;
            });
            return found.isEmpty() ? null : found.get(0);
        }

        private Clause rename(Clause clause) {
            int id = ++renameCounter;
            Map<Variable, Variable> mapping = new HashMap<>();
            return new Clause(renameTerm(clause.head(), mapping, id), renameTerm(clause.body(), mapping, id));
        }

        private Term renameTerm(Term term, Map<Variable, Variable> mapping, int id) {
            if (term instanceof Variable v) {
                return mapping.computeIfAbsent(v, k -> new Variable("_R" + id + "_" + k.name()));
            }
            if (term instanceof Struct s) {
                List<Term> args = new ArrayList<>(s.arity());
                for (Term arg : s.args()) {
                    args.add(renameTerm(arg, mapping, id));
                }
                return new Struct(s.name(), args);
            }
            return term;
        }

        private static boolean compare(String op, Term left, Term right) {
            if (!(left instanceof Num l) || !(right instanceof Num r)) {
                return false;
            }
            return switch (op) {
                case "<" -> l.value() < r.value();
                case ">" -> l.value() > r.value();
                case "=<" -> l.value() <= r.value();
                case ">=" -> l.value() >= r.value();
                case "=:=" -> l.value() == r.value();
                case "=\\=" -> l.value() != r.value();
                default -> false;
            };
        }

        private static List<Term> prepend(List<Term> rest, Term... first) {
            List<Term> out = new ArrayList<>(first.length + rest.size());
            Collections.addAll(out, first);
            out.addAll(rest);
            return out;
        }
    }

    // ── Unification ──────────────────────────────────────────────────

    /**
     * Unifies two terms under the given bindings with occurs check. Returns the
     * extended bindings, or {@code null} when the terms do not unify.
     */
    static Map<Variable, Term> unify(Term a, Term b, Map<Variable, Term> bindings) {
        Term t1 = resolve(a, bindings);
        Term t2 = resolve(b, bindings);
        if (t1.equals(t2)) {
            return bindings;
        }
        if (t1 instanceof Variable v) {
            return bind(v, t2, bindings);
        }
        if (t2 instanceof Variable v) {
            return bind(v, t1, bindings);
        }
        if (t1 instanceof Struct s1 && t2 instanceof Struct s2) {
            if (!s1.name().equals(s2.name()) || s1.arity() != s2.arity()) {
                return null;
            }
            Map<Variable, Term> current = bindings;
            for (int i = 0; i < s1.arity(); i++) {
                current = unify(s1.args().get(i), s2.args().get(i), current);
                if (current == null) {
                    return null;
                }
            }
            return current;
        }
        return null;
    }

    private static Map<Variable, Term> bind(Variable v, Term value, Map<Variable, Term> bindings) {
        if (occurs(v, value, bindings)) {
            return null;
        }
        Map<Variable, Term> extended = new HashMap<>(bindings);
        extended.put(v, value);
        return extended;
    }

    private static boolean occurs(Variable v, Term term, Map<Variable, Term> bindings) {
        Term t = resolve(term, bindings);
        if (t instanceof Variable other) {
            return other.equals(v);
        }
        if (t instanceof Struct s) {
            for (Term arg : s.args()) {
                if (occurs(v, arg, bindings)) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Follows variable bindings at the top level only. */
    static Term resolve(Term term, Map<Variable, Term> bindings) {
        Term t = term;
        while (t instanceof Variable v && bindings.containsKey(v)) {
            t = bindings.get(v);
        }
        return t;
    }

    static Term resolveFully(Term term, Map<Variable, Term> bindings) {
        Term t = resolve(term, bindings);
        if (t instanceof Struct s) {
            List<Term> args = new ArrayList<>(s.arity());
            for (Term arg : s.args()) {
                args.add(resolveFully(arg, bindings));
            }
            return new Struct(s.name(), args);
        }
        return t;
    }

    // ── Rendering ────────────────────────────────────────────────────

    private static List<Variable> namedVariables(Term goal) {
        Map<String, Variable> seen = new LinkedHashMap<>();
        collectVariables(goal, seen);
        return new ArrayList<>(seen.values());
    }

    private static void collectVariables(Term term, Map<String, Variable> seen) {
        if (term instanceof Variable v && !v.name().startsWith("_")) {
            seen.putIfAbsent(v.name(), v);
        } else if (term instanceof Struct s) {
            s.args().forEach(arg -> collectVariables(arg, seen));
        }
    }

    private static String renderSolution(List<Variable> queryVars, Map<Variable, Term> bindings) {
        if (queryVars.isEmpty()) {
            return "true";
        }
        List<String> parts = new ArrayList<>(queryVars.size());
        for (Variable v : queryVars) {
            Term value = resolveFully(v, bindings);
            parts.add(v.name() + " = " + (value instanceof Variable ? "_" : value.toString()));
        }
        return String.join(", ", parts);
    }
}
