package com.mcr.core.reasoner;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Logic term. Lists are encoded as {@code '.'(Head, Tail)} cells ending in the
 * atom {@code []}; {@link #toString()} renders them back in bracket notation.
 */
public sealed interface Term extends Serializable permits Term.Atom, Term.Variable, Term.Num, Term.Struct {

    Atom NIL = new Atom("[]");
    Atom TRUE = new Atom("true");
    String CONS = ".";

    record Atom(String name) implements Term {

        private static final Pattern PLAIN = Pattern.compile("^[a-z][a-zA-Z0-9_]*$");
        private static final Pattern SYMBOLIC = Pattern.compile("^[+\\-*/\\\\^<>=~:.?@#&$]+$");

        @Override
        public String toString() {
            if (PLAIN.matcher(name).matches() || SYMBOLIC.matcher(name).matches()
                    || name.equals("[]") || name.equals("!") || name.equals(";")) {
                return name;
            }
            return "'" + name.replace("'", "''") + "'";
        }
    }

    record Variable(String name) implements Term {
        @Override
        public String toString() {
            return name;
        }
    }

    record Num(double value) implements Term {
        @Override
        public String toString() {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
    }

    record Struct(String name, List<Term> args) implements Term {

        public Struct {
            args = List.copyOf(args);
        }

        public Struct(String name, Term... args) {
            this(name, List.of(args));
        }

        public int arity() {
            return args.size();
        }

        public String indicator() {
            return name + "/" + args.size();
        }

        @Override
        public String toString() {
            if (name.equals(CONS) && args.size() == 2) {
                return renderList();
            }
            if (args.size() == 2 && isInfix(name)) {
                String sep = name.equals(",") ? ", " : " " + name + " ";
                return args.get(0) + sep + args.get(1);
            }
            if (args.size() == 1 && name.equals("\\+")) {
                return "\\+ " + args.get(0);
            }
            var sb = new StringBuilder(new Atom(name).toString()).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(args.get(i));
            }
            return sb.append(')').toString();
        }

        private String renderList() {
            List<String> items = new ArrayList<>();
            Term cur = this;
            while (cur instanceof Struct s && s.name().equals(CONS) && s.args().size() == 2) {
                items.add(s.args().get(0).toString());
                cur = s.args().get(1);
            }
            String body = String.join(",", items);
            return NIL.equals(cur) ? "[" + body + "]" : "[" + body + "|" + cur + "]";
        }

        private static boolean isInfix(String op) {
            return switch (op) {
                case ",", ":-", ";", "=", "\\=", "==", "\\==", "->" -> true;
                default -> false;
            };
        }
    }

    static Term list(List<Term> elements, Term tail) {
        Term result = tail;
        for (int i = elements.size() - 1; i >= 0; i--) {
            result = new Struct(CONS, elements.get(i), result);
        }
        return result;
    }

    /**
     * Predicate indicator ({@code name/arity}) of a callable term, or {@code null}.
     */
    static String indicatorOf(Term term) {
        if (term instanceof Atom a) {
            return a.name() + "/0";
        }
        if (term instanceof Struct s) {
            return s.indicator();
        }
        return null;
    }
}
