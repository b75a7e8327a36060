package com.mcr.core.reasoner;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Operator-precedence parser for the Prolog subset the reasoner understands:
 * atoms (plain, quoted and symbolic), variables, numbers, compound terms,
 * lists, and the standard control and comparison operators. Line and block
 * comments are skipped.
 */
public class TermParser {

    private enum Kind { ATOM, QUOTED, VAR, NUM, PUNCT, OP, END, EOF }

    private record Token(Kind kind, String text, boolean functor, int line, int col) {}

    private enum Assoc { XFX, XFY, YFX, FX, FY }

    private record Op(int priority, Assoc assoc) {}

    private static final Map<String, Op> INFIX = Map.ofEntries(
            Map.entry(":-", new Op(1200, Assoc.XFX)),
            Map.entry(";", new Op(1100, Assoc.XFY)),
            Map.entry("->", new Op(1050, Assoc.XFY)),
            Map.entry(",", new Op(1000, Assoc.XFY)),
            Map.entry("=", new Op(700, Assoc.XFX)),
            Map.entry("\\=", new Op(700, Assoc.XFX)),
            Map.entry("==", new Op(700, Assoc.XFX)),
            Map.entry("\\==", new Op(700, Assoc.XFX)),
            Map.entry("is", new Op(700, Assoc.XFX)),
            Map.entry("<", new Op(700, Assoc.XFX)),
            Map.entry(">", new Op(700, Assoc.XFX)),
            Map.entry("=<", new Op(700, Assoc.XFX)),
            Map.entry(">=", new Op(700, Assoc.XFX)),
            Map.entry("=:=", new Op(700, Assoc.XFX)),
            Map.entry("=\\=", new Op(700, Assoc.XFX)),
            Map.entry("+", new Op(500, Assoc.YFX)),
            Map.entry("-", new Op(500, Assoc.YFX)),
            Map.entry("*", new Op(400, Assoc.YFX)),
            Map.entry("/", new Op(400, Assoc.YFX)));

    private static final Map<String, Op> PREFIX = Map.of(
            ":-", new Op(1200, Assoc.FX),
            "?-", new Op(1200, Assoc.FX),
            "\\+", new Op(900, Assoc.FY),
            "-", new Op(200, Assoc.FY));

    private static final String SYMBOL_CHARS = "+-*/\\^<>=~:.?@#&$";

    private final List<Token> tokens;
    private int pos;
    private int anonymousCounter;
    /** Priority of the term most recently returned by {@link #parsePrimary}. */
    private int lastPrimaryPriority;

    private TermParser(String text) {
        this.tokens = tokenize(text);
    }

    /**
     * Parses a knowledge base into its clauses, each terminated by a full stop.
     */
    public static List<Term> parseClauses(String text) {
        var parser = new TermParser(text == null ? "" : text);
        var clauses = new ArrayList<Term>();
        while (parser.peek().kind() != Kind.EOF) {
            clauses.add(parser.parseTerm(1200));
            parser.expect(Kind.END, "end of clause '.'");
        }
        return clauses;
    }

    /**
     * Parses a single query. A leading {@code ?-} and a missing final full stop
     * are tolerated.
     */
    public static Term parseQuery(String text) {
        String q = text == null ? "" : text.strip();
        if (q.startsWith("?-")) {
            q = q.substring(2).strip();
        }
        if (q.isEmpty()) {
            throw new ClauseSyntaxException("Empty query", 1, 1);
        }
        if (!q.endsWith(".")) {
            q = q + ".";
        }
        var parser = new TermParser(q);
        Term term = parser.parseTerm(1200);
        parser.expect(Kind.END, "end of query '.'");
        if (parser.peek().kind() != Kind.EOF) {
            Token t = parser.peek();
            throw new ClauseSyntaxException("Query must be a single term, found '" + t.text() + "'",
                    t.line(), t.col());
        }
        return term;
    }

    // ── Parsing ──────────────────────────────────────────────────────

    private Term parseTerm(int maxPriority) {
        Term left = parsePrimary(maxPriority);
        int leftPriority = lastPrimaryPriority;
        while (true) {
            Token t = peek();
            String name = infixName(t);
            Op op = name == null ? null : INFIX.get(name);
            if (op == null || op.priority() > maxPriority) {
                break;
            }
            int leftMax = op.assoc() == Assoc.YFX ? op.priority() : op.priority() - 1;
            if (leftPriority > leftMax) {
                break;
            }
            advance();
            int rightMax = op.assoc() == Assoc.XFY ? op.priority() : op.priority() - 1;
            Term right = parseTerm(rightMax);
            left = new Term.Struct(name, left, right);
            leftPriority = op.priority();
        }
        lastPrimaryPriority = leftPriority;
        return left;
    }

    private Term parsePrimary(int maxPriority) {
        Token t = advance();
        Term term = parsePrimaryToken(t, maxPriority);
        boolean prefixApplied = t.kind() == Kind.OP && !t.functor()
                && term instanceof Term.Struct s && s.arity() == 1 && s.name().equals(t.text());
        if (!prefixApplied) {
            lastPrimaryPriority = 0;
        }
        return term;
    }

    private Term parsePrimaryToken(Token t, int maxPriority) {
        switch (t.kind()) {
            case NUM:
                return new Term.Num(Double.parseDouble(t.text()));
            case VAR:
                if (t.text().equals("_")) {
                    return new Term.Variable("_G" + (++anonymousCounter));
                }
                return new Term.Variable(t.text());
            case PUNCT:
                return parsePunct(t);
            case ATOM:
            case QUOTED:
            case OP:
                return parseNamed(t, maxPriority);
            case END:
            case EOF:
            default:
                throw new ClauseSyntaxException("Unexpected " + describe(t), t.line(), t.col());
        }
    }

    private Term parsePunct(Token t) {
        switch (t.text()) {
            case "(": {
                Term inner = parseTerm(1200);
                expectPunct(")");
                return inner;
            }
            case "[": {
                if (isPunct(peek(), "]")) {
                    advance();
                    return Term.NIL;
                }
                var elements = new ArrayList<Term>();
                elements.add(parseTerm(999));
                while (isPunct(peek(), ",")) {
                    advance();
                    elements.add(parseTerm(999));
                }
                Term tail = Term.NIL;
                if (isPunct(peek(), "|")) {
                    advance();
                    tail = parseTerm(999);
                }
                expectPunct("]");
                return Term.list(elements, tail);
            }
            case "!":
                return new Term.Atom("!");
            default:
                throw new ClauseSyntaxException("Unexpected '" + t.text() + "'", t.line(), t.col());
        }
    }

    private Term parseNamed(Token t, int maxPriority) {
        String name = t.text();
        if (t.functor() && isPunct(peek(), "(")) {
            advance();
            var args = new ArrayList<Term>();
            args.add(parseTerm(999));
            while (isPunct(peek(), ",")) {
                advance();
                args.add(parseTerm(999));
            }
            expectPunct(")");
            return new Term.Struct(name, args);
        }
        if (t.kind() == Kind.OP && name.equals("-") && peek().kind() == Kind.NUM) {
            return new Term.Num(-Double.parseDouble(advance().text()));
        }
        Op prefix = t.kind() == Kind.QUOTED ? null : PREFIX.get(name);
        if (prefix != null && startsTerm(peek())) {
            int priority = Math.min(prefix.priority(), maxPriority);
            int argMax = prefix.assoc() == Assoc.FY ? priority : priority - 1;
            Term arg = parseTerm(argMax);
            lastPrimaryPriority = priority;
            return new Term.Struct(name, arg);
        }
        return new Term.Atom(name);
    }

    private String infixName(Token t) {
        if (t.kind() == Kind.OP || (t.kind() == Kind.ATOM && t.text().equals("is"))) {
            return t.text();
        }
        if (t.kind() == Kind.PUNCT && (t.text().equals(",") || t.text().equals(";"))) {
            return t.text();
        }
        return null;
    }

    private boolean startsTerm(Token t) {
        return switch (t.kind()) {
            case ATOM, QUOTED, VAR, NUM -> true;
            case PUNCT -> t.text().equals("(") || t.text().equals("[") || t.text().equals("!");
            case OP -> PREFIX.containsKey(t.text()) || !INFIX.containsKey(t.text());
            default -> false;
        };
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token advance() {
        Token t = tokens.get(pos);
        if (t.kind() != Kind.EOF) {
            pos++;
        }
        return t;
    }

    private void expect(Kind kind, String what) {
        Token t = advance();
        if (t.kind() != kind) {
            throw new ClauseSyntaxException("Expected " + what + " but found " + describe(t), t.line(), t.col());
        }
    }

    private void expectPunct(String text) {
        Token t = advance();
        if (!isPunct(t, text)) {
            throw new ClauseSyntaxException("Expected '" + text + "' but found " + describe(t), t.line(), t.col());
        }
    }

    private static boolean isPunct(Token t, String text) {
        return t.kind() == Kind.PUNCT && t.text().equals(text);
    }

    private static String describe(Token t) {
        return switch (t.kind()) {
            case EOF -> "end of input";
            case END -> "'.'";
            default -> "'" + t.text() + "'";
        };
    }

    // ── Tokenizer ────────────────────────────────────────────────────

    private static List<Token> tokenize(String text) {
        var out = new ArrayList<Token>();
        int i = 0;
        int line = 1;
        int lineStart = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\n') {
                line++;
                lineStart = i + 1;
                i++;
                continue;
            }
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int col = i - lineStart + 1;
            if (c == '%') {
                while (i < n && text.charAt(i) != '\n') i++;
                continue;
            }
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                int close = text.indexOf("*/", i + 2);
                if (close < 0) {
                    throw new ClauseSyntaxException("Unterminated block comment", line, col);
                }
                for (int k = i; k < close; k++) {
                    if (text.charAt(k) == '\n') {
                        line++;
                        lineStart = k + 1;
                    }
                }
                i = close + 2;
                continue;
            }
            if (Character.isLowerCase(c)) {
                int start = i;
                while (i < n && isAlnum(text.charAt(i))) i++;
                out.add(new Token(Kind.ATOM, text.substring(start, i), i < n && text.charAt(i) == '(', line, col));
                continue;
            }
            if (Character.isUpperCase(c) || c == '_') {
                int start = i;
                while (i < n && isAlnum(text.charAt(i))) i++;
                out.add(new Token(Kind.VAR, text.substring(start, i), false, line, col));
                continue;
            }
            if (Character.isDigit(c)) {
                int start = i;
                while (i < n && Character.isDigit(text.charAt(i))) i++;
                if (i + 1 < n && text.charAt(i) == '.' && Character.isDigit(text.charAt(i + 1))) {
                    i++;
                    while (i < n && Character.isDigit(text.charAt(i))) i++;
                }
                out.add(new Token(Kind.NUM, text.substring(start, i), false, line, col));
                continue;
            }
            if (c == '\'' || c == '"') {
                var sb = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < n) {
                    char q = text.charAt(i);
                    if (q == c) {
                        if (i + 1 < n && text.charAt(i + 1) == c) {
                            sb.append(c);
                            i += 2;
                            continue;
                        }
                        closed = true;
                        i++;
                        break;
                    }
                    if (q == '\\' && i + 1 < n) {
                        char e = text.charAt(i + 1);
                        sb.append(e == 'n' ? '\n' : e == 't' ? '\t' : e);
                        i += 2;
                        continue;
                    }
                    sb.append(q);
                    i++;
                }
                if (!closed) {
                    throw new ClauseSyntaxException("Unterminated quoted atom", line, col);
                }
                out.add(new Token(Kind.QUOTED, sb.toString(), i < n && text.charAt(i) == '(', line, col));
                continue;
            }
            if ("()[],|!;".indexOf(c) >= 0) {
                out.add(new Token(Kind.PUNCT, String.valueOf(c), false, line, col));
                i++;
                continue;
            }
            if (SYMBOL_CHARS.indexOf(c) >= 0) {
                int start = i;
                while (i < n && SYMBOL_CHARS.indexOf(text.charAt(i)) >= 0) i++;
                String sym = text.substring(start, i);
                boolean atLayout = i >= n || Character.isWhitespace(text.charAt(i)) || text.charAt(i) == '%';
                if (sym.endsWith(".") && atLayout) {
                    if (sym.length() > 1) {
                        out.add(new Token(Kind.OP, sym.substring(0, sym.length() - 1), false, line, col));
                    }
                    out.add(new Token(Kind.END, ".", false, line, i - lineStart));
                    continue;
                }
                out.add(new Token(Kind.OP, sym, i < n && text.charAt(i) == '(', line, col));
                continue;
            }
            throw new ClauseSyntaxException("Unexpected character '" + c + "'", line, col);
        }
        out.add(new Token(Kind.EOF, "", false, line, n - lineStart + 1));
        return out;
    }

    private static boolean isAlnum(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
