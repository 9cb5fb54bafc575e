package org.brahmic;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.google.gson.GsonBuilder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

enum CharClass {
    // basic
    LETTER, DIGIT, DOT,
    // strings
    QUOTE,
    // whitespaces
    NL, WS,
    // arithmetic
    PLUS, MINUS, STAR, SLASH, PERCENT,
    // special
    COMMA, COLON,
    // parens, brackets and braces
    LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE,
    // relations and assignment
    EQUALS, LESS, GREATER, NOT,
    // represents a character outside of allowed alphabet
    NOT_A_CHAR;

    static CharClass classOfChar(char c) {
        // identifiers are ASCII only
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_') return LETTER;
        if (c >= '0' && c <= '9') return DIGIT;

        return switch (c) {
            case '.' -> DOT;
            case '"' -> QUOTE;
            case '\n' -> NL;
            case ' ', '\t', '\r' -> WS;
            case '+' -> PLUS;
            case '-' -> MINUS;
            case '*' -> STAR;
            case '/' -> SLASH;
            case '%' -> PERCENT;
            case ',' -> COMMA;
            case ':' -> COLON;
            case '(' -> LPAREN;
            case ')' -> RPAREN;
            case '[' -> LBRACKET;
            case ']' -> RBRACKET;
            case '{' -> LBRACE;
            case '}' -> RBRACE;
            case '=' -> EQUALS;
            case '<' -> LESS;
            case '>' -> GREATER;
            case '!' -> NOT;
            default -> NOT_A_CHAR;
        };
    }
}

public class Lexer {
    /*
     * Static data
     */
    static final Map<String, String> singleWordKeywords = Map.ofEntries(
        // control flow
        Map.entry("okavela", "if"),
        Map.entry("lekapothe", "else"),
        Map.entry("aite", ""),
        // func
        Map.entry("vidhanam", "def"),
        Map.entry("ivvu", "return"),
        // loops
        Map.entry("lo", "in"),
        Map.entry("ki", ""),
        Map.entry("aagipo", "break"),
        // logical
        Map.entry("mariyu", "and"),
        Map.entry("leda", "or"),
        Map.entry("avvakapote", "not"),
        // literals
        Map.entry("Nijam", "True"),
        Map.entry("Abaddam", "False"),
        // print
        Map.entry("cheppu", "print")
    );
    static final Map<String, String> multiWordKeywords;
    static final Pattern multiWordPattern;
    // iterable lo var ki  ->  for var in iterable, the iterable being a name or an integer
    static final Pattern forLoopPattern = Pattern.compile(
        "([A-Za-z_][A-Za-z0-9_]*|[0-9]+)[ \\t]+lo[ \\t]+([A-Za-z_][A-Za-z0-9_]*)[ \\t]+ki(?![A-Za-z0-9_])"
    );
    static final Pattern identPattern = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    static final Pattern intPattern = Pattern.compile("[0-9]+");
    static final Set<String> twoCharSymbols = Set.of("==", "!=", "<=", ">=");

    static {
        var phrases = new LinkedHashMap<String, String>();
        phrases.put("lekapothe okavela", "elif");
        phrases.put("unnanta varaku", "while");
        phrases.put("munduku vellu", "continue");
        multiWordKeywords = Collections.unmodifiableMap(phrases);

        // longest phrase first, words may be separated by any run of blanks
        var alternatives = multiWordKeywords.keySet()
            .stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(phrase -> Arrays.stream(phrase.split(" "))
                .map(Pattern::quote)
                .collect(Collectors.joining("[ \\t]+")))
            .collect(Collectors.joining("|"));
        multiWordPattern = Pattern.compile("(?:" + alternatives + ")(?![A-Za-z0-9_])");
    }

    /*
     * Globals
     */
    private static final Logger log = LogManager.getLogger("lexer");

    /*
     * Lexer state
     */
    int numChar = 0;
    int parenDepth = 0;

    /*
     * Output
     */
    public final ArrayList<Integer> lineIndex = new ArrayList<>(List.of(0));
    public final TreeMap<Span, Token> tokenTable = new TreeMap<>();
    public final ArrayList<LexicalError> errors = new ArrayList<>();

    /*
     * Lexer data
     */
    final String sourceCode;

    public Lexer(String sourceCode) {
        this.sourceCode = sourceCode;
    }

    // Populates tokenTable, lineIndex and errors. Never throws on bad input.
    public void lex() {
        while (this.numChar < this.sourceCode.length()) {
            var ch = this.sourceCode.charAt(this.numChar);
            var cls = CharClass.classOfChar(ch);
            log.debug("[{}] ch: {} {}", this.numChar, ch, cls);

            switch (cls) {
                case WS -> this.numChar++;
                case NL -> lexNewline();
                case LETTER, DIGIT -> lexWord();
                case QUOTE -> lexString();
                case NOT_A_CHAR -> {
                    report("E101", "unexpected symbol", String.valueOf(ch), this.numChar);
                    this.numChar++;
                }
                default -> lexSymbol(ch);
            }
        }
        log.debug("the end, {} tokens", this.tokenTable.size());
    }

    // Line breaks are only significant outside of parentheses, so that
    // argument lists may span several lines.
    void lexNewline() {
        if (this.parenDepth > 0) {
            this.numChar++;
            this.lineIndex.add(this.numChar);
            return;
        }

        int start = this.numChar;
        int breaks = 0;
        int end = this.numChar;
        int i = this.numChar;
        while (i < this.sourceCode.length()) {
            var c = this.sourceCode.charAt(i);
            if (c == '\n') {
                i++;
                breaks++;
                this.lineIndex.add(i);
                end = i;
            } else if (c == ' ' || c == '\t' || c == '\r') {
                i++;
            } else {
                break;
            }
        }

        // indentation of the next line stays unconsumed
        this.numChar = end;
        emit(start, new Newline(breaks));
    }

    void lexWord() {
        // 1. multi-word phrases win over their first word
        var phrase = match(multiWordPattern);
        if (phrase != null) {
            var normalized = phrase.group().trim().replaceAll("[ \\t]+", " ");
            emitMatch(phrase, new Keyword(multiWordKeywords.get(normalized)));
            return;
        }

        // 2. packed loop header, operands are reordered right here. Only a
        // line-leading word can be the whole iterable.
        var loop = atLineStart() ? match(forLoopPattern) : null;
        if (loop != null && !isReservedWord(loop.group(1)) && !isReservedWord(loop.group(2))) {
            var iterable = loop.group(1);
            var variable = loop.group(2);
            emitMatch(loop, new Keyword("for " + variable + " in " + iterable));
            return;
        }

        // 3. and 4. single keywords and identifiers
        var word = match(identPattern);
        if (word != null) {
            var text = word.group();
            Token token;
            if (singleWordKeywords.containsKey(text)) {
                token = new Keyword(singleWordKeywords.get(text));
            } else if (text.equals("in")) {
                // membership operator, not to be confused with `lo`
                token = new Symbol("in");
            } else {
                token = new Ident(text);
            }
            emitMatch(word, token);
            return;
        }

        // 5. integers
        var number = match(intPattern);
        emitMatch(number, new IntLiteral(number.group()));
    }

    void lexString() {
        int start = this.numChar;
        var value = new StringBuilder();

        int i = this.numChar + 1;
        while (i < this.sourceCode.length()) {
            var c = this.sourceCode.charAt(i);
            if (c == '"') {
                this.numChar = i + 1;
                emit(start, new StrLiteral(value.toString()));
                return;
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\' && i + 1 < this.sourceCode.length()) {
                var escaped = this.sourceCode.charAt(i + 1);
                if (escaped == '\n') {
                    break;
                }
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case '"' -> value.append('"');
                    case '\\' -> value.append('\\');
                    default -> value.append('\\').append(escaped);
                }
                i += 2;
                continue;
            }
            value.append(c);
            i++;
        }

        // skip the opening quote only, the rest is lexed as usual
        var lineEnd = this.sourceCode.indexOf('\n', start);
        var rest = this.sourceCode.substring(start, lineEnd < 0 ? this.sourceCode.length() : lineEnd);
        report("E103", "unterminated string literal", rest, start);
        this.numChar = start + 1;
    }

    void lexSymbol(char ch) {
        int start = this.numChar;
        if (start + 1 < this.sourceCode.length()) {
            var pair = this.sourceCode.substring(start, start + 2);
            if (twoCharSymbols.contains(pair)) {
                this.numChar += 2;
                emit(start, new Symbol(pair));
                return;
            }
        }

        if (ch == '!') {
            report("E101", "unexpected symbol", "!", start);
            this.numChar++;
            return;
        }

        this.numChar++;
        emit(start, new Symbol(String.valueOf(ch)));
    }

    // Words that never lex as plain names
    static boolean isReservedWord(String word) {
        return singleWordKeywords.containsKey(word) || word.equals("in");
    }

    boolean atLineStart() {
        return this.tokenTable.isEmpty() || this.tokenTable.lastEntry().getValue() instanceof Newline;
    }

    Matcher match(Pattern pattern) {
        var matcher = pattern.matcher(this.sourceCode);
        matcher.region(this.numChar, this.sourceCode.length());
        return matcher.lookingAt() ? matcher : null;
    }

    void emitMatch(Matcher matcher, Token token) {
        int start = this.numChar;
        this.numChar = matcher.end();
        emit(start, token);
    }

    // Put the token into the table along with the span info, then update the
    // paren depth from what was just emitted.
    void emit(int start, Token token) {
        var span = new Span(start + 1, this.numChar);
        this.tokenTable.put(span, token);
        log.debug("{} at {}", token, span);

        if (token instanceof Symbol s) {
            if (s.isSym("(")) {
                this.parenDepth++;
            } else if (s.isSym(")") && this.parenDepth > 0) {
                this.parenDepth--;
            }
        }
    }

    void report(String code, String reason, String lexeme, int offset) {
        var position = SpanUtils.locate(offset + 1, this.lineIndex);
        var error = new LexicalError(code, reason, lexeme, position);
        this.errors.add(error);
        log.warn(error.getMessage());
    }

    // Tokens in source order, each with its 1-based line
    public List<Lexeme> lexemes() {
        return this.tokenTable
            .entrySet()
            .stream()
            .map(kv -> new Lexeme(
                kv.getKey(),
                kv.getValue(),
                SpanUtils.lineAt(kv.getKey().start(), this.lineIndex)))
            .collect(Collectors.toUnmodifiableList());
    }

    public String toJson() {
        var gson = new GsonBuilder()
            .setPrettyPrinting()
            .create();

        return gson.toJson(this.tokenTable);
    }
}
