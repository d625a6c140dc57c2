package org.perlfront.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import org.perlfront.heredoc.HeredocCollector;
import org.perlfront.heredoc.HeredocContent;
import org.perlfront.heredoc.PendingHeredoc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The Lexer turns Perl source text into a stream of tokens, one at a time.
 * <p>
 * Perl cannot be tokenized without knowing what came before: a {@code /} is a division
 * after an operand and the start of a pattern everywhere else, {@code %} is a sigil or
 * the modulo operator, {@code <<} starts a heredoc or shifts. The lexer keeps a
 * {@link SlashContext} that is updated from the kind of every token it emits, and
 * consults it whenever one of those characters shows up.
 * <p>
 * Whitespace, comments and POD are skipped and never produce tokens. When a newline is
 * crossed while heredoc declarations are pending, their bodies are collected right there
 * and the cursor jumps past the last terminator line.
 * <p>
 * Malformed input never throws: it produces an {@link LexerTokenType#ERROR} token with a
 * message and lexing carries on after it.
 */
public class Lexer {
    public static final int MAX_PENDING_HEREDOCS = 100;
    public static final int MAX_QUOTE_BODY = 1 << 20;

    /**
     * Words that are always operators.
     */
    public static final Set<String> WORD_OPERATORS = Set.of(
            "and", "or", "xor", "not", "lt", "gt", "le", "ge", "eq", "ne", "cmp");

    /**
     * Words the parser dispatches on. After any of them an operand is expected,
     * so {@code split /,/} and {@code return /x/} lex as patterns.
     */
    public static final Set<String> KEYWORDS = Set.of(
            "if", "unless", "elsif", "else", "while", "until", "for", "foreach", "continue",
            "do", "eval", "sub", "my", "our", "local", "state", "field", "method", "class",
            "package", "use", "no", "require", "return", "last", "next", "redo", "goto", "dump",
            "BEGIN", "END", "INIT", "CHECK", "UNITCHECK", "given", "when", "default", "break",
            "try", "catch", "finally", "defer", "format",
            "print", "printf", "say", "die", "warn", "split", "grep", "map", "sort", "join",
            "push", "unshift", "splice", "reverse", "unlink", "defined", "ref", "scalar",
            "undef", "exists", "delete", "tie", "untie", "tied", "bless",
            // named operators whose argument may start with % or /
            "keys", "values", "each", "lc", "uc", "lcfirst", "ucfirst", "length", "chomp", "chop");

    private static final Set<String> QUOTE_OPERATORS = Set.of("q", "qq", "qw", "qr", "qx", "m", "s", "tr", "y");

    private static final String FILE_TESTS = "rwxoRWXOezsfdlpSbcugktTBAMC";
    private static final String SPECIAL_PUNCTUATION = "&`'+!@/\\,;.<>|?0-=~%:^]";
    private static final Pattern PROTOTYPE_BODY = Pattern.compile("[\\s$@%&*;\\\\\\[\\]+_]*");
    private static final Pattern FORMAT_HEADER = Pattern.compile("[ \\t]*(?:[A-Za-z_][\\w:]*)?[ \\t]*=[ \\t]*\\r?");

    private final SourceText source;
    private final String input;
    private final int length;
    private final LexerStatistics statistics;

    // Current position in the input, as a char index
    private int position;
    private SlashContext context = SlashContext.EXPECT_OPERAND;
    private LexerToken previous;
    private boolean sawNewline;
    // 1 after "format NAME" at statement start, 2 once its "=" has been emitted
    private int formatState;
    // Inside the header of a sub, method, field or class, where attributes are read raw
    private boolean declarationHeader;
    private int headerParenDepth;
    // Right after "sub" or "sub NAME", where a prototype may follow
    private boolean prototypeAllowed;

    private final Deque<PendingHeredoc> pendingHeredocs = new ArrayDeque<>();
    private final Deque<LexerToken> lookahead = new ArrayDeque<>();

    public Lexer(String input) {
        this(new SourceText(input), LexerStatistics.NONE);
    }

    public Lexer(SourceText source, LexerStatistics statistics) {
        this.source = source;
        this.input = source.text();
        this.length = input.length();
        this.statistics = statistics;
        this.position = 0;
    }

    public SlashContext getContext() {
        return context;
    }

    /**
     * Tokenizes the whole input. The returned list ends with a single EOF token.
     */
    public List<LexerToken> tokenize() {
        List<LexerToken> tokens = new ArrayList<>();
        LexerToken token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type != LexerTokenType.EOF);
        return tokens;
    }

    /**
     * Returns the next token without consuming it.
     */
    public LexerToken peekToken() {
        if (lookahead.isEmpty()) {
            lookahead.add(produce());
        }
        return lookahead.peek();
    }

    /**
     * Returns the next token. Once the input is exhausted every call returns an EOF token.
     */
    public LexerToken nextToken() {
        if (!lookahead.isEmpty()) {
            return lookahead.poll();
        }
        return produce();
    }

    private LexerToken produce() {
        LexerToken token;
        if (formatState == 2) {
            formatState = 0;
            token = consumeFormatBody();
        } else {
            skipWhitespaceAndComments();
            if (position >= length) {
                LexerToken eof = new LexerToken(LexerTokenType.EOF, "", Span.at(source.byteLength()));
                eof.newlineBefore = sawNewline;
                return eof;
            }
            token = consumeToken();
        }
        token.newlineBefore = sawNewline;
        sawNewline = false;
        updateContext(token);
        return token;
    }

    private LexerToken consumeToken() {
        char current = input.charAt(position);
        int currentCp = getCurrentCodePoint();

        if (declarationHeader && headerParenDepth > 0 && (current == '$' || current == '@' || current == '%')
                && position + 1 < length && ",)=".indexOf(input.charAt(position + 1)) >= 0) {
            // placeholder parameter in a signature: ($, $y) or (@)
            position++;
            return token(LexerTokenType.SIGIL, position - 1);
        }
        if (declarationHeader && headerParenDepth == 0) {
            if (current == '(' && prototypeAllowed) {
                LexerToken prototype = consumePrototype();
                if (prototype != null) {
                    return prototype;
                }
            } else if (isPerlIdentifierStart(currentCp) && previous != null
                    && (previous.isOperator(":") || previous.type == LexerTokenType.ATTRIBUTE)) {
                return consumeAttribute();
            }
        }

        if (current >= '0' && current <= '9') {
            return consumeNumber();
        } else if (current == '.' && context == SlashContext.EXPECT_OPERAND && isDigitAt(position + 1)) {
            return consumeNumber();
        } else if (isPerlIdentifierStart(currentCp)) {
            return consumeWord();
        } else if (current < 128) {
            return consumeOperator();
        } else {
            int start = position;
            advanceCodePoint(currentCp);
            return error(start, String.format("Unrecognized character \\x{%X}", currentCp));
        }
    }

    private void updateContext(LexerToken token) {
        if (formatState == 1 && !token.isOperator("=") && token.type != LexerTokenType.IDENTIFIER
                && !token.isWord("format")) {
            formatState = 0;
        }
        switch (token.type) {
            case KEYWORD, SIGIL -> context = SlashContext.EXPECT_OPERAND;
            case OPERATOR -> {
                switch (token.text) {
                    case ")", "]", "}" -> context = SlashContext.EXPECT_OPERATOR;
                    // postfix keeps the operator context, prefix keeps the operand context
                    case "++", "--" -> {
                    }
                    default -> context = SlashContext.EXPECT_OPERAND;
                }
            }
            default -> {
                if (token.type.endsOperand()) {
                    context = SlashContext.EXPECT_OPERATOR;
                }
            }
        }
        updateDeclarationHeader(token);
        previous = token;
    }

    private void updateDeclarationHeader(LexerToken token) {
        boolean subKeyword = token.isWord("sub") && token.type == LexerTokenType.KEYWORD
                || token.isWord("method") && token.type == LexerTokenType.KEYWORD;
        prototypeAllowed = subKeyword || prototypeAllowed && token.type == LexerTokenType.IDENTIFIER;
        if (subKeyword || token.type == LexerTokenType.KEYWORD
                && (token.text.equals("field") || token.text.equals("class"))) {
            declarationHeader = true;
            headerParenDepth = 0;
            return;
        }
        if (!declarationHeader || token.type != LexerTokenType.OPERATOR) {
            return;
        }
        switch (token.text) {
            case "(" -> headerParenDepth++;
            case ")" -> {
                if (headerParenDepth > 0) {
                    headerParenDepth--;
                } else {
                    declarationHeader = false;
                }
            }
            case "{", "}", ";", "=", ",", "=>" -> {
                if (headerParenDepth == 0) {
                    declarationHeader = false;
                }
            }
            default -> {
            }
        }
    }

    // ------------------------------------------------------------------
    // Whitespace, comments, POD and heredoc bodies

    private void skipWhitespaceAndComments() {
        while (position < length) {
            char c = input.charAt(position);
            if (c == '\n') {
                position++;
                sawNewline = true;
                if (!pendingHeredocs.isEmpty()) {
                    resolveHeredocs();
                }
            } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                position++;
            } else if (c == '#') {
                while (position < length && input.charAt(position) != '\n') {
                    position++;
                }
            } else if (c == '=' && isLineStart(position) && position + 1 < length
                    && Character.isLetter(input.charAt(position + 1))) {
                skipPod();
            } else {
                break;
            }
        }
        if (position >= length && !pendingHeredocs.isEmpty()) {
            resolveHeredocs();
        }
    }

    private boolean isLineStart(int index) {
        return index == 0 || input.charAt(index - 1) == '\n';
    }

    private void skipPod() {
        while (position < length) {
            int eol = input.indexOf('\n', position);
            int next = eol < 0 ? length : eol + 1;
            boolean cut = input.startsWith("=cut", position)
                    && (position + 4 >= length || !Character.isLetterOrDigit(input.charAt(position + 4)));
            position = next;
            if (cut) {
                sawNewline = true;
                return;
            }
        }
    }

    private void resolveHeredocs() {
        List<PendingHeredoc> pending = new ArrayList<>(pendingHeredocs);
        pendingHeredocs.clear();
        HeredocCollector.Result result = HeredocCollector.collectAll(source, source.byteOffset(position), pending);
        List<HeredocContent> contents = result.contents();
        for (int i = 0; i < pending.size(); i++) {
            pending.get(i).resolve(contents.get(i));
        }
        position = source.charIndex(result.nextOffset());
    }

    // ------------------------------------------------------------------
    // Numbers

    public LexerToken consumeNumber() {
        int start = position;
        char c = input.charAt(position);
        if (c == '0' && position + 1 < length) {
            char radix = Character.toLowerCase(input.charAt(position + 1));
            if (radix == 'x') {
                return consumeRadixNumber(start, 16, "hexadecimal");
            } else if (radix == 'b') {
                return consumeRadixNumber(start, 2, "binary");
            } else if (radix == 'o') {
                return consumeRadixNumber(start, 8, "octal");
            } else if (isDigitAt(position + 1)) {
                position++;
                return consumeDigits(start, 8, "octal");
            }
        }

        LexerTokenType type = LexerTokenType.INTEGER;
        skipDecimalDigits();
        if (position < length && input.charAt(position) == '.' && isDigitAt(position + 1)) {
            type = LexerTokenType.FLOAT;
            position++;
            skipDecimalDigits();
            if (position < length && input.charAt(position) == '.' && isDigitAt(position + 1)) {
                // 1.2.3 is a version string
                while (position < length && input.charAt(position) == '.' && isDigitAt(position + 1)) {
                    position++;
                    skipDecimalDigits();
                }
                return token(LexerTokenType.VERSION, start);
            }
        }
        if (position < length && (input.charAt(position) == 'e' || input.charAt(position) == 'E')) {
            int exponent = position;
            position++;
            if (position < length && (input.charAt(position) == '+' || input.charAt(position) == '-')) {
                position++;
            }
            if (isDigitAt(position)) {
                skipDecimalDigits();
                type = LexerTokenType.FLOAT;
            } else {
                position = exponent;
            }
        }
        return token(type, start);
    }

    private LexerToken consumeRadixNumber(int start, int radix, String name) {
        position += 2;
        if (position >= length || Character.digit(input.charAt(position), 16) < 0 && input.charAt(position) != '_') {
            return error(start, "No digits found for " + name + " literal");
        }
        return consumeDigits(start, radix, name);
    }

    private LexerToken consumeDigits(int start, int radix, String name) {
        while (position < length) {
            char c = input.charAt(position);
            if (c == '_' || Character.digit(c, radix) >= 0) {
                position++;
            } else if (Character.isLetterOrDigit(c)) {
                int bad = position;
                while (position < length && (Character.isLetterOrDigit(input.charAt(position)) || input.charAt(position) == '_')) {
                    position++;
                }
                return error(start, "Illegal " + name + " digit '" + input.charAt(bad) + "'");
            } else {
                break;
            }
        }
        return token(LexerTokenType.INTEGER, start);
    }

    private void skipDecimalDigits() {
        while (position < length && (isDigitAt(position) || input.charAt(position) == '_')) {
            position++;
        }
    }

    private boolean isDigitAt(int index) {
        return index < length && input.charAt(index) >= '0' && input.charAt(index) <= '9';
    }

    // ------------------------------------------------------------------
    // Words

    public LexerToken consumeWord() {
        int start = position;
        boolean afterArrow = previous != null && previous.isOperator("->");
        String word = consumeIdentifierChars(true);

        if (word.equals("__END__") || word.equals("__DATA__")) {
            position = length;
            return token(LexerTokenType.DATA_SECTION, start);
        }
        if (afterArrow) {
            return identifier(start, word, LexerTokenType.IDENTIFIER);
        }
        if (QUOTE_OPERATORS.contains(word) && !isFileTest(start, word) && !(previous != null && previous.isWord("sub"))) {
            int delimiter = findQuoteDelimiter(position);
            if (delimiter >= 0) {
                position = delimiter;
                return consumeQuoteLike(word, start);
            }
        }
        if (isFatCommaNext()) {
            return identifier(start, word, LexerTokenType.IDENTIFIER);
        }
        if (word.length() > 1 && word.charAt(0) == 'v' && word.chars().skip(1).allMatch(Character::isDigit)) {
            while (position < length && input.charAt(position) == '.' && isDigitAt(position + 1)) {
                position++;
                skipDecimalDigits();
            }
            return token(LexerTokenType.VERSION, start);
        }
        if (context == SlashContext.EXPECT_OPERATOR && word.charAt(0) == 'x'
                && word.chars().skip(1).allMatch(Character::isDigit)) {
            // "x3" is the repetition operator followed by a count
            position = start + 1;
            if (word.length() == 1 && position < length && input.charAt(position) == '='
                    && !input.startsWith("==", position) && !input.startsWith("=~", position)) {
                position++;
            }
            return token(LexerTokenType.OPERATOR, start);
        }
        if (WORD_OPERATORS.contains(word) || word.equals("isa") && context == SlashContext.EXPECT_OPERATOR) {
            return token(LexerTokenType.OPERATOR, start);
        }
        if (word.equals("format") && context == SlashContext.EXPECT_OPERAND && isStatementStart()
                && FORMAT_HEADER.matcher(restOfLine()).matches()) {
            formatState = 1;
            return token(LexerTokenType.KEYWORD, start);
        }
        if (KEYWORDS.contains(word)) {
            return token(LexerTokenType.KEYWORD, start);
        }
        return identifier(start, word, LexerTokenType.IDENTIFIER);
    }

    /**
     * Reads identifier characters including {@code ::} package separators. With
     * {@code allowApostrophe} the legacy {@code '} separator is accepted as well.
     */
    private String consumeIdentifierChars(boolean allowApostrophe) {
        int start = position;
        if (!input.startsWith("::", position)) {
            advanceCodePoint(getCurrentCodePoint());
        }
        while (position < length) {
            int cp = getCurrentCodePoint();
            if (isPerlIdentifierPart(cp)) {
                advanceCodePoint(cp);
            } else if (input.startsWith("::", position)) {
                position += 2;
            } else if (allowApostrophe && cp == '\'' && position + 1 < length
                    && isPerlIdentifierStart(input.codePointAt(position + 1))) {
                String sofar = input.substring(start, position);
                if (KEYWORDS.contains(sofar) || QUOTE_OPERATORS.contains(sofar)) {
                    break;
                }
                position++;
            } else {
                break;
            }
        }
        return input.substring(start, position);
    }

    private LexerToken identifier(int start, String word, LexerTokenType type) {
        recordStatistics(word);
        return token(type, start);
    }

    private void recordStatistics(String name) {
        boolean unicode = false;
        boolean emoji = false;
        for (int i = 0; i < name.length(); ) {
            int cp = name.codePointAt(i);
            if (cp >= 0x80) {
                unicode = true;
                emoji |= isEmoji(cp);
            }
            i += Character.charCount(cp);
        }
        if (unicode) {
            statistics.unicodeIdentifier(name);
        }
        if (emoji) {
            statistics.emojiIdentifier(name);
        }
    }

    private boolean isFileTest(int start, String word) {
        return word.length() == 1 && FILE_TESTS.indexOf(word.charAt(0)) >= 0
                && previous != null && previous.isOperator("-")
                && previous.span.end() == source.byteOffset(start);
    }

    private boolean isStatementStart() {
        return previous == null || previous.isOperator(";") || previous.isOperator("}");
    }

    private String restOfLine() {
        int eol = input.indexOf('\n', position);
        return input.substring(position, eol < 0 ? length : eol);
    }

    private boolean isFatCommaNext() {
        int p = position;
        while (p < length && (input.charAt(p) == ' ' || input.charAt(p) == '\t')) {
            p++;
        }
        return input.startsWith("=>", p);
    }

    /**
     * Returns the index of the opening delimiter when a quote operator is followed by
     * one, or -1 when the word is an ordinary bareword ({@code s => 1}, {@code $h{q}}).
     */
    private int findQuoteDelimiter(int from) {
        int p = from;
        while (p < length && isAsciiWhitespace(input.charAt(p))) {
            p++;
        }
        if (p >= length) {
            return -1;
        }
        char d = input.charAt(p);
        if (d == '=' && input.startsWith("=>", p)) {
            return -1;
        }
        if (d == ',' || d == ';' || d == ')' || d == ']' || d == '}' || d == '>') {
            return -1;
        }
        if (d == '#' && p > from) {
            return -1;
        }
        if (d >= 128 || Character.isLetterOrDigit(d) || d == '_') {
            return -1;
        }
        return p;
    }

    // ------------------------------------------------------------------
    // Quote-like operators

    private static char closingDelimiter(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            case '<' -> '>';
            default -> open;
        };
    }

    private static LexerTokenType quoteType(String operator) {
        return switch (operator) {
            case "q" -> LexerTokenType.QUOTE;
            case "qq" -> LexerTokenType.QUOTE_DOUBLE;
            case "qw" -> LexerTokenType.QUOTE_WORDS;
            case "qr" -> LexerTokenType.QUOTE_REGEX;
            case "qx", "`" -> LexerTokenType.QUOTE_COMMAND;
            case "m", "/" -> LexerTokenType.MATCH;
            case "s" -> LexerTokenType.SUBSTITUTION;
            case "tr", "y" -> LexerTokenType.TRANSLITERATION;
            case "\"" -> LexerTokenType.INTERPOLATED_STRING;
            default -> LexerTokenType.STRING;
        };
    }

    /**
     * Consumes a quote-like construct whose opening delimiter is at {@code position}.
     *
     * @param operator the quote operator, or the delimiter itself for bare quotes and patterns
     * @param start    index where the token starts
     */
    private LexerToken consumeQuoteLike(String operator, int start) {
        char open = input.charAt(position);
        char close = closingDelimiter(open);
        position++;

        String body = readDelimited(open, close);
        if (body == null) {
            return error(start, "Can't find string terminator \"" + close + "\" anywhere before EOF");
        }

        String replacement = null;
        boolean twoBodies = operator.equals("s") || operator.equals("tr") || operator.equals("y");
        if (twoBodies) {
            char open2 = open;
            char close2 = close;
            if (open != close) {
                while (position < length && isAsciiWhitespace(input.charAt(position))) {
                    position++;
                }
                if (position < length) {
                    open2 = input.charAt(position);
                    close2 = closingDelimiter(open2);
                    position++;
                } else {
                    open2 = 0;
                }
            }
            replacement = open2 == 0 ? null : readDelimited(open2, close2);
            if (replacement == null) {
                position = length;
                return error(start, (operator.equals("s") ? "Substitution" : "Transliteration")
                        + " replacement not terminated");
            }
        }

        QuoteModifiers.ModifierSpec spec = QuoteModifiers.forOperator(operator);
        String modifiers = "";
        if (spec != QuoteModifiers.NONE) {
            int modifierStart = position;
            while (position < length && isAsciiLetter(input.charAt(position))) {
                position++;
            }
            try {
                modifiers = QuoteModifiers.canonicalize(input.substring(modifierStart, position), spec);
            } catch (IllegalArgumentException e) {
                return error(start, e.getMessage());
            }
        }

        if (body.length() > MAX_QUOTE_BODY || replacement != null && replacement.length() > MAX_QUOTE_BODY) {
            return error(start, "Quote body exceeds " + MAX_QUOTE_BODY + " characters");
        }
        LexerTokenType type = quoteType(operator);
        if ((type == LexerTokenType.MATCH || type == LexerTokenType.QUOTE_REGEX || type == LexerTokenType.SUBSTITUTION)
                && RegexSafety.lookbehindDepth(body) > RegexSafety.MAX_LOOKBEHIND_DEPTH) {
            return error(start, "Regex lookbehind nesting exceeds " + RegexSafety.MAX_LOOKBEHIND_DEPTH + " levels");
        }

        LexerToken token = token(type, start);
        token.quote = new QuoteParts(operator, open, close, body, replacement, modifiers);
        return token;
    }

    /**
     * Reads up to the matching close delimiter, honoring backslash escapes and nesting of
     * paired delimiters. Returns the body without delimiters, or null if the input ends first.
     */
    private String readDelimited(char open, char close) {
        int bodyStart = position;
        int depth = 1;
        while (position < length) {
            char c = input.charAt(position);
            if (c == '\\' && position + 1 < length) {
                position += 2;
                continue;
            }
            if (open != close && c == open) {
                depth++;
            } else if (c == close && --depth == 0) {
                String body = input.substring(bodyStart, position);
                position++;
                return body;
            }
            position++;
        }
        return null;
    }

    // ------------------------------------------------------------------
    // Heredocs, readline and glob

    /**
     * Tries to read a heredoc declaration at {@code position}. Returns null, leaving the
     * cursor untouched, when the {@code <<} is a shift operator.
     */
    private LexerToken consumeHeredoc(boolean quotedOnly) {
        int start = position;
        int p = position + 2;
        boolean indent = false;
        if (p < length && input.charAt(p) == '~') {
            indent = true;
            p++;
        }
        int q = p;
        while (q < length && (input.charAt(q) == ' ' || input.charAt(q) == '\t')) {
            q++;
        }
        if (q >= length) {
            return null;
        }
        char c = input.charAt(q);
        String label;
        PendingHeredoc.QuoteKind kind;
        int end;
        if (c == '"' || c == '\'' || c == '`') {
            int close = q + 1;
            while (close < length && input.charAt(close) != c && input.charAt(close) != '\n') {
                close++;
            }
            if (close >= length || input.charAt(close) != c) {
                return null;
            }
            label = input.substring(q + 1, close);
            kind = c == '"' ? PendingHeredoc.QuoteKind.DOUBLE
                    : c == '\'' ? PendingHeredoc.QuoteKind.SINGLE : PendingHeredoc.QuoteKind.COMMAND;
            end = close + 1;
        } else if (quotedOnly && !indent) {
            return null;
        } else if (q == p && c == '\\' && p + 1 < length && isPerlIdentifierStart(input.codePointAt(p + 1))) {
            position = p + 1;
            label = consumeIdentifierChars(false);
            kind = PendingHeredoc.QuoteKind.SINGLE;
            end = position;
        } else if (q == p && isPerlIdentifierStart(input.codePointAt(p))) {
            position = p;
            label = consumeIdentifierChars(false);
            kind = PendingHeredoc.QuoteKind.UNQUOTED;
            end = position;
        } else {
            position = start;
            return null;
        }

        position = end;
        if (pendingHeredocs.size() >= MAX_PENDING_HEREDOCS) {
            return error(start, "Too many pending heredocs (max " + MAX_PENDING_HEREDOCS + ")");
        }
        LexerToken token = token(LexerTokenType.HEREDOC, start);
        token.heredoc = new PendingHeredoc(label, indent, kind, token.span);
        pendingHeredocs.add(token.heredoc);
        return token;
    }

    /**
     * Reads {@code <$fh>}, {@code <STDIN>}, {@code <>} or a {@code <*.c>} glob. Returns null
     * when the angle bracket is a comparison.
     */
    private LexerToken consumeAngle() {
        int start = position;
        if (input.startsWith("<<>>", position)) {
            position += 4;
            return token(LexerTokenType.READLINE, start);
        }
        int close = position + 1;
        while (close < length && input.charAt(close) != '>' && input.charAt(close) != '\n') {
            close++;
        }
        if (close >= length || input.charAt(close) != '>') {
            return null;
        }
        String inside = input.substring(position + 1, close);
        if (inside.startsWith("=") || inside.startsWith("<")) {
            return null;
        }
        position = close + 1;
        if (inside.isEmpty() || inside.matches("\\$?[A-Za-z_][\\w:]*")) {
            return token(LexerTokenType.READLINE, start);
        }
        return token(LexerTokenType.GLOB, start);
    }

    private LexerToken consumeFormatBody() {
        int start = position;
        while (position < length && input.charAt(position) != '\n') {
            position++;
        }
        if (position < length) {
            position++;
        }
        int bodyStart = position;
        boolean terminated = false;
        while (position < length) {
            int eol = input.indexOf('\n', position);
            int lineEnd = eol < 0 ? length : eol;
            String line = input.substring(position, lineEnd);
            position = eol < 0 ? length : eol + 1;
            if (line.equals(".") || line.equals(".\r")) {
                terminated = true;
                break;
            }
        }
        LexerToken token = new LexerToken(LexerTokenType.FORMAT_BODY, input.substring(bodyStart, position),
                source.span(bodyStart, position));
        if (!terminated) {
            token.errorMessage = "Format not terminated";
        }
        sawNewline = sawNewline || start != bodyStart;
        return token;
    }

    // ------------------------------------------------------------------
    // Variables

    private LexerToken consumeScalar() {
        int start = position;
        int p = position + 1;
        boolean afterArrow = previous != null && previous.isOperator("->");
        char n = p < length ? input.charAt(p) : 0;

        if (n == '#') {
            char m = p + 1 < length ? input.charAt(p + 1) : 0;
            if (afterArrow && m == '*') {
                position += 3;
                return token(LexerTokenType.POSTFIX_DEREF, start);
            }
            if (m == '{' || m == '$') {
                position += 2;
                return token(LexerTokenType.SIGIL, start);
            }
            if (p + 1 < length && (isPerlIdentifierStart(input.codePointAt(p + 1)) || input.startsWith("::", p + 1))) {
                position = p + 1;
                String name = consumeIdentifierChars(true);
                recordStatistics(name);
                return token(LexerTokenType.ARRAY_LENGTH, start);
            }
            position += 2;
            return token(LexerTokenType.SCALAR, start);
        }
        if (afterArrow && n == '*') {
            position += 2;
            return token(LexerTokenType.POSTFIX_DEREF, start);
        }
        if (n == '{') {
            if (input.startsWith("{^", p)) {
                int close = input.indexOf('}', p);
                if (close > 0) {
                    position = close + 1;
                    return token(LexerTokenType.SCALAR, start);
                }
            }
            position++;
            return token(LexerTokenType.SIGIL, start);
        }
        if (n == '$') {
            char m = p + 1 < length ? input.charAt(p + 1) : 0;
            if (m == '$' || m == '{' || m == ':' || p + 1 < length && isPerlIdentifierStart(input.codePointAt(p + 1))) {
                position++;
                return token(LexerTokenType.SIGIL, start);
            }
            position += 2;
            return token(LexerTokenType.SCALAR, start);
        }
        return consumeNamedVariable(start, LexerTokenType.SCALAR, true);
    }

    /**
     * Reads the name after a sigil at {@code start}. Returns null when no name follows.
     */
    private LexerToken consumeVariableName(int start, LexerTokenType type, boolean punctuation) {
        int p = start + 1;
        if (p >= length) {
            return null;
        }
        char n = input.charAt(p);
        if (input.startsWith("::", p) || isPerlIdentifierStart(input.codePointAt(p))) {
            position = p;
            String name = consumeIdentifierChars(true);
            recordStatistics(name);
            return token(type, start);
        }
        if (n >= '0' && n <= '9') {
            position = p;
            skipDecimalDigits();
            return token(type, start);
        }
        if (n == '^' && p + 1 < length && (Character.isUpperCase(input.charAt(p + 1)) || "[]^_?\\".indexOf(input.charAt(p + 1)) >= 0)) {
            position = p + 2;
            return token(type, start);
        }
        if (punctuation && SPECIAL_PUNCTUATION.indexOf(n) >= 0) {
            position = p + 1;
            return token(type, start);
        }
        return null;
    }

    private LexerToken consumeNamedVariable(int start, LexerTokenType type, boolean punctuation) {
        LexerToken token = consumeVariableName(start, type, punctuation);
        if (token != null) {
            return token;
        }
        position = start + 1;
        return token(LexerTokenType.SIGIL, start);
    }

    /**
     * Handles {@code @}, {@code %}, {@code &} and {@code *} in operand position. Returns null
     * when the character should be read as an operator instead.
     */
    private LexerToken consumeSigil(char sigil, LexerTokenType type) {
        int start = position;
        int p = position + 1;
        char n = p < length ? input.charAt(p) : 0;
        if (previous != null && previous.isOperator("->")) {
            if (n == '*') {
                position += 2;
                return token(LexerTokenType.POSTFIX_DEREF, start);
            }
            if (n == '[' || n == '{') {
                position++;
                return token(LexerTokenType.SIGIL, start);
            }
        }
        if (n == '{' || n == '$') {
            position++;
            return token(LexerTokenType.SIGIL, start);
        }
        if ((sigil == '@' || sigil == '%') && (n == '-' || n == '+')) {
            position += 2;
            return token(type, start);
        }
        LexerToken named = consumeVariableName(start, type, false);
        if (named != null) {
            return named;
        }
        position = start;
        return null;
    }

    // ------------------------------------------------------------------
    // Prototypes and attributes

    /**
     * Reads {@code ($$;@)} after {@code sub NAME} as one token. Returns null, consuming
     * nothing, when the parentheses hold a signature instead.
     */
    private LexerToken consumePrototype() {
        int start = position;
        int close = input.indexOf(')', position + 1);
        if (close < 0 || !PROTOTYPE_BODY.matcher(input.substring(position + 1, close)).matches()) {
            return null;
        }
        position = close + 1;
        return token(LexerTokenType.PROTOTYPE, start);
    }

    /**
     * Reads an attribute name and its parenthesized argument, if any. The argument is
     * raw text; nested parentheses must balance and a backslash escapes the next character.
     */
    private LexerToken consumeAttribute() {
        int start = position;
        consumeIdentifierChars(false);
        if (position < length && input.charAt(position) == '(') {
            int depth = 0;
            int p = position;
            while (p < length) {
                char c = input.charAt(p);
                if (c == '\\') {
                    p += 2;
                    continue;
                }
                if (c == '(') {
                    depth++;
                } else if (c == ')' && --depth == 0) {
                    break;
                }
                p++;
            }
            if (p >= length) {
                position = length;
                return error(start, "Unterminated attribute parameter in attribute list");
            }
            position = p + 1;
        }
        return token(LexerTokenType.ATTRIBUTE, start);
    }

    // ------------------------------------------------------------------
    // Operators

    public LexerToken consumeOperator() {
        int start = position;
        char current = input.charAt(position);
        boolean operand = context == SlashContext.EXPECT_OPERAND;
        switch (current) {
            case '$':
                return consumeScalar();
            case '@': {
                LexerToken token = consumeSigil('@', LexerTokenType.ARRAY);
                return token != null ? token : operator("@");
            }
            case '%':
                if (operand) {
                    LexerToken token = consumeSigil('%', LexerTokenType.HASH);
                    if (token != null) {
                        return token;
                    }
                }
                return operator("%=", "%");
            case '&':
                if (operand && !input.startsWith("&&", position)) {
                    LexerToken token = consumeSigil('&', LexerTokenType.FUNCTION);
                    if (token != null) {
                        return token;
                    }
                }
                return operator("&&=", "&.=", "&&", "&=", "&.", "&");
            case '*':
                if (operand) {
                    LexerToken token = consumeSigil('*', LexerTokenType.TYPEGLOB);
                    if (token != null) {
                        return token;
                    }
                }
                return operator("**=", "**", "*=", "*");
            case '\'':
            case '"':
            case '`':
                return consumeQuoteLike(String.valueOf(current), start);
            case '/':
                if (operand) {
                    return consumeQuoteLike("/", start);
                }
                return operator("//=", "//", "/=", "/");
            case '<':
                if (input.startsWith("<<", position) && !input.startsWith("<<=", position)) {
                    LexerToken heredoc = consumeHeredoc(!operand);
                    if (heredoc != null) {
                        return heredoc;
                    }
                }
                if (operand) {
                    LexerToken angle = consumeAngle();
                    if (angle != null) {
                        return angle;
                    }
                }
                return operator("<<=", "<=>", "<<", "<=", "<");
            case '=': {
                LexerToken token = operator("==", "=>", "=~", "=");
                if (formatState == 1 && token.text.equals("=")) {
                    formatState = 2;
                }
                return token;
            }
            case '!':
                return operator("!=", "!~", "!");
            case '+':
                return operator("++", "+=", "+");
            case '-':
                return operator("--", "-=", "->", "-");
            case '.':
                return operator("...", "..", ".=", ".");
            case ':':
                return operator("::", ":");
            case '>':
                return operator(">>=", ">=", ">>", ">");
            case '^':
                return operator("^^=", "^.=", "^^", "^=", "^.", "^");
            case '|':
                return operator("||=", "|.=", "||", "|=", "|.", "|");
            case '~':
                return operator("~~", "~.", "~");
            case '\\':
            case ',':
            case ';':
            case '(':
            case ')':
            case '[':
            case ']':
            case '{':
            case '}':
            case '?':
                position++;
                return token(LexerTokenType.OPERATOR, start);
            default:
                position++;
                return error(start, String.format("Unrecognized character \\x{%02X}", (int) current));
        }
    }

    /**
     * Emits the first candidate that matches at the cursor. Candidates are listed
     * longest first and the last one is always a single character.
     */
    private LexerToken operator(String... candidates) {
        int start = position;
        for (String candidate : candidates) {
            if (input.startsWith(candidate, position)) {
                position += candidate.length();
                return token(LexerTokenType.OPERATOR, start);
            }
        }
        position++;
        return token(LexerTokenType.OPERATOR, start);
    }

    // ------------------------------------------------------------------
    // Helpers

    private LexerToken token(LexerTokenType type, int start) {
        return new LexerToken(type, input.substring(start, position), source.span(start, position));
    }

    private LexerToken error(int start, String message) {
        if (position <= start) {
            position = Math.min(length, start + 1);
        }
        LexerToken token = token(LexerTokenType.ERROR, start);
        token.errorMessage = message;
        return token;
    }

    private int getCurrentCodePoint() {
        if (position >= length) {
            return -1;
        }
        char c1 = input.charAt(position);
        if (Character.isHighSurrogate(c1) && position + 1 < length) {
            char c2 = input.charAt(position + 1);
            if (Character.isLowSurrogate(c2)) {
                return Character.toCodePoint(c1, c2);
            }
        }
        return c1;
    }

    private void advanceCodePoint(int codePoint) {
        position += Character.charCount(codePoint);
    }

    public static boolean isPerlIdentifierStart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_START) || isEmoji(codePoint);
    }

    public static boolean isPerlIdentifierPart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_CONTINUE) || isEmoji(codePoint)
                || codePoint == 0x200D || codePoint == 0xFE0F;
    }

    /**
     * Emoji blocks accepted in identifiers.
     */
    public static boolean isEmoji(int codePoint) {
        return codePoint >= 0x1F300 && codePoint <= 0x1F5FF
                || codePoint >= 0x1F600 && codePoint <= 0x1F64F
                || codePoint >= 0x1F680 && codePoint <= 0x1F6FF
                || codePoint >= 0x1F900 && codePoint <= 0x1F9FF
                || codePoint >= 0x1FA70 && codePoint <= 0x1FAFF
                || codePoint >= 0x2600 && codePoint <= 0x26FF
                || codePoint >= 0x2700 && codePoint <= 0x27BF;
    }

    private static boolean isAsciiWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isAsciiLetter(char c) {
        return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z';
    }
}
