package org.perlfront.parser;

import org.perlfront.astnode.ArrayLiteralNode;
import org.perlfront.astnode.BinaryOperatorNode;
import org.perlfront.astnode.ErrorNode;
import org.perlfront.astnode.HashLiteralNode;
import org.perlfront.astnode.IdentifierNode;
import org.perlfront.astnode.ListNode;
import org.perlfront.astnode.Node;
import org.perlfront.astnode.NumberNode;
import org.perlfront.astnode.OperatorNode;
import org.perlfront.astnode.RegexNode;
import org.perlfront.astnode.StringNode;
import org.perlfront.lexer.LexerToken;
import org.perlfront.lexer.LexerTokenType;
import org.perlfront.lexer.QuoteParts;
import org.perlfront.lexer.Span;
import org.perlfront.recovery.ParseError;
import org.perlfront.recovery.PerlSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.perlfront.parser.TokenUtils.consume;
import static org.perlfront.parser.TokenUtils.peek;

/**
 * The ParsePrimary class parses terms: literals, variables, calls, anonymous
 * constructors and prefix operators.
 */
public class ParsePrimary {

    /**
     * Operators that are infix after an operand but prefix at the start of a term.
     */
    static final Set<String> PREFIX_OPERATORS = Set.of("-", "+", "++", "--");

    private static final String FILE_TESTS = "rwxoRWXOezsfdlpSbcugktTBAMC";

    /**
     * Parses a primary expression.
     *
     * @param parser The parser instance
     * @return The parsed term; a synthetic node when no term is present
     */
    public static Node parsePrimary(Parser parser) {
        LexerToken token = peek(parser);
        int start = token.span.start();

        switch (token.type) {
            case EOF:
                return parser.recovery.missingExpression();
            case ERROR:
                return parseLexerError(parser);
            case INTEGER:
            case FLOAT:
                consume(parser);
                return new NumberNode(token.text, token.span);
            case VERSION:
                consume(parser);
                return new StringNode(token.text, "v", false, token.span);
            case STRING:
            case INTERPOLATED_STRING:
            case QUOTE:
            case QUOTE_DOUBLE:
            case QUOTE_COMMAND:
                return parseString(parser);
            case QUOTE_WORDS:
                return parseQuoteWords(parser);
            case MATCH:
            case QUOTE_REGEX:
            case SUBSTITUTION:
            case TRANSLITERATION:
                return parseRegex(parser);
            case HEREDOC:
                return ParseHeredoc.parseHeredoc(parser);
            case READLINE:
                return parseReadline(parser);
            case GLOB:
                consume(parser);
                return new OperatorNode("glob",
                        new StringNode(token.text.substring(1, token.text.length() - 1), "<", true, token.span),
                        token.span);
            case SCALAR:
            case ARRAY:
            case HASH:
            case FUNCTION:
            case TYPEGLOB:
            case ARRAY_LENGTH:
                return parseVariable(parser);
            case SIGIL:
                return parseCast(parser);
            case IDENTIFIER:
            case KEYWORD:
                return parseWord(parser);
            case OPERATOR:
                return parseOperator(parser, token, start);
            default:
                throw TokenUtils.syntaxError(parser, "syntax error near " + TokenUtils.describe(token));
        }
    }

    private static Node parseOperator(Parser parser, LexerToken token, int start) {
        switch (token.text) {
            case "(": {
                ListNode list = ListParser.parseParenList(parser);
                if (peek(parser).isOperator("[")) {
                    // list slice: (stat $file)[7]
                    return new BinaryOperatorNode("[", list,
                            ListParser.parseDelimitedList(parser, "[", "]"), parser.spanFrom(start));
                }
                return list;
            }
            case "[": {
                ListNode list = ListParser.parseDelimitedList(parser, "[", "]");
                return new ArrayLiteralNode(list.elements, list.location);
            }
            case "{": {
                // In term position a brace is always an anonymous hash
                ListNode list = ListParser.parseDelimitedList(parser, "{", "}");
                return new HashLiteralNode(list.elements, list.location);
            }
            case "\\":
            case "!":
            case "~":
            case "~.": {
                consume(parser);
                Node operand = parser.parseExpression(ParserTables.UNARY_PRECEDENCE);
                return new OperatorNode(token.text, operand, parser.spanFrom(start));
            }
            case "-": {
                LexerToken next = peek(parser, 1);
                if (next.type == LexerTokenType.IDENTIFIER && next.text.length() == 1
                        && FILE_TESTS.indexOf(next.text.charAt(0)) >= 0 && next.span.start() == token.span.end()
                        && !peek(parser, 2).isOperator("=>")) {
                    return parseFileTest(parser, start);
                }
                consume(parser);
                Node operand = parser.parseExpression(ParserTables.UNARY_PRECEDENCE);
                return new OperatorNode("unary-", operand, parser.spanFrom(start));
            }
            case "+": {
                consume(parser);
                Node operand = parser.parseExpression(ParserTables.UNARY_PRECEDENCE);
                return new OperatorNode("unary+", operand, parser.spanFrom(start));
            }
            case "++":
            case "--": {
                consume(parser);
                Node operand = parser.parseExpression(ParserTables.UNARY_PRECEDENCE);
                return new OperatorNode(token.text, operand, parser.spanFrom(start));
            }
            case "...":
                consume(parser);
                return new OperatorNode("...", null, token.span);
            case "not": {
                consume(parser);
                Node operand = null;
                if (ListParser.looksLikeArgument(peek(parser))) {
                    operand = parser.parseExpression(parser.getPrecedence("not"));
                }
                return new OperatorNode("not", operand, parser.spanFrom(start));
            }
            case ")":
            case "]":
            case "}":
            case ";":
            case ":":
            case ",":
                return parser.recovery.missingExpression();
            default:
                throw TokenUtils.syntaxError(parser, "syntax error near " + TokenUtils.describe(token));
        }
    }

    /**
     * An ERROR token in operand position becomes an error node in place of the operand.
     */
    private static Node parseLexerError(Parser parser) {
        LexerToken token = consume(parser);
        ParseError error = new ParseError(token.errorMessage, token.span).withFound(TokenUtils.describe(token));
        parser.recovery.recordError(error);
        return new ErrorNode(error.getMessage(), List.of(), null, token.span);
    }

    private static Node parseString(Parser parser) {
        LexerToken token = consume(parser);
        QuoteParts quote = token.quote;
        String operator = quote.operator();
        boolean interpolated = switch (operator) {
            case "\"", "qq", "qx", "`" -> true;
            default -> false;
        };
        return new StringNode(quote.body(), operator, interpolated, token.span);
    }

    private static Node parseQuoteWords(Parser parser) {
        LexerToken token = consume(parser);
        List<Node> words = new ArrayList<>();
        for (String word : token.quote.body().trim().split("\\s+")) {
            if (!word.isEmpty()) {
                words.add(new StringNode(word, "qw", false, token.span));
            }
        }
        ListNode list = new ListNode(words, token.span);
        list.setAnnotation("qw", true);
        return list;
    }

    private static Node parseRegex(Parser parser) {
        LexerToken token = consume(parser);
        QuoteParts quote = token.quote;
        String operator = quote.operator().equals("/") ? "m" : quote.operator();
        return new RegexNode(operator, quote.body(), quote.replacement(), quote.modifiers(), token.span);
    }

    private static Node parseReadline(Parser parser) {
        LexerToken token = consume(parser);
        String inside = token.text.equals("<<>>") ? "" : token.text.substring(1, token.text.length() - 1);
        Node operand = null;
        if (inside.startsWith("$")) {
            Span nameSpan = token.span;
            operand = new OperatorNode("$", new IdentifierNode(inside.substring(1), nameSpan), nameSpan);
        } else if (!inside.isEmpty()) {
            operand = new IdentifierNode(inside, token.span);
        }
        return new OperatorNode("readline", operand, token.span);
    }

    private static Node parseFileTest(Parser parser, int start) {
        consume(parser);
        LexerToken letter = consume(parser);
        Node operand = null;
        if (startsTerm(peek(parser))) {
            operand = parser.parseExpression(ParserTables.NAMED_UNARY_PRECEDENCE);
        }
        return new OperatorNode("-" + letter.text, operand, parser.spanFrom(start));
    }

    // ------------------------------------------------------------------
    // Variables

    /**
     * Parses a variable token and the subscripts that follow it.
     */
    static Node parseVariable(Parser parser) {
        LexerToken token = peek(parser);
        int start = token.span.start();
        Node variable = parseSimpleVariable(parser);
        return parseVariableSubscripts(parser, variable, sigilOf(token), start);
    }

    /**
     * Parses a variable token alone: {@code $x}, {@code @x}, {@code %x}, {@code &x},
     * {@code *x} or {@code $#x}.
     */
    static Node parseSimpleVariable(Parser parser) {
        LexerToken token = consume(parser);
        String sigil = sigilOf(token);
        String name = token.text.substring(sigil.length());
        if (name.startsWith("{^") && name.endsWith("}")) {
            name = name.substring(1, name.length() - 1);
        }
        return new OperatorNode(sigil, new IdentifierNode(name, token.span), token.span);
    }

    private static String sigilOf(LexerToken token) {
        if (token.type == LexerTokenType.ARRAY_LENGTH || token.text.startsWith("$#")) {
            return "$#";
        }
        return token.text.substring(0, 1);
    }

    private static Node parseVariableSubscripts(Parser parser, Node variable, String sigil, int start) {
        if (!ParseInfix.isAdjacent(parser)) {
            return variable;
        }
        LexerToken next = peek(parser);
        switch (sigil) {
            case "$":
            case "@":
            case "%":
                if (next.isOperator("[")) {
                    Node node = new BinaryOperatorNode("[", variable,
                            ListParser.parseDelimitedList(parser, "[", "]"), parser.spanFrom(start));
                    return sigil.equals("$") ? ParseInfix.parseSubscriptChain(parser, node, start) : node;
                }
                if (next.isOperator("{")) {
                    Node node = new BinaryOperatorNode("{", variable,
                            ParseInfix.parseHashSubscript(parser), parser.spanFrom(start));
                    return sigil.equals("$") ? ParseInfix.parseSubscriptChain(parser, node, start) : node;
                }
                return variable;
            case "&":
                if (next.isOperator("(")) {
                    return new BinaryOperatorNode("(", variable, ListParser.parseParenList(parser), parser.spanFrom(start));
                }
                return variable;
            default:
                return variable;
        }
    }

    /**
     * Parses a dereference cast: {@code @$ref}, {@code %{ expr }}, {@code $$ref[0]},
     * {@code &$code(...)} and {@code $#{ expr }}.
     */
    private static Node parseCast(Parser parser) {
        LexerToken sigil = consume(parser);
        int start = sigil.span.start();
        LexerToken next = peek(parser);
        Node operand;
        if (next.isOperator("{")) {
            parser.enterDepth();
            try {
                consume(parser);
                operand = peek(parser).isOperator("}") ? parser.recovery.missingExpression() : parser.parseExpression(0);
                consume(parser, LexerTokenType.OPERATOR, "}");
            } finally {
                parser.exitDepth();
            }
        } else if (next.type == LexerTokenType.SCALAR) {
            operand = parseSimpleVariable(parser);
        } else if (next.type == LexerTokenType.SIGIL && next.text.equals("$")) {
            parser.enterDepth();
            try {
                operand = parseCastOperand(parser);
            } finally {
                parser.exitDepth();
            }
        } else {
            throw new PerlSyntaxException(new ParseError("syntax error: expected variable or block after '"
                    + sigil.text + "', found " + TokenUtils.describe(next), next.span)
                    .withExpected(List.of("variable", "{")).withFound(TokenUtils.describe(next)));
        }
        Node cast = new OperatorNode(sigil.text, operand, parser.spanFrom(start));
        return parseVariableSubscripts(parser, cast, sigil.text, start);
    }

    // $$$ref: nested casts without subscripts
    private static Node parseCastOperand(Parser parser) {
        LexerToken sigil = consume(parser);
        int start = sigil.span.start();
        LexerToken next = peek(parser);
        Node operand;
        if (next.type == LexerTokenType.SCALAR) {
            operand = parseSimpleVariable(parser);
        } else if (next.type == LexerTokenType.SIGIL && next.text.equals("$")) {
            parser.enterDepth();
            try {
                operand = parseCastOperand(parser);
            } finally {
                parser.exitDepth();
            }
        } else {
            consume(parser, LexerTokenType.OPERATOR, "{");
            operand = parser.parseExpression(0);
            consume(parser, LexerTokenType.OPERATOR, "}");
        }
        return new OperatorNode("$", operand, parser.spanFrom(start));
    }

    // ------------------------------------------------------------------
    // Barewords, keywords and builtins

    private static Node parseWord(Parser parser) {
        LexerToken token = peek(parser);
        int start = token.span.start();

        // Fat comma autoquotes any word
        if (peek(parser, 1).isOperator("=>")) {
            consume(parser);
            return new StringNode(token.text, "", false, token.span);
        }

        String name = token.text.startsWith("CORE::GLOBAL::") ? token.text.substring(14)
                : token.text.startsWith("CORE::") ? token.text.substring(6) : token.text;
        switch (name) {
            case "my":
            case "our":
            case "state":
            case "local":
            case "field":
                return parseDeclaration(parser);
            case "sub":
                return SubroutineParser.parseSubroutine(parser, null, false);
            case "method":
                if (peek(parser, 1).isOperator("{") || peek(parser, 1).isOperator("(")
                        || peek(parser, 1).type == LexerTokenType.PROTOTYPE) {
                    return SubroutineParser.parseSubroutine(parser, null, true);
                }
                break;
            case "do":
            case "eval":
                return parseDoEval(parser, name);
            case "defer": {
                consume(parser);
                Node block = ParseBlock.parseRequiredBlock(parser);
                return new OperatorNode("defer", block, parser.spanFrom(start));
            }
            case "return": {
                consume(parser);
                ListNode arguments = ListParser.parseBareArguments(parser);
                Node operand = arguments.elements.isEmpty() ? null
                        : arguments.elements.size() == 1 ? arguments.elements.get(0) : arguments;
                return new OperatorNode("return", operand, parser.spanFrom(start));
            }
            case "last":
            case "next":
            case "redo":
            case "goto":
            case "dump":
                return parseLoopControl(parser, name);
            case "print":
            case "say":
            case "printf":
            case "exec":
            case "system":
                return parsePrint(parser, name);
            case "sort":
            case "map":
            case "grep":
                return parseBlockListOperator(parser, name);
            case "require":
                return parseRequire(parser);
            case "if":
            case "unless":
            case "while":
            case "until":
            case "for":
            case "foreach":
            case "else":
            case "elsif":
            case "continue":
            case "catch":
            case "finally":
            case "use":
            case "no":
            case "package":
            case "format":
            case "class":
            case "try":
            case "given":
            case "when":
            case "default":
                if (token.type == LexerTokenType.KEYWORD) {
                    throw TokenUtils.syntaxError(parser, "syntax error near " + TokenUtils.describe(token));
                }
                break;
            default:
                break;
        }

        if (ParserTables.NO_ARGS.contains(name)) {
            consume(parser);
            if (peek(parser).isOperator("(") && peek(parser, 1).isOperator(")")) {
                consume(parser);
                consume(parser);
            }
            return new OperatorNode(name, null, parser.spanFrom(start));
        }
        if (ParserTables.NAMED_UNARY.contains(name)) {
            return parseNamedUnary(parser, name);
        }
        if (token.type == LexerTokenType.KEYWORD) {
            // die, warn, push, join, bless, tie and the other list operators
            return parseListOperator(parser, name);
        }
        return parseBareword(parser);
    }

    private static Node parseBareword(Parser parser) {
        LexerToken token = consume(parser);
        int start = token.span.start();
        IdentifierNode identifier = new IdentifierNode(token.text, token.span);
        LexerToken next = peek(parser);

        if (next.isOperator("->") || next.isOperator("::")) {
            // Class->method
            return identifier;
        }
        if (next.isOperator("(")) {
            ListNode arguments = ListParser.parseParenList(parser);
            return new BinaryOperatorNode("(", identifier, arguments, parser.spanFrom(start));
        }
        if (startsTerm(next)) {
            ListNode arguments = ListParser.parseBareArguments(parser);
            return new BinaryOperatorNode("(", identifier, arguments, parser.spanFrom(start));
        }
        return identifier;
    }

    private static Node parseNamedUnary(Parser parser, String name) {
        LexerToken token = consume(parser);
        int start = token.span.start();
        Node operand = null;
        LexerToken next = peek(parser);
        if (next.isOperator("(")) {
            ListNode list = ListParser.parseParenList(parser);
            operand = list.elements.size() == 1 ? list.elements.get(0) : list;
        } else if (startsTerm(next)) {
            operand = parser.parseExpression(ParserTables.NAMED_UNARY_PRECEDENCE);
        }
        return new OperatorNode(name, operand, parser.spanFrom(start));
    }

    private static Node parseListOperator(Parser parser, String name) {
        LexerToken token = consume(parser);
        int start = token.span.start();
        ListNode arguments = peek(parser).isOperator("(")
                ? ListParser.parseParenList(parser)
                : ListParser.parseBareArguments(parser);
        return new OperatorNode(name, arguments, parser.spanFrom(start));
    }

    private static Node parseDoEval(Parser parser, String name) {
        LexerToken token = consume(parser);
        int start = token.span.start();
        LexerToken next = peek(parser);
        Node operand = null;
        if (next.isOperator("{")) {
            operand = ParseBlock.parseBlock(parser);
        } else if (next.isOperator("(")) {
            ListNode list = ListParser.parseParenList(parser);
            operand = list.elements.size() == 1 ? list.elements.get(0) : list;
        } else if (ListParser.looksLikeArgument(next)) {
            operand = parser.parseExpression(ParserTables.NAMED_UNARY_PRECEDENCE);
        } else if (name.equals("do")) {
            operand = parser.recovery.missingBlock();
        }
        return new OperatorNode(name, operand, parser.spanFrom(start));
    }

    private static Node parseLoopControl(Parser parser, String name) {
        LexerToken token = consume(parser);
        int start = token.span.start();
        LexerToken next = peek(parser);
        Node operand = null;
        if (next.type == LexerTokenType.IDENTIFIER && !peek(parser, 1).isOperator("(")) {
            consume(parser);
            operand = new IdentifierNode(next.text, next.span);
        } else if (name.equals("goto") && next.type == LexerTokenType.FUNCTION) {
            operand = parseSimpleVariable(parser);
        } else if (ListParser.looksLikeArgument(next)) {
            // last EXPR / goto EXPR
            operand = parser.parseExpression(ParserTables.NAMED_UNARY_PRECEDENCE);
        }
        return new OperatorNode(name, operand, parser.spanFrom(start));
    }

    private static Node parseRequire(Parser parser) {
        LexerToken token = consume(parser);
        int start = token.span.start();
        LexerToken next = peek(parser);
        Node operand;
        if (next.type == LexerTokenType.IDENTIFIER && !peek(parser, 1).isOperator("(")
                && !peek(parser, 1).isOperator("->")) {
            consume(parser);
            operand = new IdentifierNode(next.text, next.span);
        } else if (next.type == LexerTokenType.VERSION || next.type == LexerTokenType.INTEGER
                || next.type == LexerTokenType.FLOAT) {
            operand = parsePrimary(parser);
        } else if (startsTerm(next)) {
            operand = parser.parseExpression(ParserTables.NAMED_UNARY_PRECEDENCE);
        } else {
            operand = null;
        }
        return new OperatorNode("require", operand, parser.spanFrom(start));
    }

    /**
     * Parses print, say, printf and the exec/system forms, which accept an optional
     * filehandle or block before the list: {@code print {$fh} LIST}, {@code print STDERR LIST},
     * {@code print $fh LIST}.
     */
    private static Node parsePrint(Parser parser, String name) {
        LexerToken token = consume(parser);
        int start = token.span.start();
        boolean parens = peek(parser).isOperator("(");
        if (parens) {
            parser.enterDepth();
        }
        try {
            int listStart = parser.nextStart();
            if (parens) {
                consume(parser);
            }
            Node handle = parseFileHandle(parser);
            List<Node> elements = new ArrayList<>();
            LexerToken next = peek(parser);
            if (parens) {
                if (!next.isOperator(")")) {
                    ListParser.addElements(elements, parser.parseExpression(0));
                }
                consume(parser, LexerTokenType.OPERATOR, ")");
            } else if (ListParser.looksLikeArgument(next)) {
                ListParser.addElements(elements, parser.parseExpression(ParserTables.LIST_OPERATOR_PRECEDENCE));
            }
            ListNode list = new ListNode(elements, handle, parser.spanFrom(listStart));
            return new OperatorNode(name, list, parser.spanFrom(start));
        } finally {
            if (parens) {
                parser.exitDepth();
            }
        }
    }

    private static Node parseFileHandle(Parser parser) {
        LexerToken token = peek(parser);
        LexerToken next = peek(parser, 1);
        if (token.isOperator("{")) {
            return ParseBlock.parseBlock(parser);
        }
        if (token.type == LexerTokenType.IDENTIFIER && !next.isOperator("(") && !next.isOperator("->")
                && !next.isOperator(",") && !next.isOperator("=>") && startsTerm(next)
                && !ParserTables.NAMED_UNARY.contains(token.text)) {
            consume(parser);
            return new IdentifierNode(token.text, token.span);
        }
        if (token.type == LexerTokenType.SCALAR && next.type != LexerTokenType.OPERATOR && startsTerm(next)) {
            return parseSimpleVariable(parser);
        }
        return null;
    }

    /**
     * Parses sort, map and grep, which take an optional leading block, or for sort a
     * comparison sub name or variable.
     */
    private static Node parseBlockListOperator(Parser parser, String name) {
        LexerToken token = consume(parser);
        int start = token.span.start();
        boolean parens = peek(parser).isOperator("(");
        if (parens) {
            parser.enterDepth();
        }
        try {
            int listStart = parser.nextStart();
            if (parens) {
                consume(parser);
            }
            Node handle = null;
            LexerToken next = peek(parser);
            if (next.isOperator("{")) {
                handle = ParseBlock.parseBlock(parser);
                TokenUtils.consumeIf(parser, ",");
            } else if (name.equals("sort") && (next.type == LexerTokenType.SCALAR || next.type == LexerTokenType.IDENTIFIER)
                    && startsTerm(peek(parser, 1)) && peek(parser, 1).type != LexerTokenType.OPERATOR) {
                handle = next.type == LexerTokenType.SCALAR ? parseSimpleVariable(parser)
                        : new IdentifierNode(consume(parser).text, next.span);
            }
            List<Node> elements = new ArrayList<>();
            next = peek(parser);
            if (parens) {
                if (!next.isOperator(")")) {
                    ListParser.addElements(elements, parser.parseExpression(0));
                }
                consume(parser, LexerTokenType.OPERATOR, ")");
            } else if (ListParser.looksLikeArgument(next)) {
                ListParser.addElements(elements, parser.parseExpression(ParserTables.LIST_OPERATOR_PRECEDENCE));
            }
            ListNode list = new ListNode(elements, handle, parser.spanFrom(listStart));
            return new OperatorNode(name, list, parser.spanFrom(start));
        } finally {
            if (parens) {
                parser.exitDepth();
            }
        }
    }

    // ------------------------------------------------------------------
    // Declarations

    private static Node parseDeclaration(Parser parser) {
        LexerToken declarator = consume(parser);
        int start = declarator.span.start();
        String keyword = declarator.text;
        LexerToken next = peek(parser);

        if (next.isWord("sub") && !keyword.equals("local")) {
            return SubroutineParser.parseSubroutine(parser, keyword, false);
        }
        if (keyword.equals("local")) {
            Node operand = parser.parseExpression(ParserTables.UNARY_PRECEDENCE);
            return new OperatorNode("local", operand, parser.spanFrom(start));
        }
        if (next.type == LexerTokenType.IDENTIFIER && peek(parser, 1).type.isVariable()) {
            // my Foo::Bar $x
            consume(parser);
            next = peek(parser);
        }

        Node operand;
        if (next.isOperator("(")) {
            operand = ListParser.parseParenList(parser);
        } else if (next.type == LexerTokenType.SCALAR || next.type == LexerTokenType.ARRAY
                || next.type == LexerTokenType.HASH) {
            operand = parseSimpleVariable(parser);
        } else {
            operand = parser.recovery.missingIdentifier();
        }
        OperatorNode declaration;
        if (keyword.equals("field") && peek(parser).isOperator(":")) {
            List<String> attributes = SubroutineParser.parseAttributes(parser);
            declaration = new OperatorNode(keyword, operand, parser.spanFrom(start));
            declaration.setAnnotation("attributes", attributes);
        } else {
            declaration = new OperatorNode(keyword, operand, parser.spanFrom(start));
        }
        return declaration;
    }

    // ------------------------------------------------------------------

    /**
     * True when the token can start a term given to a named unary operator or a
     * bareword call. Tokens that would also read as infix operators ({@code - + < (})
     * and braces are excluded.
     */
    static boolean startsTerm(LexerToken token) {
        switch (token.type) {
            case EOF:
            case ERROR:
            case FORMAT_BODY:
            case DATA_SECTION:
            case POSTFIX_DEREF:
            case PROTOTYPE:
            case ATTRIBUTE:
                return false;
            case OPERATOR:
                return token.text.equals("\\") || token.text.equals("[") || token.text.equals("!");
            case KEYWORD:
                return !ParserTables.TERMINATORS.contains(token.text) && !token.text.equals("else")
                        && !token.text.equals("elsif") && !token.text.equals("continue");
            default:
                return true;
        }
    }
}
