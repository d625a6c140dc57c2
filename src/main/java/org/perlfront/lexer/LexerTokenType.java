package org.perlfront.lexer;

/**
 * Token categories produced by {@link Lexer}.
 */
public enum LexerTokenType {
    /** Bareword, function or package name. */
    IDENTIFIER,
    /** Word the parser dispatches on, such as {@code if}, {@code my} or {@code print}. */
    KEYWORD,
    OPERATOR,

    SCALAR,
    ARRAY,
    HASH,
    /** {@code &name} */
    FUNCTION,
    /** {@code *name} */
    TYPEGLOB,
    /** {@code $#name} */
    ARRAY_LENGTH,
    /** A sigil used as a dereference cast, as in {@code @$ref} or {@code ${ expr }}. */
    SIGIL,
    /** Postfix dereference such as {@code ->@*}. */
    POSTFIX_DEREF,

    INTEGER,
    FLOAT,
    VERSION,

    /** {@code '...'} */
    STRING,
    /** {@code "..."} */
    INTERPOLATED_STRING,
    QUOTE,
    QUOTE_DOUBLE,
    QUOTE_WORDS,
    QUOTE_REGEX,
    /** {@code qx//} and backticks. */
    QUOTE_COMMAND,
    MATCH,
    SUBSTITUTION,
    TRANSLITERATION,

    HEREDOC,
    /** {@code <$fh>}, {@code <STDIN>} and {@code <>}. */
    READLINE,
    /** {@code <*.c>} */
    GLOB,
    /** Picture lines of a {@code format} declaration, up to the closing dot. */
    FORMAT_BODY,
    /** {@code __END__} or {@code __DATA__} and everything after it. */
    DATA_SECTION,
    /** The parenthesized prototype of a sub, read as raw text: {@code ($$;@)}. */
    PROTOTYPE,
    /** One attribute of a sub, method, field or class header, with its raw argument: {@code isa(Base)}. */
    ATTRIBUTE,

    ERROR,
    EOF;

    /**
     * Whether a token of this type completes an operand, so that a following
     * {@code /} is division rather than the start of a pattern.
     */
    public boolean endsOperand() {
        return switch (this) {
            case IDENTIFIER, SCALAR, ARRAY, HASH, FUNCTION, TYPEGLOB, ARRAY_LENGTH, POSTFIX_DEREF,
                 INTEGER, FLOAT, VERSION, STRING, INTERPOLATED_STRING, QUOTE, QUOTE_DOUBLE, QUOTE_WORDS,
                 QUOTE_REGEX, QUOTE_COMMAND, MATCH, SUBSTITUTION, TRANSLITERATION, HEREDOC, READLINE,
                 GLOB, ERROR -> true;
            default -> false;
        };
    }

    public boolean isVariable() {
        return switch (this) {
            case SCALAR, ARRAY, HASH, FUNCTION, TYPEGLOB, ARRAY_LENGTH -> true;
            default -> false;
        };
    }
}
