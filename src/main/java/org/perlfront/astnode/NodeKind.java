package org.perlfront.astnode;

/**
 * Kinds of syntax tree nodes. Several node classes map to more than one kind,
 * for example {@link OperatorNode} covers variables, unary operators and calls.
 */
public enum NodeKind {
    PROGRAM,
    BLOCK,
    LIST,

    // literals and names
    NUMBER,
    STRING,
    INTERPOLATED_STRING,
    VERSION_STRING,
    IDENTIFIER,
    VARIABLE,
    TYPEGLOB,
    DEREFERENCE,
    ANON_ARRAY,
    ANON_HASH,
    REGEX,
    MATCH,
    SUBSTITUTION,
    TRANSLITERATION,
    HEREDOC,
    READLINE,
    GLOB,

    // declarations
    VARIABLE_DECLARATION,
    FIELD,
    SIGNATURE,
    MANDATORY_PARAMETER,
    OPTIONAL_PARAMETER,
    SLURPY_PARAMETER,
    NAMED_PARAMETER,
    SUBROUTINE,
    ANON_SUB,
    METHOD,
    CLASS,
    PACKAGE,
    USE,
    NO,
    PHASE_BLOCK,
    FORMAT,

    // expressions
    UNARY,
    POSTFIX,
    BINARY,
    TERNARY,
    ASSIGNMENT,
    SUBSCRIPT,
    FUNCTION_CALL,
    METHOD_CALL,
    DO_BLOCK,
    EVAL_BLOCK,

    // control flow
    IF,
    UNLESS,
    WHILE,
    UNTIL,
    FOR,
    FOREACH,
    GIVEN,
    WHEN,
    DEFAULT,
    LABELED_STATEMENT,
    STATEMENT_MODIFIER,
    RETURN,
    LOOP_CONTROL,
    TRY,
    DEFER,
    YADA,
    DATA_SECTION,

    // synthesized by error recovery
    ERROR,
    MISSING_EXPRESSION,
    MISSING_STATEMENT,
    MISSING_IDENTIFIER,
    MISSING_BLOCK,
    UNKNOWN_REST;

    public boolean isSynthetic() {
        return switch (this) {
            case ERROR, MISSING_EXPRESSION, MISSING_STATEMENT, MISSING_IDENTIFIER, MISSING_BLOCK, UNKNOWN_REST -> true;
            default -> false;
        };
    }
}
