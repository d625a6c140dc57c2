package org.perlfront.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

public class ParserTables {
    // Set of tokens that signify the end of an expression or statement.
    public static final Set<String> TERMINATORS =
            Set.of(":", ";", ")", "}", "]", "if", "unless", "while", "until", "for", "foreach", "when");
    // Set of tokens that can terminate a list of expressions.
    public static final Set<String> LIST_TERMINATORS =
            Set.of(":", ";", ")", "}", "]", "if", "unless", "while", "until", "for", "foreach", "when", "not", "and", "or", "xor");
    // Set of infix operators that build a plain BinaryOperatorNode.
    public static final Set<String> INFIX_OP = Set.of(
            "or", "xor", "and", "||", "//", "&&", "|", "^", "^^", "&", "|.", "^.", "&.",
            "==", "!=", "<=>", "eq", "ne", "cmp", "~~", "<", ">", "<=", ">=",
            "lt", "gt", "le", "ge", "<<", ">>", "+", "-", "*",
            "**", "/", "%", ".", "=", "**=", "+=", "*=", "&=", "&.=",
            "<<=", "&&=", "-=", "/=", "|=", "|.=", ">>=", "||=", ".=",
            "%=", "^=", "^.=", "^^=", "//=", "x=", "=~", "!~", "x", "..", "...", "isa"
    );
    // Set of operators that are right associative.
    static final Set<String> RIGHT_ASSOC_OP = Set.of(
            "=", "**=", "+=", "*=", "&=", "&.=", "<<=", "&&=", "-=", "/=", "|=", "|.=",
            ">>=", "||=", ".=", "%=", "^=", "^.=", "^^=", "//=", "x=", "**", "?"
    );
    // Operators that are only infix when they follow an operand directly.
    static final Set<String> POSTFIX_OP = Set.of("++", "--");

    /**
     * Named unary operators: take at most one argument and bind tighter than comparison,
     * so {@code defined $x && ...} reads as {@code defined($x) && ...}.
     */
    static final Set<String> NAMED_UNARY = Set.of(
            "defined", "ref", "scalar", "undef", "exists", "delete", "lc", "uc", "lcfirst", "ucfirst",
            "length", "chr", "ord", "hex", "oct", "abs", "int", "sqrt", "log", "exp", "sin", "cos",
            "rand", "srand", "quotemeta", "chdir", "rmdir", "readlink", "fc", "lock", "exit",
            "umask", "study", "pos", "alarm", "sleep", "require", "caller", "chroot",
            "localtime", "gmtime", "shift", "pop", "keys", "values", "each", "close", "chomp", "chop",
            "untie", "tied", "readline", "fileno", "eof", "stat", "lstat", "evalbytes"
    );

    /**
     * Builtins that never take arguments.
     */
    static final Set<String> NO_ARGS = Set.of(
            "time", "times", "wait", "wantarray", "fork", "getppid", "__PACKAGE__", "__FILE__",
            "__LINE__", "__SUB__", "__CLASS__", "break"
    );

    /**
     * Builtins whose first argument may be a block or a filehandle.
     */
    static final Set<String> BLOCK_LIST_OPS = Set.of("sort", "map", "grep");
    static final Set<String> PRINT_OPS = Set.of("print", "say", "printf", "exec", "system");

    // Map to store operator precedence values.
    static final Map<String, Integer> precedenceMap = new HashMap<>();

    // Static block to initialize the precedence map with operators and their precedence levels.
    static {
        addOperatorsToMap(1, "or", "xor");
        addOperatorsToMap(2, "and");
        addOperatorsToMap(3, "not");
        addOperatorsToMap(5, ",", "=>");
        addOperatorsToMap(6, "=", "**=", "+=", "*=", "&=", "&.=", "<<=", "&&=", "-=", "/=", "|=", "|.=", ">>=", "||=", ".=", "%=", "^=", "^.=", "^^=", "//=", "x=");
        addOperatorsToMap(7, "?");
        addOperatorsToMap(8, "..", "...");
        addOperatorsToMap(9, "||", "^^", "//");
        addOperatorsToMap(10, "&&");
        addOperatorsToMap(11, "|", "^", "|.", "^.");
        addOperatorsToMap(12, "&", "&.");
        addOperatorsToMap(13, "==", "!=", "<=>", "eq", "ne", "cmp", "~~");
        addOperatorsToMap(14, "<", ">", "<=", ">=", "lt", "gt", "le", "ge");
        addOperatorsToMap(15, "isa");
        addOperatorsToMap(16, "-d");
        addOperatorsToMap(17, ">>", "<<");
        addOperatorsToMap(18, "+", "-", ".");
        addOperatorsToMap(19, "*", "/", "%", "x");
        addOperatorsToMap(20, "=~", "!~");
        addOperatorsToMap(21, "!", "~", "~.", "\\");
        addOperatorsToMap(22, "**");
        addOperatorsToMap(23, "++", "--");
        addOperatorsToMap(24, "->");
    }

    // Precedence of a list operator's arguments: stops at the comma-less word operators.
    static final int LIST_OPERATOR_PRECEDENCE = 4;
    static final int COMMA_PRECEDENCE = 5;
    static final int ASSIGNMENT_PRECEDENCE = 6;
    static final int NAMED_UNARY_PRECEDENCE = 16;
    static final int UNARY_PRECEDENCE = 21;
    static final int POW_PRECEDENCE = 22;

    /**
     * Adds operators to the precedence map with the specified precedence level.
     *
     * @param precedence The precedence level.
     * @param operators  The operators to add.
     */
    private static void addOperatorsToMap(int precedence, String... operators) {
        for (String operator : operators) {
            precedenceMap.put(operator, precedence);
        }
    }
}
