package org.autosemi.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

public class ParserTables {
    // Set of tokens that signify the end of an expression or statement.
    public static final Set<String> TERMINATORS =
            Set.of(";", ")", "}", "]", ",");
    // Words that cannot be used as names.
    public static final Set<String> RESERVED_WORDS = Set.of(
            "let", "mut", "fn", "if", "else", "while", "loop", "for", "in",
            "return", "break", "continue", "throw"
    );
    // Set of operators that are right associative.
    static final Set<String> RIGHT_ASSOC_OP = Set.of(
            "=", "+=", "-=", "*=", "/=", "%="
    );
    // Operators that can be written in front of an operand.
    static final Set<String> PREFIX_OP = Set.of("-", "!", "&", "*", "+");
    // Map to store operator precedence values.
    static final Map<String, Integer> precedenceMap = new HashMap<>();

    // Precedence of prefix operators: binds tighter than any infix operator
    static final int PREFIX_PRECEDENCE = 11;

    // Static block to initialize the precedence map with operators and their precedence levels.
    static {
        addOperatorsToMap(1, "=", "+=", "-=", "*=", "/=", "%=");
        addOperatorsToMap(2, "..", "..=");
        addOperatorsToMap(3, "||");
        addOperatorsToMap(4, "&&");
        addOperatorsToMap(5, "==", "!=", "<", ">", "<=", ">=");
        addOperatorsToMap(6, "|");
        addOperatorsToMap(7, "^");
        addOperatorsToMap(8, "&");
        addOperatorsToMap(9, "+", "-");
        addOperatorsToMap(10, "*", "/", "%");
        addOperatorsToMap(12, "(", "[", ".", "::", "?");
    }

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
