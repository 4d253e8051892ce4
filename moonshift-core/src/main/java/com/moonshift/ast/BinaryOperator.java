package com.moonshift.ast;

import com.moonshift.TokenType;

/**
 * Binary operators with Lua's left/right priorities. A right priority lower than the left
 * one makes the operator right-associative.
 */
public enum BinaryOperator {
    OR("or", 1, 1),
    AND("and", 2, 2),
    LT("<", 3, 3),
    GT(">", 3, 3),
    LE("<=", 3, 3),
    GE(">=", 3, 3),
    NE("~=", 3, 3),
    EQ("==", 3, 3),
    CONCAT("..", 9, 8),
    ADD("+", 10, 10),
    SUB("-", 10, 10),
    MUL("*", 11, 11),
    DIV("/", 11, 11),
    FLOOR_DIV("//", 11, 11),
    MOD("%", 11, 11),
    POW("^", 14, 13);

    /** Priority of unary operators, between multiplicative and {@code ^}. */
    public static final int UNARY_PRIORITY = 12;

    private final String symbol;
    private final int leftPriority;
    private final int rightPriority;

    BinaryOperator(String symbol, int leftPriority, int rightPriority) {
        this.symbol = symbol;
        this.leftPriority = leftPriority;
        this.rightPriority = rightPriority;
    }

    public String symbol() {
        return symbol;
    }

    public int leftPriority() {
        return leftPriority;
    }

    public int rightPriority() {
        return rightPriority;
    }

    public boolean isRightAssociative() {
        return rightPriority < leftPriority;
    }

    public boolean isComparison() {
        return leftPriority == 3;
    }

    public boolean isArithmetic() {
        return leftPriority >= 10;
    }

    public static BinaryOperator fromToken(TokenType type) {
        return switch (type) {
            case OR -> OR;
            case AND -> AND;
            case LT -> LT;
            case GT -> GT;
            case LE -> LE;
            case GE -> GE;
            case NE -> NE;
            case EQ -> EQ;
            case CONCAT -> CONCAT;
            case PLUS -> ADD;
            case MINUS -> SUB;
            case STAR -> MUL;
            case SLASH -> DIV;
            case DOUBLE_SLASH -> FLOOR_DIV;
            case PERCENT -> MOD;
            case CARET -> POW;
            default -> null;
        };
    }

    /**
     * The operator behind a compound assignment token such as {@code +=}.
     */
    public static BinaryOperator fromCompoundAssignment(TokenType type) {
        return switch (type) {
            case PLUS_ASSIGN -> ADD;
            case MINUS_ASSIGN -> SUB;
            case STAR_ASSIGN -> MUL;
            case SLASH_ASSIGN -> DIV;
            case DOUBLE_SLASH_ASSIGN -> FLOOR_DIV;
            case PERCENT_ASSIGN -> MOD;
            case CARET_ASSIGN -> POW;
            case CONCAT_ASSIGN -> CONCAT;
            default -> null;
        };
    }
}
