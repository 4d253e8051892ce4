package com.moonshift.pass;

import com.moonshift.ast.BinaryOperator;
import com.moonshift.ast.UnaryOperator;
import com.moonshift.value.LuaStrings;
import com.moonshift.value.LuaValue;

/**
 * Compile-time evaluation over {@link LuaValue}. Every method returns null when the
 * result is not provably what every supported runtime would compute; callers then leave
 * the expression alone.
 */
public final class ConstantEvaluator {

    private ConstantEvaluator() {
        // Utility class
    }

    /**
     * Evaluates {@code left op right}. {@code and}/{@code or} are not handled here because
     * their right operand need not be constant.
     */
    public static LuaValue binary(BinaryOperator operator, LuaValue left, LuaValue right) {
        switch (operator) {
            case EQ:
                return LuaValue.of(rawEquals(left, right));
            case NE:
                return LuaValue.of(!rawEquals(left, right));
            case CONCAT:
                return concat(left, right);
            case AND:
            case OR:
                return null;
            default:
                break;
        }
        if (!(left instanceof LuaValue.Num l) || !(right instanceof LuaValue.Num r)) {
            // String coercion and string ordering are left to the runtime
            return null;
        }
        double a = l.value();
        double b = r.value();
        return switch (operator) {
            case LT -> LuaValue.of(a < b);
            case LE -> LuaValue.of(a <= b);
            case GT -> LuaValue.of(a > b);
            case GE -> LuaValue.of(a >= b);
            case ADD -> number(a + b);
            case SUB -> number(a - b);
            case MUL -> number(a * b);
            case DIV -> number(a / b);
            case FLOOR_DIV -> number(Math.floor(a / b));
            case MOD -> number(a - Math.floor(a / b) * b);
            case POW -> number(Math.pow(a, b));
            default -> null;
        };
    }

    public static LuaValue unary(UnaryOperator operator, LuaValue operand) {
        return switch (operator) {
            case NOT -> LuaValue.of(!operand.isTruthy());
            case NEG -> operand instanceof LuaValue.Num n ? number(-n.value()) : null;
            case LEN -> operand instanceof LuaValue.Str s ? LuaValue.of(s.length()) : null;
        };
    }

    public static boolean rawEquals(LuaValue left, LuaValue right) {
        if (left instanceof LuaValue.Num l && right instanceof LuaValue.Num r) {
            return l.value() == r.value();
        }
        return left.equals(right);
    }

    private static LuaValue concat(LuaValue left, LuaValue right) {
        String l = concatOperand(left);
        String r = concatOperand(right);
        if (l == null || r == null) {
            return null;
        }
        return LuaValue.ofBytes(l + r);
    }

    private static String concatOperand(LuaValue value) {
        if (value instanceof LuaValue.Str s) {
            return s.bytes();
        }
        if (value instanceof LuaValue.Num n) {
            return LuaStrings.integralToString(n.value());
        }
        return null;
    }

    // NaN, infinities and negative zero have no portable literal spelling
    private static LuaValue number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        if (value == 0 && 1 / value < 0) {
            return null;
        }
        return LuaValue.of(value);
    }
}
