package com.blockflow.pygen.api;

/**
 * Binding strength of a generated Python expression.
 *
 * <p>
 * Lower strength binds tighter. An operand is wrapped in parentheses when its
 * integer class is not below the class of the context it is embedded in, with
 * the exceptions Python allows for chained calls, member access and repeated
 * logical operators.
 */
public enum Precedence {
    ATOMIC(0),
    COLLECTION(1),
    STRING_CONVERSION(1),
    FUNCTION_CALL(2),
    MEMBER(2.1),
    EXPONENTIATION(3),
    UNARY_SIGN(4),
    BITWISE_NOT(4),
    MULTIPLICATIVE(5),
    ADDITIVE(6),
    BITWISE_SHIFT(7),
    BITWISE_AND(8),
    BITWISE_XOR(9),
    BITWISE_OR(10),
    RELATIONAL(11),
    LOGICAL_NOT(12),
    LOGICAL_AND(13),
    LOGICAL_OR(14),
    CONDITIONAL(15),
    LAMBDA(16),
    NONE(99);

    private final double strength;

    Precedence(double strength) {
        this.strength = strength;
    }

    public double strength() {
        return strength;
    }

    /**
     * Returns true if an operand of precedence {@code inner} must be
     * parenthesized when placed in a context of precedence {@code outer}.
     */
    public static boolean needsParens(Precedence outer, Precedence inner) {
        int outerClass = outer.orderClass();
        int innerClass = inner.orderClass();
        if (outerClass > innerClass)
            return false;
        if (outerClass == innerClass && (outerClass == 0 || outerClass == 99))
            return false;
        return !isOverride(outer, inner);
    }

    private int orderClass() {
        return (int) Math.floor(strength);
    }

    private static boolean isOverride(Precedence outer, Precedence inner) {
        boolean callOrMember = (outer == FUNCTION_CALL || outer == MEMBER)
                && (inner == FUNCTION_CALL || inner == MEMBER);
        boolean sameLogical = outer == inner
                && (outer == LOGICAL_NOT || outer == LOGICAL_AND || outer == LOGICAL_OR);
        return callOrMember || sameLogical;
    }
}
