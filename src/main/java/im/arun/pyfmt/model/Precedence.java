package im.arun.pyfmt.model;

/**
 * Binding strength of expression kinds, weakest first.
 * A child rendered into a slot that requires a higher value than its own is parenthesized.
 */
public final class Precedence {
    public static final int TUPLE = 0;
    public static final int YIELD = 1;
    public static final int NAMED = 2;
    public static final int LAMBDA = 3;
    public static final int IF_EXP = 4;
    public static final int OR = 5;
    public static final int AND = 6;
    public static final int NOT = 7;
    public static final int COMPARE = 8;
    public static final int BIT_OR = 9;
    public static final int BIT_XOR = 10;
    public static final int BIT_AND = 11;
    public static final int SHIFT = 12;
    public static final int ARITH = 13;
    public static final int TERM = 14;
    public static final int FACTOR = 15;
    public static final int POWER = 16;
    public static final int AWAIT = 17;
    public static final int ATOM = 18;

    private Precedence() {}
}
