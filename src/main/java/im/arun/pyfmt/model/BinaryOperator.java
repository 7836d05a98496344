package im.arun.pyfmt.model;

/**
 * Arithmetic and bitwise operators, shared by binary expressions and augmented assignment.
 */
public enum BinaryOperator {
    ADD("Add", "+", Precedence.ARITH),
    SUB("Sub", "-", Precedence.ARITH),
    MULT("Mult", "*", Precedence.TERM),
    MAT_MULT("MatMult", "@", Precedence.TERM),
    DIV("Div", "/", Precedence.TERM),
    FLOOR_DIV("FloorDiv", "//", Precedence.TERM),
    MOD("Mod", "%", Precedence.TERM),
    POW("Pow", "**", Precedence.POWER),
    LSHIFT("LShift", "<<", Precedence.SHIFT),
    RSHIFT("RShift", ">>", Precedence.SHIFT),
    BIT_OR("BitOr", "|", Precedence.BIT_OR),
    BIT_XOR("BitXor", "^", Precedence.BIT_XOR),
    BIT_AND("BitAnd", "&", Precedence.BIT_AND);

    private final String astName;
    private final String symbol;
    private final int precedence;

    BinaryOperator(String astName, String symbol, int precedence) {
        this.astName = astName;
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return this == POW;
    }

    public static BinaryOperator fromAstName(String name) {
        for (BinaryOperator op : values()) {
            if (op.astName.equals(name)) {
                return op;
            }
        }
        return null;
    }
}
