package im.arun.pyfmt.model;

public enum BoolOperator {
    AND("And", "and", Precedence.AND),
    OR("Or", "or", Precedence.OR);

    private final String astName;
    private final String symbol;
    private final int precedence;

    BoolOperator(String astName, String symbol, int precedence) {
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

    public static BoolOperator fromAstName(String name) {
        for (BoolOperator op : values()) {
            if (op.astName.equals(name)) {
                return op;
            }
        }
        return null;
    }
}
