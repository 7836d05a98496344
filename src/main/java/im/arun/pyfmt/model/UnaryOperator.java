package im.arun.pyfmt.model;

public enum UnaryOperator {
    INVERT("Invert", "~", Precedence.FACTOR),
    NOT("Not", "not ", Precedence.NOT),
    UADD("UAdd", "+", Precedence.FACTOR),
    USUB("USub", "-", Precedence.FACTOR);

    private final String astName;
    private final String symbol;
    private final int precedence;

    UnaryOperator(String astName, String symbol, int precedence) {
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

    public static UnaryOperator fromAstName(String name) {
        for (UnaryOperator op : values()) {
            if (op.astName.equals(name)) {
                return op;
            }
        }
        return null;
    }
}
