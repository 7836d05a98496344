package im.arun.pyfmt.model;

public enum CompareOperator {
    EQ("Eq", "=="),
    NOT_EQ("NotEq", "!="),
    LT("Lt", "<"),
    LT_E("LtE", "<="),
    GT("Gt", ">"),
    GT_E("GtE", ">="),
    IS("Is", "is"),
    IS_NOT("IsNot", "is not"),
    IN("In", "in"),
    NOT_IN("NotIn", "not in");

    private final String astName;
    private final String symbol;

    CompareOperator(String astName, String symbol) {
        this.astName = astName;
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static CompareOperator fromAstName(String name) {
        for (CompareOperator op : values()) {
            if (op.astName.equals(name)) {
                return op;
            }
        }
        return null;
    }
}
