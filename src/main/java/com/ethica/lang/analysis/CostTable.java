package com.ethica.lang.analysis;

/** Per-node energy costs, in abstract energy units. */
public final class CostTable {
    private static final CostTable DEFAULTS = new CostTable(1, 1, 2, 3, 2, 10, 1, 5, 3, 2, 3);

    private final int literal;
    private final int variable;
    private final int assignment;
    private final int binaryOp;
    private final int unaryOp;
    private final int call;
    private final int returnStatement;
    private final int indexAccess;
    private final int memberAccess;
    private final int listElement;
    private final int dictPair;

    public CostTable(int literal, int variable, int assignment, int binaryOp, int unaryOp,
                     int call, int returnStatement, int indexAccess, int memberAccess,
                     int listElement, int dictPair) {
        int[] all = { literal, variable, assignment, binaryOp, unaryOp, call, returnStatement,
                indexAccess, memberAccess, listElement, dictPair };
        for (int c : all) {
            if (c < 0) throw new IllegalArgumentException("energy costs must be >= 0");
        }
        this.literal = literal;
        this.variable = variable;
        this.assignment = assignment;
        this.binaryOp = binaryOp;
        this.unaryOp = unaryOp;
        this.call = call;
        this.returnStatement = returnStatement;
        this.indexAccess = indexAccess;
        this.memberAccess = memberAccess;
        this.listElement = listElement;
        this.dictPair = dictPair;
    }

    public static CostTable defaults() { return DEFAULTS; }

    public int literal() { return literal; }
    public int variable() { return variable; }
    public int assignment() { return assignment; }
    public int binaryOp() { return binaryOp; }
    public int unaryOp() { return unaryOp; }
    public int call() { return call; }
    public int returnStatement() { return returnStatement; }
    public int indexAccess() { return indexAccess; }
    public int memberAccess() { return memberAccess; }
    /** Cost per element of a list literal. */
    public int listElement() { return listElement; }
    /** Cost per entry of a dict literal. */
    public int dictPair() { return dictPair; }
}
