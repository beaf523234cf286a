package com.ecolang.script.runtime;

/** Operation categories of the eco cost table and their integer weights. */
public enum OpCategory {
    PRINT("print", 50),
    LOOP_CHECK("loop_check", 5),
    MATH("math", 10),
    ASSIGN("assign", 5),
    IO("io", 200),
    OPTIMIZE("optimize", 1000),
    OTHER("other", 5),
    FUNC_CALL("func_call", 20);

    private final String key;
    private final int weight;

    OpCategory(String key, int weight) {
        this.key = key;
        this.weight = weight;
    }

    public String key() { return key; }

    public int weight() { return weight; }

    /** Weight scaled by the savePower multiplier, truncated toward zero. */
    public long scaled(double scale) {
        return (long) (weight * scale);
    }
}
