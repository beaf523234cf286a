package com.ecolang.script.parser;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.ecolang.script.runtime.RunSettings;

/**
 * Variable bindings of one execution frame. The top-level program owns one;
 * each function call gets a fresh one that inherits only the runtime signals.
 */
public class Environment {
    /** Current op-cost multiplier, written by {@code savePower}. */
    public static final String OPS_SCALE = "_ops_scale";
    /** Running op total, refreshed before every statement for {@code ecoOps()}. */
    public static final String ECO_OPS = "_eco_ops";

    private final Map<String, Value> values = new LinkedHashMap<>();
    private final Set<String> constants = new HashSet<>();
    private final int maxStringLength;
    private final int maxArrayLength;

    public Environment() {
        this(RunSettings.defaults().maxStringLength(), RunSettings.defaults().maxArrayLength());
    }

    /** Root frame whose expressions may build strings and arrays up to the given sizes. */
    public Environment(int maxStringLength, int maxArrayLength) {
        this.maxStringLength = maxStringLength;
        this.maxArrayLength = maxArrayLength;
        values.put(OPS_SCALE, Value.number(1.0));
        values.put(ECO_OPS, Value.integer(0));
    }

    public static boolean isReserved(String name) {
        return OPS_SCALE.equals(name) || ECO_OPS.equals(name);
    }

    /** New call frame: empty bindings, signals copied from this frame. */
    public Environment newFrame() {
        Environment frame = new Environment(maxStringLength, maxArrayLength);
        frame.values.put(OPS_SCALE, values.get(OPS_SCALE));
        frame.values.put(ECO_OPS, values.get(ECO_OPS));
        return frame;
    }

    /** @return the bound value, or null when the name is unbound */
    public Value get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public boolean isConst(String name) {
        return constants.contains(name);
    }

    public void define(String name, Value value) {
        if (isReserved(name)) throw new IllegalArgumentException("Reserved name: " + name);
        values.put(name, value);
    }

    public void defineConst(String name, Value value) {
        define(name, value);
        constants.add(name);
    }

    void setSignal(String key, Value value) {
        if (!isReserved(key)) throw new IllegalArgumentException("Not a runtime signal: " + key);
        values.put(key, value);
    }

    public int maxStringLength() { return maxStringLength; }

    public int maxArrayLength() { return maxArrayLength; }

    public double opsScale() {
        return values.get(OPS_SCALE).asNumber();
    }

    /** User-visible bindings, signals excluded, in definition order. */
    public Map<String, Value> snapshot() {
        Map<String, Value> out = new LinkedHashMap<>(values);
        out.remove(OPS_SCALE);
        out.remove(ECO_OPS);
        return Collections.unmodifiableMap(out);
    }
}
