package com.ecolang.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Energy / CO2 estimate attached to a successful run. */
@JsonPropertyOrder({"total_ops", "energy_J", "energy_kWh", "co2_g", "tips"})
public final class EcoStats {

    /** Above this many weighted operations a run counts as energy-hungry. */
    public static final long HIGH_USAGE_OPS = 1000;

    public static final String HIGH_USAGE_TIP = "Consider reducing loop iterations or heavy math operations";
    public static final String HIGH_USAGE_WARNING = "High estimated energy use";

    private static final double JOULES_PER_KWH = 3_600_000.0;

    private final long totalOps;
    private final double energyJ;
    private final double energyKWh;
    private final double co2G;
    private final List<String> tips;

    private EcoStats(long totalOps, double energyJ, double energyKWh, double co2G, List<String> tips) {
        this.totalOps = totalOps;
        this.energyJ = energyJ;
        this.energyKWh = energyKWh;
        this.co2G = co2G;
        this.tips = Collections.unmodifiableList(tips);
    }

    public static EcoStats compute(long totalOps, double durationS, RunSettings settings) {
        double duration = Math.max(0.000001, durationS);
        double computeJ = totalOps * settings.energyPerOpJ();
        double idleJ = duration * settings.idlePowerW();
        double energyJ = computeJ + idleJ;
        double kWh = energyJ / JOULES_PER_KWH;
        double co2 = kWh * settings.co2PerKwhG();

        List<String> tips = new ArrayList<>();
        if (isHighUsage(totalOps)) tips.add(HIGH_USAGE_TIP);
        return new EcoStats(totalOps, energyJ, kWh, co2, tips);
    }

    public static boolean isHighUsage(long totalOps) {
        return totalOps > HIGH_USAGE_OPS;
    }

    @JsonProperty("total_ops")
    public long getTotalOps() { return totalOps; }

    @JsonProperty("energy_J")
    public double getEnergyJ() { return energyJ; }

    @JsonProperty("energy_kWh")
    public double getEnergyKWh() { return energyKWh; }

    @JsonProperty("co2_g")
    public double getCo2G() { return co2G; }

    @JsonProperty("tips")
    public List<String> getTips() { return tips; }
}
