import org.junit.jupiter.api.Test;

import com.ecolang.script.runtime.RunSettings;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RunSettingsTest {

    @Test
    void defaults() {
        RunSettings s = RunSettings.defaults();
        assertEquals(100_000, s.maxSteps());
        assertEquals(10_000, s.maxLoop());
        assertEquals(1.5, s.maxTimeS(), 0.0);
        assertEquals(5_000, s.maxOutputChars());
        assertEquals(5, s.maxCallDepth());
        assertEquals(3, s.maxFuncParams());
        assertEquals(100_000, s.maxStringLength());
        assertEquals(10_000, s.maxArrayLength());
        assertEquals(1e-9, s.energyPerOpJ(), 0.0);
        assertEquals(0.5, s.idlePowerW(), 0.0);
        assertEquals(475, s.co2PerKwhG(), 0.0);
        assertFalse(s.useSubprocess());
    }

    @Test
    void fromMap_overlaysKnownKeysAndIgnoresOthers() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("max_steps", 50);
        raw.put("max_time_s", "0.25");
        raw.put("use_subprocess", true);
        raw.put("co2_per_kwh_g", 300.5);
        raw.put("unrelated", "x");

        RunSettings s = RunSettings.fromMap(raw);
        assertEquals(50, s.maxSteps());
        assertEquals(0.25, s.maxTimeS(), 0.0);
        assertTrue(s.useSubprocess());
        assertEquals(300.5, s.co2PerKwhG(), 0.0);
        assertEquals(10_000, s.maxLoop());
    }

    @Test
    void fromMap_rejectsMalformedValues() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("max_loop", "many");
        assertThrows(IllegalArgumentException.class, () -> RunSettings.fromMap(raw));

        Map<String, Object> negative = new HashMap<>();
        negative.put("max_steps", -1);
        assertThrows(IllegalArgumentException.class, () -> RunSettings.fromMap(negative));
    }

    @Test
    void clampTo_lowersSafetyLimitsOnly() {
        RunSettings requested = RunSettings.builder()
                .maxSteps(1_000_000)
                .maxLoop(10)
                .maxCallDepth(50)
                .maxStringLength(5_000_000)
                .maxArrayLength(20)
                .energyPerOpJ(5.0)
                .useSubprocess(true)
                .build();

        RunSettings clamped = requested.clampTo(RunSettings.defaults());
        assertEquals(100_000, clamped.maxSteps());
        assertEquals(10, clamped.maxLoop());
        assertEquals(5, clamped.maxCallDepth());
        assertEquals(100_000, clamped.maxStringLength());
        assertEquals(20, clamped.maxArrayLength());
        assertEquals(5.0, clamped.energyPerOpJ(), 0.0);
        assertTrue(clamped.useSubprocess());
    }

    @Test
    void sizeLimits_readFromMapAndRejectNegatives() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("max_string_length", 64);
        raw.put("max_array_length", "8");
        RunSettings s = RunSettings.fromMap(raw);
        assertEquals(64, s.maxStringLength());
        assertEquals(8, s.maxArrayLength());

        raw.put("max_array_length", -1);
        assertThrows(IllegalArgumentException.class, () -> RunSettings.fromMap(raw));
    }

    @Test
    void toMap_roundTripsThroughFromMap() {
        RunSettings s = RunSettings.builder().maxSteps(7).timeoutS(2.0).build();
        assertEquals(s.toMap(), RunSettings.fromMap(s.toMap()).toMap());
    }
}
