import org.junit.jupiter.api.Test;

import com.ecolang.script.EcoLang;
import com.ecolang.script.runtime.EcoStats;
import com.ecolang.script.runtime.OpCategory;
import com.ecolang.script.runtime.RunResult;
import com.ecolang.script.runtime.RunSettings;

import static org.junit.jupiter.api.Assertions.*;

public class EcoAccountingTest {

    private static long ops(String src) {
        RunResult r = new EcoLang().execute(src);
        assertNull(r.getError(), () -> "unexpected error: " + r.getError());
        return r.getEco().getTotalOps();
    }

    @Test
    void costTable() {
        assertEquals(50, OpCategory.PRINT.weight());
        assertEquals(5, OpCategory.LOOP_CHECK.weight());
        assertEquals(10, OpCategory.MATH.weight());
        assertEquals(5, OpCategory.ASSIGN.weight());
        assertEquals(200, OpCategory.IO.weight());
        assertEquals(1000, OpCategory.OPTIMIZE.weight());
        assertEquals(5, OpCategory.OTHER.weight());
        assertEquals(20, OpCategory.FUNC_CALL.weight());
        assertEquals("loop_check", OpCategory.LOOP_CHECK.key());
    }

    @Test
    void perStatementCharges() {
        assertEquals(55, ops("say 1\n"));
        assertEquals(10, ops("let x = 1\n"));
        assertEquals(20, ops("let x = 1 + 1\n"));
        assertEquals(10, ops("warn 1\n"));
        assertEquals(10, ops("ecoTip\n"));
        assertEquals(5, ops("savePower 10\n"));
        assertEquals(10, ops("func f\nend\n"));
        assertEquals(5, ops("if false then\nsay 1\nend\n"));
    }

    @Test
    void ask_chargesIo() {
        RunResult r = new EcoLang().execute("ask n\n", java.util.Collections.singletonMap("n", 3));
        assertEquals(205, r.getEco().getTotalOps());
    }

    @Test
    void loopsChargePerIteration() {
        // repeat: 5 + 3 * (5 loop check + 55 say)
        assertEquals(185, ops("repeat 3 times\nsay 1\nend\n"));
        // for: 5 + 2 * (5 + 55)
        assertEquals(125, ops("for i = 1 to 2\nsay i\nend\n"));
    }

    @Test
    void callChargesFuncCallPlusBody() {
        // func 10, call 5 + 20, body say 55
        assertEquals(90, ops("func f\nsay 1\nend\ncall f\n"));
    }

    @Test
    void savePower_reducesLaterCosts() {
        // savePower 5 at full price, then say at half: 2 + 25
        assertEquals(32, ops("savePower 50\nsay 1\n"));
        assertTrue(ops("savePower 50\nsay 1\n") < ops("say 1\nsay 1\n") - 55);
    }

    @Test
    void savePower_multiplierFloorsAtTenPercent() {
        // 0.1 scale: dispatch 0, print 5
        assertEquals(5 + 5, ops("savePower 500\nsay 1\n"));
    }

    @Test
    void ecoOps_seesRunningTotal() {
        RunResult r = new EcoLang().execute("say 1\nsay ecoOps()\n");
        assertEquals("1\n60\n", r.getOutput());
    }

    @Test
    void ecoStats_formulas() {
        RunSettings s = RunSettings.builder().energyPerOpJ(2.0).idlePowerW(10.0).co2PerKwhG(100).build();
        EcoStats eco = EcoStats.compute(1000, 0.5, s);
        assertEquals(1000 * 2.0 + 0.5 * 10.0, eco.getEnergyJ(), 1e-9);
        assertEquals(eco.getEnergyJ() / 3_600_000.0, eco.getEnergyKWh(), 1e-15);
        assertEquals(eco.getEnergyKWh() * 100, eco.getCo2G(), 1e-15);
        assertTrue(eco.getTips().isEmpty());
    }

    @Test
    void ecoStats_durationHasFloor() {
        EcoStats eco = EcoStats.compute(0, 0.0, RunSettings.defaults());
        assertEquals(0.000001 * 0.5, eco.getEnergyJ(), 1e-15);
    }

    @Test
    void highUsage_addsTipAndWarning() {
        RunResult r = new EcoLang().execute("repeat 30 times\nsay 1\nend\n");
        assertTrue(r.getEco().getTotalOps() > 1000);
        assertTrue(r.getEco().getTips().contains(EcoStats.HIGH_USAGE_TIP));
        assertEquals(EcoStats.HIGH_USAGE_WARNING, r.getWarnings().get(r.getWarnings().size() - 1));
    }

    @Test
    void lowUsage_hasNoTip() {
        RunResult r = new EcoLang().execute("say 1\n");
        assertTrue(r.getEco().getTips().isEmpty());
        assertFalse(r.getWarnings().contains(EcoStats.HIGH_USAGE_WARNING));
    }
}
