package hw;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import hw.BatteryMonitor.PowerState;

public class TestBatteryMonitor {

    @AfterEach
    public void clearOverrides() {
        System.clearProperty("forceOnAC");
        System.clearProperty("forceBatteryLevel");
    }

    @Test
    public void test_threadPolicy() {
        assertEquals(12, BatteryMonitor.threadsFor(new PowerState(true, 5), 8));
        assertEquals(8, BatteryMonitor.threadsFor(new PowerState(true, 100), 4));
        assertEquals(12, BatteryMonitor.threadsFor(new PowerState(false, 80), 8));
        assertEquals(8, BatteryMonitor.threadsFor(new PowerState(false, 79), 8));
        assertEquals(8, BatteryMonitor.threadsFor(new PowerState(false, 40), 8));
        assertEquals(4, BatteryMonitor.threadsFor(new PowerState(false, 39), 8));
        assertEquals(1, BatteryMonitor.threadsFor(new PowerState(false, 10), 1));
        assertEquals(2, BatteryMonitor.threadsFor(new PowerState(true, 0), 0));
    }

    @Test
    public void test_gpuPolicy() {
        assertTrue(BatteryMonitor.gpuAllowed(new PowerState(false, 31), true));
        assertFalse(BatteryMonitor.gpuAllowed(new PowerState(true, 30), true));
        assertFalse(BatteryMonitor.gpuAllowed(new PowerState(true, 100), false));
    }

    @Test
    public void test_overrides() {
        System.setProperty("forceOnAC", "false");
        System.setProperty("forceBatteryLevel", "150");
        PowerState state = BatteryMonitor.current();
        assertFalse(state.onAC());
        assertEquals(100, state.batteryLevel());

        System.setProperty("forceBatteryLevel", " 42 ");
        assertEquals(42, BatteryMonitor.levelOrGuess());
        System.setProperty("forceOnAC", "true");
        assertTrue(BatteryMonitor.onAC());
    }
}
