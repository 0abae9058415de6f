package hw;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import oshi.SystemInfo;
import oshi.hardware.PowerSource;

/**
 * Power state via OSHI, plus the worker-count policy derived from it.
 * System properties {@code forceOnAC} and {@code forceBatteryLevel}
 * override the probe.
 */
public final class BatteryMonitor {

    private static final Logger logger = LoggerFactory.getLogger(BatteryMonitor.class);

    private BatteryMonitor() {
    }

    /** Snapshot of the power source: on mains, and charge in percent. */
    public record PowerState(boolean onAC, int batteryLevel) {
    }

    public static PowerState current() {
        return new PowerState(onAC(), levelOrGuess());
    }

    public static boolean onAC() {
        String override = System.getProperty("forceOnAC");
        if (override != null)
            return Boolean.parseBoolean(override);

        try {
            List<PowerSource> ps = powerSources();
            if (ps.isEmpty())
                return true; // desktop
            for (PowerSource p : ps) {
                if (p.isPowerOnLine())
                    return true;
            }
            return false;
        } catch (Throwable t) {
            logger.debug("Power source probe failed, assuming AC: {}", t.getMessage());
            return true;
        }
    }

    public static int levelOrGuess() {
        String lvl = System.getProperty("forceBatteryLevel");
        if (lvl != null) {
            try {
                int v = Integer.parseInt(lvl.trim());
                return Math.max(0, Math.min(100, v));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring forceBatteryLevel={}: not an integer", lvl);
            }
        }

        try {
            List<PowerSource> ps = powerSources();
            double sum = 0;
            int n = 0;
            for (PowerSource p : ps) {
                double pct = p.getRemainingCapacityPercent();
                if (!Double.isNaN(pct)) {
                    sum += pct;
                    n++;
                }
            }
            if (n == 0)
                return 100;
            return (int) Math.round((sum / n) * 100.0);
        } catch (Throwable t) {
            logger.debug("Battery level probe failed, assuming full: {}", t.getMessage());
            return 100;
        }
    }

    private static List<PowerSource> powerSources() {
        return new SystemInfo().getHardware().getPowerSources();
    }

    // ---------------- Policy ----------------

    /**
     * Workers for {@code cores} processors: oversubscribe on AC or a nearly
     * full battery, one per core above 40 %, half the cores below.
     */
    public static int threadsFor(PowerState state, int cores) {
        int c = Math.max(1, cores);
        if (state.onAC() || state.batteryLevel() >= 80)
            return Math.min(c * 2, c + 4);
        if (state.batteryLevel() >= 40)
            return c;
        return Math.max(1, c / 2);
    }

    public static int threadsFor(PowerState state) {
        return threadsFor(state, Runtime.getRuntime().availableProcessors());
    }

    /** GPU use needs a request and more than 30 % charge, regardless of AC. */
    public static boolean gpuAllowed(PowerState state, boolean requested) {
        return requested && state.batteryLevel() > 30;
    }
}
