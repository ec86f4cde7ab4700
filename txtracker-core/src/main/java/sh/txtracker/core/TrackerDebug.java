// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.txtracker.core;

/**
 * Global toggle for verbose per-event tracing.
 *
 * <p>Both switches start from the {@code txtracker.debug} system property and
 * can be flipped at runtime. The flags are volatile; a reader may briefly see
 * one updated before the other, which only affects tracing.
 */
public final class TrackerDebug {

    /**
     * System property that enables all tracing at startup when set to {@code true}.
     */
    public static final String PROPERTY = "txtracker.debug";

    private static volatile boolean ingestLogging = Boolean.getBoolean(PROPERTY);
    private static volatile boolean queryLogging = Boolean.getBoolean(PROPERTY);

    private TrackerDebug() {
    }

    public static boolean isEnabled() {
        return ingestLogging || queryLogging;
    }

    public static void setEnabled(final boolean enabled) {
        ingestLogging = enabled;
        queryLogging = enabled;
    }

    public static void setIngestLogging(final boolean enabled) {
        ingestLogging = enabled;
    }

    public static boolean isIngestLoggingEnabled() {
        return ingestLogging;
    }

    public static void setQueryLogging(final boolean enabled) {
        queryLogging = enabled;
    }

    public static boolean isQueryLoggingEnabled() {
        return queryLogging;
    }
}
