// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

/**
 * Global toggles for verbose operation tracing.
 *
 * <p>Both flags are volatile. {@link #isEnabled()} reads them non-atomically,
 * which only affects whether a trace line is printed.
 */
public final class TesseraDebug {

    private static volatile boolean operationLogging = false;
    private static volatile boolean eventLogging = false;

    private TesseraDebug() {
    }

    public static boolean isEnabled() {
        return operationLogging || eventLogging;
    }

    public static void setEnabled(final boolean enabled) {
        operationLogging = enabled;
        eventLogging = enabled;
    }

    public static void setOperationLogging(final boolean enabled) {
        operationLogging = enabled;
    }

    public static boolean isOperationLoggingEnabled() {
        return operationLogging;
    }

    public static void setEventLogging(final boolean enabled) {
        eventLogging = enabled;
    }

    public static boolean isEventLoggingEnabled() {
        return eventLogging;
    }
}
