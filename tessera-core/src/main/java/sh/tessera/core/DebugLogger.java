// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opt-in operation and event tracing, gated by {@link TesseraDebug}.
 *
 * <p>Messages use {@link String#formatted} placeholders and are passed through
 * {@link LogSanitizer} before reaching SLF4J.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.tessera.debug");

    private DebugLogger() {
    }

    public static void logOperation(final String message, final Object... args) {
        if (!TesseraDebug.isOperationLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logEvent(final String message, final Object... args) {
        if (!TesseraDebug.isEventLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void log(final String message, final Object... args) {
        if (!TesseraDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
