/**
 * Logging helpers that attach exception detail consistently
 *
 * @author William Callahan
 *
 * Features:
 * - Appends the root cause message to the formatted line
 * - Keeps the full stack trace at DEBUG for warnings, always for errors
 * - Dry-run prefix for messages describing writes that were skipped
 */
package com.williamcallahan.media_metadata_sync.util;

import org.slf4j.Logger;
import org.slf4j.helpers.MessageFormatter;

public final class LoggingUtils {

    public static final String DRY_RUN_PREFIX = "[Dry Run] ";

    private LoggingUtils() {
    }

    public static void warn(Logger log, Throwable e, String format, Object... args) {
        String message = format(format, args) + ": " + rootCauseMessage(e);
        if (log.isDebugEnabled()) {
            log.warn(message, e);
        } else {
            log.warn(message);
        }
    }

    public static void error(Logger log, Throwable e, String format, Object... args) {
        log.error(format(format, args) + ": " + rootCauseMessage(e), e);
    }

    /**
     * Prefixes the message with "[Dry Run] " when the run performs no writes
     */
    public static String dryRun(boolean dryRun, String format) {
        return dryRun ? DRY_RUN_PREFIX + format : format;
    }

    public static String rootCauseMessage(Throwable e) {
        if (e == null) {
            return "unknown error";
        }
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return root.getClass().getSimpleName() + (message != null ? " - " + message : "");
    }

    private static String format(String format, Object... args) {
        return MessageFormatter.arrayFormat(format, args).getMessage();
    }
}
