package org.example.questionnaire;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Locale;

/**
 * Console logger for the tool. Everything is written to stderr, so that
 * {@code convert} can stream JSON on stdout.
 *
 * The level starts from the {@code questionnaire.loglevel} system property
 * (none, error, warn, info, debug; default warn) and can be changed with
 * {@code --log-level}.
 */
public final class Logger {

    public static final String LEVEL_PROPERTY = "questionnaire.loglevel";

    public enum Level {
        NONE(""), ERROR("[ERROR] "), WARN("[WARN]  "), INFO("[INFO]  "), DEBUG("[DEBUG] ");

        private final String prefix;

        Level(String prefix) {
            this.prefix = prefix;
        }

        /** The level called {@code name}, ignoring case, or {@code fallback} when there is none. */
        public static Level parse(String name, Level fallback) {
            if (name == null) return fallback;
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return fallback;
            }
        }
    }

    private static volatile Level level = Level.parse(System.getProperty(LEVEL_PROPERTY), Level.WARN);

    private Logger() {
    }

    public static void setLevel(Level newLevel) {
        level = newLevel == null ? Level.WARN : newLevel;
    }

    public static boolean isEnabled(Level l) {
        return l != Level.NONE && l.ordinal() <= level.ordinal();
    }

    public static boolean isDebugEnabled() {
        return isEnabled(Level.DEBUG);
    }

    public static void error(String msg, Object... args) {
        log(Level.ERROR, msg, args);
    }

    public static void warn(String msg, Object... args) {
        log(Level.WARN, msg, args);
    }

    public static void info(String msg, Object... args) {
        log(Level.INFO, msg, args);
    }

    public static void debug(String msg, Object... args) {
        log(Level.DEBUG, msg, args);
    }

    /** Logs {@code msg} at error level followed by the stack trace of {@code t}. */
    public static void error(String msg, Throwable t) {
        if (!isEnabled(Level.ERROR)) return;
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        log(Level.ERROR, "%s%n%s", msg, sw);
    }

    private static void log(Level l, String msg, Object... args) {
        if (isEnabled(l)) System.err.printf(l.prefix + msg + "%n", args);
    }
}
