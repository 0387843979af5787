package org.example.questionnaire.validation;

import java.util.EnumMap;
import java.util.Map;

/**
 * The single place that decides whether a finding stops processing.
 *
 * <pre>
 *              CRITICAL   ERROR           WARNING
 *   STRICT     ABORT      ABORT           RECORD
 *   NORMAL     ABORT      LOG_AND_ABORT   RECORD
 *   LENIENT    ABORT      RECORD          RECORD
 * </pre>
 */
public final class ValidationPolicy {

    public enum Action {
        RECORD, LOG_AND_ABORT, ABORT;

        public boolean aborts() {
            return this != RECORD;
        }
    }

    private static final Map<ValidationLevel, Map<Severity, Action>> TABLE = new EnumMap<>(ValidationLevel.class);

    static {
        TABLE.put(ValidationLevel.STRICT, row(Action.ABORT, Action.ABORT, Action.RECORD));
        TABLE.put(ValidationLevel.NORMAL, row(Action.ABORT, Action.LOG_AND_ABORT, Action.RECORD));
        TABLE.put(ValidationLevel.LENIENT, row(Action.ABORT, Action.RECORD, Action.RECORD));
    }

    private ValidationPolicy() {
    }

    public static Action decide(ValidationLevel level, Severity severity) {
        return TABLE.get(level).get(severity);
    }

    private static Map<Severity, Action> row(Action critical, Action error, Action warning) {
        Map<Severity, Action> row = new EnumMap<>(Severity.class);
        row.put(Severity.CRITICAL, critical);
        row.put(Severity.ERROR, error);
        row.put(Severity.WARNING, warning);
        return row;
    }
}
