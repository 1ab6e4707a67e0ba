package com.example.vitals.errors;

import java.sql.SQLException;
import org.hibernate.JDBCException;

/**
 * Recognises the store telling us that another transaction already holds a
 * unique key we tried to insert.
 */
public final class KeyConflicts {

    // unique_violation, PostgreSQL and H2
    static final String UNIQUE_VIOLATION = "23505";
    // H2: the conflicting row exists but is not committed yet
    static final String CONCURRENT_UPDATE = "90131";

    private KeyConflicts() {}

    public static boolean isKeyConflict(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String state = null;
            if (t instanceof JDBCException jdbc) {
                state = jdbc.getSQLState();
            } else if (t instanceof SQLException sql) {
                state = sql.getSQLState();
            }
            if (UNIQUE_VIOLATION.equals(state) || CONCURRENT_UPDATE.equals(state)) {
                return true;
            }
        }
        return false;
    }
}
