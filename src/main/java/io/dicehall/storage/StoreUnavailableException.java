package io.dicehall.storage;

import org.sqlite.SQLiteErrorCode;

import java.sql.SQLException;

/**
 * The store could not take the write lock within the busy timeout. Nothing was written; the
 * same work may be run again.
 */
public final class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    static boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException) {
                int primary = ((SQLException) t).getErrorCode() & 0xff;
                if (primary == SQLiteErrorCode.SQLITE_BUSY.code || primary == SQLiteErrorCode.SQLITE_LOCKED.code) {
                    return true;
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
