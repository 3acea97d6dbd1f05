package org.pgstudio.cursor;

import java.sql.SQLException;

/** Raised from iteration when fetching the next batch from the cursor fails. */
public class CursorException extends RuntimeException {

    public CursorException(String message, SQLException cause) {
        super(message, cause);
    }

    @Override
    public synchronized SQLException getCause() {
        return (SQLException) super.getCause();
    }
}
