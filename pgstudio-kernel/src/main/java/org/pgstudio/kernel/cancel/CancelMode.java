package org.pgstudio.kernel.cancel;

public enum CancelMode {
    /** Abort the running statement; the backend and its session state survive. */
    CANCEL("SELECT pg_cancel_backend(?)"),
    /** Kill the backend process; the session connection is lost. */
    TERMINATE("SELECT pg_terminate_backend(?)");

    private final String sql;

    CancelMode(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }
}
