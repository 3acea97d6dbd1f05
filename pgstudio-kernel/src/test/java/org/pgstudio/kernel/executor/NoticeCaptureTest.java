package org.pgstudio.kernel.executor;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NoticeCaptureTest {

    @Test
    void collectsStatementAndConnectionNoticesInOrder() throws Exception {
        Connection conn = mock(Connection.class);
        Statement stmt = mock(Statement.class);
        SQLWarning first = new SQLWarning("NOTICE: table created");
        first.setNextWarning(new SQLWarning("NOTICE: index created"));
        when(stmt.getWarnings()).thenReturn(first);
        when(conn.getWarnings()).thenReturn(new SQLWarning("NOTICE: from connection"));

        List<String> notices;
        try (NoticeCapture capture = NoticeCapture.open(conn)) {
            notices = capture.drain(stmt);
        }

        assertThat(notices).containsExactly("NOTICE: table created", "NOTICE: index created", "NOTICE: from connection");
        verify(stmt).clearWarnings();
        // open, drain and close each clear the connection
        verify(conn, times(3)).clearWarnings();
    }

    @Test
    void nothingPendingMeansNoNotices() throws Exception {
        Connection conn = mock(Connection.class);

        try (NoticeCapture capture = NoticeCapture.open(conn)) {
            assertThat(capture.drain(null)).isEmpty();
        }
    }
}
