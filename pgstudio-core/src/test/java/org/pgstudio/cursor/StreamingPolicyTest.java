package org.pgstudio.cursor;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingPolicyTest {

    private final StreamingPolicy policy = new StreamingPolicy(1000);

    @Test
    void plainSelectIsStreamed() {
        assertThat(policy.shouldStream("  SELECT * FROM big_table")).isTrue();
        assertThat(policy.shouldStream("select id, name from t where x > 1;")).isTrue();
    }

    @Test
    void nonSelectIsNotStreamed() {
        assertThat(policy.shouldStream("UPDATE t SET x = 1")).isFalse();
        assertThat(policy.shouldStream("WITH a AS (SELECT 1) SELECT * FROM a")).isFalse();
        assertThat(policy.shouldStream(null)).isFalse();
    }

    @Test
    void aggregationsAreNotStreamed() {
        assertThat(policy.shouldStream("SELECT COUNT(*) FROM t")).isFalse();
        assertThat(policy.shouldStream("SELECT max(id) FROM t")).isFalse();
        assertThat(policy.shouldStream("SELECT a FROM t GROUP BY a")).isFalse();
    }

    @Test
    void smallExplicitLimitIsNotStreamed() {
        assertThat(policy.shouldStream("SELECT * FROM t LIMIT 10")).isFalse();
        assertThat(policy.shouldStream("SELECT * FROM t LIMIT 1000")).isFalse();
    }

    @Test
    void largeExplicitLimitIsStreamed() {
        assertThat(policy.shouldStream("SELECT * FROM t LIMIT 1001")).isTrue();
        assertThat(policy.shouldStream("SELECT * FROM t LIMIT 99999999999999999999999")).isTrue();
    }

    @Test
    void nonPositiveThresholdFallsBackToDefault() {
        assertThat(new StreamingPolicy(0).limitThreshold()).isEqualTo(StreamingPolicy.DEFAULT_LIMIT_THRESHOLD);
    }
}
