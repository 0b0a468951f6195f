package com.example.pos.report;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SqlFilterTest {

    @Test
    void emptyFiltersComposeToUnconditionalQuery() {
        SqlFilter f = SqlFilter.none().and(SqlFilter.equalTo("s.created_by", null));

        assertThat(f.isEmpty()).isTrue();
        assertThat(f.where()).isEmpty();
        assertThat(f.args()).isEmpty();
    }

    @Test
    void predicatesJoinWithAndKeepingParameterOrder() {
        SqlFilter f = SqlFilter.of("date(s.created_at) BETWEEN ? AND ?", "2024-01-01", "2024-01-31")
                .and(SqlFilter.equalTo("s.created_by", "alice"));

        assertThat(f.where()).isEqualTo(" WHERE date(s.created_at) BETWEEN ? AND ? AND s.created_by = ?");
        assertThat(f.args()).containsExactly("2024-01-01", "2024-01-31", "alice");
        assertThat(f.argsWith(100)).containsExactly("2024-01-01", "2024-01-31", "alice", 100);
    }

    @Test
    void oneSidedCompositionReturnsTheOtherSide() {
        SqlFilter actor = SqlFilter.equalTo("s.created_by", "bob");

        assertThat(SqlFilter.none().and(actor)).isEqualTo(actor);
        assertThat(actor.and(SqlFilter.none())).isEqualTo(actor);
        assertThat(actor.where()).isEqualTo(" WHERE s.created_by = ?");
    }

    @Test
    void valuesNeverAppearInTheClause() {
        SqlFilter f = SqlFilter.equalTo("s.created_by", "x' OR '1'='1");

        assertThat(f.clause()).isEqualTo("s.created_by = ?");
        assertThat(f.params()).containsExactly("x' OR '1'='1");
    }
}
