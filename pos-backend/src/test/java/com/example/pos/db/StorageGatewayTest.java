package com.example.pos.db;

import com.example.pos.StoreTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StorageGatewayTest extends StoreTestSupport {

    @Autowired
    private StorageGateway storageGateway;

    @Test
    void attributionColumnsArePresent() {
        assertThat(storageGateway.columnExists("sales", "created_by")).isTrue();
        assertThat(storageGateway.columnExists("payments", "CREATED_BY")).isTrue();
        assertThat(storageGateway.columnExists("sales", "no_such_column")).isFalse();
    }

    @Test
    void ensureColumnIsIdempotent() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS scratch_upgrade (id INTEGER PRIMARY KEY)");

        boolean first = storageGateway.ensureColumn("scratch_upgrade", "note", "note TEXT");
        boolean second = storageGateway.ensureColumn("scratch_upgrade", "note", "note TEXT");

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(storageGateway.columnExists("scratch_upgrade", "note")).isTrue();
        assertThat(storageGateway.ensureColumn("sales", "created_by", "created_by TEXT")).isFalse();
    }

    @Test
    void initializeCanRunAgainOnAnExistingSchema() {
        storageGateway.initialize();

        assertThat(storageGateway.columnExists("users", "display_name")).isTrue();
    }

    @Test
    void identifiersAreValidated() {
        assertThatThrownBy(() -> storageGateway.columnExists("sales; DROP TABLE sales", "id"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> storageGateway.ensureColumn("sales", "bad name", "x TEXT"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
