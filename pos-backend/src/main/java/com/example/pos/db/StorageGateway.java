package com.example.pos.db;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Owns the schema of the embedded store: creates the tables on first use and applies additive
 * column upgrades to databases created by older versions.
 */
@Component
@RequiredArgsConstructor
public class StorageGateway {

    private static final Logger log = LoggerFactory.getLogger(StorageGateway.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String ACTOR_COLUMN = "created_by TEXT NOT NULL DEFAULT 'SYSTEM'";

    // created_by on sales/payments is added through ensureColumn, like any pre-existing file
    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS products (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                code TEXT NOT NULL UNIQUE,
                description TEXT,
                uom TEXT NOT NULL DEFAULT 'pcs',
                buy_price REAL NOT NULL DEFAULT 0,
                sell_price REAL NOT NULL DEFAULT 0,
                default_number REAL NOT NULL DEFAULT 0,
                stock REAL NOT NULL DEFAULT 0,
                reorder_level REAL NOT NULL DEFAULT 0
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS customers (
                phone TEXT PRIMARY KEY,
                name TEXT NOT NULL,
                address TEXT,
                dob TEXT,
                email TEXT,
                status TEXT NOT NULL DEFAULT 'Active',
                credit_limit REAL NOT NULL DEFAULT 0
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS sales (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                customer_phone TEXT,
                total REAL NOT NULL DEFAULT 0,
                paid REAL NOT NULL DEFAULT 0,
                created_at TEXT NOT NULL DEFAULT (datetime('now')),
                FOREIGN KEY(customer_phone) REFERENCES customers(phone)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS sale_lines (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                sale_id INTEGER NOT NULL,
                item_id INTEGER NOT NULL,
                quantity REAL NOT NULL,
                price REAL NOT NULL,
                FOREIGN KEY(sale_id) REFERENCES sales(id) ON DELETE CASCADE
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS payments (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                sale_id INTEGER NOT NULL,
                method TEXT NOT NULL,
                amount REAL NOT NULL,
                reference TEXT,
                created_at TEXT NOT NULL DEFAULT (datetime('now')),
                FOREIGN KEY(sale_id) REFERENCES sales(id) ON DELETE CASCADE
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS users (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                username TEXT NOT NULL UNIQUE,
                password_hash TEXT NOT NULL,
                display_name TEXT NOT NULL,
                role TEXT NOT NULL DEFAULT 'CASHIER',
                created_at TEXT NOT NULL DEFAULT (datetime('now'))
            )
            """);

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void initialize() {
        for (String ddl : SCHEMA) {
            jdbcTemplate.execute(ddl);
        }
        ensureColumn("sales", "created_by", ACTOR_COLUMN);
        ensureColumn("payments", "created_by", ACTOR_COLUMN);
        log.info("Schema ready: products, customers, sales, sale_lines, payments, users");
    }

    /**
     * Adds {@code column} to {@code table} unless it is already there.
     *
     * @param definition full column definition as accepted by {@code ALTER TABLE ... ADD COLUMN}
     * @return true when the column was added by this call
     */
    public boolean ensureColumn(String table, String column, String definition) {
        requireIdentifier(column);
        if (columnExists(table, column)) {
            return false;
        }
        try {
            jdbcTemplate.execute("ALTER TABLE " + table + " ADD COLUMN " + definition);
            log.info("Added column {}.{}", table, column);
            return true;
        } catch (DataAccessException e) {
            if (isDuplicateColumn(e)) {
                log.debug("Column {}.{} appeared concurrently, nothing to add", table, column);
                return false;
            }
            throw e;
        }
    }

    public boolean columnExists(String table, String column) {
        requireIdentifier(table);
        List<String> columns = jdbcTemplate.query("PRAGMA table_info(" + table + ")",
                (rs, rowNum) -> rs.getString("name"));
        return columns.stream().anyMatch(column::equalsIgnoreCase);
    }

    private static void requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid SQL identifier: " + name);
        }
    }

    private static boolean isDuplicateColumn(Throwable e) {
        for (Throwable cur = e; cur != null; cur = cur.getCause()) {
            String msg = cur.getMessage();
            if (msg != null && msg.toLowerCase().contains("duplicate column")) {
                return true;
            }
        }
        return false;
    }
}
