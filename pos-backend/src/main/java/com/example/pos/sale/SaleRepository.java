package com.example.pos.sale;

import com.example.pos.exception.InvalidStateException;
import com.example.pos.utils.Decimals;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static com.example.pos.utils.Decimals.toDb;

/**
 * Write primitives for {@code sales}, {@code sale_lines}, {@code payments} and the stock
 * column of {@code products}. None of these demarcate a transaction; {@link SaleService}
 * composes them inside one.
 */
@Repository
@RequiredArgsConstructor
public class SaleRepository {

    private static final RowMapper<Sale> SALE_MAPPER = (rs, rowNum) -> Sale.builder()
            .id(rs.getLong("id"))
            .customerPhone(rs.getString("customer_phone"))
            .total(Decimals.fromDb(rs.getDouble("total")))
            .paid(Decimals.fromDb(rs.getDouble("paid")))
            .createdAt(rs.getString("created_at"))
            .createdBy(rs.getString("created_by"))
            .build();

    private static final RowMapper<SaleLine> LINE_MAPPER = (rs, rowNum) -> SaleLine.builder()
            .itemId(rs.getLong("item_id"))
            .quantity(Decimals.fromDb(rs.getDouble("quantity")))
            .price(Decimals.fromDb(rs.getDouble("price")))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public long insertSale(String customerPhone, BigDecimal total, BigDecimal paid, String createdBy) {
        jdbcTemplate.update("INSERT INTO sales(customer_phone, total, paid, created_by) VALUES (?, ?, ?, ?)",
                customerPhone, toDb(total), toDb(paid), createdBy);
        return lastInsertId("sale");
    }

    public void insertLines(long saleId, List<SaleLine> lines) {
        jdbcTemplate.batchUpdate("INSERT INTO sale_lines(sale_id, item_id, quantity, price) VALUES (?, ?, ?, ?)",
                lines, lines.size(), (ps, line) -> {
                    ps.setLong(1, saleId);
                    ps.setLong(2, line.getItemId());
                    ps.setDouble(3, toDb(line.getQuantity()));
                    ps.setDouble(4, toDb(line.getPrice()));
                });
    }

    /**
     * One decrement per line, so a product repeated in the cart is decremented once per
     * occurrence. No floor: stock may become negative.
     */
    public void deductStock(List<SaleLine> lines) {
        jdbcTemplate.batchUpdate("UPDATE products SET stock = stock - ? WHERE id = ?",
                lines, lines.size(), (ps, line) -> {
                    ps.setDouble(1, toDb(line.getQuantity()));
                    ps.setLong(2, line.getItemId());
                });
    }

    public long insertPayment(long saleId, String method, BigDecimal amount, String reference, String createdBy) {
        jdbcTemplate.update("INSERT INTO payments(sale_id, method, amount, reference, created_by) VALUES (?, ?, ?, ?, ?)",
                saleId, method, toDb(amount), reference, createdBy);
        return lastInsertId("payment");
    }

    public Optional<Sale> findById(long id) {
        return jdbcTemplate.query("""
                SELECT id, customer_phone, total, paid, created_at, created_by
                FROM sales
                WHERE id = ?
                LIMIT 1
                """, SALE_MAPPER, id).stream().findFirst();
    }

    public List<SaleLine> findLines(long saleId) {
        return jdbcTemplate.query("SELECT item_id, quantity, price FROM sale_lines WHERE sale_id = ? ORDER BY id",
                LINE_MAPPER, saleId);
    }

    /** Method of the most recent payment; ties on {@code created_at} go to the higher id. */
    public Optional<String> latestPaymentMethod(long saleId) {
        return jdbcTemplate.queryForList("""
                SELECT method
                FROM payments
                WHERE sale_id = ?
                ORDER BY created_at DESC, id DESC
                LIMIT 1
                """, String.class, saleId).stream().findFirst();
    }

    private long lastInsertId(String what) {
        Long id = jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Long.class);
        if (id == null || id <= 0) {
            throw new InvalidStateException("Failed to create " + what);
        }
        return id;
    }
}
