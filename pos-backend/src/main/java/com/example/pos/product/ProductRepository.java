package com.example.pos.product;

import com.example.pos.utils.Decimals;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

import static com.example.pos.utils.Decimals.toDb;

/**
 * Catalog store over the {@code products} table.
 */
@Repository
@RequiredArgsConstructor
public class ProductRepository {

    private static final String COLUMNS = "id, code, description, uom, buy_price, sell_price, default_number, stock, reorder_level";

    private static final RowMapper<Product> ROW_MAPPER = (rs, rowNum) -> Product.builder()
            .id(rs.getLong("id"))
            .code(rs.getString("code"))
            .description(rs.getString("description"))
            .uom(rs.getString("uom"))
            .buyPrice(Decimals.fromDb(rs.getDouble("buy_price")))
            .sellPrice(Decimals.fromDb(rs.getDouble("sell_price")))
            .defaultNumber(Decimals.fromDb(rs.getDouble("default_number")))
            .stock(Decimals.fromDb(rs.getDouble("stock")))
            .reorderLevel(Decimals.fromDb(rs.getDouble("reorder_level")))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public List<Product> list() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM products ORDER BY code", ROW_MAPPER);
    }

    public Optional<Product> findByCode(String code) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM products WHERE code = ? LIMIT 1", ROW_MAPPER, code)
                .stream().findFirst();
    }

    public Optional<Product> getById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM products WHERE id = ? LIMIT 1", ROW_MAPPER, id)
                .stream().findFirst();
    }

    /**
     * Inserts a product without id, otherwise overwrites every mutable field of the row with
     * that id. Resolving an existing row by code is the caller's job.
     */
    public Product upsert(Product product) {
        return product.getId() == null ? insert(product) : update(product);
    }

    private Product insert(Product p) {
        jdbcTemplate.update("""
                INSERT INTO products(code, description, uom, buy_price, sell_price, default_number, stock, reorder_level)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                p.getCode(), p.getDescription(), uomOrDefault(p), toDb(p.getBuyPrice()), toDb(p.getSellPrice()),
                toDb(p.getDefaultNumber()), toDb(p.getStock()), toDb(p.getReorderLevel()));
        Long id = jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Long.class);
        return p.toBuilder().id(id).uom(uomOrDefault(p)).build();
    }

    private Product update(Product p) {
        jdbcTemplate.update("""
                UPDATE products
                SET code = ?, description = ?, uom = ?, buy_price = ?, sell_price = ?, default_number = ?, stock = ?, reorder_level = ?
                WHERE id = ?
                """,
                p.getCode(), p.getDescription(), uomOrDefault(p), toDb(p.getBuyPrice()), toDb(p.getSellPrice()),
                toDb(p.getDefaultNumber()), toDb(p.getStock()), toDb(p.getReorderLevel()), p.getId());
        return p;
    }

    private static String uomOrDefault(Product p) {
        return p.getUom() == null || p.getUom().isBlank() ? "pcs" : p.getUom();
    }
}
