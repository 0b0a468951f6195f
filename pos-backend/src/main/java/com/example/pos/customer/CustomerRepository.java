package com.example.pos.customer;

import com.example.pos.exception.InvalidCustomerException;
import com.example.pos.utils.DateTimeUtils;
import com.example.pos.utils.Decimals;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Customer ledger over the {@code customers} table. Customers are never deleted, only set to
 * {@link Customer#STATUS_DISABLED}.
 */
@Repository
@RequiredArgsConstructor
public class CustomerRepository {

    private static final Logger log = LoggerFactory.getLogger(CustomerRepository.class);
    private static final String COLUMNS = "phone, name, address, dob, email, status, credit_limit";

    private static final RowMapper<Customer> ROW_MAPPER = (rs, rowNum) -> Customer.builder()
            .phone(rs.getString("phone"))
            .name(rs.getString("name"))
            .address(rs.getString("address"))
            .dob(rs.getString("dob"))
            .email(rs.getString("email"))
            .status(rs.getString("status"))
            .creditLimit(Decimals.fromDb(rs.getDouble("credit_limit")))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public List<Customer> list() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM customers ORDER BY name", ROW_MAPPER);
    }

    public Optional<Customer> findByPhone(String phone) {
        if (!StringUtils.hasText(phone))
            return Optional.empty();
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM customers WHERE phone = ? LIMIT 1", ROW_MAPPER,
                phone.trim()).stream().findFirst();
    }

    /**
     * Updates the customer with this phone, or inserts it when no row was touched. Calling it
     * twice with the same data leaves a single identical row.
     *
     * @return the customer as stored (trimmed phone, normalized date of birth, defaults applied)
     */
    public Customer upsert(Customer customer) {
        Customer c = normalize(customer);
        int updated = jdbcTemplate.update(
                "UPDATE customers SET name = ?, address = ?, dob = ?, email = ?, status = ?, credit_limit = ? WHERE phone = ?",
                c.getName(), c.getAddress(), c.getDob(), c.getEmail(), c.getStatus(),
                Decimals.toDb(c.getCreditLimit()), c.getPhone());
        if (updated > 0) {
            log.debug("Customer {} updated", c.getPhone());
            return c;
        }
        jdbcTemplate.update("""
                INSERT INTO customers(phone, name, address, dob, email, status, credit_limit)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
                c.getPhone(), c.getName(), c.getAddress(), c.getDob(), c.getEmail(), c.getStatus(),
                Decimals.toDb(c.getCreditLimit()));
        log.info("Customer {} created", c.getPhone());
        return c;
    }

    private static Customer normalize(Customer customer) {
        if (customer == null || !StringUtils.hasText(customer.getPhone())) {
            throw new InvalidCustomerException("Customer phone is required");
        }
        if (!StringUtils.hasText(customer.getName())) {
            throw new InvalidCustomerException("Customer name is required");
        }
        String dob = null;
        if (StringUtils.hasText(customer.getDob())) {
            LocalDate parsed = DateTimeUtils.parseDobOrNull(customer.getDob());
            if (parsed == null) {
                throw new InvalidCustomerException(
                        "Invalid date of birth '" + customer.getDob().trim() + "'. Use DD-MM-YYYY (e.g., 10-02-1975)");
            }
            dob = parsed.format(DateTimeUtils.DOB_STORAGE);
        }
        return customer.toBuilder()
                .phone(customer.getPhone().trim())
                .name(customer.getName().trim())
                .dob(dob)
                .status(StringUtils.hasText(customer.getStatus()) ? customer.getStatus().trim() : Customer.STATUS_ACTIVE)
                .creditLimit(Decimals.orZero(customer.getCreditLimit()))
                .build();
    }
}
