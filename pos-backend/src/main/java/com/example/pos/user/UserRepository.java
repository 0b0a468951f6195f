package com.example.pos.user;

import com.example.pos.exception.InvalidStateException;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Plain JDBC access to {@code users}. Callers pass usernames already normalized by
 * {@link UserService}.
 */
@Repository
@RequiredArgsConstructor
public class UserRepository {

    private static final String COLUMNS = "id, username, password_hash, display_name, role, created_at";

    private static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> User.builder()
            .id(rs.getLong("id"))
            .username(rs.getString("username"))
            .passwordHash(rs.getString("password_hash"))
            .displayName(rs.getString("display_name"))
            .role(UserRole.valueOf(rs.getString("role")))
            .createdAt(rs.getString("created_at"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public List<User> list() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM users ORDER BY username", ROW_MAPPER);
    }

    public Optional<User> findByUsername(String username) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM users WHERE username = ? LIMIT 1", ROW_MAPPER,
                username).stream().findFirst();
    }

    public Optional<User> findById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM users WHERE id = ? LIMIT 1", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public User insert(User user) {
        jdbcTemplate.update("INSERT INTO users (username, password_hash, display_name, role) VALUES (?, ?, ?, ?)",
                user.getUsername(), user.getPasswordHash(), user.getDisplayName(), user.getRole().name());
        Long id = jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Long.class);
        if (id == null || id <= 0) {
            throw new InvalidStateException("Failed to create user " + user.getUsername());
        }
        return findById(id).orElseGet(() -> user.toBuilder().id(id).build());
    }

    public User update(User user) {
        jdbcTemplate.update("UPDATE users SET password_hash = ?, display_name = ?, role = ? WHERE username = ?",
                user.getPasswordHash(), user.getDisplayName(), user.getRole().name(), user.getUsername());
        return user;
    }
}
