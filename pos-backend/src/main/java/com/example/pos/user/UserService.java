package com.example.pos.user;

import com.example.pos.exception.InvalidUserException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class UserService {

    public static final String ADMIN_USERNAME = "admin";
    public static final String ADMIN_DISPLAY_NAME = "Administrator";

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public List<User> list() {
        return userRepository.list();
    }

    public Optional<User> findByUsername(String username) {
        String normalized = normalize(username);
        return normalized.isEmpty() ? Optional.empty() : userRepository.findByUsername(normalized);
    }

    public Optional<User> findById(long id) {
        return userRepository.findById(id);
    }

    /**
     * Creates or updates the account for {@code username}. A blank password keeps the stored
     * hash of an existing user and is rejected for a new one.
     */
    public User saveUser(String username, String displayName, UserRole role, String password) {
        String normalized = normalize(username);
        if (normalized.isEmpty()) {
            throw new InvalidUserException("Username cannot be empty");
        }
        if (role == null) {
            throw new InvalidUserException("Role is required");
        }
        Optional<User> existing = userRepository.findByUsername(normalized);
        String hash;
        if (StringUtils.hasText(password)) {
            hash = passwordEncoder.encode(password.trim());
        } else if (existing.isPresent()) {
            hash = existing.get().getPasswordHash();
        } else {
            throw new InvalidUserException("Password cannot be empty for new user");
        }

        User user = User.builder()
                .id(existing.map(User::getId).orElse(null))
                .username(normalized)
                .passwordHash(hash)
                .displayName(StringUtils.hasText(displayName) ? displayName.trim() : normalized)
                .role(role)
                .createdAt(existing.map(User::getCreatedAt).orElse(null))
                .build();
        if (existing.isPresent()) {
            log.info("Updating user {} (role={})", normalized, role);
            return userRepository.update(user);
        }
        log.info("Creating user {} (role={})", normalized, role);
        return userRepository.insert(user);
    }

    /** The matching user, or empty when the username is unknown or the password is wrong. */
    public Optional<User> authenticate(String username, String password) {
        if (password == null) {
            return Optional.empty();
        }
        return findByUsername(username)
                .filter(u -> passwordEncoder.matches(password, u.getPasswordHash()));
    }

    /** @return true when the admin account had to be created */
    public boolean ensureAdminAccount(String password) {
        if (userRepository.findByUsername(ADMIN_USERNAME).isPresent()) {
            return false;
        }
        saveUser(ADMIN_USERNAME, ADMIN_DISPLAY_NAME, UserRole.ADMIN, password);
        return true;
    }

    private static String normalize(String username) {
        return username == null ? "" : username.trim().toLowerCase();
    }
}
