package com.example.pos.auth;

import com.example.pos.security.JwtService;
import com.example.pos.user.User;
import com.example.pos.user.UserRole;
import com.example.pos.user.UserService;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private static final String KEY_ERROR = "error";
    private static final String KEY_TOKEN = "token";
    private static final String KEY_USER = "user";
    private static final String MSG_INVALID_CREDENTIALS = "Invalid credentials";
    private static final String MSG_NOT_AUTHENTICATED = "Not authenticated";

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final UserService userService;
    private final JwtService jwtService;

    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(@Valid @RequestBody LoginRequest req) {
        log.info("Login attempt for username={}", req.getUsername());
        Optional<User> user = userService.authenticate(req.getUsername(), req.getPassword());
        if (user.isEmpty()) {
            log.warn("Failed login for username={}", req.getUsername());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.<String, Object>of(KEY_ERROR, MSG_INVALID_CREDENTIALS));
        }
        User u = user.get();
        return ResponseEntity.ok(Map.<String, Object>of(KEY_TOKEN, jwtService.generateToken(u), KEY_USER, u));
    }

    @GetMapping("/me")
    public ResponseEntity<Object> me(@RequestAttribute(name = "userId", required = false) Long userId) {
        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of(KEY_ERROR, MSG_NOT_AUTHENTICATED));
        }
        // a token that outlived its account counts as unauthenticated
        return userService.findById(userId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of(KEY_ERROR, MSG_NOT_AUTHENTICATED)));
    }

    @GetMapping("/users")
    public List<User> listUsers() {
        return userService.list();
    }

    /** Creates or updates by username; a blank password keeps the current one. */
    @PostMapping("/users")
    public User saveUser(@Valid @RequestBody SaveUserRequest req) {
        return userService.saveUser(req.getUsername(), req.getDisplayName(), UserRole.parse(req.getRole()),
                req.getPassword());
    }

    @Data
    public static class LoginRequest {
        @NotBlank
        private String username;
        @NotBlank
        private String password;
    }

    @Data
    public static class SaveUserRequest {
        @NotBlank
        private String username;
        @JsonProperty("display_name")
        private String displayName;
        @NotBlank
        private String role;
        private String password;
    }
}
