package com.example.pos.user;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class User {
    private Long id;

    private String username;

    @JsonIgnore
    private String passwordHash;

    @JsonProperty("display_name")
    private String displayName;

    private UserRole role;

    @JsonProperty("created_at")
    private String createdAt;
}
