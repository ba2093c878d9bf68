package com.example.storelab.models;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.IndexDirection;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document("users")
@NoArgsConstructor                     // needed for Spring Data mapping
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class User {

    public static final String EMAIL_PATTERN = "^\\S+@\\S+\\.\\S+$";

    @Id
    private String id;

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name cannot exceed 100 characters")
    private String name;

    @Indexed(unique = true)
    @NotBlank(message = "Email is required")
    @Pattern(regexp = EMAIL_PATTERN, message = "Please enter a valid email address")
    private String email;

    @Min(value = 0, message = "Age cannot be negative")
    @Max(value = 150, message = "Age seems unrealistic")
    private Integer age;

    @Indexed
    @NotNull(message = "Status is required")
    @Default
    private UserStatus status = UserStatus.DEFAULT;

    @Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Indexed(direction = IndexDirection.DESCENDING)
    private Instant createdAt;

    private Instant updatedAt;

    // ----- Domain helpers -----

    public static String normalizeName(String raw) {
        return raw == null ? null : raw.trim();
    }

    public static String normalizeEmail(String raw) {
        return raw == null ? null : raw.trim().toLowerCase(Locale.ROOT);
    }
}
