package com.example.storelab.service;

import com.example.storelab.access.UserAccess;
import com.example.storelab.config.QueryProperties;
import com.example.storelab.models.User;
import com.example.storelab.models.UserStats;
import com.example.storelab.models.UserStatus;
import com.example.storelab.query.Criterion;
import com.example.storelab.query.FilterWhitelist;
import com.example.storelab.query.PageSpec;
import com.example.storelab.query.PagedResult;
import com.example.storelab.query.RecordQuery;
import com.example.storelab.query.SortOrder;
import com.example.storelab.requests.ListRecordsServiceRequest;
import com.example.storelab.requests.UserHttpRequest;
import com.example.storelab.validation.FieldError;
import com.example.storelab.validation.RecordValidator;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * User operations over the MongoDB-backed {@link UserAccess}: validation before every write,
 * server-side timestamps, and translation of store outcomes into {@link StoreLabException}s.
 */
@Service
@Slf4j
public class UserService {

    static final FilterWhitelist LIST_FILTERS = FilterWhitelist.of("status");
    static final List<String> SEARCH_FIELDS = List.of("name", "email");

    private final UserAccess userAccess;
    private final RecordValidator validator;
    private final QueryProperties queryProperties;
    private final Clock clock;

    public UserService(UserAccess userAccess,
                       RecordValidator validator,
                       QueryProperties queryProperties,
                       Clock clock) {
        this.userAccess = userAccess;
        this.validator = validator;
        this.queryProperties = queryProperties;
        this.clock = clock;
    }

    public User createUser(UserHttpRequest request) {
        Objects.requireNonNull(request, "request");

        User candidate = newUser(request, now());
        List<FieldError> errors = validate(candidate, request.status());
        if (!errors.isEmpty()) {
            throw StoreLabException.validationFailed(errors);
        }

        try {
            return userAccess.insert(candidate);
        } catch (DuplicateKeyException ex) {
            throw StoreLabException.duplicateField("email", ex);
        }
    }

    /**
     * Validates every candidate before writing any of them. The insert itself is not atomic:
     * if the store rejects a document part-way, the ones before it stay stored.
     */
    public List<User> bulkCreateUsers(List<UserHttpRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw StoreLabException.validationFailed(
                    List.of(new FieldError("users", "At least one user is required")));
        }

        Instant now = now();
        List<User> candidates = new ArrayList<>();
        List<FieldError> errors = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            UserHttpRequest request = requests.get(i);
            if (request == null) {
                errors.add(new FieldError("[" + i + "]", "User payload is required"));
                continue;
            }
            User candidate = newUser(request, now);
            for (FieldError error : validate(candidate, request.status())) {
                errors.add(error.atIndex(i));
            }
            candidates.add(candidate);
        }
        if (!errors.isEmpty()) {
            throw StoreLabException.validationFailed(errors);
        }

        try {
            return userAccess.insertAll(candidates);
        } catch (DuplicateKeyException ex) {
            log.warn("Bulk insert of {} users stopped at a duplicate email; earlier users remain stored",
                    candidates.size());
            throw StoreLabException.duplicateField("email", ex);
        }
    }

    public PagedResult<User> listUsers(ListRecordsServiceRequest request) {
        Objects.requireNonNull(request, "request");

        PageSpec page = request.page().clampLimit(queryProperties.getMaxPageSize());
        List<Criterion> filters = LIST_FILTERS.apply(request.parameters());

        RecordQuery query = RecordQuery.builder()
                .whereAll(filters)
                .sort(SortOrder.desc("createdAt"), SortOrder.desc("id"))
                .page(page)
                .build();

        List<User> users = userAccess.find(query);
        long total = userAccess.count(query);
        return PagedResult.of(users, total, page);
    }

    public User getUser(String id) {
        Objects.requireNonNull(id, "id");
        return userAccess.findById(id)
                .orElseThrow(() -> StoreLabException.userNotFound(id));
    }

    public User getUserByEmail(String email) {
        Objects.requireNonNull(email, "email");
        String normalized = User.normalizeEmail(email);
        return userAccess.findByEmail(normalized)
                .orElseThrow(() -> StoreLabException.userNotFound(normalized));
    }

    /**
     * Applies the non-null fields of {@code request} to the stored user and re-validates the
     * merged result before writing it back.
     */
    public User updateUser(String id, UserHttpRequest request) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(request, "request");

        User existing = userAccess.findById(id)
                .orElseThrow(() -> StoreLabException.userNotFound(id));

        User.UserBuilder builder = existing.toBuilder();
        if (request.name() != null) {
            builder.name(User.normalizeName(request.name()));
        }
        if (request.email() != null) {
            builder.email(User.normalizeEmail(request.email()));
        }
        if (request.age() != null) {
            builder.age(request.age());
        }
        if (request.status() != null) {
            UserStatus.fromValue(request.status()).ifPresent(builder::status);
        }
        if (request.metadata() != null) {
            builder.metadata(new LinkedHashMap<>(request.metadata()));
        }
        User merged = builder.updatedAt(now()).build();

        List<FieldError> errors = validate(merged, request.status());
        if (!errors.isEmpty()) {
            throw StoreLabException.validationFailed(errors);
        }

        try {
            return userAccess.replace(merged)
                    .orElseThrow(() -> StoreLabException.userNotFound(id));
        } catch (DuplicateKeyException ex) {
            throw StoreLabException.duplicateField("email", ex);
        }
    }

    public User deleteUser(String id) {
        Objects.requireNonNull(id, "id");
        User deleted = userAccess.deleteById(id)
                .orElseThrow(() -> StoreLabException.userNotFound(id));
        log.info("Deleted user {}", deleted.getId());
        return deleted;
    }

    public List<User> searchUsers(String text) {
        if (text == null || text.isBlank()) {
            throw StoreLabException.searchQueryRequired();
        }

        RecordQuery query = RecordQuery.builder()
                .whereAny(SEARCH_FIELDS.stream()
                        .map(field -> Criterion.containsIgnoreCase(field, text))
                        .toList())
                .limit(queryProperties.getSearchLimit())
                .build();
        return userAccess.find(query);
    }

    public List<UserStats> userStats() {
        return userAccess.statsByStatus();
    }

    public long countUsers(Map<String, String> parameters) {
        RecordQuery query = RecordQuery.builder()
                .whereAll(LIST_FILTERS.apply(parameters))
                .build();
        return userAccess.count(query);
    }

    private User newUser(UserHttpRequest request, Instant now) {
        return User.builder()
                .name(User.normalizeName(request.name()))
                .email(User.normalizeEmail(request.email()))
                .age(request.age())
                .status(UserStatus.fromValue(request.status()).orElse(UserStatus.DEFAULT))
                .metadata(request.metadata() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(request.metadata()))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private List<FieldError> validate(User candidate, String rawStatus) {
        List<FieldError> errors = new ArrayList<>(validator.validate(candidate));
        if (rawStatus != null && UserStatus.fromValue(rawStatus).isEmpty()) {
            errors.add(new FieldError("status", rawStatus + " is not a valid status"));
        }
        errors.sort(Comparator.comparing(FieldError::field).thenComparing(FieldError::message));
        return errors;
    }

    private Instant now() {
        // stores keep millisecond precision; truncating keeps reads equal to what was written
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
