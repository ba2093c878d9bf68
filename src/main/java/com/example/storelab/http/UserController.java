package com.example.storelab.http;

import com.example.storelab.models.User;
import com.example.storelab.query.PagedResult;
import com.example.storelab.requests.ListRecordsServiceRequest;
import com.example.storelab.requests.UserHttpRequest;
import com.example.storelab.service.UserService;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for MongoDB-backed users. Absence, validation failures and conflicts are
 * raised by {@link UserService} and rendered by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/mongo")
public class UserController {

    private final UserService userService;
    private final Clock clock;

    public UserController(UserService userService, Clock clock) {
        this.userService = userService;
        this.clock = clock;
    }

    @GetMapping("/test")
    public ResponseEntity<ApiResponse<Map<String, String>>> testConnection() {
        return ResponseEntity.ok(ApiResponse.ok(
                Map.of("timestamp", clock.instant().toString()),
                "MongoDB connection is working"));
    }

    @PostMapping("/users")
    public ResponseEntity<ApiResponse<UserResponse>> createUser(@RequestBody UserHttpRequest request) {
        User user = userService.createUser(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(UserResponse.from(user)));
    }

    @PostMapping("/users/bulk")
    public ResponseEntity<ApiResponse<List<UserResponse>>> bulkCreateUsers(
            @RequestBody List<UserHttpRequest> requests) {
        List<UserResponse> created = userService.bulkCreateUsers(requests).stream()
                .map(UserResponse::from)
                .toList();
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created));
    }

    @GetMapping("/users")
    public ResponseEntity<ApiResponse<List<UserResponse>>> getAllUsers(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam Map<String, String> parameters
    ) {
        PagedResult<UserResponse> result = userService
                .listUsers(ListRecordsServiceRequest.of(page, limit, parameters))
                .map(UserResponse::from);
        return ResponseEntity.ok(ApiResponse.page(result.items(), PaginationResponse.from(result)));
    }

    @GetMapping("/users/search")
    public ResponseEntity<ApiResponse<List<UserResponse>>> searchUsers(
            @RequestParam(value = "q", required = false) String query) {
        List<UserResponse> users = userService.searchUsers(query).stream()
                .map(UserResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(users));
    }

    @GetMapping("/users/stats")
    public ResponseEntity<ApiResponse<List<UserStatsResponse>>> getUserStats() {
        List<UserStatsResponse> stats = userService.userStats().stream()
                .map(UserStatsResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(stats));
    }

    @GetMapping("/users/count")
    public ResponseEntity<ApiResponse<Map<String, Long>>> countUsers(@RequestParam Map<String, String> parameters) {
        return ResponseEntity.ok(ApiResponse.ok(Map.of("count", userService.countUsers(parameters))));
    }

    @GetMapping("/users/by-email")
    public ResponseEntity<ApiResponse<UserResponse>> getUserByEmail(@RequestParam String email) {
        return ResponseEntity.ok(ApiResponse.ok(UserResponse.from(userService.getUserByEmail(email))));
    }

    @GetMapping("/users/{id}")
    public ResponseEntity<ApiResponse<UserResponse>> getUserById(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.ok(UserResponse.from(userService.getUser(id))));
    }

    @RequestMapping(path = "/users/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public ResponseEntity<ApiResponse<UserResponse>> updateUser(
            @PathVariable String id,
            @RequestBody UserHttpRequest request
    ) {
        return ResponseEntity.ok(ApiResponse.ok(UserResponse.from(userService.updateUser(id, request))));
    }

    @DeleteMapping("/users/{id}")
    public ResponseEntity<ApiResponse<UserResponse>> deleteUser(@PathVariable String id) {
        User deleted = userService.deleteUser(id);
        return ResponseEntity.ok(ApiResponse.ok(UserResponse.from(deleted), "User deleted successfully"));
    }
}
