package com.example.storelab.health;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness only: answers whenever the process is up and never touches MongoDB or PostgreSQL.
 */
@RestController
public class HealthController {

    private final BuildProperties buildProperties;
    private final String env;
    private final Clock clock;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            Clock clock) {
        this.env = env;
        this.buildProperties = buildProperties.getIfAvailable();
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", clock.instant().toString());
        body.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);
        body.put("env", env);
        body.put("app", buildProperties != null ? buildProperties.getName() : "store-lab");
        body.put("version", buildProperties != null ? buildProperties.getVersion() : "dev");
        return ResponseEntity.ok(body);
    }
}
