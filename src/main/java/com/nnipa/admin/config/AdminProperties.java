package com.nnipa.admin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration properties for the Admin Service.
 */
@Data
@ConfigurationProperties(prefix = "admin")
public class AdminProperties {

    private Datasource datasource = new Datasource();
    private UnitOfWork unitOfWork = new UnitOfWork();
    private Audit audit = new Audit();
    private Password password = new Password();

    @Data
    public static class Datasource {
        private String url;
        private String username;
        private String password;
        private String driverClassName;
        private String poolName = "admin-pool";
        private Integer poolSize = 20;
        private Integer maxOverflow = 40;
        private Long connectionTimeoutMs = 30000L;
        private Long idleTimeoutMs = 600000L;
        private Long maxLifetimeMs = 3600000L; // recycle after 1 hour
        private Long keepaliveTimeMs = 300000L;
        private Long validationTimeoutMs = 5000L;
        private String connectionTestQuery;
    }

    @Data
    public static class UnitOfWork {
        private Integer timeoutSeconds = 30;
    }

    @Data
    public static class Audit {
        private Set<String> methods = new LinkedHashSet<>(List.of("POST", "PUT", "PATCH", "DELETE"));
        private List<String> pathPrefixes = new ArrayList<>(List.of("/admin/"));
        private String actorHeader = "X-Admin-Username";

        public boolean isAudited(String method, String path) {
            if (method == null || path == null) {
                return false;
            }
            if (!methods.contains(method.toUpperCase(Locale.ROOT))) {
                return false;
            }
            return pathPrefixes.stream().anyMatch(path::startsWith);
        }
    }

    @Data
    public static class Password {
        private Integer maxAgeDays = 90;
    }
}
