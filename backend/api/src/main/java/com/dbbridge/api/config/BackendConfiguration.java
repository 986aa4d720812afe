package com.dbbridge.api.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Per-backend settings, keyed by backend id (mysql, postgresql, sqlite)
 */
@Configuration
@ConfigurationProperties(prefix = "dbbridge.backends")
@Data
public class BackendConfiguration {

    private Map<String, BackendConfig> settings = new HashMap<>();

    @Data
    public static class BackendConfig {
        private boolean enabled = true;
        private Integer defaultPort;

        /**
         * Extra properties handed to the JDBC driver
         */
        private Map<String, String> properties = new HashMap<>();

        public Properties toDriverProperties() {
            Properties props = new Properties();
            props.putAll(properties);
            return props;
        }
    }

    /**
     * Get configuration for a specific backend, falling back to defaults
     */
    public BackendConfig getBackend(String backendId) {
        BackendConfig config = settings.get(backendId);
        return config != null ? config : new BackendConfig();
    }

    /**
     * A backend with no explicit entry is enabled
     */
    public boolean isBackendEnabled(String backendId) {
        return getBackend(backendId).isEnabled();
    }
}
