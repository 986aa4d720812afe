package com.dbbridge.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Connections are opened on demand per request, so no application-wide DataSource is configured.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class DbBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbBridgeApplication.class, args);
    }
}
