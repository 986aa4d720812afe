package com.dbbridge.api.dto;

import com.dbbridge.api.model.ConnectionParams;
import com.dbbridge.api.validation.ValidBackendKind;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OpenConnectionRequest {

    @NotBlank(message = "Database type is required")
    @ValidBackendKind
    private String backend;

    @NotBlank(message = "Host (or file path for SQLite) is required")
    private String host;

    @Min(value = 1, message = "Port must be between 1 and 65535")
    @Max(value = 65535, message = "Port must be between 1 and 65535")
    private Integer port;

    private String user;
    private String password;
    private String database; // optional initial database

    public ConnectionParams toParams() {
        return ConnectionParams.builder()
                .host(host)
                .port(port)
                .user(user)
                .password(password)
                .database(database)
                .build();
    }
}
