package com.dbbridge.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class UseDatabaseRequest {

    @NotBlank(message = "Database name cannot be empty")
    private String database;
}
