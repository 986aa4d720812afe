package com.dbbridge.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class QueryRequest {

    @NotBlank(message = "Query cannot be empty")
    private String sql;
}
