package com.dbbridge.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Backend-agnostic description of one table column.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnDescriptor {
    private String name;
    private String type;              // backend-native type string
    private boolean nullable;
    private boolean primaryKey;
    private boolean unique;
    private boolean indexed;
    private String defaultValue;      // null when the column has no default
    private String extra;             // e.g. "auto_increment"
}
