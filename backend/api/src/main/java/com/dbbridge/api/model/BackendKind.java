package com.dbbridge.api.model;

import com.dbbridge.api.exception.ConnectionException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The database systems a connection can be opened against.
 */
@Getter
@RequiredArgsConstructor
public enum BackendKind {
    MYSQL("mysql"),
    POSTGRESQL("postgresql"),
    SQLITE("sqlite");

    private final String id;

    public static boolean isSupported(String id) {
        if (id == null) return false;
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).anyMatch(kind -> kind.id.equals(normalized));
    }

    public static BackendKind fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (BackendKind kind : values()) {
                if (kind.id.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new ConnectionException(
                "Unsupported database type: " + id,
                id,
                ConnectionException.ErrorType.UNSUPPORTED_BACKEND
        );
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(BackendKind::getId).collect(Collectors.toList());
    }
}
