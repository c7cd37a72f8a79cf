package com.example.litestream.config;

import com.example.litestream.timetravel.TimeTravelException;
import com.example.litestream.vfs.ExtensionLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps replica configuration, extension and database errors to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ReplicaConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleReplicaConfiguration(ReplicaConfigurationException ex) {
        HttpStatus status;
        switch (ex.getReason()) {
            case ALIAS_NOT_FOUND:
                status = HttpStatus.NOT_FOUND;
                break;
            case ALIAS_IN_USE:
                status = HttpStatus.CONFLICT;
                break;
            case EXTENSION_UNAVAILABLE:
                status = HttpStatus.SERVICE_UNAVAILABLE;
                break;
            default:
                status = HttpStatus.BAD_REQUEST;
        }
        return body(status, "Replica configuration error", ex.getMessage());
    }

    /**
     * The VFS extension could not be loaded; a later request retries the load.
     */
    @ExceptionHandler(ExtensionLoadException.class)
    public ResponseEntity<Map<String, Object>> handleExtensionLoad(ExtensionLoadException ex) {
        log.error("Litestream VFS extension unavailable", ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Replica extension unavailable", ex.getMessage());
    }

    @ExceptionHandler(TimeTravelException.class)
    public ResponseEntity<Map<String, Object>> handleTimeTravel(TimeTravelException ex) {
        return body(HttpStatus.BAD_REQUEST, "Time-travel setup failed", ex.getMessage());
    }

    @ExceptionHandler(SQLRecoverableException.class)
    public ResponseEntity<Map<String, Object>> handleSQLRecoverableException(SQLRecoverableException ex) {
        log.warn("SQLRecoverableException: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Database connection error",
            "Connection failed. Please try again.");
    }

    @ExceptionHandler(SQLException.class)
    public ResponseEntity<Map<String, Object>> handleSQLException(SQLException ex) {
        boolean isTransient = isTransientError(ex);
        log.warn("SQLException (transient={}): {}", isTransient, ex.getMessage());
        ResponseEntity<Map<String, Object>> response = body(
            isTransient ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR,
            "Database error",
            isTransient ? "Temporary database issue. Please try again." : "Database error");
        response.getBody().put("transient", isTransient);
        return response;
    }

    /**
     * SQLite reports a locked or busy database with these result codes; both clear up on retry.
     */
    private boolean isTransientError(SQLException ex) {
        int errorCode = ex.getErrorCode();
        String sqlState = ex.getSQLState();
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase();
        return errorCode == 5       // SQLITE_BUSY
            || errorCode == 6       // SQLITE_LOCKED
            || (sqlState != null && sqlState.startsWith("08"))
            || message.contains("database is locked")
            || message.contains("connection is not available");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", System.currentTimeMillis());
        return new ResponseEntity<>(response, status);
    }
}
