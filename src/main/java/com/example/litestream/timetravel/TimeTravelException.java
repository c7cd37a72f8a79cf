package com.example.litestream.timetravel;

/**
 * The replica rejected the point-in-time directive.
 */
public class TimeTravelException extends RuntimeException {

    public TimeTravelException(String message, Throwable cause) {
        super(message, cause);
    }
}
