package com.example.litestream.annotation;

import java.lang.annotation.*;

/**
 * Marks methods that only read and may be served by a VFS replica.
 * The replica is picked among those within their lag threshold; when none is, the
 * primary serves the read.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ReadReplica {
}
