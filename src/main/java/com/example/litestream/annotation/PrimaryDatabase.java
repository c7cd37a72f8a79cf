package com.example.litestream.annotation;

import java.lang.annotation.*;

/**
 * Marks methods that must run against the primary database: inserts, updates, deletes,
 * schema changes, and reads that must observe their own writes.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface PrimaryDatabase {
}
