package com.example.litestream.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ThreadLocal-based context holder for read/write datasource routing.
 * Tracks whether the current operation reads, writes, or targets an explicit alias.
 * No context means write.
 */
public final class DataSourceContext {

    private static final Logger log = LoggerFactory.getLogger(DataSourceContext.class);

    private static final ThreadLocal<DataSourceContext> contextHolder = new ThreadLocal<>();

    private final boolean readOnly;
    private final String alias;

    private DataSourceContext(boolean readOnly, String alias) {
        this.readOnly = readOnly;
        this.alias = alias;
    }

    public static void setReadOnly() {
        contextHolder.set(new DataSourceContext(true, null));
        log.trace("DataSourceContext set to READ");
    }

    public static void setWritable() {
        contextHolder.set(new DataSourceContext(false, null));
        log.trace("DataSourceContext set to WRITE");
    }

    /**
     * Pin the current thread to one alias, bypassing the router.
     */
    public static void use(String alias) {
        contextHolder.set(new DataSourceContext(false, alias));
        log.trace("DataSourceContext pinned to {}", alias);
    }

    public static DataSourceContext get() {
        return contextHolder.get();
    }

    /**
     * Reinstate a context captured earlier with {@link #get()}; {@code null} clears.
     */
    public static void restore(DataSourceContext previous) {
        if (previous == null) {
            clear();
        } else {
            contextHolder.set(previous);
        }
    }

    public static void clear() {
        contextHolder.remove();
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Explicit alias, or {@code null} when the router decides.
     */
    public String getAlias() {
        return alias;
    }
}
