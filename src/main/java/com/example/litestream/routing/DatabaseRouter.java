package com.example.litestream.routing;

import org.springframework.lang.Nullable;

/**
 * Chooses the database alias for each data operation.
 * A {@code null} answer means no opinion; the next router in a {@link DatabaseRouterChain}
 * decides.
 */
public interface DatabaseRouter {

    @Nullable
    String dbForRead();

    @Nullable
    String dbForWrite();

    @Nullable
    Boolean allowRelation(String firstAlias, String secondAlias);

    /**
     * Whether schema migrations may run against {@code alias}.
     */
    @Nullable
    Boolean allowMigrate(String alias);
}
