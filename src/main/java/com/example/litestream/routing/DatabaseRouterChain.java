package com.example.litestream.routing;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Asks each router in turn; the first non-null answer wins. Reads and writes fall back to
 * the primary alias, migrations are allowed when nobody objects and relations only within
 * one database.
 */
public class DatabaseRouterChain implements DatabaseRouter {

    private final List<DatabaseRouter> routers;
    private final String primaryAlias;

    public DatabaseRouterChain(List<DatabaseRouter> routers, String primaryAlias) {
        this.routers = List.copyOf(routers);
        this.primaryAlias = primaryAlias;
    }

    @Override
    public String dbForRead() {
        String alias = firstOpinion(DatabaseRouter::dbForRead);
        return alias != null ? alias : primaryAlias;
    }

    @Override
    public String dbForWrite() {
        String alias = firstOpinion(DatabaseRouter::dbForWrite);
        return alias != null ? alias : primaryAlias;
    }

    @Override
    public Boolean allowRelation(String firstAlias, String secondAlias) {
        Boolean allowed = firstOpinion(router -> router.allowRelation(firstAlias, secondAlias));
        return allowed != null ? allowed : Boolean.valueOf(Objects.equals(firstAlias, secondAlias));
    }

    @Override
    public Boolean allowMigrate(String alias) {
        Boolean allowed = firstOpinion(router -> router.allowMigrate(alias));
        return allowed != null ? allowed : Boolean.TRUE;
    }

    private <T> T firstOpinion(Function<DatabaseRouter, T> question) {
        for (DatabaseRouter router : routers) {
            T answer = question.apply(router);
            if (answer != null) {
                return answer;
            }
        }
        return null;
    }
}
