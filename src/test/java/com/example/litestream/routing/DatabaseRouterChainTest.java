package com.example.litestream.routing;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseRouterChainTest {

    /**
     * Router with no opinion on anything.
     */
    private static class AbstainingRouter implements DatabaseRouter {

        @Override
        public String dbForRead() {
            return null;
        }

        @Override
        public String dbForWrite() {
            return null;
        }

        @Override
        public Boolean allowRelation(String firstAlias, String secondAlias) {
            return null;
        }

        @Override
        public Boolean allowMigrate(String alias) {
            return null;
        }
    }

    private static class AnalyticsRouter extends AbstainingRouter {

        @Override
        public Boolean allowMigrate(String alias) {
            return "analytics".equals(alias) ? Boolean.FALSE : null;
        }
    }

    @Test
    void defaultsWhenNobodyHasAnOpinion() {
        DatabaseRouterChain chain = new DatabaseRouterChain(List.of(new AbstainingRouter()), "default");

        assertEquals("default", chain.dbForRead());
        assertEquals("default", chain.dbForWrite());
        assertTrue(chain.allowMigrate("anything"));
        assertTrue(chain.allowRelation("a", "a"));
        assertFalse(chain.allowRelation("a", "b"));
    }

    @Test
    void relationDefaultToleratesUnknownAlias() {
        DatabaseRouterChain chain = new DatabaseRouterChain(List.of(new AbstainingRouter()), "default");

        assertFalse(chain.allowRelation(null, "a"));
        assertTrue(chain.allowRelation(null, null));
    }

    @Test
    void laterRouterDecidesWhereEarlierAbstains() {
        DatabaseRouter replicaAware = new AbstainingRouter() {
            @Override
            public Boolean allowMigrate(String alias) {
                if ("default".equals(alias)) {
                    return Boolean.TRUE;
                }
                return "r1".equals(alias) ? Boolean.FALSE : null;
            }

            @Override
            public String dbForRead() {
                return "r1";
            }
        };
        DatabaseRouterChain chain = new DatabaseRouterChain(List.of(replicaAware, new AnalyticsRouter()), "default");

        assertEquals("r1", chain.dbForRead());
        assertTrue(chain.allowMigrate("default"));
        assertFalse(chain.allowMigrate("r1"));
        assertFalse(chain.allowMigrate("analytics"));
        assertTrue(chain.allowMigrate("other"));
    }
}
