package com.example.litestream.config;

import com.example.litestream.annotation.PrimaryDatabase;
import com.example.litestream.annotation.ReadReplica;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceAspectTest {

    interface AccountQueries {

        String readBalance();

        String transfer();

        String transferThenRead();

        String failingRead();
    }

    static class AccountQueriesImpl implements AccountQueries {

        AccountQueries self;

        @Override
        @ReadReplica
        public String readBalance() {
            return describe();
        }

        @Override
        @PrimaryDatabase
        public String transfer() {
            return describe();
        }

        @Override
        @PrimaryDatabase
        public String transferThenRead() {
            return describe() + "/" + self.readBalance();
        }

        @Override
        @ReadReplica
        public String failingRead() {
            throw new IllegalStateException("replica gone");
        }

        private static String describe() {
            DataSourceContext context = DataSourceContext.get();
            if (context == null) {
                return "none";
            }
            return context.isReadOnly() ? "read" : "write";
        }
    }

    private AccountQueries queries;

    @BeforeEach
    void setUp() {
        AccountQueriesImpl target = new AccountQueriesImpl();
        AspectJProxyFactory proxyFactory = new AspectJProxyFactory(target);
        proxyFactory.addAspect(new DataSourceAspect());
        queries = proxyFactory.getProxy();
        target.self = queries;
    }

    @AfterEach
    void clearContext() {
        DataSourceContext.clear();
    }

    @Test
    void readReplicaMethodsRunInReadContext() {
        assertEquals("read", queries.readBalance());
        assertNull(DataSourceContext.get());
    }

    @Test
    void primaryDatabaseMethodsRunInWriteContext() {
        assertEquals("write", queries.transfer());
        assertNull(DataSourceContext.get());
    }

    @Test
    void readsInsideAWriteStayOnThePrimary() {
        assertEquals("write/write", queries.transferThenRead());
    }

    @Test
    void contextIsRestoredWhenTheMethodThrows() {
        DataSourceContext.setWritable();

        assertThrows(IllegalStateException.class, queries::failingRead);

        assertFalse(DataSourceContext.get().isReadOnly());
    }
}
