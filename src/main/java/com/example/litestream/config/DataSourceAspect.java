package com.example.litestream.config;

import com.example.litestream.annotation.PrimaryDatabase;
import com.example.litestream.annotation.ReadReplica;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * AOP aspect for read/write datasource routing.
 * Intercepts methods with {@link ReadReplica} and {@link PrimaryDatabase} and sets the
 * {@link DataSourceContext} for the duration of the call. The previous context is restored
 * afterwards, so annotated methods can call each other.
 */
@Aspect
@Component
public class DataSourceAspect {

    @Around("@annotation(readReplica)")
    public Object readReplicaRouting(ProceedingJoinPoint joinPoint, ReadReplica readReplica) throws Throwable {
        DataSourceContext previous = DataSourceContext.get();
        // a write in progress keeps the primary for nested reads
        if (previous == null || previous.isReadOnly()) {
            DataSourceContext.setReadOnly();
        }
        try {
            return joinPoint.proceed();
        } finally {
            DataSourceContext.restore(previous);
        }
    }

    @Around("@annotation(primaryDatabase)")
    public Object primaryDatabaseRouting(ProceedingJoinPoint joinPoint, PrimaryDatabase primaryDatabase) throws Throwable {
        DataSourceContext previous = DataSourceContext.get();
        DataSourceContext.setWritable();
        try {
            return joinPoint.proceed();
        } finally {
            DataSourceContext.restore(previous);
        }
    }
}
