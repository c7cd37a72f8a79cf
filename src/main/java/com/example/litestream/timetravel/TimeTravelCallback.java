package com.example.litestream.timetravel;

@FunctionalInterface
public interface TimeTravelCallback<T> {

    T doInSession(TimeTravelSession session);
}
