package io.b2mash.ismsp.store;

import org.springframework.jdbc.core.simple.JdbcClient;

@FunctionalInterface
public interface StoreCallback<T> {

  T doInStore(JdbcClient jdbc);
}
