package com.verlumen.paramsweep.store;

import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.paramsweep.execution.ResultSet;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Process-local {@link ResultStore}; nothing survives the JVM. */
public final class InMemoryResultStore<O> implements ResultStore<O> {
  private final ConcurrentMap<SweepIdentity, ResultSet<O>> resultSets = new ConcurrentHashMap<>();

  public static <O> InMemoryResultStore<O> create() {
    return new InMemoryResultStore<>();
  }

  @Override
  public Optional<ResultSet<O>> load(SweepIdentity identity) {
    return Optional.ofNullable(resultSets.get(checkNotNull(identity, "identity")));
  }

  @Override
  public void save(SweepIdentity identity, ResultSet<O> resultSet) {
    resultSets.put(checkNotNull(identity, "identity"), checkNotNull(resultSet, "resultSet"));
  }

  private InMemoryResultStore() {}
}
