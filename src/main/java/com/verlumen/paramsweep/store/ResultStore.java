package com.verlumen.paramsweep.store;

import com.verlumen.paramsweep.execution.ResultSet;
import java.util.Optional;

/**
 * Durable home of sweep result sets, keyed by {@link SweepIdentity}.
 *
 * <p>Callers check {@link #load} before running a sweep and skip the evaluation entirely when a
 * stored result set exists.
 *
 * @param <O> type of the evaluator output held by the stored result sets
 */
public interface ResultStore<O> {
  /**
   * Returns the result set stored for {@code identity}, or empty when there is none.
   *
   * @throws PersistenceException if a stored result set exists but cannot be read
   */
  Optional<ResultSet<O>> load(SweepIdentity identity) throws PersistenceException;

  /**
   * Stores {@code resultSet} under {@code identity}, replacing any previous value. Readers never
   * observe a partially written result set, and a failed save leaves the previous value intact.
   *
   * @throws PersistenceException if the result set cannot be written
   */
  void save(SweepIdentity identity, ResultSet<O> resultSet) throws PersistenceException;
}
