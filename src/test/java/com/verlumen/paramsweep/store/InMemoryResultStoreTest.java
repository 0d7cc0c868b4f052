package com.verlumen.paramsweep.store;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.paramsweep.execution.ResultSet;
import com.verlumen.paramsweep.execution.SweepResult;
import com.verlumen.paramsweep.execution.SweepStatus;
import com.verlumen.paramsweep.params.Combination;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InMemoryResultStoreTest {
  @Test
  public void save_thenLoad_returnsSameResultSet() {
    // Arrange
    InMemoryResultStore<String> store = InMemoryResultStore.create();
    SweepIdentity identity = SweepIdentity.of("SMA", "abc");
    ResultSet<String> resultSet = ResultSet.create(
        SweepStatus.COMPLETE, 1,
        ImmutableList.of(SweepResult.succeeded(Combination.of(ImmutableMap.of("n", 1)), "ok")));

    // Act
    store.save(identity, resultSet);

    // Assert
    assertThat(store.load(identity)).hasValue(resultSet);
    assertThat(store.load(SweepIdentity.of("SMA", "def"))).isEmpty();
  }
}
