package com.verlumen.paramsweep.execution;

import com.google.inject.AbstractModule;

public class ExecutionModule extends AbstractModule {
  public static ExecutionModule create() {
    return new ExecutionModule();
  }

  @Override
  protected void configure() {
    bind(SweepScheduler.class).to(SweepSchedulerImpl.class);
  }

  private ExecutionModule() {}
}
