package com.verlumen.paramsweep.sweep;

import com.google.inject.AbstractModule;
import com.verlumen.paramsweep.execution.ExecutionModule;
import com.verlumen.paramsweep.generation.GenerationModule;

public class SweepModule extends AbstractModule {
  public static SweepModule create() {
    return new SweepModule();
  }

  @Override
  protected void configure() {
    install(ExecutionModule.create());
    install(GenerationModule.create());
    bind(SweepRunner.class).to(SweepRunnerImpl.class);
  }

  private SweepModule() {}
}
