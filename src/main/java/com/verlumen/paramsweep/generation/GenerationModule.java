package com.verlumen.paramsweep.generation;

import com.google.inject.AbstractModule;

public class GenerationModule extends AbstractModule {
  public static GenerationModule create() {
    return new GenerationModule();
  }

  @Override
  protected void configure() {
    bind(CombinationGenerator.class).to(CombinationGeneratorImpl.class);
  }

  private GenerationModule() {}
}
