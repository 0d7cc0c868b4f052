package com.verlumen.paramsweep.backtesting;

import com.google.inject.AbstractModule;
import com.google.inject.assistedinject.FactoryModuleBuilder;

public class BacktestingModule extends AbstractModule {
  public static BacktestingModule create() {
    return new BacktestingModule();
  }

  @Override
  protected void configure() {
    bind(BarSeriesFactory.class).toInstance(BarSeriesBuilder::createBarSeries);
    install(new FactoryModuleBuilder().build(MovingAverageCrossoverEvaluator.Factory.class));
  }

  private BacktestingModule() {}
}
