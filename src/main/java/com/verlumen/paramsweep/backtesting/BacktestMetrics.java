package com.verlumen.paramsweep.backtesting;

/**
 * Raw metrics of one backtest run, computed over closed positions.
 *
 * @param cumulativeReturn compounded return of all closed positions, 0.1 meaning +10%
 * @param numberOfTrades number of closed positions
 * @param winRate share of closed positions with a positive profit
 * @param maxDrawdown largest peak-to-trough decline of the closed-position equity curve
 * @param profitFactor gross profit divided by gross loss, or gross profit when nothing was lost
 */
public record BacktestMetrics(
    double cumulativeReturn,
    int numberOfTrades,
    double winRate,
    double maxDrawdown,
    double profitFactor) {}
