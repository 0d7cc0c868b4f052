package com.verlumen.paramsweep.backtesting;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;

/**
 * Reads candles from CSV lines of the form {@code timestamp,open,high,low,close,volume}.
 *
 * <p>Timestamps are epoch milliseconds, ISO-8601 instants or ISO-8601 dates (taken as midnight
 * UTC). A leading header line is skipped. Candles are returned in chronological order.
 */
public final class CandleCsvReader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Splitter FIELD_SPLITTER = Splitter.on(',').trimResults();
  private static final int FIELD_COUNT = 6;

  public static ImmutableList<Candle> read(Path path) throws IOException {
    ImmutableList<Candle> candles = parse(Files.readAllLines(path, UTF_8));
    logger.atInfo().log("Read %d candles from %s", candles.size(), path);
    return candles;
  }

  /**
   * Parses CSV lines into candles.
   *
   * @throws IllegalArgumentException if a line is malformed or two candles share a timestamp
   */
  public static ImmutableList<Candle> parse(List<String> lines) {
    ImmutableList.Builder<Candle> candles = ImmutableList.builder();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).strip();
      if (line.isEmpty() || (i == 0 && isHeader(line))) {
        continue;
      }
      candles.add(parseLine(line, i + 1));
    }

    ImmutableList<Candle> sorted = ImmutableList.sortedCopyOf(
        Comparator.comparing(Candle::timestamp), candles.build());
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i).timestamp().equals(sorted.get(i - 1).timestamp())) {
        throw new IllegalArgumentException(
            "Duplicate candle timestamp: " + sorted.get(i).timestamp());
      }
    }
    return sorted;
  }

  private static boolean isHeader(String line) {
    String first = FIELD_SPLITTER.split(line).iterator().next();
    return !first.isEmpty() && CharMatcher.javaLetter().matches(first.charAt(0));
  }

  private static Candle parseLine(String line, int lineNumber) {
    List<String> fields = FIELD_SPLITTER.splitToList(line);
    if (fields.size() != FIELD_COUNT) {
      throw new IllegalArgumentException(String.format(
          "Line %d has %d fields, expected %d: %s", lineNumber, fields.size(), FIELD_COUNT, line));
    }
    try {
      return Candle.create(
          parseTimestamp(fields.get(0)),
          Double.parseDouble(fields.get(1)),
          Double.parseDouble(fields.get(2)),
          Double.parseDouble(fields.get(3)),
          Double.parseDouble(fields.get(4)),
          Double.parseDouble(fields.get(5)));
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new IllegalArgumentException(
          String.format("Malformed candle on line %d: %s", lineNumber, line), e);
    }
  }

  private static Instant parseTimestamp(String text) {
    if (CharMatcher.inRange('0', '9').matchesAllOf(text)) {
      return Instant.ofEpochMilli(Long.parseLong(text));
    }
    if (text.length() == 10) {
      return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    return Instant.parse(text);
  }

  private CandleCsvReader() {}
}
