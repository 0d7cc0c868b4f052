package com.verlumen.paramsweep.store;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.verlumen.paramsweep.execution.ResultSet;
import com.verlumen.paramsweep.execution.SweepResult;
import com.verlumen.paramsweep.execution.SweepStatus;
import com.verlumen.paramsweep.params.Combination;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of a stored result set.
 *
 * <p>Combination values carry a type tag so that a reloaded combination equals the original one.
 * Evaluator outputs are written with Gson and read back as {@code outputType}; NaN and infinite
 * doubles are written as the literals Gson reads back leniently.
 */
final class ResultSetCodec<O> {
  private static final int FORMAT_VERSION = 1;

  private final Gson gson;
  private final Type outputType;

  ResultSetCodec(Gson gson, Type outputType) {
    this.gson = gson.newBuilder().serializeSpecialFloatingPointValues().create();
    this.outputType = outputType;
  }

  /** A decoded document: the identity it was written for and its result set. */
  static final class Document<O> {
    final SweepIdentity identity;
    final ResultSet<O> resultSet;

    Document(SweepIdentity identity, ResultSet<O> resultSet) {
      this.identity = identity;
      this.resultSet = resultSet;
    }
  }

  String encode(SweepIdentity identity, ResultSet<O> resultSet) throws PersistenceException {
    JsonObject document = new JsonObject();
    document.addProperty("version", FORMAT_VERSION);
    document.addProperty("strategy", identity.strategyName());
    document.addProperty("identity", identity.digest());
    document.addProperty("status", resultSet.status().name());
    document.addProperty("expectedCount", resultSet.expectedCount());

    JsonArray results = new JsonArray();
    for (SweepResult<O> result : resultSet.results()) {
      results.add(encodeResult(result));
    }
    document.add("results", results);
    return gson.toJson(document);
  }

  Document<O> decode(String json) throws PersistenceException {
    try {
      JsonObject document = JsonParser.parseString(json).getAsJsonObject();
      int version = document.get("version").getAsInt();
      if (version != FORMAT_VERSION) {
        throw new PersistenceException("Unsupported result document version: " + version);
      }
      SweepIdentity identity = SweepIdentity.of(
          document.get("strategy").getAsString(), document.get("identity").getAsString());

      ImmutableList.Builder<SweepResult<O>> results = ImmutableList.builder();
      for (JsonElement element : document.getAsJsonArray("results")) {
        results.add(decodeResult(element.getAsJsonObject()));
      }
      ResultSet<O> resultSet = ResultSet.create(
          SweepStatus.valueOf(document.get("status").getAsString()),
          document.get("expectedCount").getAsInt(),
          results.build());
      return new Document<>(identity, resultSet);
    } catch (JsonParseException | IllegalStateException | IllegalArgumentException
        | NullPointerException e) {
      throw new PersistenceException("Malformed result document", e);
    }
  }

  private JsonObject encodeResult(SweepResult<O> result) throws PersistenceException {
    JsonObject encoded = new JsonObject();
    JsonArray combination = new JsonArray();
    for (Map.Entry<String, Comparable<?>> entry : result.combination().values().entrySet()) {
      JsonObject value = new JsonObject();
      value.addProperty("label", entry.getKey());
      value.addProperty("type", ValueType.of(entry.getValue()).name());
      value.addProperty("value", entry.getValue().toString());
      combination.add(value);
    }
    encoded.add("combination", combination);
    encoded.addProperty("status", result.status().name());
    if (result.output().isPresent()) {
      try {
        encoded.add("output", gson.toJsonTree(result.output().get(), outputType));
      } catch (JsonParseException | IllegalArgumentException e) {
        throw new PersistenceException("Cannot serialize output of " + result.combination(), e);
      }
    }
    result.errorDetail().ifPresent(detail -> encoded.addProperty("error", detail));
    return encoded;
  }

  private SweepResult<O> decodeResult(JsonObject encoded) {
    Map<String, Comparable<?>> values = new LinkedHashMap<>();
    for (JsonElement element : encoded.getAsJsonArray("combination")) {
      JsonObject value = element.getAsJsonObject();
      ValueType type = ValueType.valueOf(value.get("type").getAsString());
      values.put(value.get("label").getAsString(), type.parse(value.get("value").getAsString()));
    }
    Combination combination = Combination.of(values);

    SweepResult.Status status = SweepResult.Status.valueOf(encoded.get("status").getAsString());
    if (status == SweepResult.Status.SUCCEEDED) {
      O output = gson.fromJson(encoded.get("output"), outputType);
      return SweepResult.succeeded(combination, output);
    }
    return SweepResult.failed(combination, encoded.get("error").getAsString());
  }
}
