package com.verlumen.paramsweep.store;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.verlumen.paramsweep.execution.ResultSet;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link ResultStore} keeping one JSON document per sweep identity in a directory.
 *
 * <p>Saves write a temporary file next to the target and move it into place atomically, so a
 * reader sees either the previous document or the new one, never a partial write.
 */
public final class FileResultStore<O> implements ResultStore<O> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String TEMP_SUFFIX = ".tmp";

  private final Path directory;
  private final ResultSetCodec<O> codec;

  /**
   * Creates a store rooted at {@code directory}, which is created on first save.
   *
   * @param outputType type of the evaluator output, used to read outputs back with Gson
   */
  public static <O> FileResultStore<O> create(Path directory, Type outputType) {
    return create(directory, outputType, new GsonBuilder().setPrettyPrinting().create());
  }

  public static <O> FileResultStore<O> create(Path directory, Type outputType, Gson gson) {
    checkNotNull(directory, "directory");
    checkNotNull(outputType, "outputType");
    return new FileResultStore<>(directory, new ResultSetCodec<>(gson, outputType));
  }

  @Override
  public Optional<ResultSet<O>> load(SweepIdentity identity) throws PersistenceException {
    Path path = pathOf(identity);
    String json;
    try {
      json = Files.readString(path, UTF_8);
    } catch (NoSuchFileException e) {
      logger.atFine().log("No stored results for %s at %s", identity, path);
      return Optional.empty();
    } catch (IOException e) {
      throw new PersistenceException("Unable to read stored results from " + path, e);
    }

    ResultSetCodec.Document<O> document = codec.decode(json);
    if (!document.identity.equals(identity)) {
      logger.atWarning().log(
          "Stored results at %s belong to %s, not %s", path, document.identity, identity);
      return Optional.empty();
    }
    logger.atInfo().log(
        "Loaded %d stored results for %s from %s", document.resultSet.size(), identity, path);
    return Optional.of(document.resultSet);
  }

  @Override
  public void save(SweepIdentity identity, ResultSet<O> resultSet) throws PersistenceException {
    checkNotNull(resultSet, "resultSet");
    Path target = pathOf(identity);
    String json = codec.encode(identity, resultSet);

    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, identity.fileName(), TEMP_SUFFIX);
      Files.writeString(temp, json, UTF_8);
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new PersistenceException("Unable to store results at " + target, e);
    }
    logger.atInfo().log("Stored %d results for %s at %s", resultSet.size(), identity, target);
  }

  Path pathOf(SweepIdentity identity) {
    return directory.resolve(checkNotNull(identity, "identity").fileName());
  }

  private static void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Unable to delete temporary file %s", temp);
    }
  }

  private FileResultStore(Path directory, ResultSetCodec<O> codec) {
    this.directory = directory;
    this.codec = codec;
  }
}
