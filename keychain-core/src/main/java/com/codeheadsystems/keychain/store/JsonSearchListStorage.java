package com.codeheadsystems.keychain.store;

import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.Domain;
import com.codeheadsystems.keychain.model.SearchListState;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SearchListStorage} keeping one JSON file per domain, e.g. {@code user-keychains.json}.
 * <p>
 * The version is derived from the file's modification time and size; a missing file has version
 * 0. Writes go to a temporary file that is then moved over the record.
 */
public class JsonSearchListStorage implements SearchListStorage {

  private static final Logger log = LoggerFactory.getLogger(JsonSearchListStorage.class);

  private final Path directory;
  private final ObjectMapper objectMapper;

  public JsonSearchListStorage(final Path directory, final ObjectMapper objectMapper) {
    log.info("JsonSearchListStorage({})", directory);
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  /**
   * File holding the domain's record.
   *
   * @param domain the domain
   * @return the path
   */
  public Path fileFor(final Domain domain) {
    if (!domain.isPersisted()) {
      throw new KeychainException(ErrorKind.INVALID_DOMAIN, domain + " search list is not persisted");
    }
    return directory.resolve(domain.name().toLowerCase(Locale.ROOT) + "-keychains.json");
  }

  @Override
  public Snapshot load(final Domain domain) {
    Path file = fileFor(domain);
    try {
      long version = versionOf(file);
      if (version == 0L) {
        return new Snapshot(SearchListState.empty(), 0L);
      }
      SearchListState state = objectMapper.readValue(file.toFile(), SearchListState.class);
      log.debug("load({}): {} entries", domain, state.searchList().size());
      return new Snapshot(state, version);
    } catch (IOException e) {
      throw new KeychainException(ErrorKind.IO_FAILURE, "Unable to read " + file, e);
    }
  }

  @Override
  public long version(final Domain domain) {
    Path file = fileFor(domain);
    try {
      return versionOf(file);
    } catch (IOException e) {
      throw new KeychainException(ErrorKind.IO_FAILURE, "Unable to stat " + file, e);
    }
  }

  @Override
  public long save(final Domain domain, final SearchListState state) {
    Path file = fileFor(domain);
    try {
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
      try {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } finally {
        Files.deleteIfExists(temp);
      }
      log.debug("save({}): {} entries", domain, state.searchList().size());
      return versionOf(file);
    } catch (IOException e) {
      throw new KeychainException(ErrorKind.IO_FAILURE, "Unable to write " + file, e);
    }
  }

  private static long versionOf(final Path file) throws IOException {
    try {
      long modified = Files.getLastModifiedTime(file).toMillis();
      return modified * 31 + Files.size(file) + 1;
    } catch (NoSuchFileException e) {
      return 0L;
    }
  }
}
