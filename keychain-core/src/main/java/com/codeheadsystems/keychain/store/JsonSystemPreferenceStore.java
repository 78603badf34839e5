package com.codeheadsystems.keychain.store;

import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SystemPreferenceStore} keeping each preference domain in {@code <domain>.json} as a map
 * of key to hex-encoded value.
 * <p>
 * The file is shared with other processes. Reads go back to disk whenever the file's
 * modification time or size changed. Sets and removes are held as pending edits and merged into
 * a fresh read of the file on flush, under a file lock, so edits made elsewhere survive.
 */
public class JsonSystemPreferenceStore implements SystemPreferenceStore {

  private static final Logger log = LoggerFactory.getLogger(JsonSystemPreferenceStore.class);
  private static final TypeReference<TreeMap<String, String>> MAP_TYPE = new TypeReference<>() {
  };

  private final Path directory;
  private final ObjectMapper objectMapper;
  private final Map<String, Snapshot> snapshots = new HashMap<>();
  private final Map<String, Map<String, Optional<String>>> pending = new HashMap<>();

  public JsonSystemPreferenceStore(final Path directory, final ObjectMapper objectMapper) {
    log.info("JsonSystemPreferenceStore({})", directory);
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  @Override
  public synchronized Optional<byte[]> getValue(final String preferenceDomain, final String key) {
    Optional<String> edited = pending.getOrDefault(preferenceDomain, Map.of()).get(key);
    String hex = edited != null ? edited.orElse(null) : current(preferenceDomain).get(key);
    return Optional.ofNullable(hex).map(Hex::decode);
  }

  @Override
  public synchronized void setValue(final String preferenceDomain, final String key, final byte[] value) {
    edits(preferenceDomain).put(key, Optional.of(Hex.toHexString(value)));
  }

  @Override
  public synchronized void removeValue(final String preferenceDomain, final String key) {
    edits(preferenceDomain).put(key, Optional.empty());
  }

  @Override
  public synchronized void flush(final String preferenceDomain) {
    Path file = fileFor(preferenceDomain);
    Map<String, Optional<String>> edits = pending.getOrDefault(preferenceDomain, Map.of());
    try {
      Files.createDirectories(directory);
      try (FileChannel channel = FileChannel.open(lockFileFor(preferenceDomain),
          StandardOpenOption.CREATE, StandardOpenOption.WRITE);
           FileLock ignored = channel.lock()) {
        TreeMap<String, String> values = read(file);
        edits.forEach((key, value) -> {
          if (value.isPresent()) {
            values.put(key, value.get());
          } else {
            values.remove(key);
          }
        });
        write(file, values);
        snapshots.put(preferenceDomain, new Snapshot(values, versionOf(file)));
      }
      log.debug("flush({}): {} edits", preferenceDomain, edits.size());
      pending.remove(preferenceDomain);
    } catch (IOException e) {
      throw new KeychainException(ErrorKind.IO_FAILURE, "Unable to write " + file, e);
    }
  }

  private Path fileFor(final String preferenceDomain) {
    return directory.resolve(preferenceDomain + ".json");
  }

  private Path lockFileFor(final String preferenceDomain) {
    return directory.resolve(preferenceDomain + ".lock");
  }

  private Map<String, Optional<String>> edits(final String preferenceDomain) {
    return pending.computeIfAbsent(preferenceDomain, d -> new HashMap<>());
  }

  private TreeMap<String, String> current(final String preferenceDomain) {
    Path file = fileFor(preferenceDomain);
    try {
      long version = versionOf(file);
      Snapshot snapshot = snapshots.get(preferenceDomain);
      if (snapshot == null || snapshot.version() != version) {
        log.debug("current({}): reloading", preferenceDomain);
        snapshot = new Snapshot(read(file), version);
        snapshots.put(preferenceDomain, snapshot);
      }
      return snapshot.values();
    } catch (IOException e) {
      throw new KeychainException(ErrorKind.IO_FAILURE, "Unable to read " + file, e);
    }
  }

  private TreeMap<String, String> read(final Path file) throws IOException {
    if (!Files.exists(file)) {
      return new TreeMap<>();
    }
    return objectMapper.readValue(file.toFile(), MAP_TYPE);
  }

  private void write(final Path file, final TreeMap<String, String> values) throws IOException {
    Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
    try {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), values);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static long versionOf(final Path file) throws IOException {
    if (!Files.exists(file)) {
      return 0L;
    }
    return Files.getLastModifiedTime(file).toMillis() * 31 + Files.size(file) + 1;
  }

  private record Snapshot(TreeMap<String, String> values, long version) {
  }
}
