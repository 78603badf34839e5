package com.codeheadsystems.keychain.store;

import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.KeychainItem;
import com.codeheadsystems.keychain.model.StoreIdentifier;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link StoreBackend}. Backing stores live in a map keyed by identifier, so a
 * rename moves the entry and a handle opened for a missing identifier sees STORE_DOES_NOT_EXIST
 * until someone creates it.
 * <p>
 * Identifiers can be marked unreachable to simulate a provider that cannot be loaded.
 */
public class InMemoryStoreBackend implements StoreBackend {

  private static final Logger log = LoggerFactory.getLogger(InMemoryStoreBackend.class);

  private final ConcurrentHashMap<StoreIdentifier, StoreFile> files = new ConcurrentHashMap<>();
  private final Set<StoreIdentifier> unreachable = ConcurrentHashMap.newKeySet();
  private final Map<StoreIdentifier, ErrorKind> queryFailures = new ConcurrentHashMap<>();

  public InMemoryStoreBackend() {
    log.warn("Using InMemoryStoreBackend. Stores will NOT survive restarts.");
  }

  @Override
  public Store open(final StoreIdentifier identifier) {
    if (unreachable.contains(identifier)) {
      throw new KeychainException(ErrorKind.BACKEND_UNAVAILABLE, "Provider unavailable for " + identifier);
    }
    log.debug("open({})", identifier);
    return new InMemoryStore(this, identifier);
  }

  /**
   * Creates a backing store directly, bypassing any handle.
   *
   * @param identifier the identifier
   * @param secret     the secret
   */
  public void seed(final StoreIdentifier identifier, final byte[] secret) {
    files.put(identifier, new StoreFile(secret));
  }

  public boolean contains(final StoreIdentifier identifier) {
    return files.containsKey(identifier);
  }

  public void markUnreachable(final StoreIdentifier identifier) {
    unreachable.add(identifier);
  }

  /**
   * Makes every query against the store fail with the given kind.
   *
   * @param identifier the identifier
   * @param kind       the kind
   */
  public void failQueries(final StoreIdentifier identifier, final ErrorKind kind) {
    queryFailures.put(identifier, kind);
  }

  Optional<ErrorKind> queryFailure(final StoreIdentifier identifier) {
    return Optional.ofNullable(queryFailures.get(identifier));
  }

  StoreFile file(final StoreIdentifier identifier) {
    StoreFile file = files.get(identifier);
    if (file == null) {
      throw new KeychainException(ErrorKind.STORE_DOES_NOT_EXIST, "No such keychain: " + identifier.name());
    }
    return file;
  }

  boolean exists(final StoreIdentifier identifier) {
    return files.containsKey(identifier);
  }

  void create(final StoreIdentifier identifier, final byte[] secret) {
    if (files.putIfAbsent(identifier, new StoreFile(secret)) != null) {
      throw new KeychainException(ErrorKind.DUPLICATE_MEMBER, "Keychain already exists: " + identifier.name());
    }
  }

  void move(final StoreIdentifier from, final StoreIdentifier to) {
    StoreFile file = files.remove(from);
    if (file == null) {
      throw new KeychainException(ErrorKind.STORE_DOES_NOT_EXIST, "No such keychain: " + from.name());
    }
    files.put(to, file);
  }

  void remove(final StoreIdentifier identifier) {
    if (files.remove(identifier) == null) {
      throw new KeychainException(ErrorKind.STORE_DOES_NOT_EXIST, "No such keychain: " + identifier.name());
    }
  }

  /**
   * Contents of one backing store.
   */
  static final class StoreFile {

    private byte[] secret;
    private final Map<String, KeychainItem> items = new LinkedHashMap<>();

    StoreFile(final byte[] secret) {
      this.secret = secret.clone();
    }

    synchronized boolean secretMatches(final byte[] candidate) {
      return Arrays.equals(secret, candidate);
    }

    synchronized void secret(final byte[] newSecret) {
      this.secret = newSecret.clone();
    }

    synchronized Map<String, KeychainItem> snapshot() {
      return new LinkedHashMap<>(items);
    }

    synchronized void put(final KeychainItem item) {
      items.put(item.recordId(), item);
    }

    synchronized boolean contains(final String recordId) {
      return items.containsKey(recordId);
    }
  }
}
