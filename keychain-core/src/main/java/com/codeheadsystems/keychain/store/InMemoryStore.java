package com.codeheadsystems.keychain.store;

import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.ItemQuery;
import com.codeheadsystems.keychain.model.KeychainItem;
import com.codeheadsystems.keychain.model.StoreIdentifier;
import java.util.Iterator;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle onto one backing store of an {@link InMemoryStoreBackend}.
 */
public class InMemoryStore implements Store {

  private static final Logger log = LoggerFactory.getLogger(InMemoryStore.class);

  private final InMemoryStoreBackend backend;
  private volatile StoreIdentifier identifier;
  private volatile boolean unlocked;

  InMemoryStore(final InMemoryStoreBackend backend, final StoreIdentifier identifier) {
    this.backend = backend;
    this.identifier = identifier;
  }

  @Override
  public StoreIdentifier identifier() {
    return identifier;
  }

  @Override
  public boolean exists() {
    return backend.exists(identifier);
  }

  @Override
  public void unlock(final byte[] secret) {
    if (!backend.file(identifier).secretMatches(secret)) {
      throw new KeychainException(ErrorKind.AUTH_FAILURE, "Wrong secret for " + identifier.name());
    }
    unlocked = true;
    log.debug("unlock({})", identifier);
  }

  @Override
  public void lock() {
    unlocked = false;
  }

  public boolean isUnlocked() {
    return unlocked && exists();
  }

  @Override
  public void create(final byte[] secret) {
    backend.create(identifier, secret);
    unlocked = true;
    log.debug("create({})", identifier);
  }

  @Override
  public void changePassphrase(final byte[] oldSecret, final byte[] newSecret) {
    InMemoryStoreBackend.StoreFile file = backend.file(identifier);
    if (!file.secretMatches(oldSecret)) {
      throw new KeychainException(ErrorKind.AUTH_FAILURE, "Wrong secret for " + identifier.name());
    }
    file.secret(newSecret);
  }

  @Override
  public void rename(final StoreIdentifier target) {
    backend.move(identifier, target);
    log.debug("rename({} -> {})", identifier, target);
    identifier = target;
  }

  @Override
  public void delete() {
    backend.remove(identifier);
    unlocked = false;
  }

  @Override
  public ItemCursor query(final ItemQuery query) {
    Optional<ErrorKind> failure = backend.queryFailure(identifier);
    if (failure.isPresent()) {
      throw new KeychainException(failure.get(), "Query failed for " + identifier.name());
    }
    Iterator<KeychainItem> items = backend.file(identifier).snapshot().values().stream()
        .filter(query::matches)
        .iterator();
    return () -> items.hasNext() ? Optional.of(items.next()) : Optional.empty();
  }

  @Override
  public Optional<KeychainItem> find(final String recordId) {
    return Optional.ofNullable(backend.file(identifier).snapshot().get(recordId));
  }

  @Override
  public KeychainItem add(final KeychainItem item) {
    KeychainItem stored = item.withRecordId(UUID.randomUUID().toString());
    backend.file(identifier).put(stored);
    return stored;
  }

  @Override
  public void update(final KeychainItem item) {
    InMemoryStoreBackend.StoreFile file = backend.file(identifier);
    if (item.recordId() == null || !file.contains(item.recordId())) {
      throw new KeychainException(ErrorKind.NOT_FOUND, "No item " + item.recordId() + " in " + identifier.name());
    }
    file.put(item);
  }
}
