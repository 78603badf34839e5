package com.codeheadsystems.keychain.store;

import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.Domain;
import com.codeheadsystems.keychain.model.SearchListState;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link SearchListStorage}. Every save bumps a per-domain counter.
 */
public class InMemorySearchListStorage implements SearchListStorage {

  private static final Logger log = LoggerFactory.getLogger(InMemorySearchListStorage.class);

  private final Map<Domain, Snapshot> records = new EnumMap<>(Domain.class);

  public InMemorySearchListStorage() {
    log.warn("Using InMemorySearchListStorage. Search lists will NOT survive restarts.");
  }

  @Override
  public synchronized Snapshot load(final Domain domain) {
    requirePersisted(domain);
    return records.getOrDefault(domain, new Snapshot(SearchListState.empty(), 0L));
  }

  @Override
  public synchronized long version(final Domain domain) {
    requirePersisted(domain);
    Snapshot snapshot = records.get(domain);
    return snapshot == null ? 0L : snapshot.version();
  }

  @Override
  public synchronized long save(final Domain domain, final SearchListState state) {
    requirePersisted(domain);
    long version = version(domain) + 1;
    records.put(domain, new Snapshot(state, version));
    return version;
  }

  private static void requirePersisted(final Domain domain) {
    if (!domain.isPersisted()) {
      throw new KeychainException(ErrorKind.INVALID_DOMAIN, domain + " search list is not persisted");
    }
  }
}
