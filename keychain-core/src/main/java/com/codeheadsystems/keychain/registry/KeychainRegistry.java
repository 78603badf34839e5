package com.codeheadsystems.keychain.registry;

import com.codeheadsystems.keychain.model.StoreIdentifier;
import com.codeheadsystems.keychain.store.Store;
import com.codeheadsystems.keychain.store.StoreBackend;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache of live {@link Keychain} handles keyed by {@link StoreIdentifier}.
 * <p>
 * The registry owns the process-wide API lock. It is reentrant, and the search-list manager holds
 * it across its own read-modify-write sequences so registry and list updates appear atomic. The
 * registry is the only writer of a handle's {@link CacheState}.
 */
@Singleton
public class KeychainRegistry {

  private static final Logger log = LoggerFactory.getLogger(KeychainRegistry.class);

  private final StoreBackend backend;
  private final ReentrantLock apiLock = new ReentrantLock();
  private final Map<StoreIdentifier, Keychain> keychains = new HashMap<>();

  /**
   * Instantiates a new Keychain registry.
   *
   * @param backend the backend
   */
  @Inject
  public KeychainRegistry(final StoreBackend backend) {
    log.info("KeychainRegistry({})", backend.getClass().getSimpleName());
    this.backend = backend;
  }

  /**
   * The API lock shared with the managers.
   *
   * @return the reentrant lock
   */
  public ReentrantLock apiLock() {
    return apiLock;
  }

  /**
   * Returns the cached handle for the identifier, opening and caching one if needed. Equal
   * identifiers always get the same handle while it stays cached.
   *
   * @param identifier the identifier
   * @return the keychain
   * @throws com.codeheadsystems.keychain.exceptions.KeychainException BACKEND_UNAVAILABLE when the
   *                                                                   provider cannot serve it
   */
  public Keychain resolve(final StoreIdentifier identifier) {
    apiLock.lock();
    try {
      Keychain keychain = keychains.get(identifier);
      if (keychain == null) {
        keychain = new Keychain(backend.open(identifier));
        keychains.put(identifier, keychain);
        keychain.cacheState(CacheState.CACHED);
        log.debug("resolve({}): opened", identifier);
      }
      return keychain;
    } finally {
      apiLock.unlock();
    }
  }

  public Optional<Keychain> cached(final StoreIdentifier identifier) {
    apiLock.lock();
    try {
      return Optional.ofNullable(keychains.get(identifier));
    } finally {
      apiLock.unlock();
    }
  }

  /**
   * Whether a backing store exists, without caching a handle for it.
   *
   * @param identifier the identifier
   * @return true if the store exists
   */
  public boolean exists(final StoreIdentifier identifier) {
    Optional<Keychain> cached = cached(identifier);
    if (cached.isPresent()) {
      return cached.get().exists();
    }
    Store uncached = backend.open(identifier);
    return uncached.exists();
  }

  /**
   * Drops the handle from the cache. The mapping is removed only if the handle is the one cached
   * for the identifier. Repeated calls are no-ops.
   *
   * @param identifier the identifier
   * @param keychain   the keychain
   * @return true if the handle was the one cached for the identifier
   */
  public boolean evict(final StoreIdentifier identifier, final Keychain keychain) {
    apiLock.lock();
    try {
      if (keychain.cacheState() != CacheState.CACHED || keychains.get(identifier) != keychain) {
        return false;
      }
      keychains.remove(identifier);
      keychain.cacheState(CacheState.EVICTED);
      log.debug("evict({})", identifier);
      return true;
    } finally {
      apiLock.unlock();
    }
  }

  /**
   * Called when a store was deleted behind the registry's back.
   *
   * @param identifier the identifier
   * @return true if a handle was evicted
   */
  public boolean notifyExternallyRemoved(final StoreIdentifier identifier) {
    apiLock.lock();
    try {
      Keychain keychain = keychains.get(identifier);
      return keychain != null && evict(identifier, keychain);
    } finally {
      apiLock.unlock();
    }
  }

  /**
   * Renames the backing store and moves the cache entry with it. A different handle cached under
   * the target identifier is evicted. A handle that was not cached stays out of the cache.
   *
   * @param keychain the keychain
   * @param target   the target
   * @return the new identifier
   */
  public StoreIdentifier rename(final Keychain keychain, final StoreIdentifier target) {
    apiLock.lock();
    try {
      StoreIdentifier oldId = keychain.identifier();
      keychain.renameBacking(target);
      boolean wasCached = keychain.cacheState() == CacheState.CACHED;
      if (keychains.get(oldId) == keychain) {
        keychains.remove(oldId);
      }
      Keychain displaced = keychains.get(target);
      if (displaced != null && displaced != keychain) {
        keychains.remove(target);
        displaced.cacheState(CacheState.EVICTED);
      }
      if (wasCached) {
        keychains.put(target, keychain);
      }
      log.debug("rename({} -> {})", oldId, target);
      return target;
    } finally {
      apiLock.unlock();
    }
  }

  public int size() {
    apiLock.lock();
    try {
      return keychains.size();
    } finally {
      apiLock.unlock();
    }
  }

  /**
   * Evicts every handle. Used at shutdown.
   */
  public void clear() {
    apiLock.lock();
    try {
      keychains.values().forEach(k -> k.cacheState(CacheState.EVICTED));
      keychains.clear();
    } finally {
      apiLock.unlock();
    }
  }
}
