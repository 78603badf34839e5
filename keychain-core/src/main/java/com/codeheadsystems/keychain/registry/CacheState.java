package com.codeheadsystems.keychain.registry;

/**
 * Where a {@link Keychain} handle stands relative to the registry cache.
 */
public enum CacheState {
  /** Opened but never inserted. */
  UNCACHED,
  /** Currently the cached handle for its identifier. */
  CACHED,
  /** Removed from the cache; never reinserted. */
  EVICTED
}
