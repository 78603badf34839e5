package com.codeheadsystems.keychain.model;

/**
 * Persistence scope for search-list configuration.
 * <p>
 * {@link #DYNAMIC} is supplied at runtime and never persisted; it can be read but not mutated
 * through the search-list manager.
 */
public enum Domain {
  USER,
  SYSTEM,
  COMMON,
  DYNAMIC;

  /**
   * Whether this domain has a persisted search-list record.
   *
   * @return true unless this is {@link #DYNAMIC}
   */
  public boolean isPersisted() {
    return this != DYNAMIC;
  }
}
