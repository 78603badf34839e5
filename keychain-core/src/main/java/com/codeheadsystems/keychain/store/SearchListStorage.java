package com.codeheadsystems.keychain.store;

import com.codeheadsystems.keychain.model.Domain;
import com.codeheadsystems.keychain.model.SearchListState;

/**
 * Durable home of the per-domain search-list records. Other processes may write the same records,
 * so readers compare {@link #version(Domain)} against the version they loaded to notice changes.
 * <p>
 * Only persisted domains ({@link Domain#isPersisted()}) are accepted.
 */
public interface SearchListStorage {

  /**
   * A loaded record and the version it was read at.
   *
   * @param state   the state
   * @param version the version
   */
  record Snapshot(SearchListState state, long version) {
  }

  /**
   * Reads the record. An absent record reads as {@link SearchListState#empty()}.
   *
   * @param domain the domain
   * @return the snapshot
   */
  Snapshot load(Domain domain);

  /**
   * Cheap staleness check.
   *
   * @param domain the domain
   * @return the current version
   */
  long version(Domain domain);

  /**
   * Replaces the record.
   *
   * @param domain the domain
   * @param state  the state
   * @return the version after the write
   */
  long save(Domain domain, SearchListState state);
}
