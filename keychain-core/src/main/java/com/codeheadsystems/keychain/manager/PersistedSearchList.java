package com.codeheadsystems.keychain.manager;

import com.codeheadsystems.keychain.model.Domain;
import com.codeheadsystems.keychain.model.SearchListState;
import com.codeheadsystems.keychain.store.SearchListStorage;
import java.util.function.UnaryOperator;

/**
 * In-memory copy of one domain's persisted search-list record. Not thread safe; callers hold the
 * API lock.
 */
class PersistedSearchList {

  private static final long NOT_LOADED = -1L;

  private final SearchListStorage storage;
  private Domain domain;
  private SearchListState state = SearchListState.empty();
  private SearchListState loaded = SearchListState.empty();
  private long version = NOT_LOADED;

  PersistedSearchList(final SearchListStorage storage, final Domain domain) {
    this.storage = storage;
    this.domain = domain;
  }

  Domain domain() {
    return domain;
  }

  /**
   * Switches to another domain's record. The next read loads it.
   */
  void domain(final Domain newDomain) {
    this.domain = newDomain;
    this.state = SearchListState.empty();
    this.loaded = state;
    this.version = NOT_LOADED;
  }

  /**
   * Reloads from storage when forced, never loaded, or changed by someone else. Local changes
   * that were not saved are discarded.
   */
  void revert(final boolean force) {
    if (force || version == NOT_LOADED || storage.version(domain) != version) {
      SearchListStorage.Snapshot snapshot = storage.load(domain);
      state = snapshot.state();
      loaded = state;
      version = snapshot.version();
    }
  }

  SearchListState state() {
    if (version == NOT_LOADED) {
      revert(false);
    }
    return state;
  }

  void update(final UnaryOperator<SearchListState> change) {
    state = change.apply(state());
  }

  /**
   * Writes the record if it differs from what was loaded.
   *
   * @return true if anything was written
   */
  boolean save() {
    if (state.equals(loaded)) {
      return false;
    }
    version = storage.save(domain, state);
    loaded = state;
    return true;
  }
}
