package com.codeheadsystems.keychain.model;

/**
 * Change notifications posted after search-list mutations.
 */
public enum KeychainEventType {
  SEARCH_LIST_CHANGED,
  DEFAULT_CHANGED
}
