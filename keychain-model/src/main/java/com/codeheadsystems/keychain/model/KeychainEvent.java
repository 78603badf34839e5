package com.codeheadsystems.keychain.model;

import java.util.Objects;

/**
 * A change notification.
 *
 * @param type     what changed
 * @param keychain the store concerned, or null when not applicable (e.g. the default was cleared)
 */
public record KeychainEvent(KeychainEventType type, StoreIdentifier keychain) {

  public KeychainEvent {
    Objects.requireNonNull(type, "type");
  }

  /**
   * Search list changed keychain event.
   *
   * @return the keychain event
   */
  public static KeychainEvent searchListChanged() {
    return new KeychainEvent(KeychainEventType.SEARCH_LIST_CHANGED, null);
  }

  /**
   * Default changed keychain event.
   *
   * @param newDefault the new default, or null if it was cleared
   * @return the keychain event
   */
  public static KeychainEvent defaultChanged(final StoreIdentifier newDefault) {
    return new KeychainEvent(KeychainEventType.DEFAULT_CHANGED, newDefault);
  }
}
