package com.codeheadsystems.keychain.store;

import com.codeheadsystems.keychain.model.ItemQuery;
import com.codeheadsystems.keychain.model.KeychainItem;
import com.codeheadsystems.keychain.model.StoreIdentifier;
import java.util.Optional;

/**
 * One credential store as provided by a {@link StoreBackend}. A handle may exist for a store that
 * has not been created yet; {@link #exists()} tells the two apart.
 * <p>
 * All failures are reported as {@link com.codeheadsystems.keychain.exceptions.KeychainException}:
 * STORE_DOES_NOT_EXIST when the backing store is missing, AUTH_FAILURE for a wrong secret and
 * BACKEND_UNAVAILABLE when the provider cannot be reached.
 */
public interface Store {

  /**
   * Current identifier. Changes after {@link #rename(StoreIdentifier)}.
   *
   * @return the store identifier
   */
  StoreIdentifier identifier();

  boolean exists();

  /**
   * Unlocks the store with its secret.
   *
   * @param secret the secret
   */
  void unlock(byte[] secret);

  void lock();

  /**
   * Creates the backing store, protected by the secret.
   *
   * @param secret the secret
   */
  void create(byte[] secret);

  void changePassphrase(byte[] oldSecret, byte[] newSecret);

  /**
   * Moves the backing store. Any store already at the target is replaced.
   *
   * @param target the target identifier
   */
  void rename(StoreIdentifier target);

  void delete();

  /**
   * Opens a cursor over matching items.
   *
   * @param query the query
   * @return the item cursor
   */
  ItemCursor query(ItemQuery query);

  Optional<KeychainItem> find(String recordId);

  /**
   * Adds a new item. The store assigns the record id.
   *
   * @param item the item
   * @return the stored item, with its record id
   */
  KeychainItem add(KeychainItem item);

  /**
   * Replaces the item with the same record id.
   *
   * @param item the item
   */
  void update(KeychainItem item);
}
