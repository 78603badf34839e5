package com.codeheadsystems.keychain.registry;

import com.codeheadsystems.keychain.model.ItemQuery;
import com.codeheadsystems.keychain.model.KeychainItem;
import com.codeheadsystems.keychain.model.StoreIdentifier;
import com.codeheadsystems.keychain.store.ItemCursor;
import com.codeheadsystems.keychain.store.Store;
import java.util.Optional;

/**
 * Shared handle onto one store. Obtain handles from {@link KeychainRegistry#resolve} so that
 * equal identifiers share a handle; two handles are the same keychain only if they are the same
 * object.
 * <p>
 * Renames go through the registry so the cache follows the new identifier.
 */
public final class Keychain {

  private final Store store;
  private volatile CacheState cacheState = CacheState.UNCACHED;

  Keychain(final Store store) {
    this.store = store;
  }

  public StoreIdentifier identifier() {
    return store.identifier();
  }

  /**
   * Display name, the last segment of the store path.
   *
   * @return the name
   */
  public String name() {
    return store.identifier().fileName();
  }

  public boolean exists() {
    return store.exists();
  }

  public void unlock(final byte[] secret) {
    store.unlock(secret);
  }

  public void lock() {
    store.lock();
  }

  public void create(final byte[] secret) {
    store.create(secret);
  }

  public void changePassphrase(final byte[] oldSecret, final byte[] newSecret) {
    store.changePassphrase(oldSecret, newSecret);
  }

  /**
   * Deletes the backing store. The handle stays usable for {@link #exists()}.
   */
  public void delete() {
    store.delete();
  }

  public ItemCursor query(final ItemQuery query) {
    return store.query(query);
  }

  public Optional<KeychainItem> find(final String recordId) {
    return store.find(recordId);
  }

  public KeychainItem add(final KeychainItem item) {
    return store.add(item);
  }

  public void update(final KeychainItem item) {
    store.update(item);
  }

  public CacheState cacheState() {
    return cacheState;
  }

  void cacheState(final CacheState state) {
    this.cacheState = state;
  }

  void renameBacking(final StoreIdentifier target) {
    store.rename(target);
  }

  @Override
  public String toString() {
    return "Keychain[" + identifier() + ", " + cacheState + "]";
  }
}
