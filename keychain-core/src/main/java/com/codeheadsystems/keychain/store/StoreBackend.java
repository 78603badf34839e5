package com.codeheadsystems.keychain.store;

import com.codeheadsystems.keychain.model.StoreIdentifier;

/**
 * Provider-side factory for store handles.
 */
public interface StoreBackend {

  /**
   * Opens a handle. The backing store need not exist.
   *
   * @param identifier the identifier
   * @return the store
   * @throws com.codeheadsystems.keychain.exceptions.KeychainException BACKEND_UNAVAILABLE when the
   *                                                                   provider cannot serve it
   */
  Store open(StoreIdentifier identifier);
}
