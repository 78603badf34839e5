package com.codeheadsystems.keychain.store;

import com.codeheadsystems.keychain.model.KeychainItem;
import java.util.Optional;

/**
 * Forward-only iteration over the items of one store that match a query.
 */
@FunctionalInterface
public interface ItemCursor {

  /**
   * Next matching item.
   *
   * @return the item, or empty when the store is exhausted
   * @throws com.codeheadsystems.keychain.exceptions.KeychainException if the store cannot be read
   */
  Optional<KeychainItem> next();
}
