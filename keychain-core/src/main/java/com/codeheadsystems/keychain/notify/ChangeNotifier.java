package com.codeheadsystems.keychain.notify;

import com.codeheadsystems.keychain.model.KeychainEvent;

/**
 * Fire-and-forget sink for search-list and default-store changes. Managers post only after
 * releasing the API lock.
 */
@FunctionalInterface
public interface ChangeNotifier {

  void post(KeychainEvent event);
}
