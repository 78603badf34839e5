package com.codeheadsystems.keychain.notify;

import com.codeheadsystems.keychain.model.KeychainEvent;

/**
 * Receives events from a {@link ListenerChangeNotifier}.
 */
@FunctionalInterface
public interface KeychainEventListener {

  void onEvent(KeychainEvent event);
}
