package com.codeheadsystems.keychain.notify;

import com.codeheadsystems.keychain.model.KeychainEvent;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link ChangeNotifier} delivering each event to the registered listeners in
 * registration order. A failing listener is logged and the remaining listeners still run.
 */
@Singleton
public class ListenerChangeNotifier implements ChangeNotifier {

  private static final Logger log = LoggerFactory.getLogger(ListenerChangeNotifier.class);

  private final List<KeychainEventListener> listeners = new CopyOnWriteArrayList<>();

  public void addListener(final KeychainEventListener listener) {
    listeners.add(listener);
  }

  public void removeListener(final KeychainEventListener listener) {
    listeners.remove(listener);
  }

  @Override
  public void post(final KeychainEvent event) {
    log.debug("post({})", event);
    for (KeychainEventListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        log.warn("Listener failed for {}: {}", event.type(), e.getMessage(), e);
      }
    }
  }
}
