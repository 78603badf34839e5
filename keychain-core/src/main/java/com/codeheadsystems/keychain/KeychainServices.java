package com.codeheadsystems.keychain;

import com.codeheadsystems.keychain.config.KeychainConfiguration;
import com.codeheadsystems.keychain.interaction.LoginPrompt;
import com.codeheadsystems.keychain.keystore.KeychainKeyStore;
import com.codeheadsystems.keychain.keystore.PersistentReferences;
import com.codeheadsystems.keychain.manager.IdentityPreferenceManager;
import com.codeheadsystems.keychain.manager.LoginKeychainManager;
import com.codeheadsystems.keychain.manager.SearchListManager;
import com.codeheadsystems.keychain.manager.SystemIdentityManager;
import com.codeheadsystems.keychain.notify.ChangeNotifier;
import com.codeheadsystems.keychain.registry.KeychainRegistry;
import com.codeheadsystems.keychain.store.JsonSearchListStorage;
import com.codeheadsystems.keychain.store.JsonSystemPreferenceStore;
import com.codeheadsystems.keychain.store.SearchListStorage;
import com.codeheadsystems.keychain.store.StoreBackend;
import com.codeheadsystems.keychain.store.SystemPreferenceStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hand wiring of the search layer for callers without a DI container. Create one per process
 * with {@link #start} and {@link #close()} it at shutdown.
 */
public final class KeychainServices implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(KeychainServices.class);

  private final KeychainRegistry registry;
  private final KeychainKeyStore keyStore;
  private final SearchListManager searchListManager;
  private final LoginKeychainManager loginKeychainManager;
  private final IdentityPreferenceManager identityPreferenceManager;
  private final SystemIdentityManager systemIdentityManager;

  private KeychainServices(final KeychainConfiguration configuration,
                           final StoreBackend backend,
                           final SearchListStorage searchListStorage,
                           final SystemPreferenceStore systemPreferenceStore,
                           final ChangeNotifier notifier,
                           final LoginPrompt loginPrompt,
                           final ObjectMapper objectMapper) {
    this.registry = new KeychainRegistry(backend);
    this.keyStore = new KeychainKeyStore(registry, new PersistentReferences(objectMapper));
    this.searchListManager = new SearchListManager(configuration, registry, searchListStorage, notifier);
    this.loginKeychainManager = new LoginKeychainManager(configuration, searchListManager, registry, loginPrompt);
    this.identityPreferenceManager =
        new IdentityPreferenceManager(configuration, searchListManager, loginKeychainManager, keyStore);
    this.systemIdentityManager = new SystemIdentityManager(configuration, registry, systemPreferenceStore, keyStore);
  }

  /**
   * Wires the services over the given collaborators.
   *
   * @param configuration         the configuration
   * @param backend               the backend
   * @param searchListStorage     the search list storage
   * @param systemPreferenceStore the system preference store
   * @param notifier              the notifier
   * @param loginPrompt           the login prompt
   * @return the keychain services
   */
  public static KeychainServices start(final KeychainConfiguration configuration,
                                       final StoreBackend backend,
                                       final SearchListStorage searchListStorage,
                                       final SystemPreferenceStore systemPreferenceStore,
                                       final ChangeNotifier notifier,
                                       final LoginPrompt loginPrompt) {
    log.info("start(user={}, domain={})", configuration.userName(), configuration.initialDomain());
    return new KeychainServices(configuration, backend, searchListStorage, systemPreferenceStore, notifier,
        loginPrompt, new ObjectMapper());
  }

  /**
   * Wires the services with JSON persistence under the configured preferences directory.
   *
   * @param configuration the configuration
   * @param backend       the backend
   * @param notifier      the notifier
   * @param loginPrompt   the login prompt
   * @return the keychain services
   */
  public static KeychainServices startWithJsonStorage(final KeychainConfiguration configuration,
                                                      final StoreBackend backend,
                                                      final ChangeNotifier notifier,
                                                      final LoginPrompt loginPrompt) {
    ObjectMapper objectMapper = new ObjectMapper();
    Path preferences = Path.of(configuration.preferencesDirectory());
    log.info("startWithJsonStorage({})", preferences);
    return new KeychainServices(configuration, backend,
        new JsonSearchListStorage(preferences, objectMapper),
        new JsonSystemPreferenceStore(preferences, objectMapper),
        notifier, loginPrompt, objectMapper);
  }

  public KeychainRegistry registry() {
    return registry;
  }

  public KeychainKeyStore keyStore() {
    return keyStore;
  }

  public SearchListManager searchListManager() {
    return searchListManager;
  }

  public LoginKeychainManager loginKeychainManager() {
    return loginKeychainManager;
  }

  public IdentityPreferenceManager identityPreferenceManager() {
    return identityPreferenceManager;
  }

  public SystemIdentityManager systemIdentityManager() {
    return systemIdentityManager;
  }

  @Override
  public void close() {
    log.info("close(): evicting {} keychains", registry.size());
    registry.clear();
  }
}
