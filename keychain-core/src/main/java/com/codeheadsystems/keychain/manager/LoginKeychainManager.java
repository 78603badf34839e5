package com.codeheadsystems.keychain.manager;

import com.codeheadsystems.keychain.config.KeychainConfiguration;
import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.interaction.LoginPrompt;
import com.codeheadsystems.keychain.interaction.LoginPromptHints;
import com.codeheadsystems.keychain.model.AttributeValue;
import com.codeheadsystems.keychain.model.ItemAttribute;
import com.codeheadsystems.keychain.model.KeychainItem;
import com.codeheadsystems.keychain.model.StoreIdentifier;
import com.codeheadsystems.keychain.registry.Keychain;
import com.codeheadsystems.keychain.registry.KeychainRegistry;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings up the login store at session start and recovers when no usable default store exists.
 */
@Singleton
public class LoginKeychainManager {

  private static final Logger log = LoggerFactory.getLogger(LoginKeychainManager.class);

  private final KeychainConfiguration configuration;
  private final SearchListManager searchListManager;
  private final KeychainRegistry registry;
  private final LoginPrompt loginPrompt;

  /**
   * Instantiates a new Login keychain manager.
   *
   * @param configuration     the configuration
   * @param searchListManager the search list manager
   * @param registry          the registry
   * @param loginPrompt       the login prompt
   */
  @Inject
  public LoginKeychainManager(final KeychainConfiguration configuration,
                              final SearchListManager searchListManager,
                              final KeychainRegistry registry,
                              final LoginPrompt loginPrompt) {
    log.info("LoginKeychainManager()");
    this.configuration = configuration;
    this.searchListManager = searchListManager;
    this.registry = registry;
    this.loginPrompt = loginPrompt;
  }

  /**
   * Unlocks the login store with the user's login secret.
   * <ol>
   *   <li>If the login store is missing but a store named after the user exists, that store is
   *   moved onto the login path and unlocked.</li>
   *   <li>If neither exists, a new login store is created and made the login and default store.</li>
   *   <li>Finally a remaining short-name store is added to the search list and unlocked. Failures
   *   in this step are logged and ignored.</li>
   * </ol>
   *
   * @param secret the login secret
   * @throws KeychainException if the login store cannot be unlocked, adopted or created
   */
  public void login(final byte[] secret) {
    if (secret == null) {
      throw new KeychainException(ErrorKind.INVALID_PARAMETER, "A login secret is required");
    }
    StoreIdentifier loginId = searchListManager.loginIdentifier();
    if (loginId == null) {
      throw new KeychainException(ErrorKind.NOT_FOUND, "No login keychain designated");
    }
    StoreIdentifier shortNameId = configuration.shortNameKeychainIdentifier();
    boolean shortNameExisted = !shortNameId.equals(loginId) && registry.exists(shortNameId);

    log.debug("login({})", loginId);
    Keychain login = registry.resolve(loginId);
    try {
      login.unlock(secret);
    } catch (KeychainException e) {
      if (!e.is(ErrorKind.STORE_DOES_NOT_EXIST)) {
        throw e;
      }
      if (shortNameExisted) {
        searchListManager.adopt(shortNameId, loginId).unlock(secret);
      } else {
        createLoginKeychain(login, secret);
      }
    }
    unlockShortNameKeychain(shortNameId, loginId, secret);
  }

  /**
   * Changes the login store's secret.
   *
   * @param oldSecret the old secret
   * @param newSecret the new secret
   */
  public void changeLoginPassword(final byte[] oldSecret, final byte[] newSecret) {
    Keychain login = searchListManager.loginKeychain();
    login.changePassphrase(oldSecret, newSecret);
    log.info("Changed password of {}", login.identifier());
  }

  /**
   * Moves the login store aside as {@code <name>_renamed<n>.keychain}, optionally clearing the
   * saved list first. Failures are logged; there may simply be nothing to reset.
   *
   * @param resetSearchList whether to clear the saved list
   */
  public void resetLoginKeychain(final boolean resetSearchList) {
    try {
      if (resetSearchList) {
        searchListManager.setSearchList(List.of());
      }
      Keychain login = searchListManager.loginKeychain();
      StoreIdentifier loginId = login.identifier();
      String name = loginId.name();
      if (name.endsWith(KeychainConfiguration.KEYCHAIN_SUFFIX)) {
        name = name.substring(0, name.length() - KeychainConfiguration.KEYCHAIN_SUFFIX.length());
      }
      StoreIdentifier renamed = searchListManager.renameUnique(login, name + "_renamed");
      // the login path stays designated so the next login creates a fresh store there
      searchListManager.designateLogin(loginId);
      log.info("Reset login keychain, old one moved to {}", renamed);
    } catch (KeychainException e) {
      log.info("Login keychain not reset: {}", e.getMessage());
    }
  }

  /**
   * The default store, or if it is unusable and interaction is allowed, a login store made after
   * prompting the user.
   *
   * @param item the item about to be stored, used for the prompt; may be null
   * @return the keychain
   * @throws KeychainException INTERACTION_NOT_ALLOWED when a prompt would be needed but is not
   *                           allowed, AUTH_FAILURE if the user cancels
   */
  public Keychain defaultKeychainInteractive(final KeychainItem item) {
    try {
      return searchListManager.defaultKeychain();
    } catch (KeychainException e) {
      log.debug("No usable default keychain: {}", e.getMessage());
    }
    if (!configuration.interactionAllowed()) {
      throw new KeychainException(ErrorKind.INTERACTION_NOT_ALLOWED, "No default keychain and user interaction is disabled");
    }
    return makeLoginInteractively(item);
  }

  private Keychain makeLoginInteractively(final KeychainItem item) {
    Optional<StoreIdentifier> designated = searchListManager.defaultIdentifier();
    String defaultName = designated.map(StoreIdentifier::fileName).orElse(null);
    boolean defaultUnavailable = designated.isPresent() && !registry.exists(designated.get());
    LoginPromptHints hints = new LoginPromptHints(
        item == null ? null : item.attribute(ItemAttribute.ACCOUNT).map(AttributeValue::asString).orElse(null),
        defaultName,
        defaultUnavailable,
        configuration.userName(),
        item != null && searchListManager.size() > 1,
        item == null);
    byte[] secret = loginPrompt.requestLoginSecret(hints)
        .orElseThrow(() -> new KeychainException(ErrorKind.AUTH_FAILURE, "Login keychain creation was cancelled"));
    resetLoginKeychain(true);
    login(secret);
    Keychain login = searchListManager.loginKeychain();
    searchListManager.setDefaultKeychain(login);
    return login;
  }

  private void createLoginKeychain(final Keychain login, final byte[] secret) {
    login.create(secret);
    searchListManager.registerCreated(login);
    searchListManager.setLoginKeychain(login);
    searchListManager.setDefaultKeychain(login);
    log.info("Created login keychain {}", login.identifier());
  }

  private void unlockShortNameKeychain(final StoreIdentifier shortNameId, final StoreIdentifier loginId,
                                       final byte[] secret) {
    if (shortNameId.equals(loginId)) {
      return;
    }
    try {
      if (!registry.exists(shortNameId)) {
        return;
      }
      searchListManager.addStore(shortNameId, false).unlock(secret);
      log.debug("Unlocked legacy keychain {}", shortNameId);
    } catch (KeychainException e) {
      log.info("Legacy keychain {} not unlocked: {}", shortNameId, e.getMessage());
    }
  }
}
