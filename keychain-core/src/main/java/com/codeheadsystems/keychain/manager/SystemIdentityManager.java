package com.codeheadsystems.keychain.manager;

import com.codeheadsystems.keychain.config.KeychainConfiguration;
import com.codeheadsystems.keychain.cursor.FoundItem;
import com.codeheadsystems.keychain.cursor.MultiStoreCursor;
import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.keystore.KeyStoreAccessor;
import com.codeheadsystems.keychain.model.AttributeValue;
import com.codeheadsystems.keychain.model.Certificate;
import com.codeheadsystems.keychain.model.Identity;
import com.codeheadsystems.keychain.model.ItemAttribute;
import com.codeheadsystems.keychain.model.ItemClass;
import com.codeheadsystems.keychain.model.ItemQuery;
import com.codeheadsystems.keychain.model.SystemIdentity;
import com.codeheadsystems.keychain.registry.Keychain;
import com.codeheadsystems.keychain.registry.KeychainRegistry;
import com.codeheadsystems.keychain.store.SystemPreferenceStore;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * System-wide identities keyed by a domain tag such as {@value #KERBEROS_KDC_DOMAIN}. The
 * preference holds the public-key hash of the identity's certificate, which lives in the system
 * store.
 */
@Singleton
public class SystemIdentityManager {

  public static final String PREFERENCE_DOMAIN = "keychain.systemidentities";
  public static final String DEFAULT_DOMAIN = "systemdefault";
  public static final String KERBEROS_KDC_DOMAIN = "kerberos.kdc";

  private static final Logger log = LoggerFactory.getLogger(SystemIdentityManager.class);

  private final KeychainConfiguration configuration;
  private final KeychainRegistry registry;
  private final SystemPreferenceStore preferenceStore;
  private final KeyStoreAccessor keyStore;
  private final ReentrantLock systemIdentityLock = new ReentrantLock();

  /**
   * Instantiates a new System identity manager.
   *
   * @param configuration   the configuration
   * @param registry        the registry
   * @param preferenceStore the preference store
   * @param keyStore        the key store
   */
  @Inject
  public SystemIdentityManager(final KeychainConfiguration configuration,
                               final KeychainRegistry registry,
                               final SystemPreferenceStore preferenceStore,
                               final KeyStoreAccessor keyStore) {
    log.info("SystemIdentityManager()");
    this.configuration = configuration;
    this.registry = registry;
    this.preferenceStore = preferenceStore;
    this.keyStore = keyStore;
  }

  /**
   * The identity for a domain, falling back to {@value #DEFAULT_DOMAIN}.
   *
   * @param domain the domain tag
   * @return the identity and the domain it was actually found under
   * @throws KeychainException NOT_FOUND if neither domain has a usable identity
   */
  public SystemIdentity copySystemIdentity(final String domain) {
    systemIdentityLock.lock();
    try {
      String actualDomain = domain;
      Optional<byte[]> hash = preferenceStore.getValue(PREFERENCE_DOMAIN, domain);
      if (hash.isEmpty() && !DEFAULT_DOMAIN.equals(domain)) {
        actualDomain = DEFAULT_DOMAIN;
        hash = preferenceStore.getValue(PREFERENCE_DOMAIN, DEFAULT_DOMAIN);
      }
      if (hash.isEmpty()) {
        throw new KeychainException(ErrorKind.NOT_FOUND, "No system identity for " + domain);
      }
      List<Keychain> system = List.of(registry.resolve(configuration.systemKeychainIdentifier()));
      ItemQuery query = ItemQuery.forClass(ItemClass.CERTIFICATE)
          .where(ItemAttribute.PUBLIC_KEY_HASH, AttributeValue.of(hash.get()));
      FoundItem found = MultiStoreCursor.findFirst(system, query)
          .orElseThrow(() -> new KeychainException(ErrorKind.NOT_FOUND,
              "System identity certificate missing for " + domain));
      Certificate certificate = keyStore.certificateFromItem(found);
      Identity identity = keyStore.identityFor(certificate, system);
      log.debug("copySystemIdentity({}): found under {}", domain, actualDomain);
      return new SystemIdentity(identity, actualDomain);
    } finally {
      systemIdentityLock.unlock();
    }
  }

  /**
   * Sets or, with a null identity, clears the identity for a domain.
   *
   * @param domain   the domain tag
   * @param identity the identity, or null
   * @throws KeychainException AUTH_FAILURE if the process is not privileged, IO_FAILURE if the
   *                           preference cannot be written
   */
  public void setSystemIdentity(final String domain, final Identity identity) {
    if (!configuration.privileged()) {
      throw new KeychainException(ErrorKind.AUTH_FAILURE, "Setting a system identity requires privileges");
    }
    systemIdentityLock.lock();
    try {
      if (identity == null) {
        preferenceStore.removeValue(PREFERENCE_DOMAIN, domain);
      } else {
        preferenceStore.setValue(PREFERENCE_DOMAIN, domain, identity.certificate().publicKeyHash());
      }
      preferenceStore.flush(PREFERENCE_DOMAIN);
      log.info("System identity for {} {}", domain, identity == null ? "cleared" : "set");
    } finally {
      systemIdentityLock.unlock();
    }
  }
}
