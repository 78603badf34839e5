package com.codeheadsystems.keychain.manager;

import com.codeheadsystems.keychain.config.KeychainConfiguration;
import com.codeheadsystems.keychain.cursor.FoundItem;
import com.codeheadsystems.keychain.cursor.MultiStoreCursor;
import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.keystore.KeyStoreAccessor;
import com.codeheadsystems.keychain.model.AttributeValue;
import com.codeheadsystems.keychain.model.BatchResult;
import com.codeheadsystems.keychain.model.Certificate;
import com.codeheadsystems.keychain.model.Identity;
import com.codeheadsystems.keychain.model.ItemAttribute;
import com.codeheadsystems.keychain.model.ItemResult;
import com.codeheadsystems.keychain.model.KeychainItem;
import com.codeheadsystems.keychain.model.PreferenceRecord;
import com.codeheadsystems.keychain.naming.CandidateNames;
import com.codeheadsystems.keychain.registry.Keychain;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps names (URLs, email addresses, host names) to preferred identities.
 * <p>
 * A preference is a GENERIC_PASSWORD item whose SERVICE is the name and whose GENERIC attribute
 * is a persistent reference to the certificate. Lookups try the name's candidates from most to
 * least specific, so a preference stored for {@code https://example.com} also answers for
 * {@code https://example.com/path?x=1}.
 */
@Singleton
public class IdentityPreferenceManager {

  /**
   * Longest service or label, in UTF-8 bytes, a preference item may carry.
   */
  public static final int MAX_ATTRIBUTE_LENGTH = 1022;

  private static final Logger log = LoggerFactory.getLogger(IdentityPreferenceManager.class);

  private final KeychainConfiguration configuration;
  private final SearchListManager searchListManager;
  private final LoginKeychainManager loginKeychainManager;
  private final KeyStoreAccessor keyStore;

  /**
   * Instantiates a new Identity preference manager.
   *
   * @param configuration        the configuration
   * @param searchListManager    the search list manager
   * @param loginKeychainManager the login keychain manager
   * @param keyStore             the key store
   */
  @Inject
  public IdentityPreferenceManager(final KeychainConfiguration configuration,
                                   final SearchListManager searchListManager,
                                   final LoginKeychainManager loginKeychainManager,
                                   final KeyStoreAccessor keyStore) {
    log.info("IdentityPreferenceManager()");
    this.configuration = configuration;
    this.searchListManager = searchListManager;
    this.loginKeychainManager = loginKeychainManager;
    this.keyStore = keyStore;
  }

  /**
   * Finds the preferred identity for a name. Each candidate is tried in order; a candidate whose
   * preference is missing, stale, or names a certificate from an issuer outside
   * {@code validIssuers} is skipped.
   *
   * @param name         the name
   * @param keyUsage     the key usage, 0 for any
   * @param validIssuers acceptable issuers; null or empty accepts any
   * @return the identity
   * @throws KeychainException NOT_FOUND if no candidate yields an identity
   */
  public Identity lookup(final String name, final int keyUsage, final Collection<String> validIssuers) {
    if (name == null) {
      throw new KeychainException(ErrorKind.INVALID_PARAMETER, "A name is required");
    }
    List<Keychain> searchList = searchListManager.effectiveSearchList();
    for (String candidate : CandidateNames.of(name)) {
      try {
        Identity identity = lookupExact(candidate, keyUsage, validIssuers, searchList);
        if (configuration.logPreferenceLookups()) {
          log.info("lookup complete; will use: \"{}\" for \"{}\"", identity.certificate().label(), name);
        }
        return identity;
      } catch (KeychainException e) {
        log.debug("No usable preference for \"{}\": {}", candidate, e.getMessage());
      }
    }
    throw new KeychainException(ErrorKind.NOT_FOUND, "No identity preference for " + name);
  }

  /**
   * Stores or updates the preference for exactly this name. An existing preference anywhere in
   * the search list is updated in place; otherwise a new one goes to the default store.
   *
   * @param name     the name
   * @param identity the identity
   * @param keyUsage the key usage, 0 for any
   */
  public void set(final String name, final Identity identity, final int keyUsage) {
    if (name == null || identity == null) {
      throw new KeychainException(ErrorKind.INVALID_PARAMETER, "A name and an identity are required");
    }
    PreferenceRecord record = recordFor(name, identity, keyUsage);
    List<Keychain> searchList = searchListManager.effectiveSearchList();
    Optional<FoundItem> existing = MultiStoreCursor.findFirst(searchList, PreferenceRecord.query(name, keyUsage));
    if (existing.isPresent()) {
      existing.get().keychain().update(record.applyTo(existing.get().item()));
      log.debug("set({}): updated in {}", name, existing.get().keychain().identifier());
      return;
    }
    KeychainItem item = record.applyTo(null);
    Keychain target = loginKeychainManager.defaultKeychainInteractive(item);
    target.add(item);
    log.debug("set({}): added to {}", name, target.identifier());
  }

  /**
   * Finds a preference item by exact name.
   *
   * @param keychains where to look; null or empty means the effective search list
   * @param name      the name, or null for any preference
   * @return the found item
   * @throws KeychainException NOT_FOUND if there is none
   */
  public FoundItem findPreferenceItem(final List<Keychain> keychains, final String name) {
    return MultiStoreCursor.findFirst(searchListManager.optionalSearchList(keychains), PreferenceRecord.query(name, 0))
        .orElseThrow(() -> new KeychainException(ErrorKind.NOT_FOUND, "No identity preference for " + name));
  }

  /**
   * Points an existing preference item at another identity.
   *
   * @param found    the preference item
   * @param identity the identity
   */
  public void updatePreferenceItem(final FoundItem found, final Identity identity) {
    Certificate certificate = identity.certificate();
    String label = checkLength(certificate.label(), "label");
    byte[] reference = keyStore.persistentReference(certificate);
    KeychainItem item = found.item()
        .withAttribute(ItemAttribute.ACCOUNT, AttributeValue.of(label))
        .withAttribute(ItemAttribute.GENERIC, AttributeValue.of(reference));
    found.keychain().update(item);
  }

  /**
   * The identity a preference item refers to.
   *
   * @param found the preference item
   * @return the identity
   */
  public Identity identityFromPreferenceItem(final FoundItem found) {
    PreferenceRecord record = preferenceRecord(found);
    Certificate certificate = keyStore.certificateFromPersistentReference(record.certificateReference());
    return keyStore.identityFor(certificate, searchListManager.effectiveSearchList());
  }

  /**
   * Creates preference items for a name: one for the most specific candidate and, when the name
   * has more than one candidate, one for the least specific. Each write is independent.
   *
   * @param keychain where to write; if null or missing, the default store is used
   * @param identity the identity
   * @param name     the name
   * @return one result per written candidate, most specific first
   * @throws KeychainException INVALID_PARAMETER if the name or identity is missing
   */
  public BatchResult<KeychainItem> addPreferenceItems(final Keychain keychain, final Identity identity,
                                                      final String name) {
    if (name == null || identity == null) {
      throw new KeychainException(ErrorKind.INVALID_PARAMETER, "A name and an identity are required");
    }
    List<String> candidates = CandidateNames.of(name);
    List<String> targets = candidates.size() > 1
        ? List.of(candidates.get(0), candidates.get(candidates.size() - 1))
        : List.of(candidates.get(0));
    List<ItemResult<KeychainItem>> results = new ArrayList<>();
    for (String target : targets) {
      try {
        results.add(ItemResult.success(target, addPreferenceItem(keychain, identity, target)));
      } catch (KeychainException e) {
        log.warn("Unable to add identity preference for \"{}\": {}", target, e.getMessage());
        results.add(ItemResult.failure(target, e));
      }
    }
    return new BatchResult<>(results);
  }

  /**
   * Creates preference items as {@link #addPreferenceItems} does and reports the most specific
   * write.
   *
   * @param keychain the keychain
   * @param identity the identity
   * @param name     the name
   * @return the item written for the most specific candidate
   * @throws KeychainException that write's failure, or INVALID_PARAMETER if the name or identity
   *                           is missing
   */
  public KeychainItem addPreference(final Keychain keychain, final Identity identity, final String name) {
    ItemResult<KeychainItem> first = addPreferenceItems(keychain, identity, name).results().get(0);
    if (!first.succeeded()) {
      throw first.failure();
    }
    return first.value();
  }

  // ── Internals ───────────────────────────────────────────────────────────

  private Identity lookupExact(final String candidate, final int keyUsage, final Collection<String> validIssuers,
                               final List<Keychain> searchList) {
    FoundItem found = MultiStoreCursor.findFirst(searchList, PreferenceRecord.query(candidate, keyUsage))
        .orElseThrow(() -> new KeychainException(ErrorKind.NOT_FOUND, "No preference item for " + candidate));
    PreferenceRecord record = preferenceRecord(found);
    Certificate certificate = keyStore.certificateFromPersistentReference(record.certificateReference());
    if (validIssuers != null && !validIssuers.isEmpty()
        && (certificate.issuer() == null || !validIssuers.contains(certificate.issuer()))) {
      throw new KeychainException(ErrorKind.NOT_FOUND, "Issuer not accepted: " + certificate.issuer());
    }
    Identity identity = keyStore.identityFor(certificate, searchList);
    if (configuration.logPreferenceLookups()) {
      log.info("preferred identity: \"{}\" found for \"{}\"", certificate.label(), candidate);
    }
    return identity;
  }

  private KeychainItem addPreferenceItem(final Keychain keychain, final Identity identity, final String name) {
    KeychainItem item = recordFor(name, identity, 0).applyTo(null);
    Keychain target = keychain != null && keychain.exists()
        ? keychain
        : loginKeychainManager.defaultKeychainInteractive(item);
    return target.add(item);
  }

  private PreferenceRecord recordFor(final String name, final Identity identity, final int keyUsage) {
    String service = checkLength(name, "service");
    Certificate certificate = identity.certificate();
    String label = checkLength(certificate.label(), "label");
    return new PreferenceRecord(service, keyUsage, label, keyStore.persistentReference(certificate));
  }

  private static PreferenceRecord preferenceRecord(final FoundItem found) {
    try {
      return PreferenceRecord.fromItem(found.item());
    } catch (IllegalArgumentException e) {
      throw new KeychainException(ErrorKind.INVALID_ITEM_REF, e.getMessage(), e);
    }
  }

  private static String checkLength(final String value, final String what) {
    if (value == null || value.getBytes(StandardCharsets.UTF_8).length > MAX_ATTRIBUTE_LENGTH) {
      throw new KeychainException(ErrorKind.DATA_TOO_LARGE, "Missing or oversized " + what);
    }
    return value;
  }
}
