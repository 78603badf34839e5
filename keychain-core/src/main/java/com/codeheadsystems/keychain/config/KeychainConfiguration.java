package com.codeheadsystems.keychain.config;

import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.codeheadsystems.keychain.model.Domain;
import com.codeheadsystems.keychain.model.StoreIdentifier;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Process-wide settings for the search layer. Directories are kept as strings so the record reads
 * and writes as plain JSON.
 *
 * @param userName               the account short name, used for the legacy short-name store
 * @param userKeychainDirectory  where user stores live
 * @param systemKeychainDirectory where system stores live
 * @param preferencesDirectory   where search lists and system identity preferences are persisted
 * @param loginKeychainName      file name of the login store
 * @param systemKeychainName     file name of the system store
 * @param privileged             whether the process may change system-wide settings
 * @param interactionAllowed     whether the login prompt may be shown
 * @param logPreferenceLookups   whether identity preference lookups are logged at info level
 * @param provider               provider used for stores created from a path
 */
public record KeychainConfiguration(
    @JsonProperty("userName") String userName,
    @JsonProperty("userKeychainDirectory") String userKeychainDirectory,
    @JsonProperty("systemKeychainDirectory") String systemKeychainDirectory,
    @JsonProperty("preferencesDirectory") String preferencesDirectory,
    @JsonProperty("loginKeychainName") String loginKeychainName,
    @JsonProperty("systemKeychainName") String systemKeychainName,
    @JsonProperty("privileged") boolean privileged,
    @JsonProperty("interactionAllowed") boolean interactionAllowed,
    @JsonProperty("logPreferenceLookups") boolean logPreferenceLookups,
    @JsonProperty("provider") String provider) {

  public static final String DEFAULT_LOGIN_KEYCHAIN_NAME = "login.keychain";
  public static final String DEFAULT_SYSTEM_KEYCHAIN_NAME = "System.keychain";
  public static final String KEYCHAIN_SUFFIX = ".keychain";

  public KeychainConfiguration {
    Objects.requireNonNull(userName, "userName");
    Objects.requireNonNull(userKeychainDirectory, "userKeychainDirectory");
    Objects.requireNonNull(systemKeychainDirectory, "systemKeychainDirectory");
    Objects.requireNonNull(preferencesDirectory, "preferencesDirectory");
    if (loginKeychainName == null) {
      loginKeychainName = DEFAULT_LOGIN_KEYCHAIN_NAME;
    }
    if (systemKeychainName == null) {
      systemKeychainName = DEFAULT_SYSTEM_KEYCHAIN_NAME;
    }
    if (provider == null) {
      provider = StoreIdentifier.DEFAULT_PROVIDER;
    }
  }

  /**
   * Settings for an ordinary user session rooted at the user's home directory.
   *
   * @param userName the user name
   * @param home     the home directory
   * @return the keychain configuration
   */
  public static KeychainConfiguration forUser(final String userName, final Path home) {
    return new KeychainConfiguration(
        userName,
        home.resolve("Library/Keychains").toString(),
        "/Library/Keychains",
        home.resolve("Library/Preferences").toString(),
        null, null, false, true, false, null);
  }

  /**
   * Settings for a privileged system daemon.
   *
   * @return the keychain configuration
   */
  public static KeychainConfiguration forSystem() {
    return new KeychainConfiguration(
        "root",
        "/var/root/Library/Keychains",
        "/Library/Keychains",
        "/Library/Preferences",
        null, null, true, false, false, null);
  }

  /**
   * Settings rooted in a scratch directory. Interaction is disabled and lookups are logged.
   *
   * @param root the root
   * @return the keychain configuration
   */
  public static KeychainConfiguration forTesting(final Path root) {
    return new KeychainConfiguration(
        "tester",
        root.resolve("user").toString(),
        root.resolve("system").toString(),
        root.resolve("preferences").toString(),
        null, null, false, false, true, null);
  }

  /**
   * Reads settings from a JSON file.
   *
   * @param file   the file
   * @param mapper the mapper
   * @return the keychain configuration
   */
  public static KeychainConfiguration load(final Path file, final ObjectMapper mapper) {
    try {
      return mapper.readValue(file.toFile(), KeychainConfiguration.class);
    } catch (IOException e) {
      throw new KeychainException(ErrorKind.IO_FAILURE, "Unable to read configuration " + file, e);
    }
  }

  /**
   * The domain a fresh search manager starts in.
   *
   * @return the domain
   */
  public Domain initialDomain() {
    return privileged ? Domain.SYSTEM : Domain.USER;
  }

  /**
   * Directory that relative store names are resolved against for the domain.
   *
   * @param domain the domain
   * @return the path
   */
  public Path keychainDirectory(final Domain domain) {
    return switch (domain) {
      case USER -> Path.of(userKeychainDirectory);
      case SYSTEM -> Path.of(systemKeychainDirectory);
      default -> throw new KeychainException(ErrorKind.INVALID_DOMAIN,
          "No keychain directory for domain " + domain);
    };
  }

  /**
   * Identifier for a store at the given path, served by the configured provider.
   *
   * @param path the path
   * @return the store identifier
   */
  public StoreIdentifier identifierFor(final Path path) {
    return new StoreIdentifier(provider, 0, path.toString());
  }

  public StoreIdentifier loginKeychainIdentifier() {
    return identifierFor(Path.of(userKeychainDirectory, loginKeychainName));
  }

  /**
   * The legacy store named after the user, e.g. {@code ~/Library/Keychains/alice.keychain}.
   *
   * @return the store identifier
   */
  public StoreIdentifier shortNameKeychainIdentifier() {
    return identifierFor(Path.of(userKeychainDirectory, userName + KEYCHAIN_SUFFIX));
  }

  public StoreIdentifier systemKeychainIdentifier() {
    return identifierFor(Path.of(systemKeychainDirectory, systemKeychainName));
  }
}
