package com.codeheadsystems.keychain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one credential store: the provider module that serves it, the provider version and
 * the store name (normally a file path).
 * <p>
 * Equality is structural. The name is normalized on construction so that {@code /a/./b.keychain}
 * and {@code /a//b.keychain} identify the same store.
 *
 * @param provider provider module reference
 * @param version  provider version
 * @param name     store name or path
 */
public record StoreIdentifier(
    @JsonProperty("provider") String provider,
    @JsonProperty("version") int version,
    @JsonProperty("name") String name) implements Comparable<StoreIdentifier> {

  /**
   * Provider used when none is given.
   */
  public static final String DEFAULT_PROVIDER = "cspdl";

  private static final Comparator<StoreIdentifier> ORDER = Comparator
      .comparing(StoreIdentifier::provider)
      .thenComparingInt(StoreIdentifier::version)
      .thenComparing(StoreIdentifier::name);

  public StoreIdentifier {
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Store name must not be blank");
    }
    name = normalize(name);
  }

  /**
   * Identifier for a store served by the default provider.
   *
   * @param name the store name or path
   * @return the store identifier
   */
  public static StoreIdentifier of(final String name) {
    return new StoreIdentifier(DEFAULT_PROVIDER, 0, name);
  }

  /**
   * Same provider and version, different name. Used after a rename.
   *
   * @param newName the new name
   * @return the store identifier
   */
  public StoreIdentifier withName(final String newName) {
    return new StoreIdentifier(provider, version, newName);
  }

  /**
   * The last path segment of the name, e.g. {@code login.keychain}.
   *
   * @return the file name
   */
  public String fileName() {
    Path fileName = Path.of(name).getFileName();
    return fileName == null ? name : fileName.toString();
  }

  /**
   * Identifier of a store with the given file name in the same directory as this one.
   *
   * @param fileName the sibling's file name
   * @return the store identifier
   */
  public StoreIdentifier sibling(final String fileName) {
    Path parent = Path.of(name).getParent();
    return withName(parent == null ? fileName : parent.resolve(fileName).toString());
  }

  @Override
  public int compareTo(final StoreIdentifier other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return provider + ":" + version + ":" + name;
  }

  private static String normalize(String name) {
    return Path.of(name).normalize().toString();
  }
}
