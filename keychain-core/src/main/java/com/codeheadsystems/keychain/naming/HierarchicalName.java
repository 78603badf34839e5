package com.codeheadsystems.keychain.naming;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A name of the form {@code scheme://authority/path?query#fragment}, split with the generic
 * URI regular expression from RFC 3986 appendix B.
 *
 * @param scheme    the scheme
 * @param authority the authority, never empty
 * @param path      the path, possibly empty
 * @param query     the query, or null
 * @param fragment  the fragment, or null
 */
public record HierarchicalName(
    String scheme,
    String authority,
    String path,
    String query,
    String fragment) {

  private static final Pattern URI_PATTERN =
      Pattern.compile("^(([^:/?#]+):)?(//([^/?#]*))?([^?#]*)(\\?([^#]*))?(#(.*))?");

  /**
   * Parses a name. Names without a scheme or with an empty authority are not hierarchical.
   *
   * @param name the name
   * @return the hierarchical name
   */
  public static Optional<HierarchicalName> parse(final String name) {
    Matcher matcher = URI_PATTERN.matcher(name);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    String scheme = matcher.group(2);
    String authority = matcher.group(4);
    if (scheme == null || authority == null || authority.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new HierarchicalName(scheme, authority, matcher.group(5), matcher.group(7),
        matcher.group(9)));
  }

  public HierarchicalName withoutQuery() {
    return new HierarchicalName(scheme, authority, path, null, fragment);
  }

  /**
   * The name one path level up, without query or fragment. Trailing slashes do not count as a
   * level: the parent of {@code /a/b/} is {@code /a}.
   *
   * @return the parent, or empty at the root
   */
  public Optional<HierarchicalName> parent() {
    if (path.isEmpty()) {
      return Optional.empty();
    }
    String trimmed = path;
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    int slash = trimmed.lastIndexOf('/');
    String parentPath = slash < 0 ? "" : trimmed.substring(0, slash);
    return Optional.of(new HierarchicalName(scheme, authority, parentPath, null, null));
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder(scheme).append("://").append(authority).append(path);
    if (query != null) {
      builder.append('?').append(query);
    }
    if (fragment != null) {
      builder.append('#').append(fragment);
    }
    return builder.toString();
  }
}
