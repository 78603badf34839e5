package com.codeheadsystems.keychain.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expands a name into the ordered list of names an identity preference may be stored under,
 * most specific first.
 * <p>
 * {@code https://example.com/a/b?x=1} expands to {@code https://example.com/a/b},
 * {@code https://example.com/a} and {@code https://example.com}. A name that is not hierarchical
 * expands to itself.
 */
public final class CandidateNames {

  private CandidateNames() {
  }

  /**
   * Candidate names.
   *
   * @param name the name
   * @return the candidates, never empty
   */
  public static List<String> of(final String name) {
    Objects.requireNonNull(name, "name");
    Optional<HierarchicalName> parsed = HierarchicalName.parse(name);
    if (parsed.isEmpty()) {
      return List.of(name);
    }
    HierarchicalName current = parsed.get();
    String base = name;
    if (current.query() != null) {
      current = current.withoutQuery();
      base = current.toString();
    }
    List<String> names = new ArrayList<>();
    names.add(base);
    int lastLength = base.length();
    for (Optional<HierarchicalName> parent = current.parent(); parent.isPresent();
        parent = parent.get().parent()) {
      String candidate = parent.get().toString();
      if (candidate.length() >= lastLength || !base.startsWith(candidate)) {
        break;
      }
      names.add(candidate);
      lastLength = candidate.length();
    }
    return List.copyOf(names);
  }
}
