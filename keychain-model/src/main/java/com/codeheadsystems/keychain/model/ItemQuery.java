package com.codeheadsystems.keychain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Selection predicate handed to a store's query capability.
 * <p>
 * A null item class selects every class. Matches are combined with the query's conjunction;
 * a query without matches selects every item of the class.
 *
 * @param itemClass   record class, or null for any
 * @param conjunction how matches combine
 * @param matches     attribute equality tests
 */
public record ItemQuery(ItemClass itemClass, Conjunction conjunction, List<Match> matches) {

  public ItemQuery {
    Objects.requireNonNull(conjunction, "conjunction");
    matches = matches == null ? List.of() : List.copyOf(matches);
  }

  /**
   * How attribute matches are combined.
   */
  public enum Conjunction {
    AND,
    OR
  }

  /**
   * Attribute equality test.
   *
   * @param attribute the attribute
   * @param value     the value it must equal
   */
  public record Match(ItemAttribute attribute, AttributeValue value) {

    public Match {
      Objects.requireNonNull(attribute, "attribute");
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * Query selecting every item of the given class.
   *
   * @param itemClass the item class, or null for any
   * @return the item query
   */
  public static ItemQuery forClass(final ItemClass itemClass) {
    return new ItemQuery(itemClass, Conjunction.AND, List.of());
  }

  /**
   * Query selecting items of any class.
   *
   * @return the item query
   */
  public static ItemQuery anyClass() {
    return forClass(null);
  }

  /**
   * Copy with one more equality test.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return the item query
   */
  public ItemQuery where(final ItemAttribute attribute, final AttributeValue value) {
    List<Match> list = new ArrayList<>(matches);
    list.add(new Match(attribute, value));
    return new ItemQuery(itemClass, conjunction, list);
  }

  /**
   * Copy with a different conjunction.
   *
   * @param newConjunction the conjunction
   * @return the item query
   */
  public ItemQuery withConjunction(final Conjunction newConjunction) {
    return new ItemQuery(itemClass, newConjunction, matches);
  }

  /**
   * Evaluates the predicate against an item.
   *
   * @param item the item
   * @return true if selected
   */
  public boolean matches(final KeychainItem item) {
    if (itemClass != null && item.itemClass() != itemClass) {
      return false;
    }
    if (matches.isEmpty()) {
      return true;
    }
    boolean any = false;
    for (Match match : matches) {
      boolean hit = item.attribute(match.attribute()).map(match.value()::equals).orElse(false);
      if (conjunction == Conjunction.AND && !hit) {
        return false;
      }
      any |= hit;
    }
    return conjunction == Conjunction.AND || any;
  }
}
