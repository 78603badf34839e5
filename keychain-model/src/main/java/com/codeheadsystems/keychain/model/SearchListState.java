package com.codeheadsystems.keychain.model;

import com.codeheadsystems.keychain.exceptions.ErrorKind;
import com.codeheadsystems.keychain.exceptions.KeychainException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Persisted search-list record of one domain: an ordered, duplicate-free sequence of store
 * identifiers plus the optional default and login designations.
 * <p>
 * The default and login identifiers need not be members of the search list. Only the
 * {@link Domain#USER} record normally carries a login identifier.
 *
 * @param searchList      ordered store identifiers, no duplicates
 * @param defaultKeychain the default store, or null
 * @param loginKeychain   the login store, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchListState(
    @JsonProperty("searchList") List<StoreIdentifier> searchList,
    @JsonProperty("defaultKeychain") StoreIdentifier defaultKeychain,
    @JsonProperty("loginKeychain") StoreIdentifier loginKeychain) {

  public SearchListState {
    searchList = searchList == null ? List.of() : List.copyOf(searchList);
    Set<StoreIdentifier> seen = new HashSet<>();
    for (StoreIdentifier id : searchList) {
      if (!seen.add(id)) {
        throw new KeychainException(ErrorKind.DUPLICATE_MEMBER, "Duplicate search list entry: " + id);
      }
    }
  }

  /**
   * An empty record with no designations.
   *
   * @return the search list state
   */
  public static SearchListState empty() {
    return new SearchListState(List.of(), null, null);
  }

  /**
   * Whether the identifier is in the search list. Designations are not considered.
   *
   * @param id the id
   * @return true if listed
   */
  public boolean member(final StoreIdentifier id) {
    return searchList.contains(id);
  }

  /**
   * Is empty boolean.
   *
   * @return true if there are no entries and no designations
   */
  @JsonIgnore
  public boolean isEmpty() {
    return searchList.isEmpty() && defaultKeychain == null && loginKeychain == null;
  }

  /**
   * Appends an identifier.
   *
   * @param id the id
   * @return the new state
   * @throws KeychainException {@link ErrorKind#DUPLICATE_MEMBER} if already listed
   */
  public SearchListState withAdded(final StoreIdentifier id) {
    if (member(id)) {
      throw new KeychainException(ErrorKind.DUPLICATE_MEMBER, "Already in search list: " + id);
    }
    List<StoreIdentifier> list = new ArrayList<>(searchList);
    list.add(id);
    return new SearchListState(list, defaultKeychain, loginKeychain);
  }

  /**
   * Removes an identifier from the search list. Designations are left alone.
   *
   * @param id the id
   * @return the new state
   */
  public SearchListState withRemoved(final StoreIdentifier id) {
    List<StoreIdentifier> list = new ArrayList<>(searchList);
    list.remove(id);
    return new SearchListState(list, defaultKeychain, loginKeychain);
  }

  /**
   * Rewrites {@code from} to {@code to} everywhere it appears: list entry, default and login.
   * If {@code to} was already listed the renamed entry takes its place.
   *
   * @param from the old identifier
   * @param to   the new identifier
   * @return the new state
   */
  public SearchListState withRenamed(final StoreIdentifier from, final StoreIdentifier to) {
    List<StoreIdentifier> list = new ArrayList<>(searchList.size());
    for (StoreIdentifier id : searchList) {
      if (id.equals(from)) {
        if (!list.contains(to)) {
          list.add(to);
        }
      } else if (!id.equals(to) || !searchList.contains(from)) {
        list.add(id);
      }
    }
    return new SearchListState(list,
        Objects.equals(defaultKeychain, from) ? to : defaultKeychain,
        Objects.equals(loginKeychain, from) ? to : loginKeychain);
  }

  /**
   * With search list search list state.
   *
   * @param list the list
   * @return the new state
   */
  public SearchListState withSearchList(final List<StoreIdentifier> list) {
    return new SearchListState(list, defaultKeychain, loginKeychain);
  }

  /**
   * With default keychain search list state.
   *
   * @param id the id, or null to clear
   * @return the new state
   */
  public SearchListState withDefaultKeychain(final StoreIdentifier id) {
    return new SearchListState(searchList, id, loginKeychain);
  }

  /**
   * With login keychain search list state.
   *
   * @param id the id, or null to clear
   * @return the new state
   */
  public SearchListState withLoginKeychain(final StoreIdentifier id) {
    return new SearchListState(searchList, defaultKeychain, id);
  }
}
