package com.codeheadsystems.keychain.exceptions;

/**
 * Classification of every failure raised by the keychain layer.
 * <p>
 * Fallback and batch logic switch on the kind instead of catching distinct exception types, so
 * "nothing matched" can always be told apart from "the store could not be read".
 */
public enum ErrorKind {

  /**
   * No default or login store, no preference match, no search-list member.
   */
  NOT_FOUND,

  /**
   * The store is already a member of the list being added to.
   */
  DUPLICATE_MEMBER,

  /**
   * The operation is not allowed on the requested domain (usually {@code DYNAMIC}).
   */
  INVALID_DOMAIN,

  /**
   * A privilege check or an unlock secret was rejected.
   */
  AUTH_FAILURE,

  /**
   * A listed store cannot currently be opened or read. Non-fatal inside multi-store scans.
   */
  BACKEND_UNAVAILABLE,

  /**
   * The backing file of a store does not exist yet.
   */
  STORE_DOES_NOT_EXIST,

  /**
   * A name or label exceeds the backend's fixed attribute buffer.
   */
  DATA_TOO_LARGE,

  /**
   * Persisted state could not be read or flushed.
   */
  IO_FAILURE,

  /**
   * A persistent item reference could not be decoded or no longer points at an item.
   */
  INVALID_ITEM_REF,

  /**
   * User interaction would be required but is disabled for this process.
   */
  INTERACTION_NOT_ALLOWED,

  /**
   * A required argument was missing or malformed.
   */
  INVALID_PARAMETER
}
