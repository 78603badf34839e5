package com.codeheadsystems.keychain.model;

/**
 * Record classes a store can hold.
 */
public enum ItemClass {
  GENERIC_PASSWORD,
  INTERNET_PASSWORD,
  CERTIFICATE,
  PUBLIC_KEY,
  PRIVATE_KEY,
  SYMMETRIC_KEY,
  /**
   * Store-internal metadata record; never returned from an any-class search.
   */
  DATABASE_BLOB
}
