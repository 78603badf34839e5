package com.codeheadsystems.keychain.model;

/**
 * Attribute tags understood by the record schema.
 */
public enum ItemAttribute {
  SERVICE,
  TYPE,
  LABEL,
  ACCOUNT,
  DESCRIPTION,
  CREATOR,
  /**
   * Overloaded by identity preferences to hold the key-usage tag.
   */
  SCRIPT_CODE,
  /**
   * Opaque application data; identity preferences keep the certificate reference here.
   */
  GENERIC,
  PUBLIC_KEY_HASH,
  ISSUER
}
