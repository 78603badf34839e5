package com.codeheadsystems.keychain.exceptions;

import java.util.Objects;

/**
 * The single unchecked exception type of the keychain layer. Callers inspect {@link #kind()}.
 */
public class KeychainException extends RuntimeException {

  private final ErrorKind kind;

  /**
   * Instantiates a new Keychain exception.
   *
   * @param kind    the kind
   * @param message the message
   */
  public KeychainException(final ErrorKind kind, final String message) {
    this(kind, message, null);
  }

  /**
   * Instantiates a new Keychain exception.
   *
   * @param kind    the kind
   * @param message the message
   * @param cause   the cause
   */
  public KeychainException(final ErrorKind kind, final String message, final Throwable cause) {
    super(kind + ": " + message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * The failure classification.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Is kind boolean.
   *
   * @param candidate the candidate
   * @return true if this exception carries the given kind
   */
  public boolean is(final ErrorKind candidate) {
    return kind == candidate;
  }
}
