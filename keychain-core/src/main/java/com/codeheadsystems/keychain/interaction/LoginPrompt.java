package com.codeheadsystems.keychain.interaction;

import java.util.Optional;

/**
 * Asks the user for their login secret when a usable default store is missing.
 */
@FunctionalInterface
public interface LoginPrompt {

  /**
   * Shows the prompt.
   *
   * @param hints the hints
   * @return the secret, or empty if the user cancelled
   */
  Optional<byte[]> requestLoginSecret(LoginPromptHints hints);

  /**
   * A prompt that always cancels. For headless processes.
   *
   * @return the login prompt
   */
  static LoginPrompt cancelling() {
    return hints -> Optional.empty();
  }
}
