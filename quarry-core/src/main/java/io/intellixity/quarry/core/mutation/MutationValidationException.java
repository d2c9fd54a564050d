package io.intellixity.quarry.core.mutation;

import io.intellixity.quarry.core.error.RequestValidationException;

/** A row edit was rejected before any SQL was built. */
public final class MutationValidationException extends RequestValidationException {
  public MutationValidationException(String message) {
    super(message);
  }

  public MutationValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
