package com.telelink.scoring.exception;

/**
 * A model artifact or feature spec is missing, corrupt or was built against a different
 * feature spec version. Only raised while the registry is being built at startup.
 */
public class ModelLoadException extends ScoringException {

  public ModelLoadException(String message) {
    super(message);
  }

  public ModelLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
