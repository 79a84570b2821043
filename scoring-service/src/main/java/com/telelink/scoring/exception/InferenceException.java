package com.telelink.scoring.exception;

/**
 * A loaded model failed to produce a usable output for an encoded record.
 */
public class InferenceException extends ScoringException {

  public InferenceException(String message) {
    super(message);
  }

  public InferenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
