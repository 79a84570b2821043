package com.telelink.scoring.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A customer record cannot be encoded: a field is missing, out of range or outside the
 * training vocabulary. Recoverable per request.
 */
public class RecordValidationException extends ScoringException {

  private final Map<String, String> violations;

  public RecordValidationException(Map<String, String> violations) {
    super(describe(violations));
    this.violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
  }

  public static RecordValidationException of(String field, String message) {
    return new RecordValidationException(Map.of(field, message));
  }

  /** Re-keys the violations of one batch entry as {@code [index].field}. */
  public static RecordValidationException forBatchEntry(int index, RecordValidationException cause) {
    Map<String, String> keyed = new LinkedHashMap<>();
    cause.getViolations().forEach((field, message) -> keyed.put("[" + index + "]." + field, message));
    RecordValidationException ex = new RecordValidationException(keyed);
    ex.initCause(cause);
    return ex;
  }

  public Map<String, String> getViolations() {
    return violations;
  }

  private static String describe(Map<String, String> violations) {
    if (violations.isEmpty()) {
      throw new IllegalArgumentException("violations must not be empty");
    }
    StringBuilder sb = new StringBuilder("Invalid customer record: ");
    String sep = "";
    for (Map.Entry<String, String> e : violations.entrySet()) {
      sb.append(sep).append(e.getKey()).append(' ').append(e.getValue());
      sep = "; ";
    }
    return sb.toString();
  }
}
