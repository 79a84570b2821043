package com.telelink.scoring.service;

public enum RetentionAction {
  IMMEDIATE_RETENTION_OUTREACH(
      "Customer likely to churn. Assign a dedicated account manager and offer targeted incentives within 24 hours."),
  PROACTIVE_ENGAGEMENT(
      "Elevated churn risk detected. Schedule a check-in call and present personalised offers and loyalty rewards."),
  STANDARD_MAINTENANCE(
      "Healthy customer relationship. Continue standard engagement and periodic satisfaction surveys.");

  private final String message;

  RetentionAction(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }
}
