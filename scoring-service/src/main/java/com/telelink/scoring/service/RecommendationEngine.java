package com.telelink.scoring.service;

import org.springframework.stereotype.Component;

@Component
public class RecommendationEngine {

  public RetentionAction recommend(RiskLevel riskLevel) {
    return switch (riskLevel) {
      case HIGH -> RetentionAction.IMMEDIATE_RETENTION_OUTREACH;
      case MEDIUM -> RetentionAction.PROACTIVE_ENGAGEMENT;
      case LOW -> RetentionAction.STANDARD_MAINTENANCE;
    };
  }
}
