package com.telelink.scoring.dto;

import com.telelink.scoring.service.ConfidenceLevel;
import com.telelink.scoring.service.RetentionAction;
import com.telelink.scoring.service.RiskLevel;
import com.telelink.scoring.service.ValueTier;

public record PredictionResult(
    double churnProbability,
    boolean churnPredicted,
    RiskLevel riskLevel,
    double confidenceScore,
    ConfidenceLevel confidenceLevel,
    double clvEstimate,
    ValueTier valueTier,
    RetentionAction recommendation,
    String recommendationMessage,
    ModelVersions modelVersions) {}
