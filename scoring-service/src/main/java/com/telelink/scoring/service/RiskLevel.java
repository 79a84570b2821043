package com.telelink.scoring.service;

/** Churn risk bands, in increasing order of churn probability. */
public enum RiskLevel {
  LOW,
  MEDIUM,
  HIGH
}
