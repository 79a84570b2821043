package com.telelink.scoring.dto;

import java.util.List;

public record BatchPredictionResult(List<PredictionResult> predictions, int count) {

  public static BatchPredictionResult of(List<PredictionResult> predictions) {
    return new BatchPredictionResult(List.copyOf(predictions), predictions.size());
  }
}
