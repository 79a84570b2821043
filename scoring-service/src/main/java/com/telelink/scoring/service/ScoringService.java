package com.telelink.scoring.service;

import com.telelink.scoring.config.ScoringProperties;
import com.telelink.scoring.dto.BatchPredictionResult;
import com.telelink.scoring.dto.CustomerRecord;
import com.telelink.scoring.dto.PredictionResult;
import com.telelink.scoring.exception.RecordValidationException;
import com.telelink.scoring.feature.EncodedFeatures;
import com.telelink.scoring.feature.FeatureEncoder;
import com.telelink.scoring.model.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Scores one customer end to end: encode once, run churn and CLV inference side by side,
 * then band, recommend and assemble. Either every step succeeds or no result is produced.
 */
@Service
public class ScoringService {

  private static final Logger log = LoggerFactory.getLogger(ScoringService.class);

  private final ModelRegistry models;
  private final FeatureEncoder encoder;
  private final RiskScorer riskScorer;
  private final RecommendationEngine recommendations;
  private final double highValueThreshold;
  private final int maxBatchSize;

  public ScoringService(ModelRegistry models, RiskScorer riskScorer, RecommendationEngine recommendations,
                        ScoringProperties props) {
    this.models = models;
    this.encoder = new FeatureEncoder(models.featureSpec());
    this.riskScorer = riskScorer;
    this.recommendations = recommendations;
    this.highValueThreshold = props.getValue().getHighValueThreshold();
    this.maxBatchSize = props.getBatch().getMaxSize();
  }

  public PredictionResult scoreCustomer(CustomerRecord record) {
    return scoreCustomerAsync(record).block();
  }

  public Mono<PredictionResult> scoreCustomerAsync(CustomerRecord record) {
    return Mono.fromCallable(() -> encoder.encode(record))
        .flatMap(this::infer);
  }

  public BatchPredictionResult scoreBatch(List<CustomerRecord> records) {
    return scoreBatchAsync(records).block();
  }

  /** Scores records in input order; the first invalid record fails the whole batch. */
  public Mono<BatchPredictionResult> scoreBatchAsync(List<CustomerRecord> records) {
    if (records == null) {
      return Mono.error(RecordValidationException.of("batch", "must not be null"));
    }
    if (records.size() > maxBatchSize) {
      return Mono.error(RecordValidationException.of("batch",
          "size " + records.size() + " exceeds the maximum of " + maxBatchSize));
    }
    return Flux.range(0, records.size())
        .flatMapSequential(i -> scoreCustomerAsync(records.get(i))
            .onErrorMap(RecordValidationException.class, e -> RecordValidationException.forBatchEntry(i, e)))
        .collectList()
        .map(BatchPredictionResult::of)
        .doOnSuccess(r -> log.debug("Scored batch of {} customers", r.count()));
  }

  private Mono<PredictionResult> infer(EncodedFeatures features) {
    Mono<Double> churn = Mono.fromCallable(() -> models.churnClassifier().predict(features.classifierView()))
        .subscribeOn(Schedulers.boundedElastic());
    Mono<Double> clv = Mono.fromCallable(() -> models.clvRegressor().predict(features.regressorView()))
        .subscribeOn(Schedulers.boundedElastic());
    return Mono.zip(churn, clv, this::assemble);
  }

  private PredictionResult assemble(double churnProbability, double clvEstimate) {
    RiskAssessment risk = riskScorer.score(churnProbability);
    RetentionAction action = recommendations.recommend(risk.riskLevel());
    log.debug("Scored customer: churn={} risk={} clv={}", churnProbability, risk.riskLevel(), clvEstimate);
    return new PredictionResult(
        churnProbability,
        models.churnClassifier().isChurn(churnProbability),
        risk.riskLevel(),
        risk.confidenceScore(),
        risk.confidenceLevel(),
        clvEstimate,
        ValueTier.of(clvEstimate, highValueThreshold),
        action,
        action.message(),
        models.versions());
  }
}
