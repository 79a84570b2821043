package com.telelink.scoring.controller;

import com.telelink.scoring.dto.BatchPredictionResult;
import com.telelink.scoring.dto.CustomerRecord;
import com.telelink.scoring.dto.PredictionResult;
import com.telelink.scoring.service.ScoringService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/customers")
public class ScoreController {

  private final ScoringService scoring;

  public ScoreController(ScoringService s) {
    this.scoring = s;
  }

  @PostMapping("/score")
  public Mono<PredictionResult> score(@RequestBody CustomerRecord record) {
    return scoring.scoreCustomerAsync(record);
  }

  @PostMapping("/score/batch")
  public Mono<BatchPredictionResult> scoreBatch(@RequestBody List<CustomerRecord> records) {
    return scoring.scoreBatchAsync(records);
  }
}
