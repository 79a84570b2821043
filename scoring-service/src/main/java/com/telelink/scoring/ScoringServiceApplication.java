package com.telelink.scoring;

import com.telelink.scoring.config.ScoringProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ScoringProperties.class)
public class ScoringServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(ScoringServiceApplication.class, args);
  }
}
