package com.telelink.scoring.config;

import com.telelink.scoring.model.ModelRegistry;
import com.telelink.scoring.model.ModelRegistryLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ModelRegistryConfig {

  /** A load failure propagates out of bean creation and aborts startup. */
  @Bean(destroyMethod = "close")
  public ModelRegistry modelRegistry(ModelRegistryLoader loader, ScoringProperties props) {
    return loader.load(props.getModels());
  }
}
