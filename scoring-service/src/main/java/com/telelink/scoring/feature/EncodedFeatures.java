package com.telelink.scoring.feature;

/** Both model views of one customer record, taken from a single encoding pass. */
public record EncodedFeatures(FeatureVector classifierView, FeatureVector regressorView) {}
