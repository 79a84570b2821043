package com.telelink.scoring.model;

/** Serialized form of the churn and CLV artifacts. The feature spec is always JSON. */
public enum ModelFormat {
  JSON,
  ONNX
}
