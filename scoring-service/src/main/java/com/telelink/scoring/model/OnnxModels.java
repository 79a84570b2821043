package com.telelink.scoring.model;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxJavaType;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import ai.onnxruntime.ValueInfo;
import com.telelink.scoring.exception.InferenceException;
import com.telelink.scoring.exception.ModelLoadException;
import com.telelink.scoring.feature.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ONNX Runtime backed models, for sklearn-onnx exports. The classifier must be exported with
 * zipmap disabled so probabilities come back as a float tensor. Model metadata carries
 * {@code feature_spec_version}, {@code model_version} and, for the classifier,
 * {@code decision_threshold}.
 */
final class OnnxModels {

  static final String META_FEATURE_SPEC_VERSION = "feature_spec_version";
  static final String META_MODEL_VERSION = "model_version";
  static final String META_DECISION_THRESHOLD = "decision_threshold";

  private static final Logger log = LoggerFactory.getLogger(OnnxModels.class);

  private OnnxModels() {}

  /** Session plus the metadata every ONNX model here needs. */
  static final class Handle {
    final OrtEnvironment env;
    final OrtSession session;
    final String inputName;
    final String outputName;
    final String version;
    final String featureSpecVersion;
    final Map<String, String> metadata;

    private Handle(OrtEnvironment env, OrtSession session, String inputName, String outputName, String version,
                   String featureSpecVersion, Map<String, String> metadata) {
      this.env = env;
      this.session = session;
      this.inputName = inputName;
      this.outputName = outputName;
      this.version = version;
      this.featureSpecVersion = featureSpecVersion;
      this.metadata = metadata;
    }

    float[][] run(FeatureVector features, String what) {
      try (OnnxTensor in = OnnxTensor.createTensor(env, new float[][]{features.toFloatArray()});
           OrtSession.Result out = session.run(Map.of(inputName, in))) {
        OnnxValue value = out.get(outputName).orElseThrow(() -> new InferenceException(
            what + " model " + version + " returned no '" + outputName + "' output"));
        Object raw = value.getValue();
        if (!(raw instanceof float[][])) {
          throw new InferenceException(what + " model " + version + " returned "
              + raw.getClass().getSimpleName() + ", expected a float tensor");
        }
        return (float[][]) raw;
      } catch (OrtException e) {
        throw new InferenceException(what + " model " + version + " failed to run", e);
      }
    }

    void close() {
      try {
        session.close();
      } catch (OrtException e) {
        log.warn("Failed to close ONNX session for model {}", version, e);
      }
    }
  }

  static Handle open(OrtEnvironment env, byte[] modelBytes, int featureCount, String preferredOutput,
                     String what) {
    OrtSession session = null;
    try {
      session = env.createSession(modelBytes, new OrtSession.SessionOptions());
      Map<String, String> meta = session.getMetadata().getCustomMetadata();
      String specVersion = meta.get(META_FEATURE_SPEC_VERSION);
      if (specVersion == null || specVersion.isBlank()) {
        throw new ModelLoadException(what + " ONNX model lacks '" + META_FEATURE_SPEC_VERSION + "' metadata");
      }
      String version = meta.getOrDefault(META_MODEL_VERSION, session.getMetadata().getGraphName());
      if (session.getNumInputs() != 1) {
        throw new ModelLoadException(what + " ONNX model must have exactly one input, has " + session.getNumInputs());
      }
      Map.Entry<String, NodeInfo> input = session.getInputInfo().entrySet().iterator().next();
      if (input.getValue().getInfo() instanceof TensorInfo) {
        long[] shape = ((TensorInfo) input.getValue().getInfo()).getShape();
        long width = shape.length == 0 ? -1 : shape[shape.length - 1];
        if (width > 0 && width != featureCount) {
          throw new ModelLoadException(what + " ONNX model expects " + width + " features, view has " + featureCount);
        }
      }
      Map<String, Boolean> floatOutputs = new LinkedHashMap<>();
      session.getOutputInfo().forEach((name, node) -> floatOutputs.put(name, isFloatTensor(node.getInfo())));
      String output = selectOutput(floatOutputs, preferredOutput, what);
      return new Handle(env, session, input.getKey(), output, version, specVersion, meta);
    } catch (OrtException e) {
      closeQuietly(session);
      throw new ModelLoadException("Unable to open " + what + " ONNX model", e);
    } catch (ModelLoadException e) {
      closeQuietly(session);
      throw e;
    }
  }

  /**
   * Picks the output inference reads: the preferred name if the model has it, otherwise its only
   * float tensor output. Map values say whether each output is a float tensor.
   */
  static String selectOutput(Map<String, Boolean> floatOutputs, String preferredOutput, String what) {
    if (floatOutputs.containsKey(preferredOutput)) {
      if (!floatOutputs.get(preferredOutput)) {
        throw new ModelLoadException(what + " ONNX output '" + preferredOutput
            + "' is not a float tensor; export the model with zipmap disabled");
      }
      return preferredOutput;
    }
    List<String> candidates = floatOutputs.entrySet().stream()
        .filter(Map.Entry::getValue)
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
    if (candidates.size() != 1) {
      throw new ModelLoadException(what + " ONNX model has no '" + preferredOutput
          + "' output and " + candidates.size() + " float tensor outputs " + candidates + " among " + floatOutputs.keySet());
    }
    return candidates.get(0);
  }

  private static boolean isFloatTensor(ValueInfo info) {
    return info instanceof TensorInfo && ((TensorInfo) info).type == OnnxJavaType.FLOAT;
  }

  private static void closeQuietly(OrtSession session) {
    if (session == null) return;
    try {
      session.close();
    } catch (OrtException e) {
      log.warn("Failed to close rejected ONNX session", e);
    }
  }
}
