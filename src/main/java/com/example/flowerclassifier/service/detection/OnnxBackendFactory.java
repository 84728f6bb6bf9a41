package com.example.flowerclassifier.service.detection;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class OnnxBackendFactory implements DetectionBackendFactory {

    private static final Logger log = LoggerFactory.getLogger(OnnxBackendFactory.class);

    private final int inputSize;
    private final double nmsThreshold;

    public OnnxBackendFactory(int inputSize, double nmsThreshold) {
        this.inputSize = inputSize;
        this.nmsThreshold = nmsThreshold;
    }

    @Override
    public DetectionBackend create(byte[] modelBytes) {
        try {
            OrtEnvironment environment = OrtEnvironment.getEnvironment();
            OrtSession.SessionOptions options = new OrtSession.SessionOptions();
            options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
            OrtSession session = environment.createSession(modelBytes, options);
            log.info("Created ONNX session ({} bytes, inputs {}, outputs {})",
                    modelBytes.length, session.getInputNames(), session.getOutputNames());
            return new OnnxYoloBackend(environment, session, inputSize, nmsThreshold);
        } catch (OrtException ex) {
            throw new IllegalStateException("Unable to create ONNX session: " + ex.getMessage(), ex);
        } catch (LinkageError ex) {
            throw new IllegalStateException("ONNX Runtime native library could not be loaded: " + ex.getMessage(), ex);
        }
    }
}
