package com.example.flowerclassifier.service.detection;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.example.flowerclassifier.util.ImagePreprocessor;
import com.example.flowerclassifier.util.ImagePreprocessor.Letterbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.FloatBuffer;
import java.util.List;
import java.util.Map;

/**
 * YOLOv8 flower detector running on ONNX Runtime. The session is thread safe,
 * so one instance serves all requests.
 */
public class OnnxYoloBackend implements DetectionBackend {

    private static final Logger log = LoggerFactory.getLogger(OnnxYoloBackend.class);

    private final OrtEnvironment environment;
    private final OrtSession session;
    private final String inputName;
    private final int inputSize;
    private final YoloOutputDecoder decoder;

    OnnxYoloBackend(OrtEnvironment environment, OrtSession session, int inputSize, double nmsThreshold) {
        this.environment = environment;
        this.session = session;
        this.inputName = session.getInputNames().iterator().next();
        this.inputSize = inputSize;
        this.decoder = new YoloOutputDecoder(nmsThreshold);
    }

    @Override
    public List<RawDetection> infer(BufferedImage rgbImage, double minConfidence) {
        long start = System.nanoTime();
        Letterbox letterbox = ImagePreprocessor.letterbox(rgbImage, inputSize);
        FloatBuffer input = ImagePreprocessor.toChwTensor(letterbox.image());
        long[] shape = new long[]{1, 3, inputSize, inputSize};
        long preprocessEnd = System.nanoTime();

        try (OnnxTensor inputTensor = OnnxTensor.createTensor(environment, input, shape);
             OrtSession.Result output = session.run(Map.of(inputName, inputTensor))) {
            long inferenceEnd = System.nanoTime();
            OnnxTensor tensor = (OnnxTensor) output.get(0);
            List<RawDetection> detections = decoder.decode(tensor.getFloatBuffer(), tensor.getInfo().getShape(),
                    letterbox, rgbImage.getWidth(), rgbImage.getHeight(), minConfidence);
            long postEnd = System.nanoTime();

            log.debug("YOLO timings - preprocess: {} ms, inference: {} ms, post: {} ms",
                    (preprocessEnd - start) / 1_000_000.0,
                    (inferenceEnd - preprocessEnd) / 1_000_000.0,
                    (postEnd - inferenceEnd) / 1_000_000.0);
            return detections;
        } catch (OrtException ex) {
            throw new InferenceException("ONNX inference failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException ex) {
            log.warn("Failed to close OrtSession", ex);
        }
    }
}
