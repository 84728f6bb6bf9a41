package com.example.flowerclassifier.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "classifier")
public class ClassifierProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceThreshold = 0.25;

    private String corsOrigins = "*";

    @Valid
    private final Model model = new Model();

    @Valid
    private final Inference inference = new Inference();

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public String getCorsOrigins() {
        return corsOrigins;
    }

    public void setCorsOrigins(String corsOrigins) {
        this.corsOrigins = corsOrigins;
    }

    public Model getModel() {
        return model;
    }

    public Inference getInference() {
        return inference;
    }

    public static class Model {

        private String remoteUrl = "https://huggingface.co/deenp03/tomato_pollination_stage_classifier/resolve/main/best.onnx";

        @NotBlank
        private String cacheDir = "./models/cache";

        private String localPath = "./models/best.onnx";

        @NotNull
        private Duration initTimeout = Duration.ofSeconds(120);

        @NotNull
        private Duration downloadTimeout = Duration.ofSeconds(60);

        @Min(32)
        private int inputSize = 640;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double nmsThreshold = 0.45;

        public String getRemoteUrl() {
            return remoteUrl;
        }

        public void setRemoteUrl(String remoteUrl) {
            this.remoteUrl = remoteUrl;
        }

        public String getCacheDir() {
            return cacheDir;
        }

        public void setCacheDir(String cacheDir) {
            this.cacheDir = cacheDir;
        }

        public String getLocalPath() {
            return localPath;
        }

        public void setLocalPath(String localPath) {
            this.localPath = localPath;
        }

        public Duration getInitTimeout() {
            return initTimeout;
        }

        public void setInitTimeout(Duration initTimeout) {
            this.initTimeout = initTimeout;
        }

        public Duration getDownloadTimeout() {
            return downloadTimeout;
        }

        public void setDownloadTimeout(Duration downloadTimeout) {
            this.downloadTimeout = downloadTimeout;
        }

        public int getInputSize() {
            return inputSize;
        }

        public void setInputSize(int inputSize) {
            this.inputSize = inputSize;
        }

        public double getNmsThreshold() {
            return nmsThreshold;
        }

        public void setNmsThreshold(double nmsThreshold) {
            this.nmsThreshold = nmsThreshold;
        }
    }

    public static class Inference {

        @Min(1)
        private int threads = 2;

        @Min(0)
        private int queueCapacity = 16;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
