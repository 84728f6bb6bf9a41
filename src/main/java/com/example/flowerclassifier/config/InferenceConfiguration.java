package com.example.flowerclassifier.config;

import com.example.flowerclassifier.service.detection.DetectionBackendFactory;
import com.example.flowerclassifier.service.detection.DetectionModelLoader;
import com.example.flowerclassifier.service.detection.LocalModelAcquisitionStrategy;
import com.example.flowerclassifier.service.detection.ModelAcquisitionStrategy;
import com.example.flowerclassifier.service.detection.OnnxBackendFactory;
import com.example.flowerclassifier.service.detection.RemoteModelAcquisitionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wires the detection model loader with its ordered acquisition strategies
 * and the bounded executor inference runs on.
 */
@Configuration
public class InferenceConfiguration {

    private static final Logger log = LoggerFactory.getLogger(InferenceConfiguration.class);

    private static final String CACHED_MODEL_FILE = "model.onnx";

    @Bean
    public ThreadPoolTaskExecutor inferenceExecutor(ClassifierProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getInference().getThreads());
        executor.setMaxPoolSize(properties.getInference().getThreads());
        executor.setQueueCapacity(properties.getInference().getQueueCapacity());
        executor.setThreadNamePrefix("inference-");
        executor.initialize();
        return executor;
    }

    @Bean
    public RestTemplate modelDownloadRestTemplate(RestTemplateBuilder builder, ClassifierProperties properties) {
        return builder
                .setConnectTimeout(properties.getModel().getDownloadTimeout())
                .setReadTimeout(properties.getModel().getDownloadTimeout())
                .build();
    }

    @Bean
    public DetectionBackendFactory detectionBackendFactory(ClassifierProperties properties) {
        return new OnnxBackendFactory(properties.getModel().getInputSize(), properties.getModel().getNmsThreshold());
    }

    @Bean
    public DetectionModelLoader detectionModelLoader(@Qualifier("modelDownloadRestTemplate") RestTemplate restTemplate,
                                                     DetectionBackendFactory backendFactory,
                                                     ClassifierProperties properties) {
        ClassifierProperties.Model model = properties.getModel();
        Path cachedModel = Path.of(model.getCacheDir()).resolve(CACHED_MODEL_FILE);

        List<ModelAcquisitionStrategy> strategies = new ArrayList<>();
        if (StringUtils.hasText(model.getRemoteUrl())) {
            strategies.add(new RemoteModelAcquisitionStrategy(restTemplate, model.getRemoteUrl(), cachedModel, backendFactory));
        }
        strategies.add(new LocalModelAcquisitionStrategy("cache", cachedModel, backendFactory));
        if (StringUtils.hasText(model.getLocalPath())) {
            strategies.add(new LocalModelAcquisitionStrategy("local", Path.of(model.getLocalPath()), backendFactory));
        }

        log.info("Detection model will be acquired lazily using strategies: {}",
                strategies.stream().map(ModelAcquisitionStrategy::name).collect(Collectors.joining(" -> ")));
        return new DetectionModelLoader(strategies, model.getInitTimeout());
    }
}
