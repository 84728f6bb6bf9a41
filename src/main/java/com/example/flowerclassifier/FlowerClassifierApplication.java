package com.example.flowerclassifier;

import com.example.flowerclassifier.config.ClassifierProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Tomato Plant Flower Classification API",
                version = "1.0",
                description = "REST API for detecting tomato plant flowers in uploaded images, classifying their growth stage and mapping the results.",
                contact = @Contact(name = "Tomato Flower Classifier")))
@SpringBootApplication
@EnableConfigurationProperties(ClassifierProperties.class)
public class FlowerClassifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowerClassifierApplication.class, args);
    }
}
