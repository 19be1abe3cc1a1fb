package com.example.guideserver.config;

import com.example.guideserver.store.AnnotationStore;
import com.example.guideserver.store.JsonFileAnnotationStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;

@Configuration
public class StoreConfig {

    @Bean
    public AnnotationStore annotationStore(@Value("${guide.output-dir:data}") String outputDir) {
        return new JsonFileAnnotationStore(new File(outputDir).getAbsoluteFile());
    }
}
