package io.newsharvest.ingestion;

import io.newsharvest.ingestion.config.NewsConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(NewsConfig.class)
@ConfigurationPropertiesScan
public class NewsHarvesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(NewsHarvesterApplication.class, args);
    }
}
