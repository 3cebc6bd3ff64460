package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.ArticleRecord;
import io.newsharvest.ingestion.api.dto.ImportRunResult;
import io.newsharvest.ingestion.api.dto.kafka.ArticleImportedEvent;
import io.newsharvest.ingestion.api.dto.kafka.ImportRunCompletedEvent;
import io.newsharvest.ingestion.config.KafkaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Fire-and-forget import notifications. Publishing failures are logged and never
 * change the outcome of an import.
 */
@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties kafkaProperties;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties kafkaProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaProperties = kafkaProperties;
    }

    public void publishArticleImported(ArticleRecord article) {
        try {
            ArticleImportedEvent event = ArticleImportedEvent.create(
                    article.id(),
                    article.title(),
                    article.sourceUrl(),
                    article.categoryName(),
                    article.extractionStrategy().id(),
                    article.quality().id()
            );

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(kafkaProperties.articleImported(), article.id(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Sent article imported event: {} to partition: {}",
                            article.id(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send article imported event: {}", article.id(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing article imported event for article: {}", article.id(), e);
        }
    }

    public void publishRunCompleted(String jobName, ImportRunResult result) {
        try {
            ImportRunCompletedEvent event = ImportRunCompletedEvent.create(
                    jobName,
                    result.categories(),
                    result.imported(),
                    result.skipped(),
                    result.errors(),
                    result.errorDetails(),
                    result.durationMs()
            );

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(kafkaProperties.importRunCompleted(), event.runId(), event);

            future.whenComplete((sendResult, ex) -> {
                if (ex == null) {
                    logger.info("Sent run completed event: {} ({} imported for job {})",
                            event.runId(), result.imported(), jobName);
                } else {
                    logger.error("Failed to send run completed event: {}", event.runId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing run completed event for job: {}", jobName, e);
        }
    }
}
