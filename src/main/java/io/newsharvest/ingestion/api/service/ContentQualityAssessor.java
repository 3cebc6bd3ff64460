package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.ExtractionStrategy;
import io.newsharvest.ingestion.api.dto.QualityRating;
import org.springframework.stereotype.Component;

/**
 * Advisory rating of how rich the acquired content is. Never blocks persistence.
 */
@Component
public class ContentQualityAssessor {

    public QualityRating assess(int textLength, int imageCount, ExtractionStrategy strategyUsed) {
        if (textLength > 1000 && imageCount >= 1 && strategyUsed == ExtractionStrategy.PRIMARY_EXTRACTION) {
            return QualityRating.EXCELLENT;
        }
        if (textLength > 500) return QualityRating.GOOD;
        if (textLength > 200) return QualityRating.FAIR;
        return QualityRating.POOR;
    }
}
