package io.newsharvest.ingestion.api.dto;

import java.util.List;

public record ClassifiedImages(
        List<ScoredImage> hero,
        List<ScoredImage> thumbnail,
        List<ScoredImage> gallery
) {
    public ClassifiedImages {
        hero = List.copyOf(hero);
        thumbnail = List.copyOf(thumbnail);
        gallery = List.copyOf(gallery);
    }
}
