package io.newsharvest.ingestion.api.dto;

public record ArticleFilter(
        String sourceUrl,
        String categoryId
) {
    public static ArticleFilter bySourceUrl(String sourceUrl) {
        return new ArticleFilter(sourceUrl, null);
    }

    public static ArticleFilter byCategory(String categoryId) {
        return new ArticleFilter(null, categoryId);
    }

    public boolean matches(ArticleRecord article) {
        if (sourceUrl != null && !sourceUrl.equals(article.sourceUrl())) return false;
        if (categoryId != null && !categoryId.equals(article.categoryId())) return false;
        return true;
    }
}
