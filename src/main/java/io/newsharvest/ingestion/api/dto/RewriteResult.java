package io.newsharvest.ingestion.api.dto;

public sealed interface RewriteResult permits RewriteResult.Success, RewriteResult.Failure {

    record Success(StructuredArticle article) implements RewriteResult {}

    record Failure(String reason) implements RewriteResult {}

    static RewriteResult success(StructuredArticle article) {
        return new Success(article);
    }

    static RewriteResult failure(String reason) {
        return new Failure(reason);
    }
}
