package io.newsharvest.ingestion.api.exception;

import java.util.List;

public class UnknownCategoryException extends RuntimeException {

    private final List<String> categories;

    public UnknownCategoryException(List<String> categories) {
        super("Unknown or disabled categories: " + String.join(", ", categories));
        this.categories = List.copyOf(categories);
    }

    public List<String> getCategories() {
        return categories;
    }
}
