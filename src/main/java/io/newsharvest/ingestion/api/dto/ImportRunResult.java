package io.newsharvest.ingestion.api.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate of one import run. {@code failures} holds run-level problems (unknown feed,
 * missing category or author) that prevented a category from being processed at all;
 * {@code errorDetails} holds one {@code sourceUrl: reason} line per failed item.
 */
public record ImportRunResult(
        List<String> categories,
        int imported,
        int skipped,
        int errors,
        List<String> articleIds,
        List<String> failures,
        List<String> errorDetails,
        long durationMs
) {
    public ImportRunResult {
        categories = List.copyOf(categories);
        articleIds = List.copyOf(articleIds);
        failures = List.copyOf(failures);
        errorDetails = List.copyOf(errorDetails);
    }

    public static ImportRunResult empty() {
        return new ImportRunResult(List.of(), 0, 0, 0, List.of(), List.of(), List.of(), 0);
    }

    public static ImportRunResult runFailure(String category, String failure) {
        return new ImportRunResult(List.of(category), 0, 0, 1, List.of(), List.of(failure), List.of(), 0);
    }

    public ImportRunResult merge(ImportRunResult other) {
        List<String> mergedCategories = new ArrayList<>(categories);
        mergedCategories.addAll(other.categories);

        List<String> mergedIds = new ArrayList<>(articleIds);
        mergedIds.addAll(other.articleIds);

        List<String> mergedFailures = new ArrayList<>(failures);
        mergedFailures.addAll(other.failures);

        List<String> mergedErrorDetails = new ArrayList<>(errorDetails);
        mergedErrorDetails.addAll(other.errorDetails);

        return new ImportRunResult(
                mergedCategories,
                imported + other.imported,
                skipped + other.skipped,
                errors + other.errors,
                mergedIds,
                mergedFailures,
                mergedErrorDetails,
                durationMs + other.durationMs
        );
    }

    public ImportRunResult withDuration(long newDurationMs) {
        return new ImportRunResult(categories, imported, skipped, errors, articleIds, failures, errorDetails,
                newDurationMs);
    }
}
