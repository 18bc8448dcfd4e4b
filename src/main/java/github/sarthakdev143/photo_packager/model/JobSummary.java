package github.sarthakdev143.photo_packager.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal aggregate of a packaging run. A dry run produces the same shape as a live run.
 */
public record JobSummary(
        String shootBaseName,
        Path outputRoot,
        boolean dryRun,
        boolean cancelled,
        int totalSources,
        Map<OutputCategory, CategoryCounts> counts,
        List<FileOutcome> outcomes,
        List<String> warnings,
        List<String> errors,
        List<Path> archives,
        Duration elapsed,
        Path logFile) {

    public JobSummary {
        Map<OutputCategory, CategoryCounts> copy = new EnumMap<>(OutputCategory.class);
        if (counts != null) {
            copy.putAll(counts);
        }
        counts = Collections.unmodifiableMap(copy);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
        archives = archives == null ? List.of() : List.copyOf(archives);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public CategoryCounts countsFor(OutputCategory category) {
        return counts.getOrDefault(category, CategoryCounts.EMPTY);
    }

    public int failedCount() {
        return counts.values().stream().mapToInt(CategoryCounts::failed).sum();
    }

    public List<FileOutcome> outcomesFor(OutputCategory category) {
        return outcomes.stream().filter(outcome -> outcome.category() == category).toList();
    }

    public boolean hasFailures() {
        return failedCount() > 0 || !errors.isEmpty();
    }
}
