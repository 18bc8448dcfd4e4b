package github.sarthakdev143.photo_packager.model;

import java.util.List;

public record ScanResult(List<SourceEntry> entries, List<String> warnings) {

    public ScanResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<SourceEntry> readableEntries() {
        return entries.stream().filter(SourceEntry::readable).toList();
    }

    public int size() {
        return entries.size();
    }
}
