package github.sarthakdev143.photo_packager.model;

public record CategoryCounts(int succeeded, int skipped, int failed) {

    public static final CategoryCounts EMPTY = new CategoryCounts(0, 0, 0);

    public CategoryCounts plus(OutcomeStatus status) {
        return switch (status) {
            case SUCCESS -> new CategoryCounts(succeeded + 1, skipped, failed);
            case SKIPPED -> new CategoryCounts(succeeded, skipped + 1, failed);
            case FAILED -> new CategoryCounts(succeeded, skipped, failed + 1);
        };
    }

    public int total() {
        return succeeded + skipped + failed;
    }
}
