package github.sarthakdev143.photo_packager.model;

public enum OutcomeStatus {
    SUCCESS,
    SKIPPED,
    FAILED
}
