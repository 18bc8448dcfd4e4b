package github.sarthakdev143.photo_packager.model;

public enum OutputFormat {
    JPEG("jpeg", "jpg"),
    WEBP("webp", "webp");

    private final String writerFormatName;
    private final String extension;

    OutputFormat(String writerFormatName, String extension) {
        this.writerFormatName = writerFormatName;
        this.extension = extension;
    }

    public String writerFormatName() {
        return writerFormatName;
    }

    public String extension() {
        return extension;
    }
}
