package github.sarthakdev143.photo_packager.service.impl;

/**
 * Fits image dimensions under a total pixel count with one proportional scale factor.
 */
final class PixelBudget {

    private PixelBudget() {
    }

    static Size fit(int width, int height, long targetPixels) {
        long pixels = (long) width * height;
        if (targetPixels <= 0 || pixels <= targetPixels) {
            return new Size(width, height);
        }

        double scale = Math.sqrt((double) targetPixels / pixels);
        int scaledWidth = Math.max(1, (int) Math.floor(width * scale));
        int scaledHeight = Math.max(1, (int) Math.floor(height * scale));

        // floating point can land one pixel over the budget
        while ((long) scaledWidth * scaledHeight > targetPixels && (scaledWidth > 1 || scaledHeight > 1)) {
            if (scaledWidth >= scaledHeight && scaledWidth > 1) {
                scaledWidth--;
            } else {
                scaledHeight--;
            }
        }
        return new Size(scaledWidth, scaledHeight);
    }

    record Size(int width, int height) {

        long pixels() {
            return (long) width * height;
        }
    }
}
