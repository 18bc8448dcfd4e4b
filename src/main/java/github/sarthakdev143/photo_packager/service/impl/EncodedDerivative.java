package github.sarthakdev143.photo_packager.service.impl;

import java.util.List;

public record EncodedDerivative(byte[] bytes, int quality, int probes, List<String> warnings) {

    public EncodedDerivative {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
