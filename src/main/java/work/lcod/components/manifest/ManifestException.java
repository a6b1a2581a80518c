package work.lcod.components.manifest;

import java.nio.file.Path;
import work.lcod.components.api.ComponentException;

public final class ManifestException extends ComponentException {
    public ManifestException(Path source, String message) {
        super("manifest", source + ": " + message);
    }

    public ManifestException(Path source, String message, Throwable cause) {
        super("manifest", source + ": " + message, cause);
    }
}
