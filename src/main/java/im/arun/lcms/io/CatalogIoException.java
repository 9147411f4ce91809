package im.arun.lcms.io;

import java.nio.file.Path;

/**
 * Reading or writing a catalog file failed.
 */
public class CatalogIoException extends RuntimeException {
    private final Path path;

    public CatalogIoException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
