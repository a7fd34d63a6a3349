package edu.uconn.imat.common.exception;

import edu.uconn.imat.common.errorcode.LoadErrorCode;
import lombok.Getter;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A required input file does not exist.
 */
@Getter
public class MissingFileException extends AbstractLoadException {

    private final Path path;

    public MissingFileException(Path path) {
        super("Required input file not found: " + path, null, LoadErrorCode.MISSING_FILE);
        this.path = path;
    }

    /**
     * Returns {@code path} when it is a regular file, otherwise throws.
     */
    public static Path requireFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new MissingFileException(path);
        }
        return path;
    }
}
