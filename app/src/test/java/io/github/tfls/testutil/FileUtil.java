package io.github.tfls.testutil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileUtil {

    private FileUtil() {}

    /** Writes {@code content} to {@code root/relPath}, creating parent directories. Returns the file. */
    public static Path write(Path root, String relPath, String content) throws IOException {
        var file = root.resolve(relPath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
