package com.brewuv.input;

import com.brewuv.core.diagnostics.CauseCode;
import com.brewuv.core.diagnostics.Outcome;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Local instrument file. A missing file is an unavailable outcome; a malformed one throws from the reader.
 */
public final class FileSource<T> implements DataSource<T> {

    @FunctionalInterface
    public interface Reader<T> {
        T read(Path path) throws IOException;
    }

    private final Path path;
    private final Reader<T> reader;

    public FileSource(Path path, Reader<T> reader) {
        this.path = path;
        this.reader = reader;
    }

    @Override
    public String name() {
        return path == null ? "file" : "file:" + path.getFileName();
    }

    @Override
    public Outcome<T> fetch() {
        if (path == null) {
            return Outcome.failure(CauseCode.FILE_MISSING, name(), "no file given");
        }
        if (!Files.isRegularFile(path)) {
            return Outcome.failure(CauseCode.FILE_MISSING, name(), path + " does not exist");
        }
        try {
            return Outcome.success(reader.read(path), name());
        } catch (IOException e) {
            return Outcome.failure(CauseCode.RUNTIME_ERROR, name(), "cannot read " + path + ": " + e.getMessage());
        }
    }
}
