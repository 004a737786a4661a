package com.brewuv.parse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Line access to instrument files. Files are read as ISO-8859-1 so that any byte sequence decodes;
 * carriage returns become spaces.
 */
final class InputText {

    private InputText() {
    }

    static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.ISO_8859_1);
    }

    static List<String> lines(String content) {
        List<String> out = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return out;
        }
        for (String line : content.split("\n", -1)) {
            out.add(line.replace('\r', ' '));
        }
        // a trailing newline does not start another line
        if (!out.isEmpty() && content.endsWith("\n")) {
            out.remove(out.size() - 1);
        }
        return out;
    }

    static double parseDouble(String fileName, int lineNumber, String raw, String what) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new MalformedInputException(fileName, lineNumber, "invalid " + what + " '" + raw + "'", e);
        }
    }

    static int parseInt(String fileName, int lineNumber, String raw, String what) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new MalformedInputException(fileName, lineNumber, "invalid " + what + " '" + raw + "'", e);
        }
    }
}
