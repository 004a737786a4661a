package com.brewuv.parse;

/**
 * Input file content that does not follow its format. Line numbers start at 1; 0 means the whole file.
 */
public class MalformedInputException extends RuntimeException {
    private final String fileName;
    private final int lineNumber;

    public MalformedInputException(String fileName, int lineNumber, String message) {
        super(format(fileName, lineNumber, message));
        this.fileName = fileName == null ? "" : fileName;
        this.lineNumber = Math.max(0, lineNumber);
    }

    public MalformedInputException(String fileName, int lineNumber, String message, Throwable cause) {
        super(format(fileName, lineNumber, message), cause);
        this.fileName = fileName == null ? "" : fileName;
        this.lineNumber = Math.max(0, lineNumber);
    }

    public String getFileName() {
        return fileName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    private static String format(String fileName, int lineNumber, String message) {
        String location = lineNumber > 0 ? fileName + ":" + lineNumber : fileName;
        return location + ": " + message;
    }
}
