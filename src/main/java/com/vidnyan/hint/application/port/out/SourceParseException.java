package com.vidnyan.hint.application.port.out;

import lombok.Getter;

/**
 * Raised when a source file is not syntactically valid Go.
 */
@Getter
public class SourceParseException extends Exception {

    private final String fileName;
    private final int line;
    private final int column;

    public SourceParseException(String fileName, int line, int column, String message) {
        super(fileName + ":" + line + ":" + column + ": " + message);
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }
}
