package com.vidnyan.hint.application.port.out;

import com.vidnyan.hint.domain.ast.GoFile;

/**
 * Port for parsing Go source into the syntax tree the rules inspect.
 * Implemented by adapters (e.g., the tree-sitter Go parser).
 */
public interface SourceCodeParser {

    /**
     * Parse one file, keeping comments.
     * @param fileName name used in positions and error messages
     * @param source raw UTF-8 file contents
     * @return the file's syntax tree; node positions are byte offsets into {@code source}
     * @throws SourceParseException if the source is not valid Go
     */
    GoFile parse(String fileName, byte[] source) throws SourceParseException;
}
