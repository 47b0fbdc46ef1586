package com.vidnyan.hint.application.port.in;

import com.vidnyan.hint.application.port.out.SourceParseException;
import com.vidnyan.hint.domain.lint.LintConfig;
import com.vidnyan.hint.domain.lint.Problem;

import java.util.List;

/**
 * Primary use case: lint a single Go source file.
 * This is the main entry point to the application.
 */
public interface LintSourceUseCase {

    /**
     * Lint one file.
     * @param fileName file name; a {@code _test.go} suffix marks a test file
     * @param config lint options, or {@code null} for the defaults
     * @param source raw file contents
     * @return problems at or above the configured minimum confidence, in rule order
     * @throws SourceParseException if the file does not parse; no problems are reported then
     */
    List<Problem> lint(String fileName, LintConfig config, byte[] source) throws SourceParseException;
}
