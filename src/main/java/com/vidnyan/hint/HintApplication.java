package com.vidnyan.hint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Hint - style checker for Go source files.
 * <p>
 * Lints the files under {@code hint.lint.paths} and exits with status 1 when problems were found.
 */
@SpringBootApplication
public class HintApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(HintApplication.class, args)));
    }
}
