package com.vidnyan.hint.adapter.out.parser;

import lombok.Getter;

/**
 * Aborts scanning or parsing at the first syntax error.
 */
@Getter
class ParseError extends RuntimeException {

    private final int pos;

    ParseError(int pos, String message) {
        super(message);
        this.pos = pos;
    }
}
