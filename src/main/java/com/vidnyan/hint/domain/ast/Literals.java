package com.vidnyan.hint.domain.ast;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Decoding of Go string literals as they appear in source.
 */
public final class Literals {

    private Literals() {
    }

    /**
     * The value of an interpreted ("...") or raw (`...`) string literal.
     * Empty if the literal is malformed.
     */
    public static Optional<String> unquote(String literal) {
        if (literal.length() < 2) {
            return Optional.empty();
        }
        char quote = literal.charAt(0);
        if (literal.charAt(literal.length() - 1) != quote) {
            return Optional.empty();
        }
        String body = literal.substring(1, literal.length() - 1);
        if (quote == '`') {
            return Optional.of(body.replace("\r", ""));
        }
        if (quote != '"') {
            return Optional.empty();
        }
        byte[] in = body.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream(in.length);
        int i = 0;
        while (i < in.length) {
            byte b = in[i];
            if (b != '\\') {
                out.write(b);
                i++;
                continue;
            }
            if (i + 1 >= in.length) {
                return Optional.empty();
            }
            char c = (char) in[i + 1];
            i += 2;
            switch (c) {
                case 'a' -> out.write(0x07);
                case 'b' -> out.write('\b');
                case 'f' -> out.write('\f');
                case 'n' -> out.write('\n');
                case 'r' -> out.write('\r');
                case 't' -> out.write('\t');
                case 'v' -> out.write(0x0B);
                case '\\' -> out.write('\\');
                case '"' -> out.write('"');
                case 'x' -> {
                    int v = hex(in, i, 2);
                    if (v < 0) {
                        return Optional.empty();
                    }
                    out.write(v);
                    i += 2;
                }
                case 'u', 'U' -> {
                    int n = c == 'u' ? 4 : 8;
                    int v = hex(in, i, n);
                    if (v < 0 || !Character.isValidCodePoint(v)) {
                        return Optional.empty();
                    }
                    byte[] utf8 = new String(Character.toChars(v)).getBytes(StandardCharsets.UTF_8);
                    out.write(utf8, 0, utf8.length);
                    i += n;
                }
                case '0', '1', '2', '3', '4', '5', '6', '7' -> {
                    if (i + 1 >= in.length) {
                        return Optional.empty();
                    }
                    int v = 0;
                    for (int k = i - 1; k < i + 2; k++) {
                        int d = in[k] - '0';
                        if (d < 0 || d > 7) {
                            return Optional.empty();
                        }
                        v = v * 8 + d;
                    }
                    if (v > 255) {
                        return Optional.empty();
                    }
                    out.write(v);
                    i += 2;
                }
                default -> {
                    return Optional.empty();
                }
            }
        }
        return Optional.of(out.toString(StandardCharsets.UTF_8));
    }

    private static int hex(byte[] in, int from, int n) {
        if (from + n > in.length) {
            return -1;
        }
        int v = 0;
        for (int k = from; k < from + n; k++) {
            int d = Character.digit(in[k], 16);
            if (d < 0) {
                return -1;
            }
            v = v * 16 + d;
        }
        return v;
    }
}
