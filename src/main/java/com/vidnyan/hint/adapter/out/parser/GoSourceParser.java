package com.vidnyan.hint.adapter.out.parser;

import com.vidnyan.hint.application.port.out.SourceCodeParser;
import com.vidnyan.hint.application.port.out.SourceParseException;
import com.vidnyan.hint.domain.ast.GoFile;
import com.vidnyan.hint.domain.lint.LineIndex;
import com.vidnyan.hint.domain.lint.Location;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterGo;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.StandardCharsets;

/**
 * Adapter that parses Go source with tree-sitter-go and maps the tree onto the domain syntax tree.
 * Implements the SourceCodeParser port.
 */
@Slf4j
@Component
public class GoSourceParser implements SourceCodeParser {

    /** Syntax nested deeper than this is rejected; rules walk the tree recursively. */
    static final int MAX_NESTING_DEPTH = 1000;

    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterGo());
        return parser;
    });

    @Override
    public GoFile parse(String fileName, byte[] source) throws SourceParseException {
        LineIndex lines = new LineIndex(fileName, source);
        try {
            String text = decode(source);
            TSTree tree = PARSER.get().parseString(null, text);
            TSNode root = tree.getRootNode();

            TreeScan scan = TreeScan.of(root, source, MAX_NESTING_DEPTH);
            CommentIndex comments = new CommentIndex(scan, lines, source.length);
            GoFile file = new GoTreeMapper(source, comments).file(root);
            log.trace("Parsed {}: {} tokens, {} comment groups, {} spans",
                    fileName, scan.tokens().size(), file.comments().size(), file.spans().size());
            return file;
        } catch (ParseError e) {
            Location at = lines.locate(Math.min(Math.max(e.getPos(), 0), source.length));
            throw new SourceParseException(fileName, at.line(), at.column(), e.getMessage());
        }
    }

    /**
     * Strict UTF-8 decoding. A leading byte order mark becomes three spaces so byte offsets in
     * the tree still match the source.
     */
    private static String decode(byte[] source) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder();
        ByteBuffer in = ByteBuffer.wrap(source);
        CharBuffer out = CharBuffer.allocate(source.length);
        CoderResult result = decoder.decode(in, out, true);
        if (result.isError()) {
            throw new ParseError(in.position(), "illegal UTF-8 encoding");
        }
        decoder.flush(out);
        out.flip();
        String text = out.toString();
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = "   " + text.substring(1);
        }
        return text;
    }
}
