package com.lunar.script.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds raw source lines into logical lines, one complete top-level statement
 * each, by counting block openers against lines that read exactly {@code end}.
 *
 * Comment stripping and quote normalization are plain text operations: a
 * {@code --} or a single quote inside a string literal is not protected.
 */
public final class LinePreprocessor {

    private static final String COMMENT = "--";
    private static final String[] BLOCK_OPENERS = { "if ", "for ", "while ", "function ", "local function" };

    private LinePreprocessor() {}

    public static List<String> process(List<String> rawLines) {
        List<String> logical = new ArrayList<>();
        StringBuilder block = new StringBuilder();
        int depth = 0;

        for (String raw : rawLines) {
            String line = clean(raw);
            if (line.isEmpty()) continue;

            if (depth == 0 && opensBlock(line)) {
                depth = 1;
                block.append(line).append(' ');
                continue;
            }

            if (depth > 0) {
                if (opensBlock(line)) depth++;
                block.append(line).append(' ');

                if (line.equalsIgnoreCase("end")) {
                    depth--;
                    if (depth == 0) {
                        logical.add(block.toString().trim());
                        block.setLength(0);
                    }
                }
                continue;
            }

            logical.add(line);
        }

        // unterminated block: keep what we have
        if (block.length() > 0) {
            logical.add(block.toString().trim());
        }
        return logical;
    }

    /** Quote normalization, comment removal and trimming for one raw line. */
    static String clean(String raw) {
        if (raw == null) return "";
        String line = raw.replace('\'', '"');
        int comment = line.indexOf(COMMENT);
        if (comment >= 0) line = line.substring(0, comment);
        return line.trim();
    }

    static boolean opensBlock(String trimmed) {
        for (String opener : BLOCK_OPENERS) {
            if (trimmed.startsWith(opener)) return true;
        }
        return false;
    }
}
