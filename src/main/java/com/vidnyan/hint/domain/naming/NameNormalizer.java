package com.vidnyan.hint.domain.naming;

import java.util.Locale;
import java.util.Set;

/**
 * Computes the conventional MixedCaps spelling of an identifier.
 * <p>
 * The name is split into words at underscores (a run of underscores is one boundary and is
 * removed) and at every lower case to non-lower case transition. Words that are known
 * initialisms are upper-cased, or lower-cased when they open an unexported name; other
 * all-lower-case words after the first get a capital first letter.
 */
public final class NameNormalizer {

    private static final String BLANK = "_";

    private NameNormalizer() {
    }

    /**
     * @param initialisms upper-case initialisms, e.g. {@code ID}, {@code URL}
     * @return the normalized name, or the name itself when it is already conventional
     */
    public static String normalize(String name, Set<String> initialisms) {
        // Removing underscores can join a word to an initialism, so repeat until nothing changes.
        // Each pass only drops underscores or upper-cases letters, which bounds the loop.
        String current = name;
        String next = normalizeOnce(current, initialisms);
        while (!next.equals(current)) {
            current = next;
            next = normalizeOnce(current, initialisms);
        }
        return current;
    }

    private static String normalizeOnce(String name, Set<String> initialisms) {
        if (name.equals(BLANK) || isAllLower(name)) {
            return name;
        }

        int[] runes = name.codePoints().toArray();
        int length = runes.length;
        int w = 0;
        int i = 0;
        while (i + 1 <= length) {
            boolean endOfWord = false;
            if (i + 1 == length) {
                endOfWord = true;
            } else if (runes[i + 1] == '_') {
                endOfWord = true;
                int n = 1;
                while (i + n + 1 < length && runes[i + n + 1] == '_') {
                    n++;
                }
                System.arraycopy(runes, i + n + 1, runes, i + 1, length - (i + n + 1));
                length -= n;
            } else if (Character.isLowerCase(runes[i]) && !Character.isLowerCase(runes[i + 1])) {
                endOfWord = true;
            }
            i++;
            if (!endOfWord) {
                continue;
            }

            // [w, i) is a word.
            String word = new String(runes, w, i - w);
            String upper = word.toUpperCase(Locale.ROOT);
            if (initialisms.contains(upper)) {
                String canonical = (w == 0 && Character.isLowerCase(runes[w]))
                        ? upper.toLowerCase(Locale.ROOT)
                        : upper;
                int[] replacement = canonical.codePoints().toArray();
                if (replacement.length == i - w) {
                    System.arraycopy(replacement, 0, runes, w, replacement.length);
                }
            } else if (w > 0 && word.toLowerCase(Locale.ROOT).equals(word)) {
                runes[w] = Character.toUpperCase(runes[w]);
            }
            w = i;
        }
        return new String(runes, 0, length);
    }

    private static boolean isAllLower(String name) {
        return name.codePoints().allMatch(Character::isLowerCase);
    }
}
