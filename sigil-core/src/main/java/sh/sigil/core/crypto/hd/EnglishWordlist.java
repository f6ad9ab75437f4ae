// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.hd;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * BIP-39 English wordlist, loaded once from the classpath resource {@code /bip39-english.txt}.
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0039/english.txt">english.txt</a>
 */
final class EnglishWordlist {

    static final int WORDLIST_SIZE = 2048;
    private static final String RESOURCE_PATH = "/bip39-english.txt";

    private static final List<String> WORDS;
    private static final Map<String, Integer> WORD_TO_INDEX;

    static {
        try {
            final List<String> words = loadWordlist();
            WORDS = Collections.unmodifiableList(words);

            final var wordToIndex = new HashMap<String, Integer>(WORDLIST_SIZE * 2);
            for (int i = 0; i < words.size(); i++) {
                if (wordToIndex.put(words.get(i), i) != null) {
                    throw new IOException("Duplicate word in wordlist at line " + (i + 1));
                }
            }
            WORD_TO_INDEX = Collections.unmodifiableMap(wordToIndex);
        } catch (IOException e) {
            throw new ExceptionInInitializerError("Failed to load BIP-39 English wordlist: " + e.getMessage());
        }
    }

    private EnglishWordlist() {
    }

    /**
     * @param index the wordlist index (0-2047)
     * @return the word at the given index
     * @throws IndexOutOfBoundsException if index is not in range [0, 2047]
     */
    static String getWord(final int index) {
        return WORDS.get(index);
    }

    /**
     * @param word the word to look up
     * @return the 11-bit index of the word
     * @throws IllegalArgumentException if the word is not in the wordlist
     */
    static int getIndex(final String word) {
        Objects.requireNonNull(word, "word cannot be null");
        final Integer index = WORD_TO_INDEX.get(word);
        if (index == null) {
            // the word itself may belong to a secret phrase
            throw new IllegalArgumentException("Word not found in BIP-39 wordlist");
        }
        return index;
    }

    static boolean contains(final String word) {
        return word != null && WORD_TO_INDEX.containsKey(word);
    }

    private static List<String> loadWordlist() throws IOException {
        try (InputStream is = EnglishWordlist.class.getResourceAsStream(RESOURCE_PATH)) {
            if (is == null) {
                throw new IOException("Resource not found: " + RESOURCE_PATH);
            }

            final var words = new ArrayList<String>(WORDLIST_SIZE);
            try (var reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    final String trimmed = line.trim();
                    if (!trimmed.isEmpty()) {
                        words.add(trimmed);
                    }
                }
            }

            if (words.size() != WORDLIST_SIZE) {
                throw new IOException(
                        "Invalid wordlist size: expected " + WORDLIST_SIZE + " words, got " + words.size());
            }
            return words;
        }
    }
}
