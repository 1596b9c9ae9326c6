package org.arenasync.arena.chat;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;
import java.util.Map;

/**
 * Masks configured terms with {@code *}, matching case-insensitively anywhere in the
 * text, so a disallowed term is never delivered verbatim, even when embedded in a
 * longer word. Control characters are removed. A message with more than
 * {@code maxMatches} masked terms is rejected.
 * <p>
 * <strong>Configuration Options:</strong>
 * <ul>
 *   <li><b>words</b>: disallowed terms (default: none)</li>
 *   <li><b>maxMatches</b>: masked terms tolerated per message (default: 3)</li>
 * </ul>
 */
public class WordListModerationFilter implements IModerationFilter {

    private final List<String> words;
    private final int maxMatches;

    public WordListModerationFilter(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
            "words", List.of(),
            "maxMatches", 3
        ));
        Config config = options.withFallback(defaults);
        this.words = config.getStringList("words").stream()
            .map(String::strip)
            .filter(word -> !word.isEmpty())
            .toList();
        this.maxMatches = config.getInt("maxMatches");
    }

    @Override
    public ModerationVerdict moderate(String text) {
        StringBuilder cleaned = new StringBuilder(text.length());
        text.codePoints()
            .filter(cp -> !Character.isISOControl(cp))
            .forEach(cleaned::appendCodePoint);

        char[] chars = cleaned.toString().toCharArray();
        String source = cleaned.toString();
        int matches = 0;
        for (String word : words) {
            int from = 0;
            while (from + word.length() <= source.length()) {
                int at = indexOfIgnoreCase(source, word, from);
                if (at < 0) {
                    break;
                }
                for (int i = at; i < at + word.length(); i++) {
                    chars[i] = '*';
                }
                matches++;
                from = at + 1;
            }
        }
        String result = new String(chars);
        return new ModerationVerdict(result, matches > 0 || result.length() != text.length(), matches > maxMatches);
    }

    private static int indexOfIgnoreCase(String text, String word, int from) {
        for (int i = from; i + word.length() <= text.length(); i++) {
            if (text.regionMatches(true, i, word, 0, word.length())) {
                return i;
            }
        }
        return -1;
    }
}
