package io.github.cyfko.drlparser.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Keywords introducing a logical construct whose argument list may span several lines and nest.
 *
 * @since 1.0
 */
public enum PatternKeyword {
    EXISTS,
    NOT,
    EVAL,
    FORALL,
    COLLECT,
    ACCUMULATE;

    private final String text = name().toLowerCase(Locale.ROOT);

    /**
     * @return the keyword as written in source, e.g. {@code "exists"}
     */
    public String text() {
        return text;
    }

    /**
     * @return the condition type a condition introduced by this keyword carries
     */
    public ConditionType conditionType() {
        return ConditionType.valueOf(name());
    }

    /**
     * Looks up a keyword by its source spelling.
     *
     * @param word the candidate word (case-sensitive, DRL keywords are lowercase)
     * @return the keyword, or empty if the word is not a pattern keyword
     */
    public static Optional<PatternKeyword> fromText(String word) {
        for (PatternKeyword keyword : values()) {
            if (keyword.text.equals(word)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return text;
    }
}
