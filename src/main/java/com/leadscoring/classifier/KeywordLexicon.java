package com.leadscoring.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword phrases compiled into a token prefix tree.
 *
 * Text is lower-cased and split on anything that is not a letter or digit. Scanning is greedy:
 * at each position the longest phrase wins and its tokens are consumed, so "not interested"
 * reports only the categories of that phrase and not those of "interested".
 *
 * Matching is whole-token: "no" does not fire inside "know" or "now". The last token of a phrase
 * also accepts inflected forms once it is at least {@value #MIN_STEM_LENGTH} characters long, so
 * "meeting" matches "meetings" and "schedule" matches "scheduling" (a trailing 'e' is dropped
 * before the prefix test). An exact token always takes precedence over an inflected one.
 *
 * @param <C> category enum a phrase is tagged with
 */
public final class KeywordLexicon<C extends Enum<C>> {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");
    static final int MIN_STEM_LENGTH = 4;

    private final Class<C> categoryType;
    private final Node<C> root;

    private KeywordLexicon(Class<C> categoryType, Node<C> root) {
        this.categoryType = categoryType;
        this.root = root;
    }

    public static <C extends Enum<C>> Builder<C> builder(Class<C> categoryType) {
        return new Builder<>(categoryType);
    }

    /**
     * Categories of every phrase found in the text. Never null; empty for null or blank text.
     */
    public Set<C> match(String text) {
        EnumSet<C> hits = EnumSet.noneOf(categoryType);
        List<String> tokens = tokenize(text);
        int position = 0;
        while (position < tokens.size()) {
            Node<C> node = root;
            Set<C> longest = null;
            int longestEnd = position;
            for (int i = position; i < tokens.size(); i++) {
                Node<C> next = node.children.get(tokens.get(i));
                if (next == null) {
                    Set<C> inflected = node.inflectedMatch(tokens.get(i));
                    if (!inflected.isEmpty()) {
                        longest = inflected;
                        longestEnd = i;
                    }
                    break;
                }
                node = next;
                if (!node.categories.isEmpty()) {
                    longest = node.categories;
                    longestEnd = i;
                }
            }
            if (longest != null) {
                hits.addAll(longest);
                position = longestEnd + 1;
            } else {
                position++;
            }
        }
        return hits;
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static final class Node<C extends Enum<C>> {
        private final Map<String, Node<C>> children = new HashMap<>();
        private final EnumSet<C> categories;

        private Node(Class<C> categoryType) {
            this.categories = EnumSet.noneOf(categoryType);
        }

        /**
         * Categories of the phrase-ending children whose stem starts the token.
         */
        private Set<C> inflectedMatch(String token) {
            Set<C> hits = null;
            for (Map.Entry<String, Node<C>> child : children.entrySet()) {
                String keyword = child.getKey();
                if (child.getValue().categories.isEmpty() || keyword.length() < MIN_STEM_LENGTH) {
                    continue;
                }
                if (token.startsWith(stem(keyword))) {
                    if (hits == null) {
                        hits = EnumSet.copyOf(child.getValue().categories);
                    } else {
                        hits.addAll(child.getValue().categories);
                    }
                }
            }
            return hits == null ? Collections.emptySet() : hits;
        }

        private static String stem(String keyword) {
            return keyword.endsWith("e") ? keyword.substring(0, keyword.length() - 1) : keyword;
        }
    }

    public static final class Builder<C extends Enum<C>> {

        private final Class<C> categoryType;
        private final Node<C> root;

        private Builder(Class<C> categoryType) {
            this.categoryType = categoryType;
            this.root = new Node<>(categoryType);
        }

        /**
         * Tag every phrase with the category. A phrase may carry several categories.
         */
        public Builder<C> add(C category, String... phrases) {
            for (String phrase : phrases) {
                List<String> tokens = tokenize(phrase);
                if (tokens.isEmpty()) {
                    throw new IllegalArgumentException("Blank phrase for category " + category);
                }
                Node<C> node = root;
                for (String token : tokens) {
                    node = node.children.computeIfAbsent(token, t -> new Node<>(categoryType));
                }
                node.categories.add(category);
            }
            return this;
        }

        public KeywordLexicon<C> build() {
            return new KeywordLexicon<>(categoryType, root);
        }
    }
}
