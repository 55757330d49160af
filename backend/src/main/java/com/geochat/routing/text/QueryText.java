package com.geochat.routing.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenized view of a query: lower-cased word tokens with their character spans in the
 * original text. All matching in the router is whole-token and case-insensitive.
 */
public final class QueryText {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+(?:['&][\\p{L}\\p{N}]+)*");

    private final String raw;
    private final List<Token> tokens;
    private final Set<String> tokenSet;

    private QueryText(String raw, List<Token> tokens) {
        this.raw = raw;
        this.tokens = Collections.unmodifiableList(tokens);
        Set<String> set = new LinkedHashSet<>();
        for (Token t : tokens) {
            set.add(t.getText());
        }
        this.tokenSet = Collections.unmodifiableSet(set);
    }

    public static QueryText of(String raw) {
        String text = raw == null ? "" : raw;
        List<Token> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            tokens.add(new Token(m.group().toLowerCase(Locale.ROOT), m.start(), m.end()));
        }
        return new QueryText(text, tokens);
    }

    /**
     * Tokenizes a configured term or phrase the same way queries are tokenized.
     */
    public static List<String> tokenize(String phrase) {
        List<String> out = new ArrayList<>();
        for (Token t : of(phrase).tokens) {
            out.add(t.getText());
        }
        return out;
    }

    public String getRaw() {
        return raw;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public String token(int index) {
        return tokens.get(index).getText();
    }

    public boolean contains(String token) {
        return tokenSet.contains(token);
    }

    public boolean containsAll(List<String> phrase) {
        return !phrase.isEmpty() && tokenSet.containsAll(phrase);
    }

    /**
     * Start indexes of every contiguous occurrence of {@code phrase}.
     */
    public List<Integer> occurrences(List<String> phrase) {
        if (phrase.isEmpty() || phrase.size() > tokens.size()) {
            return Collections.emptyList();
        }
        List<Integer> starts = new ArrayList<>();
        for (int i = 0; i + phrase.size() <= tokens.size(); i++) {
            if (matchesAt(phrase, i)) {
                starts.add(i);
            }
        }
        return starts;
    }

    public boolean containsPhrase(List<String> phrase) {
        return !occurrences(phrase).isEmpty();
    }

    public boolean matchesAt(List<String> phrase, int index) {
        if (index < 0 || index + phrase.size() > tokens.size()) {
            return false;
        }
        for (int j = 0; j < phrase.size(); j++) {
            if (!tokens.get(index + j).getText().equals(phrase.get(j))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Original text covered by tokens {@code from}..{@code to} inclusive.
     */
    public String span(int from, int to) {
        return raw.substring(tokens.get(from).getStart(), tokens.get(to).getEnd());
    }

    /**
     * Appends another text (e.g. conversation context) as additional tokens.
     */
    public QueryText with(String more) {
        if (more == null || more.isBlank()) {
            return this;
        }
        return of(raw + "\n" + more);
    }

    public static final class Token {
        private final String text;
        private final int start;
        private final int end;

        Token(String text, int start, int end) {
            this.text = text;
            this.start = start;
            this.end = end;
        }

        public String getText() {
            return text;
        }

        public int getStart() {
            return start;
        }

        public int getEnd() {
            return end;
        }
    }
}
