package de.bsommerfeld.checksum.walk;

import java.util.regex.Pattern;

/**
 * Simple wildcard pattern: {@code *} matches any run of characters, {@code ?}
 * matches exactly one character, everything else (including {@code .}) is
 * literal. Path separators are not special, so a pattern can match across
 * directory components.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern pattern;

    private GlobPattern(String glob, Pattern pattern) {
        this.glob = glob;
        this.pattern = pattern;
    }

    public static GlobPattern compile(String glob) {
        return new GlobPattern(glob, Pattern.compile(toRegex(glob)));
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                appendLiteral(regex, literal);
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        appendLiteral(regex, literal);
        return regex.toString();
    }

    private static void appendLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    /** Whether the pattern matches anywhere within {@code candidate}. */
    public boolean find(CharSequence candidate) {
        return pattern.matcher(candidate).find();
    }

    /** Whether the pattern matches the whole of {@code candidate}. */
    public boolean matchesFully(CharSequence candidate) {
        return pattern.matcher(candidate).matches();
    }

    @Override
    public String toString() {
        return glob;
    }
}
