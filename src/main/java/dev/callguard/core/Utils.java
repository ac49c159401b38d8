package dev.callguard.core;

import java.util.regex.Pattern;

public class Utils {

    /**
     * Compiles a glob into an anchored regular expression.
     * {@code *} matches zero or more characters and {@code ?} exactly one; everything else is literal.
     *
     * @param glob the pattern, e.g. {@code user:*} or {@code order:??}
     * @return a pattern that must match the whole key
     */
    public static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                flushLiteral(regex, literal);
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        flushLiteral(regex, literal);
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    /**
     * Masks a credential for diagnostics, keeping at most the last four characters.
     */
    public static String mask(String credential) {
        if (credential == null || credential.length() <= 4) {
            return "****";
        }
        return "****" + credential.substring(credential.length() - 4);
    }
}
