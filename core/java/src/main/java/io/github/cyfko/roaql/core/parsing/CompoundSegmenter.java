package io.github.cyfko.roaql.core.parsing;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the raw argument of a compound operator into its top-level sub-expressions.
 * <p>
 * Commas separate sub-expressions only at parenthesis depth zero and outside quoted strings and
 * JSON arrays or objects, so arbitrarily nested compounds stay in one piece:
 * </p>
 * <pre>{@code
 * CompoundSegmenter.split("eq(a,1),or(eq(b,2),eq(c,\"x,y\")),in(d,[1,2])");
 * // ["eq(a,1)", "or(eq(b,2),eq(c,\"x,y\"))", "in(d,[1,2])"]
 * }</pre>
 * <p>Segments are trimmed and returned in textual order. An empty input yields one empty segment.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CompoundSegmenter {

    private CompoundSegmenter() {}

    public static List<String> split(String rawArgument) {
        List<String> segments = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;

        while (i < rawArgument.length()) {
            char c = rawArgument.charAt(i);

            if (c == '"' || c == '[' || c == '{') {
                int next = ExpressionLexer.skipLiteral(rawArgument, i);
                i = next < 0 ? rawArgument.length() : next;
                continue;
            }

            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                segments.add(rawArgument.substring(start, i).trim());
                start = i + 1;
            }
            i++;
        }

        segments.add(rawArgument.substring(start).trim());
        return segments;
    }
}
