package org.humspine.parser.frontend.links;

import org.humspine.parser.model.Line;
import org.humspine.parser.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Links every data token to the nearest non-null data tokens before and after it in its spine,
 * skipping null data tokens and non-data lines.
 * <p>
 * One sweep runs top-down over the already linked graph and one bottom-up. Each token carries the set of
 * non-null data tokens that are "visible" from it, so every link is followed once. After a merge a token
 * may see several previous tokens; before a split, several next ones.
 */
public class NonNullLinker {

    /**
     * @param lines All lines of the file in order; lines without spines are skipped.
     */
    public void link(List<Line> lines) {
        Map<Token, Set<Token>> visible = new IdentityHashMap<>();
        for (Line line : lines) {
            if (!line.hasSpines()) continue;
            for (Token token : line.getTokens()) {
                Set<Token> incoming = collect(token.getPreviousTokens(), visible);
                if (token.isData()) {
                    incoming.forEach(token::addPreviousNonNullToken);
                }
                visible.put(token, isNonNullData(token) ? Collections.singleton(token) : incoming);
            }
        }

        visible.clear();
        List<Line> reversed = new ArrayList<>(lines);
        Collections.reverse(reversed);
        for (Line line : reversed) {
            if (!line.hasSpines()) continue;
            for (Token token : line.getTokens()) {
                Set<Token> incoming = collect(token.getNextTokens(), visible);
                if (token.isData()) {
                    incoming.forEach(token::addNextNonNullToken);
                }
                visible.put(token, isNonNullData(token) ? Collections.singleton(token) : incoming);
            }
        }
    }

    private static Set<Token> collect(List<Token> neighbours, Map<Token, Set<Token>> visible) {
        Set<Token> result = new LinkedHashSet<>();
        for (Token neighbour : neighbours) {
            Set<Token> seen = visible.get(neighbour);
            if (seen != null) {
                result.addAll(seen);
            }
        }
        return result;
    }

    private static boolean isNonNullData(Token token) {
        return token.isData() && !token.isNullData();
    }
}
