package org.humspine.parser.frontend.tracks;

import org.humspine.parser.api.ParserErrorCode;
import org.humspine.parser.frontend.StructureException;
import org.humspine.parser.frontend.spines.SpinePaths;
import org.humspine.parser.model.Line;
import org.humspine.parser.model.Token;

import java.util.HashMap;
import java.util.Map;

/**
 * Assigns track and subtrack numbers to the tokens of a line.
 * <p>
 * The track is read from the token's spine path. A token that is alone in its track on a line has
 * subtrack 0; otherwise the tokens of the track are numbered 1, 2, ... from left to right.
 * Tokens of lines without spine structure get track 0.
 */
public class TrackAnalyzer {

    /**
     * @param line The line to analyse.
     * @throws StructureException if a structural token has no track.
     */
    public void analyze(Line line) throws StructureException {
        if (!line.hasSpines()) {
            for (Token token : line.getTokens()) {
                token.setFieldIndex(0);
                token.setTrack(0);
                token.setSubtrack(0, 0);
            }
            return;
        }

        Map<Integer, Integer> counts = new HashMap<>();
        for (int i = 0; i < line.getTokenCount(); i++) {
            Token token = line.getToken(i);
            int track = SpinePaths.trackOf(token.getSpineInfo());
            if (track <= 0) {
                throw new StructureException(ParserErrorCode.INTERNAL,
                        "No track assigned to token '" + token.getText() + "'", line.getLineNumber(), i);
            }
            token.setTrack(track);
            counts.merge(track, 1, Integer::sum);
        }

        Map<Integer, Integer> seen = new HashMap<>();
        for (Token token : line.getTokens()) {
            int total = counts.get(token.getTrack());
            if (total == 1) {
                token.setSubtrack(0, 1);
            } else {
                int position = seen.merge(token.getTrack(), 1, Integer::sum);
                token.setSubtrack(position, total);
            }
        }
    }
}
