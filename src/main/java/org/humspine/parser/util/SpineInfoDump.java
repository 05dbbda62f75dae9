package org.humspine.parser.util;

import org.humspine.parser.HumdrumFile;
import org.humspine.parser.model.Line;
import org.humspine.parser.model.Token;

import java.util.function.Function;

/**
 * Renders the analysis results of a file in the shape of the file itself, for debugging.
 * Each structural line prints one tab-separated value per token; global lines print their text.
 */
public final class SpineInfoDump {

    private SpineInfoDump() {}

    /**
     * @param file A parsed file.
     * @return The spine-path label of every token.
     */
    public static String spineInfo(HumdrumFile file) {
        return render(file, Token::getSpineInfo);
    }

    /**
     * @param file A parsed file.
     * @return The datatype of every token.
     */
    public static String dataTypeInfo(HumdrumFile file) {
        return render(file, Token::getDataType);
    }

    /**
     * @param file A parsed file.
     * @return {@code track} for tokens alone in their track, {@code track.subtrack} otherwise.
     */
    public static String trackInfo(HumdrumFile file) {
        return render(file, t -> t.getSubtrack() == 0
                ? String.valueOf(t.getTrack())
                : t.getTrack() + "." + t.getSubtrack());
    }

    /**
     * @param file A parsed file.
     * @return The number of forward links of every token.
     */
    public static String linkInfo(HumdrumFile file) {
        return render(file, t -> t.getPreviousTokenCount() + ">" + t.getNextTokenCount());
    }

    private static String render(HumdrumFile file, Function<Token, String> value) {
        StringBuilder sb = new StringBuilder();
        for (Line line : file) {
            if (!line.hasSpines()) {
                sb.append(line.getText()).append('\n');
                continue;
            }
            for (int i = 0; i < line.getTokenCount(); i++) {
                if (i > 0) sb.append('\t');
                sb.append(value.apply(line.getToken(i)));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
