package org.humspine.parser.frontend.lexer;

import org.humspine.parser.model.LineType;
import org.humspine.parser.model.Token;
import org.humspine.parser.model.TokenType;

import java.util.List;

/**
 * Determines the {@link LineType} of a tokenized line.
 * Whether a line takes part in the spine structure depends on its first token only.
 * A line is {@link LineType#EMPTY} only when it has no text at all; a line that starts with a tab
 * has an empty first field and counts as data.
 */
public final class LineClassifier {

    private LineClassifier() {}

    /**
     * Classifies a line by its tokens.
     * @param tokens The tokens of the line, in field order.
     * @return The line type.
     */
    public static LineType classify(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return LineType.EMPTY;
        }
        Token first = tokens.get(0);
        switch (first.getType()) {
            case EMPTY:
                return tokens.size() == 1 ? LineType.EMPTY : LineType.DATA;
            case GLOBAL_COMMENT:
                return isReferenceRecord(first.getText()) ? LineType.REFERENCE : LineType.GLOBAL_COMMENT;
            case LOCAL_COMMENT:
                return LineType.LOCAL_COMMENT;
            case DATA:
            case NULL_DATA:
                return LineType.DATA;
            default:
                return classifyInterpretationLine(tokens);
        }
    }

    /**
     * @param text The text of a line.
     * @return {@code true} if the line is a reference record such as {@code !!!COM: Bach}.
     */
    public static boolean isReferenceRecord(String text) {
        return text.startsWith("!!!") && !text.startsWith("!!!!") && text.indexOf(':') > 3;
    }

    private static LineType classifyInterpretationLine(List<Token> tokens) {
        for (Token token : tokens) {
            TokenType type = token.getType();
            if (type != TokenType.EXCLUSIVE && type.isManipulator()) {
                return LineType.MANIPULATOR;
            }
        }
        return tokens.get(0).isExclusive() ? LineType.EXCLUSIVE : LineType.INTERPRETATION;
    }
}
