package org.humspine.parser.frontend.links;

import org.humspine.parser.api.ParserErrorCode;
import org.humspine.parser.frontend.StructureException;
import org.humspine.parser.model.Line;
import org.humspine.parser.model.Token;

/**
 * Creates the forward and backward links between the tokens of two consecutive structural lines.
 * <p>
 * The manipulators on the previous line decide how its tokens fan out onto the next line:
 * <ul>
 *     <li>plain tokens and exclusive interpretations continue into one token,</li>
 *     <li>{@code *^} continues into two tokens,</li>
 *     <li>a run of {@code *v} converges into one token,</li>
 *     <li>a pair of {@code *x} continues into two tokens in swapped order,</li>
 *     <li>{@code *-} has no continuation,</li>
 *     <li>{@code *+} continues into one token and is followed by the exclusive interpretation of the new spine.</li>
 * </ul>
 */
public class LineStitcher {

    /**
     * Links the tokens of {@code previous} to the tokens of {@code next}.
     *
     * @param previous The earlier structural line.
     * @param next The following structural line.
     * @throws StructureException if the lines cannot be aligned.
     */
    public void stitch(Line previous, Line next) throws StructureException {
        if (!previous.hasManipulators()) {
            stitchOneToOne(previous, next);
            return;
        }

        int count = previous.getTokenCount();
        int i = 0;
        int ii = 0;
        while (i < count) {
            Token token = previous.getToken(i);
            switch (token.getType()) {
                case SPLIT:
                    token.makeForwardLink(target(previous, next, ii++));
                    token.makeForwardLink(target(previous, next, ii++));
                    i++;
                    break;
                case MERGE: {
                    Token merged = target(previous, next, ii++);
                    while (i < count && previous.getToken(i).isMerge()) {
                        previous.getToken(i).makeForwardLink(merged);
                        i++;
                    }
                    break;
                }
                case EXCHANGE:
                    if (i + 1 >= count || !previous.getToken(i + 1).isExchange()) {
                        throw new StructureException(ParserErrorCode.UNPAIRED_EXCHANGE,
                                "Exchange manipulator without a partner on line " + previous.getLineNumber()
                                        + " at token " + i,
                                previous.getLineNumber(), i);
                    }
                    previous.getToken(i + 1).makeForwardLink(target(previous, next, ii++));
                    token.makeForwardLink(target(previous, next, ii++));
                    i += 2;
                    break;
                case TERMINATE:
                    i++;
                    break;
                case ADD: {
                    Token continuation = target(previous, next, ii);
                    Token opened = target(previous, next, ii + 1);
                    if (!opened.isExclusive()) {
                        throw new StructureException(ParserErrorCode.MISSING_EXCLUSIVE_AFTER_ADD,
                                "Expecting exclusive interpretation on line " + next.getLineNumber()
                                        + " at token " + (ii + 1) + " but got " + opened.getText(),
                                next.getLineNumber(), ii + 1);
                    }
                    token.makeForwardLink(continuation);
                    ii += 2;
                    i++;
                    break;
                }
                default:
                    token.makeForwardLink(target(previous, next, ii++));
                    i++;
                    break;
            }
        }

        if (ii != next.getTokenCount()) {
            throw alignmentError(previous, next, i, ii);
        }
    }

    private void stitchOneToOne(Line previous, Line next) throws StructureException {
        if (previous.getTokenCount() != next.getTokenCount()) {
            throw new StructureException(ParserErrorCode.LINE_LENGTH_MISMATCH,
                    "Error lines " + previous.getLineNumber() + " and " + next.getLineNumber() + " not same length\n"
                            + "Line " + previous.getLineNumber() + ": " + previous.getText() + "\n"
                            + "Line " + next.getLineNumber() + ": " + next.getText(),
                    next.getLineNumber());
        }
        for (int i = 0; i < previous.getTokenCount(); i++) {
            previous.getToken(i).makeForwardLink(next.getToken(i));
        }
    }

    private Token target(Line previous, Line next, int index) throws StructureException {
        if (index >= next.getTokenCount()) {
            throw alignmentError(previous, next, -1, index + 1);
        }
        return next.getToken(index);
    }

    private StructureException alignmentError(Line previous, Line next, int i, int ii) {
        StringBuilder sb = new StringBuilder("Cannot stitch lines ")
                .append(previous.getLineNumber()).append(" and ").append(next.getLineNumber())
                .append(" together due to alignment problem\n")
                .append("Line ").append(previous.getLineNumber()).append(": ").append(previous.getText()).append('\n')
                .append("Line ").append(next.getLineNumber()).append(": ").append(next.getText());
        if (i >= 0) {
            sb.append("\nI = ").append(i).append(" token count ").append(previous.getTokenCount());
        }
        sb.append("\nII = ").append(ii).append(" token count ").append(next.getTokenCount());
        return new StructureException(ParserErrorCode.ALIGNMENT, sb.toString(), next.getLineNumber());
    }
}
