package org.humspine.parser.model;

import org.humspine.parser.frontend.lexer.LineClassifier;
import org.humspine.parser.frontend.lexer.LineTokenizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One line of a Humdrum file together with the tokens parsed from it.
 * <p>
 * The line owns its tokens. Token text may be edited in place and written back with
 * {@link #rebuildFromTokens()}; the token list itself is only replaced by {@link #retokenize()}.
 */
public class Line {

    private String text;
    private final List<Token> tokens = new ArrayList<>();
    private LineType type = LineType.EMPTY;
    private int lineIndex = -1;

    /**
     * Creates a line and tokenizes it.
     * @param text The raw line text without the line terminator.
     */
    public Line(String text) {
        this.text = text == null ? "" : text;
        retokenize();
    }

    /**
     * Splits the current text into tokens again, dropping all previous tokens and their links.
     */
    public void retokenize() {
        tokens.clear();
        for (String field : LineTokenizer.splitFields(text)) {
            tokens.add(new Token(this, field));
        }
        type = LineClassifier.classify(tokens);
    }

    /**
     * Rebuilds the line text from the current token texts, joined by tabs.
     */
    public void rebuildFromTokens() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            if (i > 0) sb.append(LineTokenizer.FIELD_SEPARATOR);
            sb.append(tokens.get(i).getText());
        }
        text = sb.toString();
        type = LineClassifier.classify(tokens);
    }

    public String getText() {
        return text;
    }

    public List<Token> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    public int getTokenCount() {
        return tokens.size();
    }

    /**
     * @param index The field index; negative values count from the end of the line.
     * @return The token at the given field.
     * @throws IndexOutOfBoundsException if the index is outside the line.
     */
    public Token getToken(int index) {
        int i = index < 0 ? tokens.size() + index : index;
        return tokens.get(i);
    }

    public String getTokenString(int index) {
        return getToken(index).getText();
    }

    public int getLineIndex() {
        return lineIndex;
    }

    /**
     * Assigns the position of this line within its file. The index can only be set once.
     * @param lineIndex The 0-based line index.
     */
    public void setLineIndex(int lineIndex) {
        if (this.lineIndex >= 0 && this.lineIndex != lineIndex) {
            throw new IllegalStateException("Line index already assigned: " + this.lineIndex);
        }
        this.lineIndex = lineIndex;
    }

    /**
     * @return The 1-based line number.
     */
    public int getLineNumber() {
        return lineIndex + 1;
    }

    public LineType getType() {
        return type;
    }

    public boolean hasSpines() {
        return type.hasSpines();
    }

    /**
     * @return {@code true} if any token changes the spine structure, exclusive interpretations included.
     */
    public boolean hasManipulators() {
        if (!hasSpines()) {
            return false;
        }
        for (Token token : tokens) {
            if (token.isManipulator()) return true;
        }
        return false;
    }

    public boolean isExclusive() {
        return hasSpines() && !tokens.isEmpty() && tokens.get(0).isExclusive();
    }

    public boolean isInterpretation() {
        return hasSpines() && !tokens.isEmpty() && tokens.get(0).isInterpretation();
    }

    public boolean isData() {
        return type == LineType.DATA;
    }

    public boolean isLocalComment() {
        return type == LineType.LOCAL_COMMENT;
    }

    public boolean isGlobalComment() {
        return type == LineType.GLOBAL_COMMENT || type == LineType.REFERENCE;
    }

    public boolean isReference() {
        return type == LineType.REFERENCE;
    }

    public boolean isEmpty() {
        return type == LineType.EMPTY;
    }

    /**
     * @return The key of a reference record ({@code !!!COM: Bach} gives {@code COM}), or an empty string.
     */
    public String getReferenceKey() {
        if (!isReference()) return "";
        int colon = text.indexOf(':');
        return text.substring(3, colon).trim();
    }

    /**
     * @return The value of a reference record ({@code !!!COM: Bach} gives {@code Bach}), or an empty string.
     */
    public String getReferenceValue() {
        if (!isReference()) return "";
        int colon = text.indexOf(':');
        return text.substring(colon + 1).trim();
    }

    /**
     * Clears links and per-token analysis results of every token on this line.
     */
    public void clearAnalysis() {
        for (Token token : tokens) {
            token.clearAnalysis();
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
