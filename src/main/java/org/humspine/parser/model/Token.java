package org.humspine.parser.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single field of a Humdrum line.
 * <p>
 * Tokens are created by their owning {@link Line} and are linked to the tokens of the previous and
 * next structural lines during analysis. The links form a graph rather than a tree: a split token has two
 * next tokens, and the token after a merge has several previous tokens.
 */
public class Token {

    private final Line owner;
    private String text;
    private TokenType type;

    private int fieldIndex = -1;
    private int track;
    private int subtrack;
    private int subtrackCount;
    private String spineInfo = "";
    private String dataType = "";

    private final List<Token> nextTokens = new ArrayList<>(1);
    private final List<Token> previousTokens = new ArrayList<>(1);
    private final List<Token> nextNonNullTokens = new ArrayList<>(1);
    private final List<Token> previousNonNullTokens = new ArrayList<>(1);

    /**
     * Creates a token owned by the given line.
     * @param owner The line this token belongs to.
     * @param text The raw text of the field.
     */
    public Token(Line owner, String text) {
        this.owner = owner;
        this.text = text == null ? "" : text;
        this.type = TokenType.classify(this.text);
    }

    public Line getOwner() {
        return owner;
    }

    public String getText() {
        return text;
    }

    /**
     * Replaces the token text in place. The owning line's text is not updated until
     * {@link Line#rebuildFromTokens()} is called; the spine structure is not re-analysed.
     * @param text The new text.
     */
    public void setText(String text) {
        this.text = text == null ? "" : text;
        this.type = TokenType.classify(this.text);
    }

    public TokenType getType() {
        return type;
    }

    /**
     * @return The index of the owning line in its file, or -1 when the line is not indexed yet.
     */
    public int getLineIndex() {
        return owner == null ? -1 : owner.getLineIndex();
    }

    /**
     * @return The 1-based line number, for messages.
     */
    public int getLineNumber() {
        return getLineIndex() + 1;
    }

    public int getFieldIndex() {
        return fieldIndex;
    }

    public void setFieldIndex(int fieldIndex) {
        this.fieldIndex = fieldIndex;
    }

    /**
     * @return The track (primary spine) number, or 0 for tokens outside the spine structure.
     */
    public int getTrack() {
        return track;
    }

    public void setTrack(int track) {
        this.track = track;
    }

    /**
     * @return 0 if this is the only token of its track on the line, otherwise the 1-based position
     *         among the line's tokens of the same track.
     */
    public int getSubtrack() {
        return subtrack;
    }

    public int getSubtrackCount() {
        return subtrackCount;
    }

    public void setSubtrack(int subtrack, int subtrackCount) {
        this.subtrack = subtrack;
        this.subtrackCount = subtrackCount;
    }

    /**
     * @return The spine-path label, e.g. {@code "1"}, {@code "(1)a"} or {@code "((2)b)a"}.
     */
    public String getSpineInfo() {
        return spineInfo;
    }

    public void setSpineInfo(String spineInfo) {
        this.spineInfo = spineInfo == null ? "" : spineInfo;
    }

    /**
     * @return The exclusive interpretation governing this token's column, e.g. {@code **kern}.
     */
    public String getDataType() {
        return dataType;
    }

    public void setDataType(String dataType) {
        this.dataType = dataType == null ? "" : dataType;
    }

    // Links

    /**
     * Links this token to a token on the next structural line, adding the reverse link as well.
     * @param next The token that follows this one.
     */
    public void makeForwardLink(Token next) {
        nextTokens.add(next);
        next.previousTokens.add(this);
    }

    public List<Token> getNextTokens() {
        return Collections.unmodifiableList(nextTokens);
    }

    public List<Token> getPreviousTokens() {
        return Collections.unmodifiableList(previousTokens);
    }

    public int getNextTokenCount() {
        return nextTokens.size();
    }

    public int getPreviousTokenCount() {
        return previousTokens.size();
    }

    /**
     * @param index The link index; negative values count from the end.
     * @return The linked token, or {@code null} when the index is out of range.
     */
    public Token getNextToken(int index) {
        return pick(nextTokens, index);
    }

    /**
     * @param index The link index; negative values count from the end.
     * @return The linked token, or {@code null} when the index is out of range.
     */
    public Token getPreviousToken(int index) {
        return pick(previousTokens, index);
    }

    public List<Token> getNextNonNullTokens() {
        return Collections.unmodifiableList(nextNonNullTokens);
    }

    public List<Token> getPreviousNonNullTokens() {
        return Collections.unmodifiableList(previousNonNullTokens);
    }

    /**
     * Adds a non-null neighbour found by the non-null link analysis, ignoring duplicates.
     * @param token The next non-null data token.
     */
    public void addNextNonNullToken(Token token) {
        if (!nextNonNullTokens.contains(token)) {
            nextNonNullTokens.add(token);
        }
    }

    /**
     * Adds a non-null neighbour found by the non-null link analysis, ignoring duplicates.
     * @param token The previous non-null data token.
     */
    public void addPreviousNonNullToken(Token token) {
        if (!previousNonNullTokens.contains(token)) {
            previousNonNullTokens.add(token);
        }
    }

    /**
     * Drops every link and all analysis results so the file can be analysed again.
     */
    public void clearAnalysis() {
        nextTokens.clear();
        previousTokens.clear();
        nextNonNullTokens.clear();
        previousNonNullTokens.clear();
        fieldIndex = -1;
        track = 0;
        subtrack = 0;
        subtrackCount = 0;
        spineInfo = "";
        dataType = "";
    }

    private static Token pick(List<Token> list, int index) {
        int i = index < 0 ? list.size() + index : index;
        return (i < 0 || i >= list.size()) ? null : list.get(i);
    }

    // Classification shortcuts

    public boolean isExclusive() {
        return type == TokenType.EXCLUSIVE;
    }

    public boolean isSplit() {
        return type == TokenType.SPLIT;
    }

    public boolean isMerge() {
        return type == TokenType.MERGE;
    }

    public boolean isExchange() {
        return type == TokenType.EXCHANGE;
    }

    public boolean isAdd() {
        return type == TokenType.ADD;
    }

    public boolean isTerminator() {
        return type == TokenType.TERMINATE;
    }

    public boolean isManipulator() {
        return type.isManipulator();
    }

    public boolean isInterpretation() {
        return type.isInterpretation();
    }

    public boolean isData() {
        return type.isData();
    }

    public boolean isLocalComment() {
        return type == TokenType.LOCAL_COMMENT;
    }

    /**
     * @return {@code true} for the null data token {@code .}.
     */
    public boolean isNullData() {
        return type == TokenType.NULL_DATA;
    }

    /**
     * A token is null when it only holds a place in its spine: null data {@code .}, the null
     * interpretation {@code *} and the null local comment {@code !}.
     * @return {@code true} for placeholder tokens.
     */
    public boolean isNull() {
        return type == TokenType.NULL_DATA || "*".equals(text) || "!".equals(text);
    }

    /**
     * @return {@code true} when this token is part of the spine structure.
     */
    public boolean hasSpines() {
        return owner == null || owner.hasSpines();
    }

    @Override
    public String toString() {
        return text;
    }
}
