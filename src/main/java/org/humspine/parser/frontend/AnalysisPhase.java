package org.humspine.parser.frontend;

/**
 * Defines the phases of the analysis pipeline, in execution order.
 * A failing phase stops the pipeline; later phases never see a structurally invalid file.
 */
public enum AnalysisPhase {
    /** Phase 0: splits every raw line into tokens. */
    TOKENIZE,
    /** Phase 1: stores each line's position in the file. */
    INDEX_LINES,
    /** Phase 2: validates spine widths and assigns spine-path labels, datatypes and track starts/ends. */
    SPINES,
    /** Phase 3: links the tokens of consecutive structural lines. */
    LINKS,
    /** Phase 4: assigns track and subtrack numbers. */
    TRACKS,
    /** Phase 5: links data tokens to their nearest non-null neighbours. Optional. */
    NON_NULL_LINKS
}
