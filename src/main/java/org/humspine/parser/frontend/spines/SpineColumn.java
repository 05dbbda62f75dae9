package org.humspine.parser.frontend.spines;

/**
 * The state of one active spine column while the file is scanned.
 *
 * @param dataType The exclusive interpretation of the column, or an empty string for a column just opened
 *                 by an add manipulator whose exclusive interpretation has not been read yet.
 * @param spinePath The spine-path label of the column.
 */
public record SpineColumn(String dataType, String spinePath) {

    /**
     * @return The track number encoded in the spine path.
     */
    public int track() {
        return SpinePaths.trackOf(spinePath);
    }
}
