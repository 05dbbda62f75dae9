package org.humspine.cli.commands;

import org.humspine.parser.HumdrumFile;
import org.humspine.parser.HumdrumReader;
import org.humspine.parser.util.SpineInfoDump;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Prints a summary of a file, or one of the analysis dumps of {@link SpineInfoDump}.
 */
@Command(name = "info", description = "Prints the spine analysis of a Humdrum file.")
public class InfoCommand extends AbstractParseCommand {

    @Parameters(index = "0", arity = "0..1", defaultValue = "-", paramLabel = "FILE",
            description = "The file to inspect; '-' reads standard input.")
    private String input;

    @Option(names = "--spines", description = "Print the spine-path label of every token.")
    private boolean spines;

    @Option(names = "--tracks", description = "Print the track (and subtrack) of every token.")
    private boolean tracks;

    @Option(names = "--types", description = "Print the datatype of every token.")
    private boolean types;

    @Option(names = "--links", description = "Print the backward and forward link counts of every token.")
    private boolean links;

    @Override
    protected int run(HumdrumReader reader) {
        HumdrumFile file = read(reader, input);
        if (!reportIfInvalid(file)) {
            return EXIT_INVALID;
        }
        if (spines) out().print(SpineInfoDump.spineInfo(file));
        if (tracks) out().print(SpineInfoDump.trackInfo(file));
        if (types) out().print(SpineInfoDump.dataTypeInfo(file));
        if (links) out().print(SpineInfoDump.linkInfo(file));
        if (!(spines || tracks || types || links)) {
            out().printf("Source: %s%n", file.getSourceName());
            out().printf("Lines: %d%n", file.getLineCount());
            out().printf("Tracks: %d%n", file.getMaxTrack());
            for (int track = 1; track <= file.getMaxTrack(); track++) {
                out().printf("  %d: %s (%d end(s))%n", track,
                        file.getTrackStart(track), file.getTrackEndCount(track));
            }
        }
        file.getWarnings().forEach(err()::println);
        return 0;
    }
}
