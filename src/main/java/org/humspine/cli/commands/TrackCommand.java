package org.humspine.cli.commands;

import org.humspine.parser.HumdrumFile;
import org.humspine.parser.HumdrumReader;
import org.humspine.parser.api.TrackSequenceOption;
import org.humspine.parser.model.Token;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Command(name = "track", description = "Extracts the tokens of one track.")
public class TrackCommand extends AbstractParseCommand {

    @Parameters(index = "0", arity = "0..1", defaultValue = "-", paramLabel = "FILE",
            description = "The file to read; '-' reads standard input.")
    private String input;

    @Option(names = {"-t", "--track"}, required = true, description = "The track number, starting at 1.")
    private int track;

    @Option(names = "--no-nulls", description = "Leave out null tokens.")
    private boolean noNulls;

    @Option(names = "--no-manipulators", description = "Leave out spine manipulators other than exclusive interpretations and terminators.")
    private boolean noManipulators;

    @Option(names = "--no-globals", description = "Leave out global comments and reference records.")
    private boolean noGlobals;

    @Option(names = "--all-subspines", description = "Print every subspine, one tab-separated line per input line.")
    private boolean allSubspines;

    @Override
    protected int run(HumdrumReader reader) {
        HumdrumFile file = read(reader, input);
        if (!reportIfInvalid(file)) {
            return EXIT_INVALID;
        }
        if (track < 1 || track > file.getMaxTrack()) {
            err().printf("Track %d does not exist; %s has %d track(s)%n",
                    track, file.getSourceName(), file.getMaxTrack());
            return EXIT_INVALID;
        }

        Set<TrackSequenceOption> options = EnumSet.noneOf(TrackSequenceOption.class);
        if (noNulls) options.add(TrackSequenceOption.EXCLUDE_NULLS);
        if (noManipulators) options.add(TrackSequenceOption.EXCLUDE_MANIPULATORS);
        if (noGlobals) options.add(TrackSequenceOption.EXCLUDE_GLOBALS);

        if (allSubspines) {
            for (List<Token> row : file.getTrackSequence(track, options)) {
                out().println(row.stream().map(Token::getText).collect(Collectors.joining("\t")));
            }
        } else {
            for (Token token : file.getPrimaryTrackSequence(track, options)) {
                out().println(token.getText());
            }
        }
        return 0;
    }
}
