package org.humspine.cli.commands;

import org.humspine.parser.HumdrumFile;
import org.humspine.parser.HumdrumReader;
import org.humspine.parser.diagnostics.Diagnostic;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

@Command(name = "check", description = "Validates the spine structure of Humdrum files.")
public class CheckCommand extends AbstractParseCommand {

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "Files to check; '-' or none reads standard input.")
    private List<String> files;

    @Override
    protected int run(HumdrumReader reader) {
        List<String> inputs = files == null || files.isEmpty() ? List.of("-") : files;
        int invalid = 0;
        for (String input : inputs) {
            HumdrumFile file = read(reader, input);
            if (!reportIfInvalid(file)) {
                invalid++;
                continue;
            }
            for (Diagnostic warning : file.getWarnings()) {
                err().println(warning);
            }
            out().printf("%s: OK, %d line(s), %d track(s)%n",
                    file.getSourceName(), file.getLineCount(), file.getMaxTrack());
        }
        return invalid == 0 ? 0 : EXIT_INVALID;
    }
}
