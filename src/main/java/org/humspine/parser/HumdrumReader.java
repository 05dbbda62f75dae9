package org.humspine.parser;

import org.humspine.parser.api.IHumdrumReader;
import org.humspine.parser.api.ParseError;
import org.humspine.parser.api.ParseResult;
import org.humspine.parser.api.ParserErrorCode;
import org.humspine.parser.api.ParserOptions;
import org.humspine.parser.diagnostics.DiagnosticsEngine;
import org.humspine.parser.diagnostics.ParserLogger;
import org.humspine.parser.frontend.AnalysisPhase;
import org.humspine.parser.frontend.StructureException;
import org.humspine.parser.frontend.lexer.LineTokenizer;
import org.humspine.parser.frontend.links.LineStitcher;
import org.humspine.parser.frontend.links.NonNullLinker;
import org.humspine.parser.frontend.spines.SpineTopologyTracker;
import org.humspine.parser.frontend.tracks.TrackAnalyzer;
import org.humspine.parser.frontend.tracks.TrackTable;
import org.humspine.parser.model.Line;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads Humdrum data and runs the analysis pipeline that builds the token graph.
 * <p>
 * The phases of {@link AnalysisPhase} run in order over the whole file; the first failing phase stops the
 * pipeline. Errors are never thrown to the caller: they are returned in the {@link ParseResult} and stored
 * on the {@link HumdrumFile}. A reader keeps no state between parses and may be reused, but it is not
 * thread-safe.
 */
public class HumdrumReader implements IHumdrumReader {

    private static final Logger LOG = LoggerFactory.getLogger(HumdrumReader.class);
    private static final String STDIN_NAME = "<stdin>";
    private static final String MEMORY_NAME = "<memory>";

    private final ParserOptions options;
    private int verbosity = -1;

    /**
     * Creates a reader with the default options.
     */
    public HumdrumReader() {
        this(ParserOptions.defaults());
    }

    /**
     * @param options The parser options.
     */
    public HumdrumReader(ParserOptions options) {
        this.options = options;
    }

    public ParserOptions getOptions() {
        return options;
    }

    // Parse API returning a result

    @Override
    public ParseResult parse(List<String> lines, String sourceName) {
        HumdrumFile file = new HumdrumFile(sourceName);
        return analyze(file, lines);
    }

    @Override
    public ParseResult parseCsv(List<String> csvLines, String sourceName) {
        return parse(convertCsv(csvLines), sourceName);
    }

    @Override
    public ParseResult parse(Path path) {
        return load(new HumdrumFile(path.toString()), () -> Files.readAllLines(path, StandardCharsets.UTF_8), false);
    }

    /**
     * Reads and parses a CSV file.
     * @param path The file to read.
     * @return The parse result.
     */
    public ParseResult parseCsv(Path path) {
        return load(new HumdrumFile(path.toString()), () -> Files.readAllLines(path, StandardCharsets.UTF_8), true);
    }

    /**
     * Reads all lines from a reader and parses them. The reader is not closed.
     * @param reader The source of tab-separated lines.
     * @param sourceName A name for the input.
     * @return The parse result.
     */
    public ParseResult parse(Reader reader, String sourceName) {
        return load(new HumdrumFile(sourceName), () -> readLines(reader), false);
    }

    /**
     * Reads all lines from a reader as CSV and parses them. The reader is not closed.
     * @param reader The source of CSV records.
     * @param sourceName A name for the input.
     * @return The parse result.
     */
    public ParseResult parseCsv(Reader reader, String sourceName) {
        return load(new HumdrumFile(sourceName), () -> readLines(reader), true);
    }

    /**
     * Runs the pipeline again on the current contents of a file, for instance after
     * {@link HumdrumFile#append(String)} or after token text was edited in place.
     *
     * @param file The file to analyse.
     * @return The parse result.
     */
    public ParseResult reanalyze(HumdrumFile file) {
        file.createLinesFromTokens();
        List<String> texts = new ArrayList<>(file.getLineCount());
        for (Line line : file) {
            texts.add(line.getText());
        }
        file.clearLines();
        return analyze(file, texts);
    }

    // Convenience API returning the file itself, valid or not

    /**
     * Reads a file; {@code "-"} or an empty name reads standard input.
     * @param filename The file name.
     * @return The file; check {@link HumdrumFile#isValid()}.
     */
    public HumdrumFile read(String filename) {
        if (filename == null || filename.isEmpty() || "-".equals(filename)) {
            return read(System.in);
        }
        return read(Path.of(filename));
    }

    /**
     * @param path The file to read.
     * @return The file; check {@link HumdrumFile#isValid()}.
     */
    public HumdrumFile read(Path path) {
        HumdrumFile file = new HumdrumFile(path.toString());
        load(file, () -> Files.readAllLines(path, StandardCharsets.UTF_8), false);
        return file;
    }

    /**
     * Reads UTF-8 encoded lines from a stream. The stream is not closed.
     * @param in The input stream.
     * @return The file; check {@link HumdrumFile#isValid()}.
     */
    public HumdrumFile read(InputStream in) {
        return read(new InputStreamReader(in, StandardCharsets.UTF_8), STDIN_NAME);
    }

    /**
     * Reads all lines from a reader. The reader is not closed.
     * @param reader The source of tab-separated lines.
     * @param sourceName A name for the input.
     * @return The file; check {@link HumdrumFile#isValid()}.
     */
    public HumdrumFile read(Reader reader, String sourceName) {
        HumdrumFile file = new HumdrumFile(sourceName);
        load(file, () -> readLines(reader), false);
        return file;
    }

    /**
     * @param contents The file contents.
     * @return The file; check {@link HumdrumFile#isValid()}.
     */
    public HumdrumFile readString(String contents) {
        HumdrumFile file = new HumdrumFile(MEMORY_NAME);
        load(file, () -> readLines(new StringReader(contents)), false);
        return file;
    }

    /**
     * @param path The CSV file to read.
     * @return The file; check {@link HumdrumFile#isValid()}.
     */
    public HumdrumFile readCsv(Path path) {
        HumdrumFile file = new HumdrumFile(path.toString());
        load(file, () -> Files.readAllLines(path, StandardCharsets.UTF_8), true);
        return file;
    }

    /**
     * Reads all CSV records from a reader. The reader is not closed.
     * @param reader The source of CSV records.
     * @param sourceName A name for the input.
     * @return The file; check {@link HumdrumFile#isValid()}.
     */
    public HumdrumFile readCsv(Reader reader, String sourceName) {
        HumdrumFile file = new HumdrumFile(sourceName);
        load(file, () -> readLines(reader), true);
        return file;
    }

    /**
     * @param contents The CSV contents.
     * @return The file; check {@link HumdrumFile#isValid()}.
     */
    public HumdrumFile readStringCsv(String contents) {
        HumdrumFile file = new HumdrumFile(MEMORY_NAME);
        load(file, () -> readLines(new StringReader(contents)), true);
        return file;
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    // Pipeline

    private ParseResult analyze(HumdrumFile file, List<String> rawLines) {
        if (verbosity >= 0) {
            ParserLogger.setLevel(verbosity);
        }
        file.resetAnalysis();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        PipelineState state = new PipelineState(file, rawLines);

        for (AnalysisPhase phase : AnalysisPhase.values()) {
            if (phase == AnalysisPhase.NON_NULL_LINKS && !options.linkNonNullTokens()) {
                continue;
            }
            ParserLogger.trace("Phase " + phase + ": " + file.getSourceName());
            try {
                runPhase(phase, state, diagnostics);
            } catch (StructureException e) {
                diagnostics.reportError(e.getCode(), e.getMessage(), file.getSourceName(),
                        e.getLineNumber(), e.getFieldIndex());
                break;
            }
        }

        file.setWarnings(diagnostics.getWarnings());
        if (diagnostics.hasErrors()) {
            ParseError error = diagnostics.firstError().orElseThrow();
            file.setParseError(error);
            if (options.noisy()) {
                LOG.warn("Failed to parse {}: {}", file.getSourceName(), error);
            } else {
                LOG.debug("Failed to parse {}:\n{}", file.getSourceName(), diagnostics.summary());
            }
            return ParseResult.failure(error);
        }
        ParserLogger.debug("Parsed " + file.getSourceName() + ": " + file.getLineCount()
                + " lines, " + file.getMaxTrack() + " track(s)");
        return ParseResult.success(file);
    }

    private void runPhase(AnalysisPhase phase, PipelineState state, DiagnosticsEngine diagnostics)
            throws StructureException {
        HumdrumFile file = state.file;
        switch (phase) {
            case TOKENIZE:
                for (String raw : state.rawLines) {
                    file.addLine(new Line(raw));
                }
                break;
            case INDEX_LINES:
                for (int i = 0; i < file.getLineCount(); i++) {
                    file.getLine(i).setLineIndex(i);
                }
                break;
            case SPINES:
                analyzeSpines(state, diagnostics);
                break;
            case LINKS: {
                LineStitcher stitcher = new LineStitcher();
                for (int i = 1; i < state.structuralLines.size(); i++) {
                    stitcher.stitch(state.structuralLines.get(i - 1), state.structuralLines.get(i));
                }
                break;
            }
            case TRACKS: {
                TrackAnalyzer analyzer = new TrackAnalyzer();
                for (Line line : file) {
                    analyzer.analyze(line);
                }
                break;
            }
            case NON_NULL_LINKS:
                new NonNullLinker().link(file.getLines());
                break;
            default:
                throw new StructureException(ParserErrorCode.INTERNAL, "Unknown analysis phase " + phase, 0);
        }
    }

    private void analyzeSpines(PipelineState state, DiagnosticsEngine diagnostics) throws StructureException {
        HumdrumFile file = state.file;
        TrackTable tracks = file.getTrackTable();
        SpineTopologyTracker tracker = new SpineTopologyTracker(tracks);
        for (Line line : file) {
            if (!line.hasSpines()) {
                line.getToken(0).setFieldIndex(0);
                continue;
            }
            tracker.advance(line);
            state.structuralLines.add(line);
        }
        tracker.finish();

        if (options.warnUnterminated()) {
            Set<Integer> open = tracker.getOpenTracks();
            if (!open.isEmpty()) {
                int lastLine = state.structuralLines.isEmpty()
                        ? 0 : state.structuralLines.get(state.structuralLines.size() - 1).getLineNumber();
                diagnostics.reportWarning("Spines of track(s) " + open + " are not terminated",
                        file.getSourceName(), lastLine);
            }
        }
    }

    // Input helpers

    private ParseResult load(HumdrumFile file, LineSource source, boolean csv) {
        List<String> lines;
        try {
            lines = source.read();
        } catch (IOException e) {
            return ioFailure(file, e);
        }
        return analyze(file, csv ? convertCsv(lines) : lines);
    }

    private List<String> convertCsv(List<String> csvLines) {
        List<String> lines = new ArrayList<>(csvLines.size());
        for (String csv : csvLines) {
            lines.add(LineTokenizer.fromCsv(csv, options.csvSeparator()));
        }
        return lines;
    }

    private static List<String> readLines(Reader reader) throws IOException {
        BufferedReader buffered = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = buffered.readLine()) != null) {
            lines.add(line);
        }
        return lines;
    }

    private ParseResult ioFailure(HumdrumFile file, IOException e) {
        ParseError error = new ParseError(ParserErrorCode.IO_ERROR,
                "Cannot open file " + file.getSourceName() + " for reading: " + e.getMessage(),
                file.getSourceName(), 0, -1);
        file.setParseError(error);
        if (options.noisy()) {
            LOG.warn("{}", error);
        } else {
            LOG.debug("{}", error);
        }
        return ParseResult.failure(error);
    }

    @FunctionalInterface
    private interface LineSource {
        List<String> read() throws IOException;
    }

    private static final class PipelineState {
        final HumdrumFile file;
        final List<String> rawLines;
        final List<Line> structuralLines = new ArrayList<>();

        PipelineState(HumdrumFile file, List<String> rawLines) {
            this.file = file;
            this.rawLines = rawLines;
        }
    }
}
