package de.mirkosertic.mwe;

import com.fasterxml.jackson.core.JsonProcessingException;
import de.mirkosertic.mwe.config.ApplicationConfig;
import de.mirkosertic.mwe.config.BuildInfo;
import de.mirkosertic.mwe.config.LoggingConfigurator;
import de.mirkosertic.mwe.dto.JsonOutput;
import de.mirkosertic.mwe.dto.RecognitionResponse;
import de.mirkosertic.mwe.dto.StatisticsResponse;
import de.mirkosertic.mwe.util.WordSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Command line front end.
 * <p>
 * Reads one sentence per line from standard input and writes one JSON object
 * {@code {"tokens": [...], "mwes": [...]}} per line to standard output. In text mode a line is
 * split on whitespace; with {@code -Dmwe.input=json} each line is a JSON array of tokens.
 * <p>
 * {@code --stats} prints the dictionary statistics of the default language,
 * {@code --version} the build version.
 */
public class MweRecognizerApplication {

    private static final Logger logger = LoggerFactory.getLogger(MweRecognizerApplication.class);

    private final MweRecognizer recognizer;
    private final ApplicationConfig.InputFormat inputFormat;
    private final TokenJsonCodec codec;

    public MweRecognizerApplication(final MweRecognizer recognizer, final ApplicationConfig.InputFormat inputFormat) {
        this.recognizer = recognizer;
        this.inputFormat = inputFormat;
        this.codec = new TokenJsonCodec(JsonOutput.objectMapper());
    }

    /**
     * Processes sentences until the end of input.
     *
     * @return the number of sentences written
     */
    public int run(final BufferedReader in, final Writer out) throws IOException {
        int sentences = 0;
        int lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (WordSplitter.isBlank(line)) {
                continue;
            }

            final List<Token> tokens;
            try {
                tokens = parseLine(line);
            } catch (final JsonProcessingException e) {
                logger.warn("Skipping line {}: {}", lineNumber, e.getOriginalMessage());
                continue;
            }

            out.write(processSentence(tokens));
            out.write(System.lineSeparator());
            out.flush();
            sentences++;
        }
        logger.debug("Processed {} sentences", sentences);
        return sentences;
    }

    String processSentence(final List<Token> tokens) {
        final List<Token> annotated = recognizer.recognizeDocument(List.of(Sentence.of(tokens)))
                .get(0)
                .tokens();
        return JsonOutput.toJson(new RecognitionResponse(codec.toJsonMaps(annotated), MweMentions.extract(annotated)));
    }

    String statistics() {
        return JsonOutput.toJson(StatisticsResponse.of(recognizer));
    }

    private List<Token> parseLine(final String line) throws JsonProcessingException {
        if (inputFormat == ApplicationConfig.InputFormat.JSON) {
            return codec.readTokens(line);
        }
        return Token.listOf(WordSplitter.split(line));
    }

    public static void main(final String[] args) {
        final List<String> arguments = Arrays.asList(args);
        if (arguments.contains("--version")) {
            System.out.println(BuildInfo.current().describe());
            return;
        }

        try {
            // Configure logging FIRST, before any other code that might log
            LoggingConfigurator.configure(Boolean.getBoolean("mwe.quiet"));

            final ApplicationConfig config = ApplicationConfig.load();
            final MweRecognizerRegistry registry = MweRecognizerRegistry.fromConfig(config);
            final MweRecognizer recognizer = registry.getDefault();
            if (!recognizer.isEnabled()) {
                logger.warn("No expressions loaded for {}, input is passed through unchanged",
                        registry.getDefaultLanguage());
            }

            final MweRecognizerApplication app = new MweRecognizerApplication(recognizer, config.getInputFormat());
            final Writer out = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));

            if (arguments.contains("--stats")) {
                out.write(app.statistics());
                out.write(System.lineSeparator());
                out.flush();
                return;
            }

            final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            app.run(in, out);
        } catch (final Exception e) {
            // stdout consumers expect JSON lines
            System.out.println(JsonOutput.error("Failed to run MWE recognizer: " + e.getMessage()));
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
