package im.arun.lcms.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

/**
 * Reads input lines from a plain {@link Reader}, for batch files and piped input.
 * Prompts are not echoed.
 */
public class ReaderPrompter implements Prompter {
    private final BufferedReader reader;

    public ReaderPrompter(Reader reader) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    }

    @Override
    public String readLine(String prompt) {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input", e);
        }
    }
}
