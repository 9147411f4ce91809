package im.arun.lcms.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Terminal input with history and command completion.
 */
public class JLinePrompter implements Prompter, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JLinePrompter.class);

    private final Terminal terminal;
    private final LineReader reader;

    public JLinePrompter(String historyFile) throws IOException {
        this.terminal = TerminalBuilder.builder().system(true).build();
        LineReaderBuilder builder = LineReaderBuilder.builder()
            .terminal(terminal)
            .appName("lcms")
            .completer(new StringsCompleter(CatalogShell.COMMANDS));
        if (historyFile != null && !historyFile.isBlank()) {
            builder.variable(LineReader.HISTORY_FILE, Paths.get(historyFile));
        }
        this.reader = builder.build();
    }

    @Override
    public String readLine(String prompt) {
        while (true) {
            try {
                return reader.readLine(prompt);
            } catch (UserInterruptException e) {
                // Ctrl-C discards the current line
                continue;
            } catch (EndOfFileException e) {
                return null;
            }
        }
    }

    @Override
    public void close() {
        try {
            reader.getHistory().save();
            terminal.close();
        } catch (IOException e) {
            logger.warn("Failed to close terminal: {}", e.getMessage());
        }
    }
}
