package im.arun.lcms.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class LcmsCLITest {

    @TempDir
    Path tempDir;

    @Test
    void testBatchRunWithImportAndExport() throws Exception {
        Path csv = tempDir.resolve("books.csv");
        Files.writeString(csv, "\"Cosmos\",\"Carl Sagan\",\"\",1980,\"Science\"\n");
        Path exported = tempDir.resolve("out.csv");
        Path batch = tempDir.resolve("commands.txt");
        Files.writeString(batch, "addCategory Poetry\nexport " + exported + "\nexit\n");

        int exitCode = new CommandLine(new LcmsCLI()).execute(
            "--import", csv.toString(), "--batch", batch.toString(), "--root-name", "Shelf");

        assertEquals(0, exitCode);
        assertTrue(Files.readString(exported).contains("\"Cosmos\",\"Carl Sagan\",\"\",1980,\"Science\""));
    }

    @Test
    void testMissingBatchFile() {
        int exitCode = new CommandLine(new LcmsCLI()).execute(
            "--batch", tempDir.resolve("nope.txt").toString());
        assertEquals(1, exitCode);
    }

    @Test
    void testMissingImportFile() {
        int exitCode = new CommandLine(new LcmsCLI()).execute(
            "--import", tempDir.resolve("nope.csv").toString(),
            "--batch", tempDir.resolve("nope.txt").toString());
        assertEquals(1, exitCode);
    }
}
