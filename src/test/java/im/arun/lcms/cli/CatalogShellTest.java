package im.arun.lcms.cli;

import im.arun.lcms.config.LcmsConfig;
import im.arun.lcms.service.LibraryCatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogShellTest {

    @TempDir
    Path tempDir;

    private LibraryCatalogService service;
    private LcmsConfig config;
    private ByteArrayOutputStream buffer;

    @BeforeEach
    void setUp() {
        config = new LcmsConfig();
        config.setRootName("Library");
        service = new LibraryCatalogService(config);
        buffer = new ByteArrayOutputStream();
    }

    private String run(String script) {
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        new CatalogShell(service, config, new ReaderPrompter(new StringReader(script)), out).run();
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testAddBookPromptsForFields() {
        String output = run(String.join("\n",
            "addBook",
            "Cosmos",
            "Carl Sagan",
            "",
            "1980",
            "Science/Astronomy",
            "exit"));

        assertTrue(output.contains("Book added."));
        assertEquals(1, service.findCategory("Science").orElseThrow().getBookCount());
    }

    @Test
    void testAddBookDuplicateIsReported() {
        service.addBook("Cosmos", "Carl Sagan", "", "1980", "Science");
        String output = run("addBook\nCosmos\nCarl Sagan\n\n1980\nElsewhere\n");
        assertTrue(output.contains("Duplicate book exists. Not added."));
    }

    @Test
    void testFindBookAndList() {
        service.addBook("Cosmos", "Carl Sagan", "", "1980", "Science/Astronomy");
        String output = run("findBook Cosmos\nlist\nfindBook Missing\n");

        assertTrue(output.contains("Author(s): Carl Sagan"));
        assertTrue(output.contains("Category: Science/Astronomy"));
        assertTrue(output.contains("Library (1)"));
        assertTrue(output.contains("    Astronomy (1)"));
        assertTrue(output.contains("Book not found."));
    }

    @Test
    void testRemoveBookNeedsConfirmation() {
        service.addBook("Cosmos", "Carl Sagan", "", "1980", "Science");

        run("removeBook Cosmos\nn\n");
        assertTrue(service.findBook("Cosmos").isPresent());

        run("removeBook Cosmos\ny\n");
        assertTrue(service.findBook("Cosmos").isEmpty());
    }

    @Test
    void testRemoveCategoryWithoutConfirmation() {
        config.setConfirmRemovals(false);
        service.addBook("Cosmos", "Carl Sagan", "", "1980", "Science/Astronomy");

        String output = run("removeCategory Science\nremoveCategory /\n");

        assertTrue(output.contains("Category removed with 1 books."));
        assertTrue(output.contains("  - Cosmos"));
        assertTrue(output.contains("The root category cannot be removed."));
        assertEquals(0, service.getTree().getRoot().getBookCount());
    }

    @Test
    void testEditBookAndEditCategory() {
        service.addBook("Cosmos", "Carl Sagan", "", "1980", "Science");

        String output = run("editBook Cosmos\n\nSagan\n\n\neditCategory Science\nAstronomy\n");

        assertTrue(output.contains("Book updated."));
        assertTrue(output.contains("Category renamed."));
        assertEquals("Sagan", service.findBook("Cosmos").orElseThrow().getAuthor());
        assertTrue(service.findCategory("Astronomy").isPresent());
    }

    @Test
    void testImportAndExport() throws Exception {
        Path in = tempDir.resolve("in.csv");
        Files.writeString(in, "Title,Author,ISBN,Publication Year,Category\n"
            + "\"Cosmos\",\"Carl Sagan\",\"\",1980,\"Science\"\n");
        Path out = tempDir.resolve("out.csv");

        String output = run("import " + in + "\nexport " + out + "\n");

        assertTrue(output.contains("1 books imported"));
        assertTrue(output.contains("1 books exported"));
        assertTrue(Files.readString(out).contains("\"Cosmos\",\"Carl Sagan\",\"\",1980,\"Science\""));
    }

    @Test
    void testImportReportsRowsWithoutCategory() throws Exception {
        Path in = tempDir.resolve("loose.csv");
        Files.writeString(in, "\"Cosmos\",\"Carl Sagan\",\"\",1980,\"\"\n"
            + "\"Contact\",\"Carl Sagan\",\"\",1985,\"Fiction\"\n");

        String output = run("import " + in + "\n");

        assertTrue(output.contains("1 books imported"));
        assertTrue(output.contains("Skipped 1 books with no category"));
    }

    @Test
    void testErrorsDoNotStopTheShell() {
        String output = run("import " + tempDir.resolve("missing.csv") + "\nbogus\nfindBook\nlist\n");

        assertTrue(output.contains("! Failed to read catalog"));
        assertTrue(output.contains("Unknown command: bogus"));
        assertTrue(output.contains("Usage: findBook <title>"));
        assertTrue(output.contains("Library (0)"));
    }

    @Test
    void testExitStopsProcessing() {
        String output = run("exit\nlist\n");
        assertFalse(output.contains("Library (0)"));
    }
}
