package im.arun.lcms.cli;

import im.arun.lcms.config.LcmsConfig;
import im.arun.lcms.model.Book;
import im.arun.lcms.model.BookEdit;
import im.arun.lcms.model.CatalogStatus;
import im.arun.lcms.model.CategoryRemoval;
import im.arun.lcms.model.ImportReport;
import im.arun.lcms.render.CatalogPrinter;
import im.arun.lcms.service.LibraryCatalogService;
import im.arun.lcms.tree.CategoryNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Line-oriented command loop over a {@link LibraryCatalogService}.
 * Each line is {@code <command> [argument]}; the argument is the rest of the line.
 */
public class CatalogShell {
    private static final Logger logger = LoggerFactory.getLogger(CatalogShell.class);

    static final String[] COMMANDS = {
        "import", "export", "exportJson", "find", "findAll", "list", "findBook",
        "addBook", "editBook", "removeBook", "findCategory", "addCategory",
        "editCategory", "removeCategory", "help", "exit", "quit"
    };

    private final LibraryCatalogService service;
    private final LcmsConfig config;
    private final Prompter prompter;
    private final PrintStream out;
    private final CatalogPrinter printer;

    public CatalogShell(LibraryCatalogService service, LcmsConfig config, Prompter prompter, PrintStream out) {
        this.service = service;
        this.config = config;
        this.prompter = prompter;
        this.out = out;
        this.printer = new CatalogPrinter(out);
    }

    /**
     * Read and execute commands until {@code exit} or end of input.
     */
    public void run() {
        while (true) {
            String line = prompter.readLine(config.getPrompt());
            if (line == null) {
                break;
            }
            if (!execute(line)) {
                break;
            }
        }
    }

    /**
     * Execute one command line.
     *
     * @return false when the shell should stop
     */
    public boolean execute(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }

        int space = trimmed.indexOf(' ');
        String command = space < 0 ? trimmed : trimmed.substring(0, space);
        String argument = space < 0 ? "" : trimmed.substring(space + 1).trim();

        try {
            return dispatch(command.toLowerCase(Locale.ROOT), argument);
        } catch (RuntimeException e) {
            logger.debug("Command '{}' failed", command, e);
            out.println("! " + e.getMessage());
            return true;
        }
    }

    private boolean dispatch(String command, String argument) {
        switch (command) {
            case "exit":
            case "quit":
                return false;
            case "help":
                printHelp();
                break;
            case "import":
                if (requireArgument(argument, "import <file>")) importCsv(argument);
                break;
            case "export":
                if (requireArgument(argument, "export <file>")) exportCsv(argument);
                break;
            case "exportjson":
                if (requireArgument(argument, "exportJson <file>")) exportJson(argument);
                break;
            case "find":
                if (requireArgument(argument, "find <keyword>")) printer.printMatches(service.find(argument));
                break;
            case "findall":
                findAll(argument);
                break;
            case "list":
                printer.printTree(service.getTree());
                break;
            case "findbook":
                if (requireArgument(argument, "findBook <title>")) findBook(argument);
                break;
            case "addbook":
                addBook();
                break;
            case "editbook":
                if (requireArgument(argument, "editBook <title>")) editBook(argument);
                break;
            case "removebook":
                if (requireArgument(argument, "removeBook <title>")) removeBook(argument);
                break;
            case "findcategory":
                findCategory(argument);
                break;
            case "addcategory":
                if (requireArgument(argument, "addCategory <path>")) addCategory(argument);
                break;
            case "editcategory":
                if (requireArgument(argument, "editCategory <path>")) editCategory(argument);
                break;
            case "removecategory":
                if (requireArgument(argument, "removeCategory <path>")) removeCategory(argument);
                break;
            default:
                out.println("Unknown command: " + command + " (type 'help')");
        }
        return true;
    }

    private void importCsv(String file) {
        ImportReport report = service.importCsv(Paths.get(file));
        out.println(report.getImported() + " books imported");
        if (report.getDuplicates() > 0 || report.getMalformed() > 0) {
            out.println("Skipped " + report.getDuplicates() + " duplicates and "
                + report.getMalformed() + " malformed rows");
        }
        if (report.getUncategorized() > 0) {
            out.println("Skipped " + report.getUncategorized() + " books with no category");
        }
    }

    private void exportCsv(String file) {
        int rows = service.exportCsv(Paths.get(file));
        out.println(rows + " books exported to " + file);
    }

    private void exportJson(String file) {
        Path path = Paths.get(file);
        service.exportJson(path);
        out.println("Catalog written to " + file);
    }

    private void findAll(String category) {
        Optional<List<Book>> books = service.findAll(category);
        if (books.isEmpty()) {
            out.println("Category not found.");
            return;
        }
        printer.printBooks(books.get());
    }

    private void findBook(String title) {
        Optional<Book> book = service.findBook(title);
        if (book.isEmpty()) {
            out.println("Book not found.");
            return;
        }
        printer.printBook(book.get());
        service.categoryOf(book.get()).ifPresent(path -> out.println("Category: " + path));
    }

    private void addBook() {
        String title = ask("Enter title: ");
        String author = ask("Enter author: ");
        String isbn = ask("Enter ISBN: ");
        String year = ask("Enter publication year: ");
        String category = ask("Enter category (e.g., Computer Science/Algorithms): ");

        CatalogStatus status = service.addBook(title, author, isbn, year, category);
        switch (status) {
            case OK:
                out.println("Book added.");
                break;
            case INVALID_INPUT:
                out.println("Invalid year. Book not added.");
                break;
            case INVALID_PATH:
                out.println("Invalid category path. Book not added.");
                break;
            case DUPLICATE_REJECTED:
                out.println("Duplicate book exists. Not added.");
                break;
            default:
                out.println("Book not added: " + status);
        }
    }

    private void editBook(String title) {
        Optional<Book> found = service.findBook(title);
        if (found.isEmpty()) {
            out.println("Book not found.");
            return;
        }

        Book book = found.get();
        out.println("Editing book. Leave a field blank to keep the current value.");
        BookEdit edit = new BookEdit(
            ask("Title [" + book.getTitle() + "]: "),
            ask("Author [" + book.getAuthor() + "]: "),
            ask("ISBN [" + book.getIsbn() + "]: "),
            ask("Publication Year [" + book.getPublicationYear() + "]: "));

        CatalogStatus status = service.editBook(title, edit);
        if (status == CatalogStatus.DUPLICATE_REJECTED) {
            out.println("Edit would create a duplicate; changes reverted.");
        } else if (status.isOk()) {
            out.println("Book updated.");
        } else {
            out.println("Book not found.");
        }
    }

    private void removeBook(String title) {
        if (!confirm("Remove \"" + title + "\"? (y/n): ")) {
            out.println("Cancelled.");
            return;
        }
        out.println(service.removeBook(title).isOk() ? "Book removed." : "Book not found.");
    }

    private void findCategory(String category) {
        Optional<CategoryNode> node = service.findCategory(category);
        if (node.isEmpty()) {
            out.println("Category not found.");
            return;
        }
        printer.printCategory(node.get());
    }

    private void addCategory(String category) {
        if (service.addCategory(category).isOk()) {
            out.println("Category ensured: " + category.trim());
        } else {
            out.println("Invalid category path.");
        }
    }

    private void editCategory(String category) {
        String newName = ask("New name: ");
        CatalogStatus status = service.renameCategory(category, newName);
        switch (status) {
            case OK:
                out.println("Category renamed.");
                break;
            case NOT_FOUND:
                out.println("Category not found.");
                break;
            case ROOT_PROTECTED:
                out.println("The root category cannot be renamed.");
                break;
            case DUPLICATE_REJECTED:
                out.println("A sibling category already has that name.");
                break;
            default:
                out.println("Invalid category name.");
        }
    }

    private void removeCategory(String category) {
        if (!confirm("Remove category \"" + category + "\" and everything in it? (y/n): ")) {
            out.println("Cancelled.");
            return;
        }

        CategoryRemoval removal = service.removeCategory(category);
        switch (removal.getStatus()) {
            case OK:
                out.println("Category removed with " + removal.getRemovedBooks().size() + " books.");
                for (Book book : removal.getRemovedBooks()) {
                    out.println("  - " + book.getTitle());
                }
                break;
            case ROOT_PROTECTED:
                out.println("The root category cannot be removed.");
                break;
            default:
                out.println("Category not found.");
        }
    }

    private boolean confirm(String question) {
        if (!config.isConfirmRemovals()) {
            return true;
        }
        String answer = ask(question).trim();
        return answer.equalsIgnoreCase("y");
    }

    private String ask(String question) {
        String answer = prompter.readLine(question);
        return answer == null ? "" : answer;
    }

    private boolean requireArgument(String argument, String usage) {
        if (argument.isEmpty()) {
            out.println("Usage: " + usage);
            return false;
        }
        return true;
    }

    private void printHelp() {
        out.println("Commands:");
        out.println("  import <file>            Import books from CSV");
        out.println("  export <file>            Export the catalog to CSV");
        out.println("  exportJson <file>        Export the category tree as JSON");
        out.println("  find <keyword>           Search categories, titles and authors");
        out.println("  findAll [category]       List books under a category (all if omitted)");
        out.println("  list                     Show the category tree");
        out.println("  findBook <title>         Show a book's details");
        out.println("  addBook                  Add a book (prompts for fields)");
        out.println("  editBook <title>         Edit a book");
        out.println("  removeBook <title>       Remove a book");
        out.println("  findCategory <path>      Show a category and its subtree");
        out.println("  addCategory <path>       Create a category path");
        out.println("  editCategory <path>      Rename a category");
        out.println("  removeCategory <path>    Remove a category and everything under it");
        out.println("  help | exit");
    }
}
