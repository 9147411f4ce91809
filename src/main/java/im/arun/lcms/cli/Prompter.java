package im.arun.lcms.cli;

/**
 * Source of user input for the shell.
 */
public interface Prompter {

    /**
     * Show the prompt and read one line.
     *
     * @return the line without its terminator, or null at end of input
     */
    String readLine(String prompt);
}
