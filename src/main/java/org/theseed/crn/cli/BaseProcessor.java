/**
 *
 */
package org.theseed.crn.cli;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for all commands.  It parses the command line using the args4j
 * annotations on the subclass, adjusts the logging level, and runs the command.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** TRUE if the command failed */
    private boolean failed;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true, usage = "display command-line usage")
    private boolean help;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "display more frequent log messages")
    private boolean debug;

    /**
     * Parse the command line and validate the parameters.
     *
     * @param args	command-line arguments
     *
     * @return TRUE if the command is ready to run, FALSE if it should be skipped
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.failed = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help)
                parser.printUsage(System.err);
            else {
                if (this.debug) {
                    ch.qos.logback.classic.Logger root =
                            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
                    root.setLevel(Level.DEBUG);
                    log.debug("Debug logging enabled.");
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            this.failed = true;
        } catch (IOException e) {
            log.error("Error processing parameters: {}", e.getMessage());
            this.failed = true;
        }
        return retVal;
    }

    /**
     * Run the command.  Errors are logged and recorded in the failure flag.
     */
    public void run() {
        try {
            long start = System.currentTimeMillis();
            this.runCommand();
            log.info("{} milliseconds to run command.", System.currentTimeMillis() - start);
        } catch (Exception e) {
            log.error("Command failed.", e);
            this.failed = true;
        }
    }

    /**
     * @return TRUE if parameter validation or the command itself failed
     */
    public boolean isFailed() {
        return this.failed;
    }

    /**
     * Set the default values of the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line parameters.
     *
     * @return TRUE if the command should run, FALSE if it should be skipped
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Execute the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
