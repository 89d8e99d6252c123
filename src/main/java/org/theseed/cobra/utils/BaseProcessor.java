/**
 *
 */
package org.theseed.cobra.utils;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for a command processor.  The subclass declares its parameters and
 * options with args4j annotations.  The processor sets the defaults, parses the command line,
 * validates the parameters, and then runs the command, logging any failure.
 *
 * The command-line options common to all processors are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** start time of the command */
    private long startTime;
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
     * Parse the command-line parameters and validate them.
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
                    ch.qos.logback.classic.Logger rootLogger =
                            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
                    rootLogger.setLevel(Level.DEBUG);
                    log.debug("Debug logging enabled.");
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            this.failed = true;
        } catch (IOException e) {
            log.error("Error processing parameters: {}", e.toString());
            this.failed = true;
        }
        return retVal;
    }

    /**
     * Run the command.  Any error is logged and the command is marked as failed.
     */
    public void run() {
        this.startTime = System.currentTimeMillis();
        try {
            this.runCommand();
            log.info("{} seconds to run command.", (System.currentTimeMillis() - this.startTime) / 1000.0);
        } catch (Exception e) {
            log.error("Command failed: {}", e.toString(), e);
            this.failed = true;
        }
    }

    /**
     * @return TRUE if parameter validation or execution failed
     */
    public boolean isFailed() {
        return this.failed;
    }

    /**
     * Set the default values of the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line parameters and options.
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
