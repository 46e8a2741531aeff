/**
 *
 */
package org.theseed.crn.cli;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is a base class for reports about reaction networks.
 *
 * The positional parameter is the name of the network JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * --order	species ordering (AUTO, LEXICOGRAPHIC, NUMERIC_SUFFIX, DECLARED; default AUTO)
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseNetworkReportProcessor extends BaseNetworkProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseNetworkReportProcessor.class);
    /** output stream */
    private OutputStream outStream;

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, usage = "output file for report (if not STDOUT)")
    private File outFile;

    @Override
    protected void setNetworkDefaults() {
        this.outFile = null;
        this.setReporterDefaults();
    }

    /**
     * Set the option defaults for the subclass.
     */
    protected abstract void setReporterDefaults();

    @Override
    protected void validateNetworkParms() throws IOException, ParseFailureException {
        this.validateNetworkReportParms();
        // Handle the output file.
        if (this.outFile == null) {
            log.info("Output will be to the standard output.");
            this.outStream = System.out;
        } else {
            log.info("Output will be to {}.", this.outFile);
            this.outStream = new FileOutputStream(this.outFile);
        }
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateNetworkReportParms() throws IOException, ParseFailureException;

    @Override
    protected final void runCommand() throws Exception {
        PrintWriter writer = new PrintWriter(this.outStream);
        try {
            this.runReporter(writer);
        } finally {
            writer.flush();
            // Only close a real output file.  Standard output stays open.
            if (this.outFile != null)
                writer.close();
        }
    }

    /**
     * Execute the command and produce the report.
     *
     *  @param writer	print writer to receive the report
     *
     *  @throws Exception
     */
    protected abstract void runReporter(PrintWriter writer) throws Exception;

}
