/**
 *
 */
package org.theseed.crn.cli;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.crn.NetworkFormatException;
import org.theseed.crn.ReactionNetwork;
import org.theseed.crn.SpeciesOrder;

/**
 * This is a base class for commands against reaction networks.
 *
 * The positional parameter is the name of the network JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --order	species ordering (AUTO, LEXICOGRAPHIC, NUMERIC_SUFFIX, DECLARED; default AUTO)
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseNetworkProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseNetworkProcessor.class);
    /** reaction network */
    private ReactionNetwork network;

    // COMMAND-LINE OPTIONS

    /** species ordering */
    @Option(name = "--order", usage = "ordering to use for species")
    private SpeciesOrder order;

    /** network JSON file */
    @Argument(index = 0, metaVar = "network.json", usage = "JSON file for reaction network",
            required = true)
    private File networkFile;

    @Override
    protected final void setDefaults() {
        this.order = SpeciesOrder.AUTO;
        this.setNetworkDefaults();
    }

    /**
     * Set the default options for the subclass.
     */
    protected abstract void setNetworkDefaults();

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (! this.networkFile.canRead())
            throw new FileNotFoundException("Network file " + this.networkFile + " is not found or unreadable.");
        log.info("Loading network from {}.", this.networkFile);
        try {
            this.network = ReactionNetwork.load(this.networkFile);
            this.network.validate();
        } catch (NetworkFormatException e) {
            throw new ParseFailureException("Invalid network in " + this.networkFile + ": " + e.getMessage());
        }
        this.validateNetworkParms();
        return true;
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateNetworkParms() throws IOException, ParseFailureException;

    /**
     * @return the network
     */
    protected ReactionNetwork getNetwork() {
        return this.network;
    }

    /**
     * @return the species ordering
     */
    protected SpeciesOrder getOrder() {
        return this.order;
    }

}
