package org.theseed.crn.cli;

import java.util.Arrays;

/**
 * Commands for analyzing the conservation laws of chemical reaction networks.
 *
 * laws			compute the conservation laws of a network
 * matrix		write the stoichiometric matrix of a network
 * species		list the species of a network in canonical order
 * reactions	list the reactions of a network
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1) {
            System.err.println("Usage: App <laws|matrix|species|reactions> [options] network.json");
            System.exit(1);
        }
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "laws" :
            processor = new LawsProcessor();
            break;
        case "matrix" :
            processor = new MatrixProcessor();
            break;
        case "species" :
            processor = new SpeciesProcessor();
            break;
        case "reactions" :
            processor = new ReactionsProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
        }
        if (processor.isFailed())
            System.exit(1);
    }
}
