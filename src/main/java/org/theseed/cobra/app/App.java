package org.theseed.cobra.app;

import java.util.Arrays;

import org.theseed.cobra.utils.BaseProcessor;

/**
 * Commands for reading, writing, and converting metabolic models.
 *
 * convert		convert a model from one file format to another
 * summary		summarize the contents of a model
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1) {
            System.err.println("A command is required:  convert or summary.");
            System.exit(1);
        }
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "convert" :
            processor = new ConvertProcessor();
            break;
        case "summary" :
            processor = new SummaryProcessor();
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
