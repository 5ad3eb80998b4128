package funcmap.utils;

import java.io.File;

/**
 * Options of one command line run, parsed from "key=value" arguments.
 */
public class Options {
    public File traceFile;
    public File outputDirectory;
    public boolean draw = false;
    public boolean report = true;

    /**
     * @param args the command line arguments
     * @return the parsed options
     * @throws IllegalArgumentException if an argument is malformed or a required one is missing
     */
    public static Options parse(String[] args) {
        Options options = new Options();
        for (String arg : args) {
            Logging.debug("Options", "Arg: " + arg);
            // split the arguments string by the first "="
            String[] argParts = arg.split("=", 2);
            if (argParts.length != 2 || argParts[1].isEmpty()) {
                throw new IllegalArgumentException("Invalid argument: " + arg);
            }

            String key = argParts[0];
            String value = argParts[1];

            switch (key) {
                case "trace" -> options.traceFile = new File(value);
                case "output" -> options.outputDirectory = new File(value);
                case "draw" -> options.draw = parseBoolean(arg, value);
                case "report" -> options.report = parseBoolean(arg, value);
                default -> throw new IllegalArgumentException("Invalid argument: " + arg);
            }
        }

        if (options.traceFile == null) {
            throw new IllegalArgumentException("Trace file not specified");
        }
        if (options.outputDirectory == null) {
            throw new IllegalArgumentException("Output directory not specified");
        }
        return options;
    }

    private static boolean parseBoolean(String arg, String value) {
        if (value.equalsIgnoreCase("true")) {
            return true;
        } else if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("Invalid argument: " + arg);
    }
}
