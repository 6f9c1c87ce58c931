package org.autosemi;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * The ArgumentParser class is responsible for parsing command-line arguments
 * and configuring the CompilerOptions accordingly. It handles the flags
 * that select what is printed (tokens, syntax tree, decisions, rewritten source),
 * the semicolon insertion override, and where the source code comes from.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments and returns a CompilerOptions object
     * configured based on the provided arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A CompilerOptions object with settings derived from the arguments.
     */
    public static CompilerOptions parseArguments(String[] args) {
        CompilerOptions parsedArgs = new CompilerOptions();
        parsedArgs.code = null; // Initialize code to null

        processArgs(args, parsedArgs);
        return parsedArgs;
    }

    /**
     * Processes the command-line arguments, distinguishing between switch and non-switch arguments.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The CompilerOptions object to configure.
     */
    private static void processArgs(String[] args, CompilerOptions parsedArgs) {
        boolean readingFiles = false;

        for (int i = 0; i < args.length; i++) {
            if (readingFiles || !args[i].startsWith("-") || args[i].equals("-")) {
                processNonSwitchArgument(args, parsedArgs, i);
                readingFiles = true;
            } else {
                String arg = args[i];

                if (arg.equals("--")) {
                    // "--" indicates the end of switch arguments
                    readingFiles = true;
                    continue;
                }

                if (!arg.startsWith("--")) {
                    // Process clustered single-character switches (e.g., -c, -e)
                    i = processClusteredSwitches(args, parsedArgs, arg, i);
                } else {
                    // Process long-form switches (e.g., --debug, --tokenize)
                    i = processLongSwitches(args, parsedArgs, arg, i);
                }
            }
        }
    }

    /**
     * Processes non-switch arguments: the name of the file to read.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The CompilerOptions object to configure.
     * @param index      The current index in the arguments array.
     */
    private static void processNonSwitchArgument(String[] args, CompilerOptions parsedArgs, int index) {
        if (parsedArgs.code != null) {
            System.err.println("Error: unexpected argument " + args[index]);
            System.exit(1);
        }
        parsedArgs.fileName = args[index];
        try {
            if (parsedArgs.fileName.equals("-")) {
                parsedArgs.code = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            } else {
                parsedArgs.code = Files.readString(Paths.get(parsedArgs.fileName), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            System.err.println("Error: Unable to read file " + parsedArgs.fileName);
            System.exit(1);
        }
    }

    /**
     * Processes clustered single-character switches (e.g., -ve).
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The CompilerOptions object to configure.
     * @param arg        The current argument being processed.
     * @param index      The current index in the arguments array.
     * @return The updated index after processing the switches.
     */
    private static int processClusteredSwitches(String[] args, CompilerOptions parsedArgs, String arg, int index) {
        for (int j = 1; j < arg.length(); j++) {
            char switchChar = arg.charAt(j);
            switch (switchChar) {
                case 'e':
                    // Handle inline code specified with -e
                    return handleInlineCode(args, parsedArgs, index, j, arg);
                case 'v':
                    System.out.println("autosemi " + Configuration.version);
                    System.exit(0);
                    break;
                case 'h':
                case '?':
                    // Print help message and exit
                    printHelp();
                    System.exit(0);
                    break;
                default:
                    System.err.println("Unrecognized switch: -" + switchChar + "  (-h will show valid options)");
                    System.exit(1);
                    break;
            }
        }
        return index;
    }

    /**
     * Handles inline code specified with -e. Several -e's are joined with newlines.
     */
    private static int handleInlineCode(String[] args, CompilerOptions parsedArgs, int index, int j, String arg) {
        String newCode = null;
        if (j < arg.length() - 1) {
            newCode = arg.substring(j + 1);
        } else if (index + 1 < args.length) {
            newCode = args[++index];
        }
        if (newCode == null) {
            System.err.println("No code specified for -e.");
            System.exit(1);
        }
        if (parsedArgs.code == null) {
            parsedArgs.code = newCode;
        } else {
            parsedArgs.code += "\n" + newCode;
        }
        parsedArgs.fileName = "-e"; // Indicate that the code was provided inline
        return index;
    }

    /**
     * Processes long-form switches.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The CompilerOptions object to configure.
     * @param arg        The current argument being processed.
     * @param index      The current index in the arguments array.
     * @return The updated index after processing the switch.
     */
    private static int processLongSwitches(String[] args, CompilerOptions parsedArgs, String arg, int index) {
        switch (arg) {
            case "--debug":
                // Enable debugging mode
                parsedArgs.debugEnabled = true;
                break;
            case "--tokenize":
                // Print the token list after semicolon insertion
                validateExclusiveOptions(parsedArgs, "tokenize");
                parsedArgs.tokenizeOnly = true;
                break;
            case "--parse":
                // Print the syntax tree
                validateExclusiveOptions(parsedArgs, "parse");
                parsedArgs.parseOnly = true;
                break;
            case "--explain":
                validateExclusiveOptions(parsedArgs, "explain");
                parsedArgs.explain = true;
                break;
            case "--json":
                validateExclusiveOptions(parsedArgs, "json");
                parsedArgs.explainJson = true;
                break;
            case "--emit":
                validateExclusiveOptions(parsedArgs, "emit");
                parsedArgs.emit = true;
                break;
            case "--asi":
                parsedArgs.asiOverride = Boolean.TRUE;
                break;
            case "--no-asi":
                parsedArgs.asiOverride = Boolean.FALSE;
                break;
            case "--config":
                if (index + 1 >= args.length) {
                    System.err.println("No file specified for --config.");
                    System.exit(1);
                }
                parsedArgs.configFile = args[++index];
                break;
            case "--version":
                System.out.println("autosemi " + Configuration.version);
                System.exit(0);
                break;
            case "--help":
                // Print help message and exit
                printHelp();
                System.exit(0);
                break;
            default:
                System.err.println("Unrecognized switch: " + arg + "  (-h will show valid options)");
                System.exit(1);
                break;
        }
        return index;
    }

    /**
     * Validates that exclusive options are not combined.
     *
     * @param parsedArgs The CompilerOptions object to check.
     * @param option     The option being validated.
     */
    private static void validateExclusiveOptions(CompilerOptions parsedArgs, String option) {
        if (parsedArgs.tokenizeOnly || parsedArgs.parseOnly
                || parsedArgs.explain || parsedArgs.explainJson || parsedArgs.emit) {
            System.err.println("Error: " + (option.length() == 1 ? "-" : "--") + option
                    + " cannot be combined with other exclusive options");
            System.exit(1);
        }
    }

    /**
     * Prints the help message for the command-line interface.
     */
    private static void printHelp() {
        System.out.println("Usage: java -jar target/autosemi-1.0-SNAPSHOT.jar [options] [file]");
        System.out.println();
        System.out.println("  -e code               one line of program (several -e's allowed, omit file)");
        System.out.println("  --tokenize            print the tokens after semicolon insertion");
        System.out.println("  --parse               print the syntax tree");
        System.out.println("  --explain             print the decision taken at every line boundary");
        System.out.println("  --json                print the line boundary decisions as JSON");
        System.out.println("  --emit                print the source with inserted semicolons");
        System.out.println("  --asi, --no-asi       enable or disable semicolon insertion, overriding " + Configuration.SETTINGS_FILE_NAME);
        System.out.println("  --config file         read project settings from file");
        System.out.println("  --debug               enable debugging mode");
        System.out.println("  -v, --version         print the version");
        System.out.println("  -h, --help            displays this help message");
    }

    public static class CompilerOptions implements Cloneable {
        public boolean debugEnabled = false;
        public boolean tokenizeOnly = false;
        public boolean parseOnly = false;
        public boolean explain = false;
        public boolean explainJson = false;
        public boolean emit = false;
        public String code = null;
        public String fileName = null;
        // --asi / --no-asi, null if neither was given
        public Boolean asiOverride = null;
        public String configFile = null;

        @Override
        public CompilerOptions clone() {
            try {
                // Use super.clone() to create a shallow copy
                return (CompilerOptions) super.clone();
            } catch (CloneNotSupportedException e) {
                // This shouldn't happen, since we're implementing Cloneable
                throw new AssertionError();
            }
        }

        @Override
        public String toString() {
            return "CompilerOptions{\n" +
                    "    debugEnabled=" + debugEnabled + ",\n" +
                    "    tokenizeOnly=" + tokenizeOnly + ",\n" +
                    "    parseOnly=" + parseOnly + ",\n" +
                    "    explain=" + explain + ",\n" +
                    "    explainJson=" + explainJson + ",\n" +
                    "    emit=" + emit + ",\n" +
                    "    code='" + (code != null ? code : "null") + "',\n" +
                    "    fileName='" + fileName + "',\n" +
                    "    asiOverride=" + asiOverride + ",\n" +
                    "    configFile='" + configFile + "'\n" +
                    "}";
        }
    }
}
