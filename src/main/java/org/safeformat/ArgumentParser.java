package org.safeformat;

import org.safeformat.runtime.FormatArgument;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * The ArgumentParser class is responsible for parsing command-line arguments
 * and configuring the CliOptions accordingly. It handles the switches of the
 * command-line tool and turns the remaining arguments into typed format
 * arguments.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments and returns a CliOptions object
     * configured based on the provided arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A CliOptions object with settings derived from the arguments.
     * @throws IllegalArgumentException if a switch or a typed argument is invalid
     */
    public static CliOptions parseArguments(String[] args) {
        CliOptions parsedArgs = new CliOptions();
        processArgs(args, parsedArgs);
        return parsedArgs;
    }

    /**
     * Processes the command-line arguments, distinguishing between switch and non-switch arguments.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The CliOptions object to configure.
     */
    private static void processArgs(String[] args, CliOptions parsedArgs) {
        boolean readingArgv = false; // Once set, every argument is positional

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (readingArgv || !arg.startsWith("-") || arg.equals("-")) {
                processNonSwitchArgument(arg, parsedArgs);
                readingArgv = true;
            } else if (arg.equals("--")) {
                readingArgv = true;
            } else if (arg.startsWith("--")) {
                i = processLongSwitches(args, parsedArgs, arg, i);
            } else {
                i = processClusteredSwitches(args, parsedArgs, arg, i);
            }
        }
    }

    /**
     * The first positional argument is the template unless -e gave one; the rest are format arguments.
     */
    private static void processNonSwitchArgument(String arg, CliOptions parsedArgs) {
        if (parsedArgs.template == null) {
            parsedArgs.template = arg;
        } else {
            parsedArgs.arguments.add(parseTypedArgument(arg));
        }
    }

    /**
     * Processes clustered single-character switches such as -nh.
     *
     * @return The index of the last argument consumed.
     */
    private static int processClusteredSwitches(String[] args, CliOptions parsedArgs, String arg, int index) {
        for (int j = 1; j < arg.length(); j++) {
            char switchChar = arg.charAt(j);
            switch (switchChar) {
                case 'n':
                    parsedArgs.newline = false;
                    break;
                case 'h':
                    parsedArgs.help = true;
                    break;
                case 'v':
                    parsedArgs.version = true;
                    break;
                case 'e':
                    // The template is the rest of this argument or the next one
                    if (j + 1 < arg.length()) {
                        parsedArgs.template = arg.substring(j + 1);
                    } else if (index + 1 < args.length) {
                        parsedArgs.template = args[++index];
                    } else {
                        throw new IllegalArgumentException("No template specified for -e");
                    }
                    return index;
                default:
                    throw new IllegalArgumentException("Unrecognized switch: -" + switchChar);
            }
        }
        return index;
    }

    /**
     * Processes long-form switches such as --help.
     *
     * @return The index of the last argument consumed.
     */
    private static int processLongSwitches(String[] args, CliOptions parsedArgs, String arg, int index) {
        switch (arg) {
            case "--help":
                parsedArgs.help = true;
                break;
            case "--version":
                parsedArgs.version = true;
                break;
            case "--no-newline":
                parsedArgs.newline = false;
                break;
            case "--template":
                if (index + 1 >= args.length) {
                    throw new IllegalArgumentException("No template specified for --template");
                }
                parsedArgs.template = args[++index];
                break;
            default:
                throw new IllegalArgumentException("Unrecognized switch: " + arg);
        }
        return index;
    }

    /**
     * Turns a command-line value into a format argument. A kind prefix selects the kind:
     * i: int, u: unsigned int, l: long, ul: unsigned long, d: double, x: decimal,
     * c: char, p: pointer, s: text. Values without a known prefix are text.
     *
     * @param text The command-line value
     * @return The typed argument
     * @throws IllegalArgumentException if the value does not parse as its kind
     */
    static FormatArgument parseTypedArgument(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            return FormatArgument.ofText(text);
        }
        String prefix = text.substring(0, colon);
        String value = text.substring(colon + 1);
        try {
            switch (prefix) {
                case "i":
                    return FormatArgument.ofInt(Integer.parseInt(value));
                case "u":
                    return FormatArgument.ofUnsigned(Integer.parseUnsignedInt(value));
                case "l":
                    return FormatArgument.ofLong(Long.parseLong(value));
                case "ul":
                    return FormatArgument.ofUnsignedLong(Long.parseUnsignedLong(value));
                case "d":
                    return FormatArgument.ofDouble(Double.parseDouble(value));
                case "x":
                    return FormatArgument.ofExtended(new BigDecimal(value));
                case "c":
                    if (value.length() != 1) {
                        throw new IllegalArgumentException("Expected a single character for c: but got '" + value + "'");
                    }
                    return FormatArgument.ofChar(value.charAt(0));
                case "p":
                    return FormatArgument.ofPointer(value.startsWith("0x") || value.startsWith("0X")
                            ? Long.parseUnsignedLong(value.substring(2), 16)
                            : Long.parseUnsignedLong(value));
                case "s":
                    return FormatArgument.ofText(value);
                default:
                    return FormatArgument.ofText(text);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + prefix + ": argument '" + value + "'", e);
        }
    }

    /**
     * Prints the usage message.
     */
    public static void printHelp(PrintStream out) {
        out.println("Usage: safeformat [switches] [--] TEMPLATE [ARG]...");
        out.println("       safeformat [switches] -e TEMPLATE [ARG]...");
        out.println();
        out.println("  -e TEMPLATE, --template TEMPLATE   template to format");
        out.println("  -n, --no-newline                   do not print a trailing newline");
        out.println("  -h, --help                         print this message");
        out.println("  -v, --version                      print the version");
        out.println();
        out.println("Arguments take an optional kind prefix:");
        out.println("  i:int  u:unsigned  l:long  ul:unsigned-long  d:double  x:decimal");
        out.println("  c:char  p:pointer  s:text (default)");
        out.println();
        out.println("Example: safeformat '{0:8} = {1:#010x}' s:mask i:255");
    }

    /**
     * Options collected from the command line.
     */
    public static class CliOptions {
        public String template;
        public boolean newline = true;
        public boolean help = false;
        public boolean version = false;
        public List<FormatArgument> arguments = new ArrayList<>();
    }
}
