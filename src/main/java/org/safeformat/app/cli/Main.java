package org.safeformat.app.cli;

import org.safeformat.ArgumentParser;
import org.safeformat.ArgumentParser.CliOptions;
import org.safeformat.Configuration;
import org.safeformat.Format;
import org.safeformat.FormatSession;
import org.safeformat.runtime.ErrorMessageUtil;
import org.safeformat.runtime.FormatArgument;
import org.safeformat.runtime.FormatError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Command-line front end: formats a template with typed arguments and prints the result.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FORMAT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the tool and returns its exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = ArgumentParser.parseArguments(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (options.help) {
            ArgumentParser.printHelp(out);
            return EXIT_OK;
        }
        if (options.version) {
            out.println("safeformat " + Configuration.version);
            return EXIT_OK;
        }
        if (options.template == null) {
            err.println("Error: no template given");
            ArgumentParser.printHelp(err);
            return EXIT_USAGE;
        }

        log.debug("Formatting template with {} argument(s)", options.arguments.size());
        try (FormatSession session = Format.print(options.template, out)) {
            for (FormatArgument argument : options.arguments) {
                session.insert(argument);
            }
        } catch (FormatError e) {
            err.println("Error: " + ErrorMessageUtil.errorMessage(options.template, e));
            return EXIT_FORMAT_ERROR;
        }
        if (options.newline) {
            out.println();
        }
        out.flush();
        return EXIT_OK;
    }
}
