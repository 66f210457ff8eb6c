package com.mimecast.wren;

import com.mimecast.wren.main.Server;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import javax.naming.ConfigurationException;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Starts the standalone SMTP server from a configuration directory.
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "wren.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "SMTP submission engine";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args).run();
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;
    }

    /**
     * Parses options and starts the server.
     *
     * @return True if the server started.
     */
    boolean run() {
        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            return false;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help") || !cmd.hasOption("conf")) {
            optionsUsage(options());
            return false;
        }

        if (cmd.hasOption("debug")) {
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.DEBUG);
        }

        try {
            Server.run(cmd.getOptionValue("conf"));
            return true;
        } catch (ConfigurationException e) {
            log("Configuration error: " + e.getMessage());
            return false;
        }
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    Options options() {
        Options options = new Options();
        options.addOption("c", "conf", true, "Configuration directory containing server.json5");
        options.addOption("d", "debug", false, "Log protocol exchange");
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");
        new HelpFormatter().printHelp(USAGE, options);
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
