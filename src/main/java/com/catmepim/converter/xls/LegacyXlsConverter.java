package com.catmepim.converter.xls;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.xls.config.ConverterConfig;
import com.catmepim.converter.xls.core.WorkbookExporter;
import com.catmepim.converter.xls.exception.ConversionException;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;

/**
 * Main class of the Legacy XLS Converter.
 * <p>
 * Parses the command line into a {@link ConverterConfig}, validates it and runs the
 * {@link WorkbookExporter}. Exit codes: 0 on success, picocli's invalid-input code for bad
 * arguments, 1 for invalid configuration or a failed conversion.
 */
public class LegacyXlsConverter {

    private static final Logger logger = LoggerFactory.getLogger(LegacyXlsConverter.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the converter without exiting the JVM.
     *
     * @return the process exit code
     * @pre args != null
     */
    static int run(String[] args) {
        if (args == null) {
            throw new IllegalArgumentException("args must not be null");
        }
        long startTime = System.nanoTime();
        ConverterConfig config = new ConverterConfig();
        CommandLine cmd = new CommandLine(config).setCaseInsensitiveEnumValuesAllowed(true);

        try {
            cmd.parseArgs(args);
            if (cmd.isUsageHelpRequested()) {
                cmd.usage(System.out);
                return 0;
            }
            if (cmd.isVersionHelpRequested()) {
                cmd.printVersionHelp(System.out);
                return 0;
            }

            config.validate();
            if (config.verbose) {
                enableVerboseLogging();
            }
            logger.info("Legacy XLS Converter starting. Input: {}, format: {}, output directory: {}",
                    config.inputFile, config.format, config.outputDir);

            List<Path> written = new WorkbookExporter(config).export();
            logger.info("Conversion completed successfully: {} file(s) written", written.size());
            return 0;
        } catch (CommandLine.ParameterException ex) {
            logger.error("Invalid parameter(s): {}", ex.getMessage());
            cmd.usage(System.err);
            return cmd.getCommandSpec().exitCodeOnInvalidInput();
        } catch (IllegalArgumentException ex) {
            logger.error("Configuration validation failed: {}", ex.getMessage());
            return 1;
        } catch (ConversionException ex) {
            logger.error("Conversion failed: {}", ex.getMessage());
            logger.debug("Conversion failure detail", ex);
            return 1;
        } catch (Exception ex) {
            logger.error("An unexpected error occurred during conversion: {}", ex.getMessage(), ex);
            return 1;
        } finally {
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
            logger.info("Legacy XLS Converter finished in {} ms.", durationMillis);
        }
    }

    private static void enableVerboseLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
