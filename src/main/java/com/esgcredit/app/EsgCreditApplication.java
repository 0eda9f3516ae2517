package com.esgcredit.app;

import com.esgcredit.config.Config;
import com.esgcredit.core.ConfigurationException;
import com.esgcredit.core.ValidationException;
import com.esgcredit.core.diagnostics.Outcome;
import com.esgcredit.data.CatalogLoader;
import com.esgcredit.matching.ConditionRegistry;
import com.esgcredit.model.CompanyProfile;
import com.esgcredit.model.PipelineResult;
import com.esgcredit.model.ProductSpec;
import com.esgcredit.output.ResultJsonBuilder;
import com.esgcredit.runner.BatchRunner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class EsgCreditApplication {
    private static final Logger LOG = LogManager.getLogger(EsgCreditApplication.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final PrintStream resultOut;

    public EsgCreditApplication() {
        this(System.out);
    }

    EsgCreditApplication(PrintStream resultOut) {
        this.resultOut = resultOut;
    }

    public static void main(String[] args) {
        int exit = new EsgCreditApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("esg-credit", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("esg-credit", options);
            return 0;
        }

        if (!cmd.hasOption("companies") || !cmd.hasOption("products")) {
            new HelpFormatter().printHelp("esg-credit", options);
            System.err.println("ERROR: --companies and --products are required");
            return 2;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        if (!cmd.hasOption("no-log-route")) {
            installLogRoutingIfNeeded(config);
        }

        int horizon;
        try {
            horizon = Integer.parseInt(cmd.getOptionValue("horizon", config.getString("forecast.default_horizon", "12")).trim());
        } catch (NumberFormatException e) {
            System.err.println("ERROR: --horizon must be an integer");
            return 2;
        }
        if (horizon < 1) {
            System.err.println("ERROR: --horizon must be >= 1");
            return 2;
        }

        try {
            CatalogLoader loader = new CatalogLoader(ConditionRegistry.standard());
            List<Outcome<CompanyProfile>> companies =
                    loader.loadCompanyEntries(workingDir.resolve(cmd.getOptionValue("companies")));
            List<ProductSpec> products = loader.loadProducts(workingDir.resolve(cmd.getOptionValue("products")));
            companies = filterCompany(companies, cmd.getOptionValue("company"));
            if (companies.isEmpty()) {
                System.err.println("ERROR: no company matches --company " + cmd.getOptionValue("company"));
                return 2;
            }

            List<Outcome<PipelineResult>> outcomes = new BatchRunner(config).runEntries(companies, products, horizon);
            String json = new ResultJsonBuilder().build(outcomes);
            if (cmd.hasOption("output")) {
                Path out = workingDir.resolve(cmd.getOptionValue("output"));
                Path parent = out.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(out, json, StandardCharsets.UTF_8);
                LOG.info("results written to {}", out);
            } else {
                resultOut.println(json);
            }
            return 0;
        } catch (ConfigurationException e) {
            LOG.error("configuration error: {}", e.getMessage());
            return 2;
        } catch (ValidationException e) {
            LOG.error("catalog rejected: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.error("i/o failure: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("batch interrupted");
            return 130;
        }
    }

    /**
     * Entries whose company name matches, ignoring case; rejected entries match on the name they were reported under.
     */
    static List<Outcome<CompanyProfile>> filterCompany(List<Outcome<CompanyProfile>> companies, String name) {
        if (name == null || name.trim().isEmpty()) {
            return companies;
        }
        List<Outcome<CompanyProfile>> out = new ArrayList<>();
        for (Outcome<CompanyProfile> entry : companies) {
            if (entry.owner.equalsIgnoreCase(name.trim())) {
                out.add(entry);
            }
        }
        return out;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (EsgCreditApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("esgcredit.log.dir", logDir.toAbsolutePath().toString());

                // Log4j context must exist before stdout is replaced, so the console appender keeps the real stream.
                LogManager.getLogger(EsgCreditApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (IOException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("companies").hasArg().argName("file")
                .desc("Company catalog JSON (indicators, monthly history, suppliers)").build());
        options.addOption(Option.builder().longOpt("products").hasArg().argName("file")
                .desc("Financial product catalog JSON").build());
        options.addOption(Option.builder().longOpt("company").hasArg().argName("name")
                .desc("Evaluate only this company").build());
        options.addOption(Option.builder().longOpt("horizon").hasArg().argName("months")
                .desc("Forecast horizon in months (default forecast.default_horizon)").build());
        options.addOption(Option.builder().longOpt("output").hasArg().argName("file")
                .desc("Write the JSON result here instead of stdout").build());
        options.addOption(Option.builder().longOpt("no-log-route")
                .desc("Keep stdout/stderr out of Log4j").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }
}
