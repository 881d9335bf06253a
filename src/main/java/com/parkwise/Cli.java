package com.parkwise;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.parkwise.api.EventJournal;
import com.parkwise.api.ParkingApi;
import com.parkwise.engine.CustomerType;
import com.parkwise.engine.ParkingEngine;
import com.parkwise.engine.PricingTable;
import com.parkwise.engine.Section;
import com.parkwise.engine.SizeClass;
import com.parkwise.engine.Topology;
import com.sun.net.httpserver.HttpServer;

/**
 * Implements the <em>main</em> method and the command line interface.
 */
public class Cli {
    private static final Logger LOGGER = Logger.getLogger(Cli.class.getName());

    /**
     * Explicit default constructor.
     */
    protected Cli() {
    }

    /**
     * Port for the HTTP server to listen on.
     */
    @Parameter(names = "-port", description = "Port for the HTTP server to listen on")
    private int port = 5000;

    /**
     * Hostname for the HTTP server to listen on.
     */
    @Parameter(names = "-host", description = "Hostname for the HTTP server to listen on")
    private String host = "127.0.0.1";

    /**
     * Number of threads handling HTTP requests.
     */
    @Parameter(names = "-threads", description = "Number of threads handling HTTP requests")
    private int threads = 16;

    /**
     * Number of levels of the garage.
     */
    @Parameter(names = "-levels", description = "Number of levels of the garage")
    private int levels = 2;

    @Parameter(names = "-small-regular", description = "Small regular slots per level")
    private int smallRegular = 4;

    @Parameter(names = "-small-vip", description = "Small VIP slots per level")
    private int smallVip = 1;

    @Parameter(names = "-small-ev", description = "Small EV slots per level")
    private int smallEv = 1;

    @Parameter(names = "-medium-regular", description = "Medium regular slots per level")
    private int mediumRegular = 4;

    @Parameter(names = "-medium-vip", description = "Medium VIP slots per level")
    private int mediumVip = 2;

    @Parameter(names = "-medium-ev", description = "Medium EV slots per level")
    private int mediumEv = 2;

    @Parameter(names = "-large-regular", description = "Large regular slots per level")
    private int largeRegular = 2;

    @Parameter(names = "-large-vip", description = "Large VIP slots per level")
    private int largeVip = 1;

    @Parameter(names = "-large-ev", description = "Large EV slots per level")
    private int largeEv = 1;

    @Parameter(names = "-rate-small", description = "Hourly rate for small vehicles")
    private long rateSmall = 20;

    @Parameter(names = "-rate-medium", description = "Hourly rate for medium vehicles")
    private long rateMedium = 40;

    @Parameter(names = "-rate-large", description = "Hourly rate for large vehicles")
    private long rateLarge = 60;

    @Parameter(names = "-minimum-charge", description = "Minimum charge of a parking event")
    private long minimumCharge = 20;

    @Parameter(names = "-pass-small", description = "Price of a 30-day pass for small vehicles")
    private long passSmall = 1050;

    @Parameter(names = "-pass-medium", description = "Price of a 30-day pass for medium vehicles")
    private long passMedium = 2100;

    @Parameter(names = "-pass-large", description = "Price of a 30-day pass for large vehicles")
    private long passLarge = 3150;

    @Parameter(names = "-limit-regular-hours", description = "Hours a regular customer may stay")
    private long limitRegularHours = 24;

    @Parameter(names = "-limit-vip-hours", description = "Hours a VIP customer may stay")
    private long limitVipHours = 30 * 24;

    /**
     * Whether VIPs without a pass buy one on entry.
     */
    @Parameter(names = "-vip-auto-enroll", description = "Sell a pass to VIPs entering without one")
    private boolean vipAutoEnroll = false;

    /**
     * Number of events kept for polling viewers.
     */
    @Parameter(names = "-journal-size", description = "Number of events kept for polling viewers")
    private int journalSize = 256;

    @Parameter(names = { "-h", "-help" }, help = true, description = "Show this help")
    private boolean help = false;

    /**
     * Main entry point.
     *
     * @param args Command line arguments.
     * @throws IOException When there is an I/O error.
     */
    public static void main(final String[] args) throws IOException {
        final var app = new Cli();
        final var commander = JCommander.newBuilder().addObject(app).programName("parkwise").build();
        commander.parse(args);
        if (app.help) {
            commander.usage();
            return;
        }
        configureLogging();
        app.run();
    }

    /**
     * Loads {@code logging.properties} from the classpath unless the JVM has been
     * told to use another configuration.
     *
     * @throws IOException When the configuration cannot be read.
     */
    static void configureLogging() throws IOException {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (var stream = Cli.class.getResourceAsStream("/logging.properties")) {
            if (stream != null) {
                LogManager.getLogManager().readConfiguration(stream);
            }
        }
    }

    /**
     * Collects the command line options into a {@link Config}.
     *
     * @return The configuration.
     */
    Config toConfig() {
        final var topology = Topology.builder();
        for (var level = 1; level <= this.levels; level++) {
            topology.add(level, SizeClass.SMALL, Section.REGULAR, this.smallRegular)
                    .add(level, SizeClass.SMALL, Section.VIP, this.smallVip)
                    .add(level, SizeClass.SMALL, Section.EV, this.smallEv)
                    .add(level, SizeClass.MEDIUM, Section.REGULAR, this.mediumRegular)
                    .add(level, SizeClass.MEDIUM, Section.VIP, this.mediumVip)
                    .add(level, SizeClass.MEDIUM, Section.EV, this.mediumEv)
                    .add(level, SizeClass.LARGE, Section.REGULAR, this.largeRegular)
                    .add(level, SizeClass.LARGE, Section.VIP, this.largeVip)
                    .add(level, SizeClass.LARGE, Section.EV, this.largeEv);
        }
        final var pricing = new PricingTable(
                Map.of(SizeClass.SMALL, this.rateSmall, SizeClass.MEDIUM, this.rateMedium,
                        SizeClass.LARGE, this.rateLarge),
                this.minimumCharge,
                Map.of(SizeClass.SMALL, this.passSmall, SizeClass.MEDIUM, this.passMedium,
                        SizeClass.LARGE, this.passLarge));
        final var timeLimits = Map.of(CustomerType.REGULAR, Duration.ofHours(this.limitRegularHours),
                CustomerType.VIP, Duration.ofHours(this.limitVipHours));
        return new Config(topology.build(), pricing, this.vipAutoEnroll, timeLimits);
    }

    /**
     * Runs the parking system.
     *
     * @throws IOException When there is an I/O error.
     */
    public void run() throws IOException {
        final var engine = ParkingEngine.launch(this.toConfig(), Clock.systemUTC());
        final var handler = new ParkingApi(engine, new EventJournal(this.journalSize));
        final var server = HttpServer.create(new InetSocketAddress(this.host, this.port), 8);
        // We are doing all the routing of requests ourselves.
        server.createContext("/", new ExchangeHandler(handler));
        final var executor = Executors.newFixedThreadPool(this.threads);
        server.setExecutor(executor);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop(1);
            executor.shutdown();
            handler.shutdown();
        }, "parkwise-shutdown"));
        server.start();
        LOGGER.info(() -> String.format("Parking API listening on http://%s:%d/api/status", this.host, this.port));
    }
}
