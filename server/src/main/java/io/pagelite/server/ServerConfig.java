// file: src/main/java/io/pagelite/server/ServerConfig.java
package io.pagelite.server;

import io.pagelite.storage.StoreOptions;

import java.util.Map;

/**
 * Server configuration parsed from CLI args, with environment fallback.
 *
 * Supports:
 *  - host:       interface the HTTP listener binds to
 *  - httpPort:   HTTP port (flag, else env PORT, else 80)
 *  - dbPath:     store file, relative to the working directory by default
 *  - mapSizeMb:  upper bound for the store file
 *  - seedDir:    optional directory of seed documents; null means the bundled set
 *  - workerThreads: size of the HTTP worker pool, the upper bound on concurrent store reads
 */
public record ServerConfig(
        String host,
        int httpPort,
        String dbPath,
        long mapSizeMb,
        String seedDir,
        int workerThreads
) {
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 80;
    public static final String DEFAULT_DB = "amis.db";
    public static final long DEFAULT_MAP_SIZE_MB = 64;
    public static final int DEFAULT_WORKER_THREADS = 64;
    /** Reader slots kept free for non-worker threads (seeding, shutdown). */
    static final int READER_MARGIN = 8;

    public ServerConfig {
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("http-port out of range: " + httpPort);
        }
        if (mapSizeMb <= 0) {
            throw new IllegalArgumentException("map-size-mb must be > 0");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("worker-threads must be > 0");
        }
        if (dbPath == null || dbPath.isBlank()) {
            throw new IllegalArgumentException("db path must not be empty");
        }
    }

    public long mapSizeBytes() {
        return mapSizeMb * 1024L * 1024L;
    }

    /**
     * Store options sized for this server: every worker may hold a read
     * transaction at the same time, so reader slots never run out.
     */
    public StoreOptions storeOptions() {
        int readers = Math.max(StoreOptions.DEFAULT_MAX_READERS, workerThreads + READER_MARGIN);
        return StoreOptions.defaults()
                .withMapSizeBytes(mapSizeBytes())
                .withMaxReaders(readers);
    }

    /**
     * Parse process args and environment; print usage and exit on bad input.
     */
    public static ServerConfig fromArgs(String[] args) {
        for (String a : args) {
            if ("--help".equals(a) || "-h".equals(a)) {
                printHelpAndExit();
            }
        }
        try {
            return parse(args, System.getenv());
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Try --help for usage.");
            System.exit(1);
            return null; // unreachable
        }
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --host             <addr>
     *   --http-port,  -p   <port>
     *   --db,         -d   <path>
     *   --map-size-mb      <megabytes>
     *   --seed-dir         <path>
 *   --worker-threads   <count>
     *
     * @throws IllegalArgumentException on unknown flags, missing or malformed values
     */
    static ServerConfig parse(String[] args, Map<String, String> env) {
        String host = DEFAULT_HOST;
        int httpPort = DEFAULT_PORT;
        String db = DEFAULT_DB;
        long mapSizeMb = DEFAULT_MAP_SIZE_MB;
        String seedDir = null;
        int workerThreads = DEFAULT_WORKER_THREADS;

        String envPort = env.get("PORT");
        if (envPort != null && !envPort.isBlank()) {
            httpPort = parseInt("PORT", envPort.trim());
        }

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--host" -> host = valueAt(args, i++);
                case "--http-port", "-p" -> httpPort = parseInt("http-port", valueAt(args, i++));
                case "--db", "-d" -> db = valueAt(args, i++);
                case "--map-size-mb" -> mapSizeMb = parseLong("map-size-mb", valueAt(args, i++));
                case "--seed-dir" -> seedDir = valueAt(args, i++);
                case "--worker-threads" -> workerThreads = parseInt("worker-threads", valueAt(args, i++));
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new ServerConfig(host, httpPort, db, mapSizeMb, seedDir, workerThreads);
    }

    private static String valueAt(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int parseInt(String what, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + raw, e);
        }
    }

    private static long parseLong(String what, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + raw, e);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: pagelite [options]

            Options:
              --host                 Bind address (default: 0.0.0.0)
              --http-port,   -p      HTTP port (default: $PORT, else 80)
              --db,          -d      Store file (default: ./amis.db)
              --map-size-mb          Maximum store size in MiB (default: 64)
              --seed-dir             Load seed pages from this directory instead of the bundled set
              --worker-threads       HTTP worker threads (default: 64)
              --help,        -h      Show this help message
            """);
        System.exit(0);
    }
}
