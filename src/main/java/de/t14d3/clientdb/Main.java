package de.t14d3.clientdb;

import com.fasterxml.jackson.databind.JsonNode;
import de.t14d3.clientdb.config.ClientDbConfig;
import de.t14d3.clientdb.core.ClientDb;
import de.t14d3.clientdb.exceptions.RemoteException;
import de.t14d3.clientdb.remote.HttpRemoteDataSource;
import de.t14d3.clientdb.remote.RemoteDataSource;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * ClientDb CLI - maintenance commands for a local cache store.
 *
 * Usage:
 *   java -cp ... de.t14d3.clientdb.Main [command] [options]
 *
 * Commands:
 *   init                      - Create or upgrade the store
 *   inspect                   - Show stored row counts per collection
 *   get <collection> <id>     - Read an object through the cache
 *   clear                     - Remove every cached object
 *   help                      - Show this help message
 *
 * Options:
 *   --db-url <url>            - Store JDBC URL (default: jdbc:sqlite:client-db.db)
 *   --remote-url <url>        - Base URL of the remote source (required for get)
 *   --verbose                 - Print stack traces on failure
 */
public class Main {

    public static void main(String[] args) {
        if (args.length == 0) {
            printHelp();
            System.exit(1);
        }

        String command = args[0].toLowerCase();
        try {
            switch (command) {
                case "help":
                case "--help":
                case "-h":
                    printHelp();
                    break;
                case "init":
                case "inspect":
                case "get":
                case "clear":
                    run(command, Options.parse(Arrays.copyOfRange(args, 1, args.length)));
                    break;
                default:
                    System.err.println("Unknown command: " + command);
                    System.out.println();
                    printHelp();
                    System.exit(1);
            }
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (isVerbose(args)) {
                e.printStackTrace();
            }
            System.exit(1);
        }
    }

    static void run(String command, Options options) {
        ClientDbConfig.Builder builder = ClientDbConfig.builder();
        if (options.dbUrl != null) {
            builder.jdbcUrl(options.dbUrl);
        }
        ClientDbConfig config = builder.build();

        try (ClientDb db = ClientDb.create(remoteFor(options), config)) {
            db.init();
            switch (command) {
                case "init":
                    System.out.println("Store ready: " + config.getJdbcUrl());
                    break;
                case "inspect":
                    inspect(db, config);
                    break;
                case "get":
                    if (options.arguments.size() != 2) {
                        throw new IllegalArgumentException("Usage: get <collection> <id>");
                    }
                    JsonNode obj = db.getObj(options.arguments.get(0), options.arguments.get(1));
                    System.out.println(obj == null ? "(not found)" : obj.toPrettyString());
                    break;
                case "clear":
                    db.clearAll();
                    System.out.println("Cache cleared");
                    break;
                default:
                    throw new IllegalArgumentException("Unknown command: " + command);
            }
        }
    }

    private static void inspect(ClientDb db, ClientDbConfig config) {
        System.out.println("Client Cache Inspector");
        System.out.println("======================");
        System.out.println("Store URL: " + config.getJdbcUrl());
        System.out.println();

        Map<String, Long> counts = db.countByCollection();
        if (counts.isEmpty()) {
            System.out.println("No cached objects");
            return;
        }
        long total = 0;
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            System.out.printf("  %-40s %8d%n", entry.getKey(), entry.getValue());
            total += entry.getValue();
        }
        System.out.println();
        System.out.println("Total: " + total + " row(s) in " + counts.size() + " collection(s)");
    }

    private static RemoteDataSource remoteFor(Options options) {
        if (options.remoteUrl != null) {
            return new HttpRemoteDataSource(URI.create(options.remoteUrl));
        }
        return (method, path, body) -> {
            throw new RemoteException("No --remote-url given, cannot " + method + " " + path, -1);
        };
    }

    private static void printHelp() {
        System.out.println("ClientDb CLI - maintenance commands for a local cache store");
        System.out.println();
        System.out.println("Usage:");
        System.out.println("  java -cp ... de.t14d3.clientdb.Main [command] [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  init                           - Create or upgrade the store");
        System.out.println("  inspect                        - Show stored row counts per collection");
        System.out.println("  get <collection> <id>          - Read an object through the cache");
        System.out.println("  clear                          - Remove every cached object");
        System.out.println("  help                           - Show this help message");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --db-url <url>                 - Store JDBC URL (default: jdbc:sqlite:" +
                ClientDbConfig.DEFAULT_STORE_NAME + ")");
        System.out.println("  --remote-url <url>             - Base URL of the remote source (required for get)");
        System.out.println("  --verbose                      - Print stack traces on failure");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -cp ... de.t14d3.clientdb.Main init --db-url jdbc:sqlite:cache.db");
        System.out.println("  java -cp ... de.t14d3.clientdb.Main get users 42 --remote-url https://api.example.com/");
        System.out.println("  java -cp ... de.t14d3.clientdb.Main inspect");
    }

    private static boolean isVerbose(String[] args) {
        for (String arg : args) {
            if ("--verbose".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static final class Options {
        String dbUrl;
        String remoteUrl;
        boolean verbose;
        final List<String> arguments = new ArrayList<>();

        static Options parse(String[] args) {
            Options options = new Options();
            int i = 0;
            while (i < args.length) {
                if (args[i].startsWith("--")) {
                    switch (args[i]) {
                        case "--db-url":
                            options.dbUrl = value(args, i);
                            i += 2;
                            break;
                        case "--remote-url":
                            options.remoteUrl = value(args, i);
                            i += 2;
                            break;
                        case "--verbose":
                            options.verbose = true;
                            i++;
                            break;
                        default:
                            throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                } else {
                    options.arguments.add(args[i]);
                    i++;
                }
            }
            return options;
        }

        private static String value(String[] args, int i) {
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException(args[i] + " requires a value");
            }
            return args[i + 1];
        }
    }
}
