package com.lbg.markets.surveillance.docsync.cli;

import com.lbg.markets.surveillance.docsync.domain.Dataset;
import com.lbg.markets.surveillance.docsync.domain.ProgressSnapshot;
import com.lbg.markets.surveillance.docsync.log.DocumentNode;
import com.lbg.markets.surveillance.docsync.log.InMemoryDocumentNode;
import com.lbg.markets.surveillance.docsync.orchestration.SessionRegistry;
import com.lbg.markets.surveillance.docsync.store.FsContentStore;
import com.lbg.markets.surveillance.docsync.sync.SyncSession;
import com.lbg.markets.surveillance.docsync.util.SecretKeys;
import io.quarkus.picocli.runtime.annotations.TopCommand;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@TopCommand
@CommandLine.Command(
        name = "docsync",
        mixinStandardHelpOptions = true,
        version = "docsync 1.0",
        description = "Replicate the document datasets and report synchronization progress")
@Singleton
public class Shell implements Runnable {

    private static final Logger LOG = Logger.getLogger(Shell.class);

    static final String SERVER = "server";
    static final String CLIENT = "client";

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
            names = {"--storage-path"},
            defaultValue = ".",
            description = "Path where storage files will be created (default: .)")
    Path storagePath;

    @CommandLine.Option(
            names = {"-k", "--secret-key"},
            description = "Node secret key, as [1,2,3] array or hex string; generated when absent")
    String secretKey;

    @CommandLine.Parameters(
            index = "0",
            description = "server to create the datasets, client to join them")
    String mode;

    @CommandLine.Parameters(
            index = "1..*",
            arity = "0..*",
            description = "Client tickets in order: RESOURCE FOLDER NODE RESOURCE1 RESOURCE2 RESOURCE3")
    List<String> tickets = new ArrayList<>();

    @Inject
    SessionRegistry registry;

    @Override
    public void run() {
        Map<Dataset, String> importTickets = importTickets();
        byte[] key = resolveSecretKey();
        try {
            Path root = storagePath.resolve(mode);
            Files.createDirectories(root);
            DocumentNode node = new InMemoryDocumentNode(SecretKeys.nodeId(key), new FsContentStore(root.resolve("blobs")));
            LOG.infof("Starting %s node %s with storage %s", mode, node.nodeId(), root);

            registry.openAll(node, importTickets);
            if (SERVER.equals(mode)) {
                System.out.println("Server started.");
                System.out.println("Use the following command to connect clients: docsync client "
                        + registry.ticketString());
            }
            readCommands();
        } catch (IOException e) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Failed to start " + mode, e);
        } finally {
            registry.closeAll();
        }
    }

    private Map<Dataset, String> importTickets() {
        Map<Dataset, String> imports = new EnumMap<>(Dataset.class);
        if (SERVER.equals(mode)) {
            if (!tickets.isEmpty()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "server takes no tickets");
            }
            return imports;
        }
        if (!CLIENT.equals(mode)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Unknown mode: " + mode);
        }
        Dataset[] order = Dataset.values();
        if (tickets.size() != order.length) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "client expects " + order.length + " tickets, got " + tickets.size());
        }
        for (int i = 0; i < order.length; i++) {
            imports.put(order[i], tickets.get(i));
        }
        return imports;
    }

    private byte[] resolveSecretKey() {
        if (secretKey == null) {
            LOG.info("No secret key provided, generating a new one");
            return SecretKeys.generate();
        }
        try {
            return SecretKeys.parse(secretKey);
        } catch (IllegalArgumentException e) {
            LOG.warnf("Failed to parse secret key: %s, generating a new one", e.getMessage());
            return SecretKeys.generate();
        }
    }

    private void readCommands() throws IOException {
        System.out.println("Type 'help' for commands, 'quit' to exit.");
        Terminal terminal = TerminalBuilder.builder().system(true).build();
        LineReader reader = LineReaderBuilder.builder()
                .terminal(terminal)
                .appName("docsync")
                .completer(new StringsCompleter(
                        "help", "quit", "exit", "status", "tickets", "add", "add_folder", "get", "get_folder"))
                .build();
        while (true) {
            String line;
            try {
                line = reader.readLine("docsync> ");
            } catch (UserInterruptException | EndOfFileException e) {
                break;
            }
            if (line == null) {
                break;
            }
            if (!dispatch(line, System.out)) {
                break;
            }
        }
        System.out.println("Shutdown complete.");
    }

    /**
     * Run one line command.
     *
     * @return false when the shell should exit
     */
    boolean dispatch(String line, PrintStream out) {
        String input = line.trim();
        if (input.isEmpty()) {
            return true;
        }
        try {
            switch (input) {
                case "quit":
                case "exit":
                    out.println("Goodbye!");
                    return false;
                case "help":
                    printHelp(out);
                    break;
                case "status":
                    printStatus(out);
                    break;
                case "tickets":
                    out.println(registry.ticketString());
                    break;
                case "add":
                    int added = registry.loadImages();
                    out.println("Loaded " + added + " files into resources.");
                    break;
                case "add_folder":
                    registry.folders().insertFolder("New Folder");
                    out.println("Folder added.");
                    break;
                case "get":
                    out.println("Retrieved resources len: " + registry.resources(Dataset.RESOURCE).search().size());
                    break;
                case "get_folder":
                    out.println("Retrieved folders len: " + registry.folders().search().size());
                    break;
                default:
                    out.println("Unknown command: '" + input + "'. Type 'help' for available commands.");
            }
        } catch (IOException | RuntimeException e) {
            LOG.debugf(e, "Command %s failed", input);
            out.println("! " + input + " failed: " + e.getMessage());
        }
        return true;
    }

    private void printHelp(PrintStream out) {
        out.println("Available commands:");
        out.println("  help       - Show this help message");
        out.println("  quit, exit - Exit the program");
        out.println("  status     - Show synchronization progress per dataset");
        out.println("  tickets    - Print the tickets clients need to join");
        out.println("  add        - Load images from the configured directory into resources");
        out.println("  add_folder - Add a new folder named 'New Folder'");
        out.println("  get        - Retrieve and display the number of resources");
        out.println("  get_folder - Retrieve and display the number of folders");
    }

    private void printStatus(PrintStream out) {
        for (SyncSession session : registry.sessions()) {
            ProgressSnapshot p = session.snapshot();
            out.printf("%-10s pending %d/%d items, %d/%d bytes (%.0f%%) metadata=%s content=%s%n",
                    p.datasetName(),
                    p.queuePendingCount(),
                    p.lifetimePendingCount(),
                    p.queuePendingBytes(),
                    p.lifetimePendingBytes(),
                    p.completedRatio() * 100,
                    p.metadataCaughtUp() ? "synced" : "syncing",
                    p.allContentMaterialized() ? "synced" : "syncing");
        }
    }
}
