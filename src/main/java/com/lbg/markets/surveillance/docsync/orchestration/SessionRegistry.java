package com.lbg.markets.surveillance.docsync.orchestration;

import com.lbg.markets.surveillance.docsync.domain.Dataset;
import com.lbg.markets.surveillance.docsync.entity.EntityTable;
import com.lbg.markets.surveillance.docsync.entity.Folder;
import com.lbg.markets.surveillance.docsync.entity.Folders;
import com.lbg.markets.surveillance.docsync.entity.Node;
import com.lbg.markets.surveillance.docsync.entity.Nodes;
import com.lbg.markets.surveillance.docsync.entity.Resource;
import com.lbg.markets.surveillance.docsync.entity.Resources;
import com.lbg.markets.surveillance.docsync.log.DocumentLog;
import com.lbg.markets.surveillance.docsync.log.DocumentNode;
import com.lbg.markets.surveillance.docsync.log.EventSubscription;
import com.lbg.markets.surveillance.docsync.store.ContentStore;
import com.lbg.markets.surveillance.docsync.sync.SyncSession;
import com.lbg.markets.surveillance.docsync.tracker.InMemoryPendingIndex;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Opens the fixed set of datasets and owns one sync session per dataset.
 * Each session gets its own subscription and consumer thread; sessions share nothing.
 */
@ApplicationScoped
public class SessionRegistry {

    private static final Logger LOG = Logger.getLogger(SessionRegistry.class);

    // Shared author identity so every node writes as the same author
    static final byte[] AUTHOR_SECRET = {
            7, 57, (byte) 234, (byte) 237, (byte) 239, (byte) 151, (byte) 201, 39,
            (byte) 210, (byte) 244, (byte) 128, (byte) 178, 34, 67, 38, (byte) 216,
            (byte) 247, 76, 126, 49, (byte) 255, 112, 41, (byte) 183,
            79, 0, (byte) 138, 66, (byte) 249, 34, 109, 14
    };

    private final ResourceLoader resourceLoader;
    private final int outletCapacity;
    private final Set<String> excludedDatasets;
    private final long maxEntityBytes;
    private final String missingLabel;
    private final String untitledLabel;
    private final int seedFolderCount;
    private final Optional<String> imagesPath;

    private final Map<Dataset, SyncSession> sessions = new ConcurrentHashMap<>();
    private final Map<Dataset, EntityTable<?>> tables = new ConcurrentHashMap<>();
    private final ExecutorService consumers = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable);
        thread.setDaemon(true);
        return thread;
    });

    public SessionRegistry(
            ResourceLoader resourceLoader,
            @ConfigProperty(name = "docsync.outlet.capacity", defaultValue = "1000") int outletCapacity,
            @ConfigProperty(name = "docsync.progress.excluded-datasets", defaultValue = "resource") List<String> excludedDatasets,
            @ConfigProperty(name = "docsync.entity.max-size-bytes", defaultValue = "157286400") long maxEntityBytes,
            @ConfigProperty(name = "docsync.entity.missing-label", defaultValue = "File not found") String missingLabel,
            @ConfigProperty(name = "docsync.entity.untitled-label", defaultValue = "Untitled") String untitledLabel,
            @ConfigProperty(name = "docsync.seed.folder-count", defaultValue = "9") int seedFolderCount,
            @ConfigProperty(name = "docsync.images.path") Optional<String> imagesPath
    ) {
        this.resourceLoader = resourceLoader;
        this.outletCapacity = outletCapacity;
        this.excludedDatasets = Set.copyOf(excludedDatasets);
        this.maxEntityBytes = maxEntityBytes;
        this.missingLabel = missingLabel;
        this.untitledLabel = untitledLabel;
        this.seedFolderCount = seedFolderCount;
        this.imagesPath = imagesPath;
    }

    /**
     * Open or join every dataset. A dataset with an entry in {@code importTickets} is joined,
     * the others are created. Datasets opened before a failure stay open.
     */
    public void openAll(DocumentNode node, Map<Dataset, String> importTickets) throws IOException {
        for (Dataset dataset : Dataset.values()) {
            open(node, dataset, importTickets.get(dataset));
        }
        LOG.infof("Opened %d datasets on node %s", sessions.size(), node.nodeId());
    }

    /**
     * Open one dataset and start its sync session. Calls are serialized, so a dataset
     * is never opened twice.
     *
     * @param importTicket ticket to join, or null to create the dataset and issue a ticket
     */
    public synchronized EntityTable<?> open(DocumentNode node, Dataset dataset, String importTicket) throws IOException {
        if (sessions.containsKey(dataset)) {
            throw new IllegalStateException("Dataset already open: " + dataset.tableName());
        }

        DocumentLog doc = importTicket == null
                ? node.create(dataset.tableName())
                : node.importTicket(dataset.tableName(), importTicket);
        String authorId = node.ensureAuthor(AUTHOR_SECRET);
        String ticket = importTicket == null ? doc.share() : null;
        EntityTable<?> table = createTable(dataset, doc, node.contentStore(), authorId, ticket);
        LOG.infof("%s namespace ID: %s", dataset.tableName(), doc.namespaceId());

        SyncSession session = new SyncSession(
                dataset.tableName(),
                doc.namespaceId(),
                new InMemoryPendingIndex(),
                outletCapacity,
                excludedDatasets
        );
        EventSubscription events = doc.subscribe();
        Future<?> consumer = consumers.submit(() -> {
            Thread.currentThread().setName("docsync-" + dataset.tableName());
            session.consume(events);
        });
        session.attach(consumer);

        sessions.put(dataset, session);
        tables.put(dataset, table);

        if (importTicket == null) {
            seed(dataset, table);
        }
        return table;
    }

    private EntityTable<?> createTable(Dataset dataset, DocumentLog doc, ContentStore store,
                                       String authorId, String ticket) {
        switch (dataset.kind()) {
            case FOLDER:
                return new Folders(doc, store, new Folder.Codec(untitledLabel), authorId, ticket, maxEntityBytes);
            case NODE:
                return new Nodes(doc, store, new Node.Codec(missingLabel), authorId, ticket, maxEntityBytes);
            case RESOURCE:
                return new Resources(doc, store, new Resource.Codec(missingLabel), authorId, ticket, maxEntityBytes);
            default:
                throw new IllegalArgumentException("Unknown dataset kind: " + dataset.kind());
        }
    }

    private void seed(Dataset dataset, EntityTable<?> table) throws IOException {
        if (dataset == Dataset.FOLDER) {
            Folders folders = (Folders) table;
            for (int i = 1; i <= seedFolderCount; i++) {
                folders.insertFolder("New Folder" + i);
            }
        } else if (dataset == Dataset.RESOURCE || dataset == Dataset.RESOURCE1) {
            if (imagesPath.isPresent()) {
                resourceLoader.load((Resources) table, Path.of(imagesPath.get()));
            }
        }
    }

    /**
     * Load the configured images directory into the default resource dataset.
     *
     * @return the number of files added
     */
    public int loadImages() throws IOException {
        String path = imagesPath.orElseThrow(() -> new IllegalStateException("docsync.images.path is not set"));
        return resourceLoader.load(resources(Dataset.RESOURCE), Path.of(path));
    }

    public Optional<SyncSession> session(Dataset dataset) {
        return Optional.ofNullable(sessions.get(dataset));
    }

    /**
     * Open sessions in dataset order.
     */
    public List<SyncSession> sessions() {
        return Arrays.stream(Dataset.values())
                .map(sessions::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    public Folders folders() {
        return (Folders) table(Dataset.FOLDER);
    }

    public Nodes nodes() {
        return (Nodes) table(Dataset.NODE);
    }

    public Resources resources(Dataset dataset) {
        if (dataset.kind() != Dataset.Kind.RESOURCE) {
            throw new IllegalArgumentException("Not a resource dataset: " + dataset.tableName());
        }
        return (Resources) table(dataset);
    }

    /**
     * Tickets of all datasets in dataset order, separated by single spaces.
     * A dataset that was joined contributes an empty ticket.
     */
    public String ticketString() {
        return Arrays.stream(Dataset.values())
                .map(d -> {
                    EntityTable<?> table = tables.get(d);
                    return table != null ? table.ticketString() : "";
                })
                .collect(Collectors.joining(" "));
    }

    /**
     * Best-effort stop of every consumer still running, then forget all sessions.
     */
    public synchronized void closeAll() {
        for (SyncSession session : sessions.values()) {
            session.stop();
        }
        sessions.clear();
        tables.clear();
        LOG.info("All sync sessions closed");
    }

    @PreDestroy
    void shutdown() {
        closeAll();
        consumers.shutdownNow();
    }

    private EntityTable<?> table(Dataset dataset) {
        EntityTable<?> table = tables.get(dataset);
        if (table == null) {
            throw new IllegalStateException("Dataset not open: " + dataset.tableName());
        }
        return table;
    }
}
