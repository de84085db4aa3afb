package com.stashguard.server;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.stashguard.config.ConfigLoadException;
import com.stashguard.config.ConfigService;
import com.stashguard.config.ConfigValidationException;
import com.stashguard.config.ServiceConfig;
import com.stashguard.identity.IdentityVerifier;
import com.stashguard.identity.TokenTableIdentityVerifier;
import com.stashguard.persistence.DocumentStore;
import com.stashguard.persistence.FileDocumentStore;
import com.stashguard.persistence.StoreException;
import com.stashguard.rpc.GetItemsMethod;
import com.stashguard.rpc.InventoryCommitOrchestrator;
import com.stashguard.rpc.RateLimiter;
import com.stashguard.rpc.RpcDispatcher;
import com.stashguard.rpc.RpcMethodRegistry;
import com.stashguard.rpc.UploadPlayerInventoryMethod;
import com.stashguard.templates.StoreTemplateCatalog;
import com.stashguard.templates.TemplateCache;
import com.stashguard.validation.EquipmentValidator;
import com.stashguard.validation.GridValidator;
import com.stashguard.validation.InventorySanitizer;
import com.stashguard.validation.ItemValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Process entry point. Wires the service graph from configuration and serves RPC over HTTP
 * until the JVM shuts down.
 */
public class StashguardServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(StashguardServer.class);

    static final String IMPORT_COMMAND = "import-catalog";

    private final RpcMethodRegistry registry;
    private final RpcHttpServer httpServer;

    StashguardServer(ServiceConfig config, IdentityVerifier identityVerifier, DocumentStore store, Clock clock) {
        TemplateCache templateCache = new TemplateCache(new StoreTemplateCatalog(store), clock);
        ItemValidator itemValidator = new ItemValidator();

        InventoryCommitOrchestrator orchestrator = new InventoryCommitOrchestrator(
            identityVerifier,
            new RateLimiter(clock),
            templateCache,
            new GridValidator(itemValidator),
            new EquipmentValidator(itemValidator),
            new InventorySanitizer(),
            store
        );

        this.registry = new RpcMethodRegistry();
        registry.register(new UploadPlayerInventoryMethod(orchestrator));
        registry.register(new GetItemsMethod(identityVerifier, templateCache));
        registry.closeRegistration();

        this.httpServer = new RpcHttpServer(new RpcDispatcher(registry), config.bindHost(), config.port());
    }

    public void start() throws IOException {
        httpServer.start();
    }

    public void stop() {
        httpServer.stop();
    }

    RpcMethodRegistry getRegistry() {
        return registry;
    }

    int getPort() {
        return httpServer.getPort();
    }

    /**
     * Starts the server, or with {@code import-catalog <file>} loads item templates into the
     * store and exits.
     *
     * <pre>
     * StashguardServer [config.json]
     * StashguardServer import-catalog &lt;catalog.json&gt; [config.json]
     * </pre>
     */
    public static void main(String[] args) {
        boolean importCatalog = args.length > 0 && IMPORT_COMMAND.equals(args[0]);
        if (importCatalog && args.length < 2) {
            LOGGER.error("Usage: {} <catalog.json> [config.json]", IMPORT_COMMAND);
            System.exit(2);
        }
        int configArg = importCatalog ? 2 : 0;
        Path configFile = Path.of(args.length > configArg ? args[configArg] : ConfigService.DEFAULT_FILE_NAME);

        try {
            ServiceConfig config = new ConfigService().load(configFile);
            Clock clock = Clock.systemUTC();
            DocumentStore store = new FileDocumentStore(config.storageDirectory(), clock);

            if (importCatalog) {
                importCatalog(store, Path.of(args[1]));
                return;
            }

            IdentityVerifier verifier = TokenTableIdentityVerifier.load(config.tokensFile());
            StashguardServer server = new StashguardServer(config, verifier, store, clock);
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "stashguard-shutdown"));
        } catch (ConfigLoadException | ConfigValidationException e) {
            LOGGER.error("Invalid configuration in {}: {}", configFile, e.getMessage());
            System.exit(2);
        } catch (IOException | StoreException | IllegalArgumentException | IllegalStateException e) {
            LOGGER.error("Failed to start: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    private static void importCatalog(DocumentStore store, Path catalogFile) throws IOException, StoreException {
        JsonElement documents;
        try (Reader reader = Files.newBufferedReader(catalogFile, StandardCharsets.UTF_8)) {
            documents = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IOException("Catalog file is not valid JSON: " + catalogFile, e);
        }
        if (!documents.isJsonObject()) {
            throw new IOException("Catalog file must contain a JSON object keyed by template id: " + catalogFile);
        }
        new StoreTemplateCatalog(store).importCatalog(documents.getAsJsonObject());
    }
}
