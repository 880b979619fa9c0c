package com.graphsync.cli;

import ch.qos.logback.classic.Level;
import com.graphsync.cli.exception.OptionsValidationException;
import com.graphsync.cli.model.SyncOptions;
import com.graphsync.cli.model.ValidatedSyncOptions;
import com.graphsync.cli.output.SyncResultsPrinter;
import com.graphsync.cli.validation.SyncOptionsValidator;
import com.graphsync.engine.JobArgs;
import com.graphsync.engine.SyncConnector;
import com.graphsync.engine.SyncReport;
import com.graphsync.exception.ConstructionException;
import com.graphsync.loader.ApiConnection;
import com.graphsync.loader.DataConnection;
import com.graphsync.loader.FileConnection;
import com.graphsync.node.LoaderNode;
import com.graphsync.repository.JsonFileTargetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.Callable;

/**
 * CLI command running one sync job of a connector against a JSON file repository.
 */
@Command(
        name = "run",
        mixinStandardHelpOptions = true,
        version = "graphsync-connector 1.0.0",
        description = "Synchronizes a source into a target repository using the node tree of a connector class."
)
public class SyncCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SyncCommand.class);

    @Mixin
    private SyncOptions options;

    private final SyncOptionsValidator validator = new SyncOptionsValidator();
    private final SyncResultsPrinter printer = new SyncResultsPrinter();

    @Override
    public Integer call() {
        ValidatedSyncOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        }
        applyLogLevel(validated.getLogLevel());
        printer.printBanner(options, validated);

        try {
            SyncConnector connector = instantiate(options.getConnectorClass());
            connector.form();

            JobArgs jobArgs = JobArgs.builder()
                    .connection(connection(connector, validated))
                    .containerKey(options.getContainerKey())
                    .enableDelete(!options.isNoDelete())
                    .revisionHeader(options.getRevisionHeader())
                    .build();
            JsonFileTargetRepository repository = JsonFileTargetRepository.open(validated.getNormalizedRepositoryFile());
            SyncReport report = connector.runJob(repository, jobArgs);

            if (options.getSnapshotFile() != null) {
                connector.save(options.getSnapshotFile());
            }
            printer.printSuccess(report);
            return report.isSuccess() ? 0 : 1;
        } catch (Exception e) {
            printer.printFailure(e);
            return 1;
        }
    }

    private DataConnection connection(SyncConnector connector, ValidatedSyncOptions validated) {
        String loaderKey = options.getLoaderNodeKey();
        if (loaderKey == null) {
            loaderKey = connector.getTree().findContainer(options.getContainerKey())
                    .flatMap(container -> connector.getTree().findLoader(container))
                    .map(LoaderNode::getKey)
                    .orElseThrow(() -> new ConstructionException("Container " + options.getContainerKey()
                            + " has no loader node"));
        }
        return validated.isApiSource()
                ? new ApiConnection(loaderKey, options.getApiBaseUrl())
                : new FileConnection(loaderKey, validated.getNormalizedSourceFile());
    }

    static SyncConnector instantiate(String className) {
        try {
            Class<?> type = Class.forName(className);
            if (!SyncConnector.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(className + " does not extend " + SyncConnector.class.getName());
            }
            return (SyncConnector) type.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Connector class not found: " + className, e);
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException
                 | InvocationTargetException e) {
            throw new IllegalArgumentException("Cannot instantiate connector " + className
                    + ": a public no-argument constructor is required", e);
        }
    }

    private static void applyLogLevel(String level) {
        ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.graphsync");
        root.setLevel(Level.toLevel(level, Level.INFO));
    }
}
