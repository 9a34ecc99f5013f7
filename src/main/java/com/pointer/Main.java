package com.pointer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pointer.gc.GcReport;
import com.pointer.ingest.ExtractionBatch;
import com.pointer.ingest.IngestionReport;
import com.pointer.maintenance.MaintenanceCoordinator;
import com.pointer.retention.PolicyDeletion;
import com.pointer.retention.PruneReport;
import com.pointer.retention.RetentionPolicy;
import com.pointer.retention.RetentionReport;
import com.pointer.runtime.AppConfig;
import com.pointer.search.NameMatchMode;
import com.pointer.search.SearchPage;
import com.pointer.search.SearchRequest;
import com.pointer.search.SearchSurface;
import com.pointer.search.TextMatchMode;
import com.pointer.store.ConsistencyReport;
import com.pointer.store.NotFoundException;
import com.pointer.store.PointerIndex;
import com.pointer.symbols.NameCacheRebuilder;
import com.pointer.symbols.SymbolKind;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "pointer",
        mixinStandardHelpOptions = true,
        version = "pointer 0.1.0",
        description = "Content-addressed code index: ingestion, search, retention and garbage collection.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", required = true)
    Mode mode;

    @Option(names = "--index-path", description = "Overrides storage.indexPath from the config")
    Path indexPath;

    @Option(names = "--input", description = "Extraction batch JSON for ingest mode")
    Path input;

    @Option(names = "--query", description = "Query for search mode")
    String query;

    @Option(names = "--surface", description = "Search surface: ${COMPLETION-CANDIDATES}", defaultValue = "SYMBOL")
    SearchSurface surface;

    @Option(names = "--name-mode", description = "Symbol name matching: ${COMPLETION-CANDIDATES}", defaultValue = "EXACT")
    NameMatchMode nameMode;

    @Option(names = "--text-mode", description = "Text matching: ${COMPLETION-CANDIDATES}", defaultValue = "SUBSTRING")
    TextMatchMode textMode;

    @Option(names = "--namespace", description = "Namespace used for ranking symbol hits")
    String namespace;

    @Option(names = "--path-hint", description = "Path used for ranking hits")
    String pathHint;

    @Option(names = "--kind", split = ",", description = "Symbol kinds to keep: ${COMPLETION-CANDIDATES}")
    List<SymbolKind> kinds;

    @Option(names = "--fqn", description = "Fully-qualified name filter")
    String fullyQualified;

    @Option(names = "--namespace-prefix", description = "Keep only symbols whose namespace starts with this prefix")
    String namespacePrefix;

    @Option(names = "--language", split = ",", description = "Languages to keep")
    List<String> languages;

    @Option(names = "--path", description = "Keep only hits whose path contains this text (case-insensitive)")
    String pathFilter;

    @Option(names = "--repo", description = "Repository")
    String repository;

    @Option(names = "--branch", description = "Branch")
    String branch;

    @Option(names = "--commit", description = "Commit")
    String commit;

    @Option(names = "--expect-branch", description = "Current live branch expected by live-branch mode; 'none' for no live branch")
    String expectBranch;

    @Option(names = "--case-sensitive", description = "Case-sensitive text matching", defaultValue = "false")
    boolean caseSensitive;

    @Option(names = "--context", description = "Context lines around each hit")
    Integer contextLines;

    @Option(names = "--page", description = "1-based result page", defaultValue = "1")
    int page;

    @Option(names = "--page-size", description = "Results per page")
    Integer pageSize;

    @Option(names = "--latest", description = "Latest snapshots kept; without --branch applies to every branch of --repo")
    Integer latestKeepCount;

    @Option(names = "--interval", description = "Interval tier width in seconds")
    Long intervalSeconds;

    @Option(names = "--keep", description = "Snapshots kept by an interval tier")
    Integer keepCount;

    @Option(names = "--batch-size", description = "Batch size for prune-repo and cleanup-name-cache")
    Integer batchSize;

    @Option(names = "--max-batches", description = "Batch limit for cleanup-name-cache")
    Integer maxBatches;

    @Option(names = "--shards", description = "Shard count for rebuild-name-cache")
    Integer shards;

    private final ObjectMapper json = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    enum Mode {
        ingest,
        search,
        gc,
        retain,
        daemon,
        verify,
        policy_set,
        policy_add_tier,
        policy_remove_tier,
        policy_delete,
        policy_show,
        live_branch,
        prune_commit,
        prune_branch,
        prune_repo,
        rebuild_name_cache,
        cleanup_name_cache
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        if (indexPath != null) {
            config.getStorage().setIndexPath(indexPath.toString());
        }
        log.info("Starting pointer in {} mode", mode);
        log.info("Using config file: {} index: {}", configPath, config.getStorage().getIndexPath());

        Integer usage = validate();
        if (usage != null) {
            return usage;
        }
        try (PointerIndex index = PointerIndex.open(config, Clock.systemUTC())) {
            run(index, config);
            return 0;
        } catch (NotFoundException e) {
            log.error("{}", e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("invalid request: {}", e.getMessage());
            return 1;
        } catch (IllegalStateException e) {
            log.error("{}", e.getMessage());
            return 1;
        }
    }

    private void run(PointerIndex index, AppConfig config) throws IOException, InterruptedException {
        switch (mode) {
            case ingest -> {
                ExtractionBatch batch = json.readValue(input.toFile(), ExtractionBatch.class);
                IngestionReport report = index.ingestAll(batch.toExtractedFiles());
                if (report.failed() == 0 && batch.branch() != null) {
                    if (batch.indexedAt() == null) {
                        index.completeCommit(batch.repository(), batch.branch(), batch.commit());
                    } else {
                        index.completeCommit(batch.repository(), batch.branch(), batch.commit(), batch.indexedAt());
                    }
                }
                log.info("Ingested batch repo={} commit={} files={} newBlobs={} deduped={} symbols={} failed={}",
                        batch.repository(), batch.commit(), report.files(), report.newBlobs(), report.dedupedBlobs(),
                        report.symbolsIndexed(), report.failed());
                index.save();
            }
            case search -> {
                AppConfig.SearchConfig search = config.getSearch();
                SearchPage result = index.search(SearchRequest.builder(query)
                        .surface(surface)
                        .nameMode(nameMode)
                        .textMode(textMode)
                        .namespace(namespace)
                        .pathHint(pathHint)
                        .kinds(kinds == null ? Set.of() : EnumSet.copyOf(kinds))
                        .fullyQualified(fullyQualified)
                        .namespacePrefix(namespacePrefix)
                        .languages(languages == null ? Set.of() : Set.copyOf(languages))
                        .pathFilter(pathFilter)
                        .repository(repository)
                        .commit(commit)
                        .caseSensitive(caseSensitive)
                        .contextLines(contextLines == null ? search.getContextLines() : contextLines)
                        .page(page)
                        .pageSize(pageSize == null ? search.getDefaultPageSize() : pageSize)
                        .build());
                System.out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            }
            case gc -> {
                GcReport report = index.runGc();
                log.info("GC completed blobs={} chunks={} symbols={} names={} failures={}",
                        report.blobsDeleted(), report.chunksDeleted(), report.symbolsDeleted(), report.namesRemoved(), report.failures());
                index.save();
            }
            case retain -> {
                RetentionReport report = index.runRetention();
                log.info("Retention completed branches={} snapshots={} commits={} files={} failures={}",
                        report.branchesEvaluated(), report.snapshotsRemoved(), report.commitsPruned(), report.filesRemoved(), report.failures());
                index.save();
            }
            case daemon -> {
                index.startBackgroundMaintenance();
                MaintenanceCoordinator coordinator = new MaintenanceCoordinator(index);
                Runtime.getRuntime().addShutdownHook(new Thread(coordinator::requestStop, "maintenance-shutdown"));
                MaintenanceCoordinator.MaintenanceState state = coordinator.runLoop();
                log.info("Maintenance loop finished status={} cycles={} failed={}", state.lastCycleStatus, state.totalCycles, state.failedCycles);
                index.save();
            }
            case verify -> {
                ConsistencyReport report = index.verify();
                System.out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(report));
                if (!report.consistent()) {
                    throw new IllegalStateException("index is inconsistent");
                }
            }
            case policy_set -> {
                List<String> branches = branch == null ? index.retentionStore().branches(repository) : List.of(branch);
                if (branches.isEmpty()) {
                    throw new NotFoundException("repository", repository);
                }
                for (String target : branches) {
                    index.retentionStore().setLatestKeepCount(repository, target, latestKeepCount);
                }
                index.save();
            }
            case policy_add_tier -> {
                index.retentionStore().addIntervalTier(repository, branch, intervalSeconds, keepCount);
                index.save();
            }
            case policy_remove_tier -> {
                boolean removed = index.retentionStore().removeIntervalTier(repository, branch, intervalSeconds);
                log.info("Interval tier removed={} repo={} branch={} intervalSeconds={}", removed, repository, branch, intervalSeconds);
                index.save();
            }
            case policy_delete -> {
                PolicyDeletion deletion = index.retentionStore().deletePolicy(repository, branch);
                log.info("Policy deleted repo={} branch={} tiers={} snapshots={}", repository, branch,
                        deletion.tiersRemoved(), deletion.snapshotsRemoved());
                index.save();
            }
            case policy_show -> {
                List<RetentionPolicy> policies = branch == null
                        ? index.retentionStore().policies().stream()
                                .filter(policy -> repository == null || policy.repository().equals(repository))
                                .toList()
                        : List.of(index.retentionStore().policy(repository, branch));
                System.out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(policies));
            }
            case live_branch -> {
                if (expectBranch == null) {
                    index.retentionStore().setLiveBranch(repository, branch);
                } else {
                    String expected = "none".equals(expectBranch) ? null : expectBranch;
                    if (!index.retentionStore().compareAndSetLiveBranch(repository, expected, branch)) {
                        throw new IllegalStateException("live branch of " + repository + " is "
                                + index.retentionStore().liveBranch(repository).orElse("none") + ", not " + expectBranch);
                    }
                }
                log.info("Live branch repo={} branch={}", repository, branch);
                index.save();
            }
            case prune_commit -> logPrune(index, index.commitPruner().pruneCommit(repository, commit));
            case prune_branch -> logPrune(index, index.commitPruner().pruneBranch(repository, branch));
            case prune_repo -> logPrune(index, index.commitPruner().pruneRepository(repository,
                    batchSize == null ? config.getNameCache().getCleanupBatchSize() : batchSize));
            case rebuild_name_cache -> {
                index.flushNameCache();
                NameCacheRebuilder.RebuildReport report = index.rebuildNameCache(shards == null ? config.getNameCache().getRebuildShards() : shards);
                log.info("Name cache rebuilt shards={} names={} refs={}", report.shards(), report.names(), report.refs());
                index.save();
            }
            case cleanup_name_cache -> {
                NameCacheRebuilder.CleanupReport report = index.cleanupNameCache(
                        batchSize == null ? config.getNameCache().getCleanupBatchSize() : batchSize,
                        maxBatches == null ? config.getNameCache().getCleanupMaxBatches() : maxBatches);
                log.info("Name cache cleanup refs={} names={} remaining={}", report.refsRemoved(), report.namesRemoved(), report.remaining());
                index.save();
            }
        }
    }

    Integer validate() {
        String missing = switch (mode) {
            case ingest -> input == null ? "--input" : null;
            case search -> query == null || query.isBlank() ? "--query" : null;
            case policy_set -> requireAll(repository, latestKeepCount, "", "--repo and --latest");
            case policy_add_tier -> requireAll(repository, branch, intervalSeconds, "--repo, --branch and --interval")
                    != null || keepCount == null ? "--repo, --branch, --interval and --keep" : null;
            case policy_remove_tier -> requireAll(repository, branch, intervalSeconds, "--repo, --branch and --interval");
            case policy_delete, prune_branch, live_branch -> requireAll(repository, branch, "", "--repo and --branch");
            case prune_commit -> requireAll(repository, commit, "", "--repo and --commit");
            case prune_repo -> repository == null ? "--repo" : null;
            default -> null;
        };
        if (missing != null) {
            log.error("{} required in {} mode", missing, mode);
            return 2;
        }
        return null;
    }

    private static String requireAll(Object first, Object second, Object third, String description) {
        return first == null || second == null || third == null ? description : null;
    }

    private static void logPrune(PointerIndex index, PruneReport report) throws IOException {
        log.info("Prune completed repo={} snapshots={} commits={} files={} batches={}",
                report.repository(), report.snapshotsRemoved(), report.commitsPruned(), report.filesRemoved(), report.batches());
        index.save();
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
