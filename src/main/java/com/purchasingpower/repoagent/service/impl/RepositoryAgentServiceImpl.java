package com.purchasingpower.repoagent.service.impl;

import com.purchasingpower.repoagent.configuration.AppProperties;
import com.purchasingpower.repoagent.configuration.CompletionProperties;
import com.purchasingpower.repoagent.configuration.ContextProperties;
import com.purchasingpower.repoagent.context.ContextAssembler;
import com.purchasingpower.repoagent.context.RelevanceSelector;
import com.purchasingpower.repoagent.exception.EngineException;
import com.purchasingpower.repoagent.exception.InputValidationException;
import com.purchasingpower.repoagent.exception.NotFoundException;
import com.purchasingpower.repoagent.index.FileTreeIndexer;
import com.purchasingpower.repoagent.model.AgentResponse;
import com.purchasingpower.repoagent.model.ChatMessage;
import com.purchasingpower.repoagent.model.CloneProgress;
import com.purchasingpower.repoagent.model.CompletionRequest;
import com.purchasingpower.repoagent.model.ConnectivityStatus;
import com.purchasingpower.repoagent.model.ContextBudget;
import com.purchasingpower.repoagent.model.FileModification;
import com.purchasingpower.repoagent.model.FileTreeNode;
import com.purchasingpower.repoagent.model.GeneratedCodeWithTests;
import com.purchasingpower.repoagent.model.LoadedRepository;
import com.purchasingpower.repoagent.model.RemoteRepository;
import com.purchasingpower.repoagent.model.TaskType;
import com.purchasingpower.repoagent.model.prompt.RenderedPrompt;
import com.purchasingpower.repoagent.parser.AgentResponseParser;
import com.purchasingpower.repoagent.parser.CodeBlockExtractor;
import com.purchasingpower.repoagent.parser.PathListExtractor;
import com.purchasingpower.repoagent.service.ConnectivityMonitor;
import com.purchasingpower.repoagent.service.ModelCatalog;
import com.purchasingpower.repoagent.service.PromptLibraryService;
import com.purchasingpower.repoagent.service.RepositoryAgentService;
import com.purchasingpower.repoagent.service.RepositorySession;
import com.purchasingpower.repoagent.service.ResilientCompletionService;
import com.purchasingpower.repoagent.store.RepositoryStore;
import com.purchasingpower.repoagent.util.FileNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * Implementation of RepositoryAgentService.
 *
 * Sequences store, indexer, selector, assembler, prompt library and the resilient
 * completion pipeline for each workflow. Store reads are blocking and run on the
 * bounded elastic scheduler.
 */
@Slf4j
@Service
public class RepositoryAgentServiceImpl implements RepositoryAgentService {

    private final RepositoryStore store;
    private final FileTreeIndexer indexer;
    private final RelevanceSelector selector;
    private final ContextAssembler assembler;
    private final PromptLibraryService prompts;
    private final ResilientCompletionService completions;
    private final ConnectivityMonitor connectivity;
    private final ModelCatalog catalog;
    private final AgentResponseParser responseParser;
    private final PathListExtractor pathListExtractor;
    private final CodeBlockExtractor codeBlockExtractor;
    private final RepositorySession session;
    private final CompletionProperties completionProperties;
    private final ContextProperties contextProperties;

    public RepositoryAgentServiceImpl(RepositoryStore store,
                                      FileTreeIndexer indexer,
                                      RelevanceSelector selector,
                                      ContextAssembler assembler,
                                      PromptLibraryService prompts,
                                      ResilientCompletionService completions,
                                      ConnectivityMonitor connectivity,
                                      ModelCatalog catalog,
                                      AgentResponseParser responseParser,
                                      PathListExtractor pathListExtractor,
                                      CodeBlockExtractor codeBlockExtractor,
                                      RepositorySession session,
                                      AppProperties appProperties) {
        this.store = store;
        this.indexer = indexer;
        this.selector = selector;
        this.assembler = assembler;
        this.prompts = prompts;
        this.completions = completions;
        this.connectivity = connectivity;
        this.catalog = catalog;
        this.responseParser = responseParser;
        this.pathListExtractor = pathListExtractor;
        this.codeBlockExtractor = codeBlockExtractor;
        this.session = session;
        this.completionProperties = appProperties.getCompletion();
        this.contextProperties = appProperties.getContext();
    }

    // ======================================================================
    // REPOSITORY
    // ======================================================================

    @Override
    public Mono<RemoteRepository> loadRepository(String url, Consumer<CloneProgress> onProgress) {
        return store.cloneRepository(url, onProgress)
                .flatMap(repository -> blocking(() -> {
                    FileTreeIndexer.Result indexed = indexer.index(repository.namespace(), repository.getName());
                    LoadedRepository loaded = new LoadedRepository(
                            repository, indexed.tree(), indexed.tree().flattenFilePaths());
                    session.replace(loaded)
                            .filter(previous -> !previous.namespace().equals(loaded.namespace()))
                            .ifPresent(previous -> store.evict(previous.namespace()));
                    log.info("Repository {} loaded ({} files)", repository.namespace(), repository.getFileCount());
                    return repository;
                }));
    }

    @Override
    public Optional<RemoteRepository> getRepository() {
        return session.current().map(LoadedRepository::repository);
    }

    @Override
    public FileTreeNode getTree() {
        return session.require().tree();
    }

    @Override
    public Mono<String> getFile(String path) {
        return Mono.defer(() -> {
            LoadedRepository loaded = session.require();
            String normalized = requirePath(path, "path");
            return blocking(() -> store.readFile(loaded.namespace(), normalized));
        });
    }

    // ======================================================================
    // PROVIDER
    // ======================================================================

    @Override
    public Mono<ConnectivityStatus> checkConnectivity(boolean force) {
        return connectivity.check(force);
    }

    @Override
    public Mono<List<String>> availableModels() {
        return catalog.availableModels();
    }

    @Override
    public Mono<String> bestAvailableModel(String preferred, TaskType taskType) {
        String model = preferred == null || preferred.isBlank() ? catalog.defaultModel() : preferred;
        return catalog.bestAvailable(model, taskType == null ? TaskType.GENERAL : taskType);
    }

    @Override
    public String recommendModel(String category) {
        return catalog.recommendFor(category);
    }

    // ======================================================================
    // WORKFLOWS
    // ======================================================================

    @Override
    public Mono<String> analyze(String prompt, String filePath, String model) {
        return Mono.defer(() -> {
            requireText(prompt, "prompt");
            LoadedRepository loaded = session.require();
            Map<String, Object> vars = repositoryVariables(loaded);
            vars.put("prompt", prompt);

            Mono<Map<String, Object>> context;
            if (filePath != null && !filePath.isBlank()) {
                String path = FileNames.normalize(filePath);
                context = blocking(() -> {
                    vars.put("filePath", path);
                    vars.put("fileContent", ContextAssembler.truncate(
                            store.readFile(loaded.namespace(), path), budget().maxCharsPerFile()));
                    vars.put("context", assembler.summarize(loaded.repository()));
                    return vars;
                });
            } else {
                context = fullContext(loaded, budget()).map(text -> {
                    vars.put("context", text);
                    return vars;
                });
            }
            return context.flatMap(v -> complete("analyze", v, model, TaskType.ANALYSIS));
        });
    }

    @Override
    public Mono<String> generate(String prompt, String language, String model) {
        return generateVariables(prompt, language)
                .flatMap(vars -> complete("generate", vars, model, TaskType.CODE));
    }

    @Override
    public Mono<String> generateStream(String prompt, String language, String model,
                                       Consumer<String> onChunk, Consumer<String> onComplete) {
        return generateVariables(prompt, language)
                .flatMap(vars -> completions.stream(
                        request(prompts.render("generate", vars), model), TaskType.CODE, onChunk, onComplete));
    }

    @Override
    public Mono<FileModification> edit(String filePath, String instruction, String model) {
        return Mono.defer(() -> {
            String path = requirePath(filePath, "filePath");
            requireText(instruction, "instruction");
            LoadedRepository loaded = session.require();

            return blocking(() -> store.readFile(loaded.namespace(), path))
                    .flatMap(original -> {
                        Map<String, Object> vars = repositoryVariables(loaded);
                        vars.put("filePath", path);
                        vars.put("instruction", instruction);
                        vars.put("currentContent", original);
                        return complete("edit", vars, model, TaskType.EDIT)
                                .map(answer -> new FileModification(path, original, codeBlockExtractor.extract(answer)));
                    });
        });
    }

    @Override
    public Mono<FileModification> create(String directory, String fileName, String description, String model) {
        return Mono.defer(() -> {
            requireText(fileName, "fileName");
            requireText(description, "description");
            LoadedRepository loaded = session.require();
            String dir = FileNames.normalize(directory);
            String path = dir.isEmpty() ? FileNames.normalize(fileName) : dir + "/" + FileNames.normalize(fileName);

            List<String> similar = selector.similarByExtension(
                    loaded.filePaths(), fileName, contextProperties.getStyleReferenceFiles());

            return blocking(() -> assembler.loadContents(loaded.namespace(), similar))
                    .flatMap(contents -> {
                        Map<String, Object> vars = repositoryVariables(loaded);
                        vars.put("filePath", path);
                        vars.put("description", description);
                        vars.put("similarFiles", fileEntries(contents));
                        vars.put("hasSimilarFiles", !contents.isEmpty());
                        return complete("create", vars, model, TaskType.CODE);
                    })
                    .map(answer -> FileModification.proposed(path, codeBlockExtractor.extract(answer)));
        });
    }

    @Override
    public Mono<AgentResponse> solve(String problem, String model) {
        return Mono.defer(() -> {
            requireText(problem, "problem");
            LoadedRepository loaded = session.require();

            return fullContext(loaded, budget()).flatMap(context -> {
                Map<String, Object> planVars = repositoryVariables(loaded);
                planVars.put("problem", problem);
                planVars.put("context", context);

                return complete("solve-plan", planVars, model, TaskType.ANALYSIS).flatMap(plan -> {
                    log.debug("Solve plan received ({} chars)", plan.length());
                    Map<String, Object> implVars = repositoryVariables(loaded);
                    implVars.put("problem", problem);
                    implVars.put("plan", plan);
                    implVars.put("context", head(context, contextProperties.getImplementationContextChars()));
                    return complete("solve-implement", implVars, model, TaskType.CODE);
                });
            }).flatMap(answer -> withOriginals(loaded, responseParser.parseMultiFile(answer), Map.of()));
        });
    }

    @Override
    public Mono<AgentResponse> autonomousModify(String task, String model) {
        return Mono.defer(() -> {
            requireText(task, "task");
            LoadedRepository loaded = session.require();

            Map<String, Object> searchVars = repositoryVariables(loaded);
            searchVars.put("task", task);
            searchVars.put("tree", assembler.renderTree(loaded.tree(), budget()));

            return complete("autonomous-search", searchVars, model, TaskType.ANALYSIS)
                    .map(answer -> pathListExtractor.extract(answer).stream()
                            .map(FileNames::normalize)
                            .filter(path -> !path.isEmpty())
                            .distinct()
                            .limit(contextProperties.getAutonomousFiles())
                            .toList())
                    .doOnNext(paths -> log.info("Autonomous search selected {}", paths))
                    .flatMap(paths -> blocking(() -> assembler.loadContents(loaded.namespace(), paths)))
                    .flatMap(contents -> {
                        Map<String, Object> planVars = repositoryVariables(loaded);
                        planVars.put("task", task);
                        planVars.put("files", fileEntries(contents));

                        return complete("autonomous-plan", planVars, model, TaskType.ANALYSIS)
                                .flatMap(plan -> {
                                    Map<String, Object> implVars = new HashMap<>(planVars);
                                    implVars.put("plan", plan);
                                    return complete("autonomous-implement", implVars, model, TaskType.CODE);
                                })
                                .flatMap(answer -> withOriginals(loaded, responseParser.parseMultiFile(answer), contents));
                    });
        });
    }

    @Override
    public Mono<List<String>> search(String description, String model) {
        return Mono.defer(() -> {
            requireText(description, "description");
            LoadedRepository loaded = session.require();

            Map<String, Object> vars = repositoryVariables(loaded);
            vars.put("description", description);
            vars.put("tree", assembler.renderTree(loaded.tree(), budget()));
            return complete("search", vars, model, TaskType.ANALYSIS).map(pathListExtractor::extract);
        });
    }

    @Override
    public Mono<GeneratedCodeWithTests> generateWithTests(String specification, String language, String model) {
        return Mono.defer(() -> {
            requireText(specification, "specification");
            LoadedRepository loaded = session.require();

            return fullContext(loaded, budget()).flatMap(context -> {
                Map<String, Object> vars = repositoryVariables(loaded);
                vars.put("specification", specification);
                vars.put("language", blankToNull(language));
                vars.put("context", context);
                return complete("generate-with-tests", vars, model, TaskType.CODE);
            }).map(responseParser::parseImplementationWithTests);
        });
    }

    // ======================================================================
    // HELPERS
    // ======================================================================

    private Mono<Map<String, Object>> generateVariables(String prompt, String language) {
        return Mono.defer(() -> {
            requireText(prompt, "prompt");
            Optional<LoadedRepository> loaded = session.current();
            Map<String, Object> vars = loaded.map(this::repositoryVariables).orElseGet(HashMap::new);
            vars.put("prompt", prompt);
            vars.put("language", blankToNull(language));
            if (loaded.isEmpty()) {
                return Mono.just(vars);
            }
            ContextBudget generateBudget = budget().withMaxSelectedFiles(contextProperties.getGenerateFiles());
            return fullContext(loaded.get(), generateBudget).map(context -> {
                vars.put("context", context);
                return vars;
            });
        });
    }

    private Mono<String> fullContext(LoadedRepository loaded, ContextBudget budget) {
        return blocking(() -> {
            List<String> selected = selector.select(loaded.filePaths(), budget.maxSelectedFiles());
            Map<String, String> contents = assembler.loadContents(loaded.namespace(), selected);
            return assembler.assemble(loaded.repository(), loaded.tree(), contents, budget);
        });
    }

    private Mono<String> complete(String template, Map<String, Object> vars, String model, TaskType taskType) {
        return Mono.defer(() -> completions.complete(request(prompts.render(template, vars), model), taskType));
    }

    private CompletionRequest request(RenderedPrompt prompt, String model) {
        return CompletionRequest.builder()
                .systemPrompt(prompt.systemPrompt())
                .message(ChatMessage.user(prompt.userPrompt()))
                .modelId(blankToNull(model))
                .temperature(completionProperties.getTemperature())
                .maxTokens(completionProperties.getMaxTokens())
                .build();
    }

    /**
     * Fills {@code originalContent} for proposed files that already exist. Files absent from
     * the repository, or whose original cannot be read, are returned without one.
     */
    private Mono<AgentResponse> withOriginals(LoadedRepository loaded, AgentResponse response,
                                              Map<String, String> known) {
        return blocking(() -> {
            List<FileModification> files = new ArrayList<>();
            for (FileModification file : response.files()) {
                String path = FileNames.normalize(file.path());
                String original = known.get(path);
                if (original == null) {
                    try {
                        original = store.readFile(loaded.namespace(), path);
                    } catch (NotFoundException e) {
                        log.debug("{} does not exist yet, proposing it as a new file", path);
                    } catch (EngineException e) {
                        log.warn("Could not read original of {}: {}", path, e.getMessage());
                    }
                }
                files.add(new FileModification(path, original, file.newContent()));
            }
            return new AgentResponse(response.explanation(), List.copyOf(files));
        });
    }

    private Map<String, Object> repositoryVariables(LoadedRepository loaded) {
        RemoteRepository repository = loaded.repository();
        Map<String, Object> vars = new HashMap<>();
        vars.put("repoName", repository.getName());
        vars.put("repoOwner", repository.getOwner());
        vars.put("repoDescription", repository.getDescription() == null || repository.getDescription().isBlank()
                ? "No description provided" : repository.getDescription());
        vars.put("fileCount", repository.getFileCount());
        vars.put("fileTypes", assembler.describeFileTypes(repository.getFileTypes()));
        return vars;
    }

    private static List<Map<String, Object>> fileEntries(Map<String, String> contents) {
        List<Map<String, Object>> entries = new ArrayList<>();
        contents.forEach((path, content) -> entries.add(Map.of("path", path, "content", content)));
        return entries;
    }

    private ContextBudget budget() {
        return contextProperties.toBudget();
    }

    private static <T> Mono<T> blocking(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }

    private static String head(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InputValidationException(field + " must not be blank");
        }
    }

    private static String requirePath(String value, String field) {
        requireText(value, field);
        String normalized = FileNames.normalize(value);
        if (normalized.isEmpty()) {
            throw new InputValidationException(field + " must name a file");
        }
        return normalized;
    }
}
