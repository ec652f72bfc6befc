package me.christianrobert.trylower.transformation.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.trylower.config.service.ConfigService;
import me.christianrobert.trylower.transformation.context.FunctionContext;
import me.christianrobert.trylower.transformation.context.LoweringOptions;
import me.christianrobert.trylower.transformation.context.LoweringResult;
import me.christianrobert.trylower.transformation.context.TransformationContext;
import me.christianrobert.trylower.transformation.context.TransformationException;
import me.christianrobert.trylower.transformation.desugar.FunctionBodyRewriter;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCollector;
import me.christianrobert.trylower.transformation.semantic.statement.Block;
import me.christianrobert.trylower.transformation.semantic.statement.FunctionDeclaration;
import me.christianrobert.trylower.transformation.semantic.statement.TryCatchStatement;
import me.christianrobert.trylower.transformation.type.TypeOracle;
import me.christianrobert.trylower.transformation.util.LoweredTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the try/catch lowering pass.
 *
 * <p>Architecture:
 * <pre>
 * FunctionDeclaration → FunctionBodyRewriter → ConstructLowering (per construct, innermost first)
 *                                                  ↓
 *          ErrorFlowAnalyzer → HandlerTableBuilder → ExhaustivenessChecker
 *                            → ScopeTypeValidator → ChainDesugarer → lowered body
 * </pre>
 *
 * <p>Diagnostics are batched per function. A fatal diagnostic suppresses only the lowering of
 * the construct it belongs to; sibling constructs and other functions are still lowered.
 *
 * <p>Functions are independent: {@link #lowerAll} lowers them in parallel on a shared pool. The
 * type oracle is read by all workers and must be an immutable snapshot; every other piece of
 * state is created per function.
 */
@ApplicationScoped
public class TryCatchLoweringService {

    private static final Logger log = LoggerFactory.getLogger(TryCatchLoweringService.class);

    @Inject
    ConfigService configService;

    /**
     * Shared worker pool for batch lowering, sized from configuration at startup.
     */
    private ExecutorService executorService;

    @PostConstruct
    public void init() {
        int parallelism = configService.getParallelism();
        log.info("Initializing lowering worker pool with {} threads", parallelism);
        executorService = Executors.newFixedThreadPool(parallelism);
    }

    /**
     * Shuts down the worker pool, waiting up to 30 seconds for running work.
     */
    @PreDestroy
    public void shutdown() {
        if (executorService == null || executorService.isShutdown()) {
            return;
        }
        log.info("Shutting down lowering worker pool");
        try {
            executorService.shutdown();
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in 30s, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while shutting down worker pool");
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ==================== FUNCTIONS ====================

    /**
     * Lowers every try/catch construct of a function body.
     *
     * @param function Function as built by the host front end
     * @param oracle   Host type queries (read-only)
     * @return LoweringResult with the rewritten body and all diagnostics of this function
     */
    public LoweringResult lowerFunction(FunctionDeclaration function, TypeOracle oracle) {
        if (function == null) {
            return LoweringResult.failure(null, "Function cannot be null");
        }
        if (oracle == null) {
            return LoweringResult.failure(function.getName(), "Type oracle cannot be null");
        }

        LoweringOptions options = configService.getLoweringOptions();
        log.debug("Lowering function {} declared {}", function.getName(), function.getFunctionContext());

        try {
            TransformationContext context = new TransformationContext(function.getName(), function.getFunctionContext(),
                    oracle, options);
            DiagnosticCollector diagnostics = context.newCollector();

            Block lowered = new FunctionBodyRewriter(context, diagnostics).rewrite(function.getBody());

            if (diagnostics.hasErrors()) {
                log.info("Function {} lowered with {} error(s), {} warning(s)", function.getName(),
                        diagnostics.getErrors().size(), diagnostics.getWarnings().size());
            } else {
                log.info("Successfully lowered function {} ({} warning(s))", function.getName(),
                        diagnostics.getWarnings().size());
            }

            if (options.isIncludeDebugTree()) {
                return LoweringResult.completedWithDebugTree(function.getName(), lowered,
                        diagnostics.getDiagnostics(), LoweredTreeFormatter.format(lowered));
            }
            return LoweringResult.completed(function.getName(), lowered, diagnostics.getDiagnostics());

        } catch (TransformationException e) {
            log.error("Lowering failed: {}", e.getDetailedMessage(), e);
            return LoweringResult.failure(function.getName(), e);

        } catch (Exception e) {
            log.error("Unexpected error while lowering function {}", function.getName(), e);
            return LoweringResult.failure(function.getName(), new TransformationException(function.getName(), e));
        }
    }

    /**
     * Lowers independent functions in parallel.
     *
     * @return One result per function, in input order
     */
    public List<LoweringResult> lowerAll(List<FunctionDeclaration> functions, TypeOracle oracle) {
        if (functions == null || functions.isEmpty()) {
            return List.of();
        }
        if (executorService == null) {
            throw new IllegalStateException("Lowering service has not been initialized");
        }

        log.info("Lowering {} functions", functions.size());
        List<CompletableFuture<LoweringResult>> futures = new ArrayList<>(functions.size());
        for (FunctionDeclaration function : functions) {
            futures.add(CompletableFuture.supplyAsync(() -> lowerFunction(function, oracle), executorService));
        }

        List<LoweringResult> results = new ArrayList<>(functions.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                String name = functions.get(i) != null ? functions.get(i).getName() : null;
                log.error("Worker failed while lowering function {}", name, e.getCause());
                results.add(LoweringResult.failure(name, "Unexpected error: " + e.getCause()));
            }
        }

        long failed = results.stream().filter(LoweringResult::isFailure).count();
        log.info("Lowered {} functions, {} failed", results.size(), failed);
        return results;
    }

    // ==================== SINGLE CONSTRUCT ====================

    /**
     * Lowers one construct on its own, as if it were the only statement of a function body.
     */
    public LoweringResult lowerConstruct(TryCatchStatement construct, FunctionContext functionContext, TypeOracle oracle) {
        if (construct == null) {
            return LoweringResult.failure(null, "Construct cannot be null");
        }
        if (functionContext == null) {
            return LoweringResult.failure(null, "Function context cannot be null");
        }
        String name = "<construct@" + construct.getLocation() + ">";
        Block body = new Block(List.of(construct), construct.getLocation());
        return lowerFunction(new FunctionDeclaration(name, functionContext, body, construct.getLocation()), oracle);
    }
}
