package lk;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks whole derivations: every node must be a valid application of its rule to its premises.
 * Nodes are independent of each other, so with a pool size above one they are checked concurrently.
 */
public class ProofChecker implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(ProofChecker.class.getName());

    public static final int DEFAULT_POOL_SIZE = 1;

    private final int poolSize;
    private final @Nullable ExecutorService executor;

    public ProofChecker() {
        this(DEFAULT_POOL_SIZE);
    }

    public ProofChecker(int poolSize) {
        if (poolSize < 1) throw new IllegalArgumentException("poolSize must be positive, got " + poolSize);
        this.poolSize = poolSize;
        this.executor = this.poolSize > 1 ? Executors.newFixedThreadPool(this.poolSize) : null;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public static boolean isValidStep(@NotNull LK node) {
        return node.isValidStep();
    }

    /**
     * Checks every node of {@code root}. Rejected nodes are reported, not thrown; an
     * {@link IllegalStateException} from a malformed sequent is propagated.
     */
    public @NotNull ProofReport check(@NotNull LK root) {
        // pre-order; each visited node remembers its parent and which premise of the parent it is
        List<LK> nodes = new ArrayList<>();
        int[] parent = new int[16];
        int[] premiseIndex = new int[16];
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, -1, -1));
        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            int id = nodes.size();
            if (id == parent.length) {
                parent = Arrays.copyOf(parent, id * 2);
                premiseIndex = Arrays.copyOf(premiseIndex, id * 2);
            }
            nodes.add(pending.node());
            parent[id] = pending.parent();
            premiseIndex[id] = pending.premiseIndex();
            // pushed right to left so the left premise is visited first
            List<LK> premises = pending.node().premises();
            for (int i = premises.size() - 1; i >= 0; i--) {
                stack.push(new Pending(premises.get(i), id, i));
            }
        }

        boolean[] valid = executor == null ? checkSequentially(nodes) : checkConcurrently(nodes);

        List<ProofReport.Failure> failures = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (valid[i]) continue;
            ProofReport.Failure failure = new ProofReport.Failure(pathOf(i, parent, premiseIndex), nodes.get(i));
            if (LOGGER.isLoggable(Level.FINE)) LOGGER.fine("Rejected step " + failure);
            failures.add(failure);
        }
        ProofReport report = new ProofReport(nodes.size(), failures);
        LOGGER.info("Checked derivation of " + root.conclusion() + ": " + report);
        return report;
    }

    private static List<Integer> pathOf(int id, int[] parent, int[] premiseIndex) {
        List<Integer> path = new ArrayList<>();
        for (int n = id; parent[n] >= 0; n = parent[n]) path.add(premiseIndex[n]);
        Collections.reverse(path);
        return path;
    }

    private boolean[] checkSequentially(List<LK> nodes) {
        boolean[] valid = new boolean[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) valid[i] = nodes.get(i).isValidStep();
        return valid;
    }

    private boolean[] checkConcurrently(List<LK> nodes) {
        List<CompletableFuture<Boolean>> futures = new ArrayList<>(nodes.size());
        for (LK node : nodes) {
            futures.add(CompletableFuture.supplyAsync(node::isValidStep, executor));
        }
        boolean[] valid = new boolean[nodes.size()];
        for (int i = 0; i < futures.size(); i++) {
            try {
                valid[i] = futures.get(i).join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) throw cause;
                throw e;
            }
        }
        return valid;
    }

    private record Pending(LK node, int parent, int premiseIndex) {
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
            if (LOGGER.isLoggable(Level.FINE)) LOGGER.fine("Shut down checker pool of " + poolSize);
        }
    }
}
