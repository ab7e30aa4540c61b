package com.vidnyan.pde.adapter.out.metrics;

import com.vidnyan.pde.domain.pattern.PatternMatch;
import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DetectionMetricsTest {

    private static PatternMatch match(String pattern) {
        return new PatternMatch(pattern, TreeNode.leaf(NodeKind.TYPE_DECL, "T"), 0.9, List.of(), List.of(), null);
    }

    @Test
    void onMatch_ShouldCountPerPattern() {
        DetectionMetrics metrics = new DetectionMetrics();

        metrics.onMatch(match("Singleton"));
        metrics.onMatch(match("Observer"));
        metrics.onMatch(match("Singleton"));
        metrics.onParseFailure(Path.of("Broken.java"), "unexpected token");

        assertEquals(2, metrics.matches("Singleton"));
        assertEquals(0, metrics.matches("Factory"));
        assertEquals(Map.of("Observer", 1L, "Singleton", 2L), metrics.matchCounts());
        assertEquals(List.of("Observer", "Singleton"), List.copyOf(metrics.matchCounts().keySet()));
        assertEquals(1, metrics.parseFailures());
    }

    @Test
    void counters_ShouldNotLoseConcurrentUpdates() throws InterruptedException {
        DetectionMetrics metrics = new DetectionMetrics();
        ExecutorService pool = Executors.newFixedThreadPool(4);

        for (int i = 0; i < 400; i++) {
            pool.submit(() -> metrics.onMatch(match("Command")));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(400, metrics.matches("Command"));
    }
}
