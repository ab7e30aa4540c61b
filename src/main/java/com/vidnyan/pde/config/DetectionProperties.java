package com.vidnyan.pde.config;

import com.vidnyan.pde.domain.tree.NodeKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for pattern detection.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "pde.detection")
public class DetectionProperties {

    /**
     * Global confidence floor. A definition matches at
     * max(definition threshold, minConfidence).
     */
    private double minConfidence = 0.0;

    /**
     * Count heuristic evidence.
     */
    private boolean enableHeuristics = true;

    /**
     * Count signature (tree shape) evidence.
     */
    private boolean enableAstMatching = true;

    /**
     * Deepest level visited by the tree walk; 0 means unlimited.
     */
    private int maxDepth = 0;

    /**
     * Node kinds child-signature search may descend through.
     */
    private List<NodeKind> transparentKinds = new ArrayList<>(List.of(NodeKind.BLOCK));

    /**
     * Worker threads for project scans.
     */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    /**
     * Scan test sources too.
     */
    private boolean includeTests = false;

    /**
     * Path fragments excluded from project scans.
     */
    private List<String> excludePatterns = new ArrayList<>();

    /**
     * File name suffixes picked up by project scans.
     */
    private List<String> fileSuffixes = new ArrayList<>(List.of(".java", ".ast.json"));
}
