package com.urdfix.core.analyzer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.urdfix.core.UrdfException;
import com.urdfix.core.model.Joint;
import com.urdfix.core.model.Link;
import com.urdfix.core.model.Robot;
import com.urdfix.core.model.UrdfDocument;

/**
 * Read-only analysis of a parsed robot description: statistics, lint findings and
 * kinematic-tree validation.
 *
 * <p>Lint rules are discovered via {@link ServiceLoader} and run in ascending priority
 * order. Rules disabled in {@link LintSettings} are skipped. No operation mutates the
 * document, and an analyzer may be reused across documents.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * UrdfAnalyzer analyzer = new UrdfAnalyzer();
 * UrdfStats stats = analyzer.analyze(doc);
 * List<UrdfIssue> issues = analyzer.lint(doc);
 * }</pre>
 */
public class UrdfAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(UrdfAnalyzer.class);

    private final List<LintRule> rules;
    private final LintSettings settings;
    private final KinematicTreeValidator validator = new KinematicTreeValidator();

    /**
     * Creates an analyzer with every discovered rule enabled.
     */
    public UrdfAnalyzer() {
        this(discoverRules(), LintSettings.defaults());
    }

    /**
     * Creates an analyzer with the discovered rules filtered by settings.
     *
     * @param settings rule selection
     */
    public UrdfAnalyzer(LintSettings settings) {
        this(discoverRules(), settings);
    }

    /**
     * Creates an analyzer with an explicit rule set.
     *
     * @param rules rules to run, reordered by priority
     * @param settings rule selection
     */
    public UrdfAnalyzer(List<LintRule> rules, LintSettings settings) {
        List<LintRule> sorted = new ArrayList<>(Objects.requireNonNull(rules, "rules must not be null"));
        sorted.sort(Comparator.comparingInt(LintRule::getPriority));
        this.rules = List.copyOf(sorted);
        this.settings = settings == null ? LintSettings.defaults() : settings;
    }

    /**
     * Discovers all available lint rules via SPI.
     *
     * @return rules in ascending priority order
     */
    public static List<LintRule> discoverRules() {
        log.debug("Discovering lint rules via ServiceLoader");
        List<LintRule> discovered = new ArrayList<>();
        ServiceLoader.load(LintRule.class).forEach(discovered::add);
        discovered.sort(Comparator.comparingInt(LintRule::getPriority));

        if (log.isDebugEnabled()) {
            discovered.forEach(r -> log.debug("  - {} ({})", r.getId(), r.getDisplayName()));
        }
        return discovered;
    }

    public List<LintRule> rules() {
        return rules;
    }

    // ==================== Statistics ====================

    /**
     * Computes statistics of a document.
     *
     * @param doc document to analyze
     * @return statistics
     */
    public UrdfStats analyze(UrdfDocument doc) {
        Robot robot = doc.robot();
        KinematicGraph graph = KinematicGraph.of(robot);

        Map<String, Integer> jointTypes = new LinkedHashMap<>();
        for (Joint joint : robot.joints().values()) {
            jointTypes.merge(joint.type(), 1, Integer::sum);
        }

        int withVisual = 0;
        int withCollision = 0;
        int withInertial = 0;
        int empty = 0;
        for (Link link : robot.links().values()) {
            if (!link.visuals().isEmpty()) {
                withVisual++;
            }
            if (!link.collisions().isEmpty()) {
                withCollision++;
            }
            if (link.inertial() != null) {
                withInertial++;
            }
            if (link.isEmpty()) {
                empty++;
            }
        }

        UrdfStats stats = new UrdfStats(
            robot.name(),
            robot.links().size(),
            robot.joints().size(),
            robot.materials().size(),
            jointTypes,
            new LinkProperties(withVisual, withCollision, withInertial, empty),
            graph.depth(),
            graph.chains()
        );
        log.info("Analyzed robot: {}", stats.getSummary());
        return stats;
    }

    // ==================== Linting ====================

    /**
     * Runs every enabled rule and concatenates their findings in rule order.
     *
     * @param doc document to lint
     * @return ordered issues, empty if none
     */
    public List<UrdfIssue> lint(UrdfDocument doc) {
        LintContext context = LintContext.of(doc);
        List<UrdfIssue> issues = new ArrayList<>();

        for (LintRule rule : rules) {
            if (!settings.isEnabled(rule.getId())) {
                log.debug("Lint rule {} is disabled in configuration", rule.getId());
                continue;
            }
            List<UrdfIssue> found = rule.check(context);
            log.debug("Lint rule {} reported {} issue(s)", rule.getId(), found.size());
            issues.addAll(found);
        }

        log.info("Lint of robot '{}' found {} issue(s)", doc.robot().name(), issues.size());
        return issues;
    }

    // ==================== Kinematic Tree ====================

    /**
     * Validates that the joints form a single tree over all links.
     *
     * @param doc document to check
     * @return result listing every violation
     */
    public TreeValidationResult validateKinematicTree(UrdfDocument doc) {
        return validator.validate(doc.robot());
    }

    /**
     * Validates the kinematic tree and fails on the first violation.
     *
     * @param doc document to check
     * @throws UrdfException STRUCTURE carrying the first violation
     */
    public void requireValidKinematicTree(UrdfDocument doc) {
        TreeValidationResult result = validateKinematicTree(doc);
        if (!result.valid()) {
            throw UrdfException.structure(result.errors().get(0));
        }
    }

    /**
     * Returns the links never named as a joint child.
     *
     * @param doc document to inspect
     * @return root link names in link order
     */
    public List<String> findRootLinks(UrdfDocument doc) {
        return KinematicGraph.of(doc.robot()).roots();
    }

    /**
     * Returns the links never named as a joint parent.
     *
     * @param doc document to inspect
     * @return leaf link names in link order
     */
    public List<String> findLeafLinks(UrdfDocument doc) {
        return KinematicGraph.of(doc.robot()).leaves();
    }

    /**
     * Returns each parent link with the names of its child links.
     *
     * @param doc document to inspect
     * @return adjacency map in joint order
     */
    public Map<String, List<String>> dependencyGraph(UrdfDocument doc) {
        return KinematicGraph.of(doc.robot()).childrenByParent();
    }
}
