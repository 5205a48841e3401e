package com.neurasense.jitai.ruleset;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.neurasense.jitai.domain.CompanionTask;
import com.neurasense.jitai.domain.Condition;
import com.neurasense.jitai.domain.ConditionNode;
import com.neurasense.jitai.domain.Rule;
import com.neurasense.jitai.domain.RuleAction;
import com.neurasense.jitai.domain.Ruleset;
import com.neurasense.jitai.domain.Tier;
import com.neurasense.jitai.engine.ConditionEvaluator;
import com.neurasense.jitai.util.AlertLogger;
import com.neurasense.jitai.util.EngineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses rule documents into immutable {@link Ruleset} snapshots.
 * <p>
 * The document is JSON, or YAML when the file name ends in {@code .yaml}/{@code .yml}.
 * Individual malformed rules are skipped with a warning; only a document that cannot be
 * read or whose root is not an object fails the whole load.
 */
@ApplicationScoped
public class RulesetLoader {

    private static final Logger LOG = Logger.getLogger(RulesetLoader.class);

    static final String BUILTIN_RESOURCE = "rules/jitai_rules.json";

    @Inject
    EngineMetrics engineMetrics;

    /**
     * Nesting allowed by the parsers for a whole document. Far above the condition depth limit,
     * so an over-deep condition is rejected as one malformed rule instead of failing the document.
     */
    static final int MAX_DOCUMENT_NESTING = 2_000;

    private final ObjectMapper yamlMapper = new ObjectMapper(yamlFactory());
    private final ObjectMapper jsonMapper = new ObjectMapper(JsonFactory.builder()
            .streamReadConstraints(documentConstraints())
            .build());

    /**
     * Loads a rule document from the filesystem.
     *
     * @param path the document path
     * @return the parsed snapshot, stamped with the file's modification time
     * @throws RulesetLoadException if the file cannot be read or parsed
     */
    public Ruleset loadFromFile(Path path) {
        try {
            byte[] content = Files.readAllBytes(path);
            Instant modified = Files.getLastModifiedTime(path).toInstant();
            return parse(content, path.toString(), modified, isYaml(path));
        } catch (IOException e) {
            throw new RulesetLoadException("Cannot read rule document " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads the rule document bundled on the classpath.
     *
     * @throws RulesetLoadException if the resource is missing or invalid
     */
    public Ruleset loadBuiltin() {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(BUILTIN_RESOURCE)) {
            if (in == null) {
                throw new RulesetLoadException("Builtin rule document missing: " + BUILTIN_RESOURCE);
            }
            return parse(in.readAllBytes(), "classpath:" + BUILTIN_RESOURCE, null, false);
        } catch (IOException e) {
            throw new RulesetLoadException("Cannot read builtin rule document: " + e.getMessage(), e);
        }
    }

    public Ruleset parse(byte[] content, String source, Instant lastModified, boolean yaml) {
        JsonNode root;
        try {
            root = (yaml ? yamlMapper : jsonMapper).readTree(content);
        } catch (IOException e) {
            throw new RulesetLoadException("Rule document " + source + " is not valid "
                    + (yaml ? "YAML" : "JSON") + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new RulesetLoadException("Rule document " + source + " must be an object");
        }

        Integer versionValue = readInt(root, "version", "rules_version");
        int version = versionValue != null ? versionValue : 0;

        List<Rule> rules = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int skipped = 0;
        JsonNode rulesNode = root.get("rules");
        if (rulesNode != null && rulesNode.isArray()) {
            int index = 0;
            for (JsonNode ruleNode : rulesNode) {
                String label = labelOf(ruleNode, index++);
                try {
                    Rule rule = parseRule(ruleNode);
                    if (!seenIds.add(rule.getRuleId())) {
                        throw new MalformedRuleException("duplicate rule_id");
                    }
                    rules.add(rule);
                } catch (MalformedRuleException e) {
                    skipped++;
                    AlertLogger.malformedRuleSkipped(source, label, e.getMessage());
                }
            }
        } else if (rulesNode != null && !rulesNode.isNull()) {
            LOG.warnf("Rule document %s: 'rules' is not an array, loading no rules", source);
        }

        List<RuleAction> defaultActions = parseActions(root.get("default_actions"));
        CompanionTask defaultTask = parseTask(root.get("default_task"));

        if (skipped > 0 && engineMetrics != null) {
            engineMetrics.incrementMalformedRulesSkipped(skipped);
        }
        LOG.infof("Parsed rule document %s: version=%d, rules=%d, skipped=%d, default_actions=%d",
                source, version, rules.size(), skipped, defaultActions.size());

        return new Ruleset(version, rules, defaultActions, defaultTask, source, lastModified, skipped);
    }

    private Rule parseRule(JsonNode ruleNode) {
        if (ruleNode == null || !ruleNode.isObject()) {
            throw new MalformedRuleException("rule must be an object");
        }
        String ruleId = readString(ruleNode, "rule_id", "id");
        if (ruleId == null || ruleId.isBlank()) {
            throw new MalformedRuleException("missing rule_id");
        }

        Tier tier = Tier.DEFAULT;
        JsonNode tierNode = ruleNode.get("tier");
        if (tierNode != null && !tierNode.isNull()) {
            tier = Tier.fromString(tierNode.asText())
                    .orElseThrow(() -> new MalformedRuleException("unknown tier '" + tierNode.asText() + "'"));
        }

        Integer priorityValue = readInt(ruleNode, "priority");

        return Rule.builder(ruleId, tier, priorityValue != null ? priorityValue : 0,
                        parseCondition(ruleNode.get("condition")))
                .name(readString(ruleNode, "name"))
                .description(readString(ruleNode, "description"))
                .enabled(readBoolean(ruleNode, "enabled", true))
                .actions(parseActions(ruleNode.get("actions")))
                .task(parseTask(ruleNode.get("task")))
                .build();
    }

    ConditionNode parseCondition(JsonNode node) {
        if (node == null || node.isNull()) {
            return ConditionNode.always();
        }
        return parseConditionNode(node, 1);
    }

    private ConditionNode parseConditionNode(JsonNode node, int depth) {
        if (depth > ConditionEvaluator.MAX_DEPTH) {
            throw new MalformedRuleException("condition deeper than " + ConditionEvaluator.MAX_DEPTH + " levels");
        }
        if (node == null || !node.isObject()) {
            throw new MalformedRuleException("condition node must be an object");
        }

        JsonNode and = combinator(node, "AND");
        if (and != null) {
            return ConditionNode.allOf(parseChildren(and, "AND", depth));
        }
        JsonNode or = combinator(node, "OR");
        if (or != null) {
            return ConditionNode.anyOf(parseChildren(or, "OR", depth));
        }
        JsonNode not = combinator(node, "NOT");
        if (not != null) {
            if (!not.isObject()) {
                throw new MalformedRuleException("NOT requires a single condition object");
            }
            return ConditionNode.not(parseConditionNode(not, depth + 1));
        }
        return ConditionNode.leaf(parseLeaf(node));
    }

    private List<ConditionNode> parseChildren(JsonNode array, String kind, int depth) {
        if (!array.isArray()) {
            throw new MalformedRuleException(kind + " requires an array of conditions");
        }
        List<ConditionNode> children = new ArrayList<>(array.size());
        for (JsonNode child : array) {
            children.add(parseConditionNode(child, depth + 1));
        }
        return children;
    }

    private Condition parseLeaf(JsonNode node) {
        String field = readString(node, "field");
        String op = readString(node, "op", "operator");
        if (field == null || field.isBlank() || op == null) {
            throw new MalformedRuleException("condition leaf requires field and op");
        }
        Condition.Operator operator;
        try {
            operator = Condition.Operator.fromString(op);
        } catch (IllegalArgumentException e) {
            throw new MalformedRuleException(e.getMessage());
        }
        JsonNode valueNode = node.get("value");
        Object value = valueNode == null || valueNode.isNull() ? null : jsonMapper.convertValue(valueNode, Object.class);
        return new Condition(field, operator, value);
    }

    private List<RuleAction> parseActions(JsonNode node) {
        List<RuleAction> actions = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return actions;
        }
        for (JsonNode actionNode : node) {
            if (!actionNode.isObject()) {
                continue;
            }
            String type = readString(actionNode, "type");
            RuleAction action = new RuleAction(
                    type != null ? type : RuleAction.TYPE_RECOMMEND_TOOL,
                    readString(actionNode, "tool_id", "action_id"),
                    readString(actionNode, "reason", "reason_zh"));
            actions.add(action);
        }
        return actions;
    }

    private CompanionTask parseTask(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String text = readString(node, "text", "text_zh");
        if (text == null || text.isBlank()) {
            return null;
        }
        return new CompanionTask(text, readString(node, "reason", "reason_zh"));
    }

    private static JsonNode combinator(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null) {
            value = node.get(name.toLowerCase(Locale.ROOT));
        }
        return value;
    }

    private static String labelOf(JsonNode ruleNode, int index) {
        if (ruleNode != null && ruleNode.isObject()) {
            JsonNode id = ruleNode.get("rule_id");
            if (id != null && id.isTextual()) {
                return id.asText();
            }
        }
        return "#" + index;
    }

    private static StreamReadConstraints documentConstraints() {
        return StreamReadConstraints.builder().maxNestingDepth(MAX_DOCUMENT_NESTING).build();
    }

    private static YAMLFactory yamlFactory() {
        LoaderOptions options = new LoaderOptions();
        options.setNestingDepthLimit(MAX_DOCUMENT_NESTING);
        return YAMLFactory.builder()
                .loaderOptions(options)
                .streamReadConstraints(documentConstraints())
                .build();
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private Integer readInt(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isNumber()) {
                return value.asInt();
            }
        }
        return null;
    }

    private boolean readBoolean(JsonNode node, String name, boolean defaultValue) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.asBoolean(defaultValue);
    }

    private String readString(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isTextual()) {
                return value.asText();
            }
        }
        return null;
    }

    /**
     * One rule cannot be used; the load continues without it.
     */
    static class MalformedRuleException extends RuntimeException {
        MalformedRuleException(String message) {
            super(message);
        }
    }
}
