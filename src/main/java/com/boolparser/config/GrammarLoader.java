package com.boolparser.config;

import com.boolparser.exception.ConfigurationException;
import com.boolparser.expression.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads grammar configuration from YAML files.
 * <pre>
 * grammar:
 *   name: default
 *   tiers:
 *     - name: negation
 *       operations: [NOT]
 *     - name: conjunction
 *       operations:
 *         - operation: AND
 *           symbol: "&amp;&amp;"
 * </pre>
 */
public class GrammarLoader {

    private static final Logger log = LoggerFactory.getLogger(GrammarLoader.class);

    private GrammarLoader() {
    }

    /**
     * Load a grammar from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the grammar file
     * @return Loaded grammar
     */
    public static GrammarConfig load(String path) {
        log.info("Loading grammar configuration from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return load(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load grammar configuration from: " + path, e);
        }
    }

    /**
     * Load a grammar from an open YAML stream. The stream is not closed.
     */
    @SuppressWarnings("unchecked")
    public static GrammarConfig load(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded;
        try {
            loaded = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Grammar configuration is not valid YAML: " + e.getMessage(), e);
        }

        if (loaded == null) {
            throw new ConfigurationException("Grammar configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Grammar configuration must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // The grammar section could be at root or under 'grammar' key
        Object section = root.containsKey("grammar") ? root.get("grammar") : root;
        if (section == null) {
            throw new ConfigurationException("Grammar section is empty");
        }
        if (!(section instanceof Map)) {
            throw new ConfigurationException("Grammar section must be a mapping, got: " + section);
        }
        Map<String, Object> grammarMap = (Map<String, Object>) section;

        String name = getString(grammarMap, "name", "default");
        Object tierValue = grammarMap.get("tiers");
        if (tierValue != null && !(tierValue instanceof List)) {
            throw new ConfigurationException("Tiers of grammar '" + name + "' must be a list, got: " + tierValue);
        }
        List<Object> tierList = (List<Object>) tierValue;

        if (tierList == null || tierList.isEmpty()) {
            log.warn("No tiers configured for grammar '{}', using default tiers", name);
            return new GrammarConfig(name, GrammarConfig.defaults().tiers());
        }

        List<PrecedenceTier> tiers = new ArrayList<>();
        for (int i = 0; i < tierList.size(); i++) {
            Object tier = tierList.get(i);
            if (!(tier instanceof Map)) {
                throw new ConfigurationException("Tier " + i + " of grammar '" + name + "' must be a mapping, got: " + tier);
            }
            tiers.add(parseTier((Map<String, Object>) tier, i));
        }

        GrammarConfig config = new GrammarConfig(name, tiers);
        log.info("Loaded grammar '{}' with {} tiers and operators {}",
                name, tiers.size(), config.operatorSymbols());
        return config;
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static PrecedenceTier parseTier(Map<String, Object> tierMap, int index) {
        String name = getString(tierMap, "name", "tier-" + index);
        Object operationValue = tierMap.get("operations");
        if (operationValue != null && !(operationValue instanceof List)) {
            throw new ConfigurationException("Operations of precedence tier '" + name + "' must be a list, got: "
                    + operationValue);
        }
        List<Object> operationList = (List<Object>) operationValue;
        if (operationList == null || operationList.isEmpty()) {
            throw new ConfigurationException("Precedence tier '" + name + "' has no operations");
        }

        List<OperationSpec> specs = new ArrayList<>();
        for (Object item : operationList) {
            if (item instanceof Map<?, ?> opMap) {
                Map<String, Object> opMapTyped = (Map<String, Object>) opMap;
                Operation operation = parseOperation(getString(opMapTyped, "operation", null), name);
                String symbol = getString(opMapTyped, "symbol", operation.getSymbol());
                specs.add(OperationSpec.of(operation, symbol));
            } else {
                specs.add(OperationSpec.of(parseOperation(item == null ? null : item.toString(), name)));
            }
        }

        log.debug("Parsed precedence tier: name={}, operations={}", name, specs);
        return new PrecedenceTier(name, specs);
    }

    private static Operation parseOperation(String value, String tierName) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Precedence tier '" + tierName + "' has an entry without an operation");
        }
        try {
            return Operation.valueOf(value.trim().toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown operation '" + value + "' in precedence tier '" + tierName + "'", e);
        }
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
