package com.qml.config;

import com.qml.exception.ConfigurationException;
import com.qml.expression.Operator;
import com.qml.lexer.TokenType;
import com.qml.operator.Modality;
import com.qml.operator.OperatorMappings;
import com.qml.parser.EntryRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads parser configuration from YAML files.
 * <pre>
 * qml:
 *   modality: deontic
 *   entry-rule: equivalence
 *   operators:
 *     NEC: DEONTIC_NECESSITY
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static ParserConfig load(String path) {
        log.info("Loading parser configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Load configuration from a stream.
     *
     * @param inputStream YAML content
     * @return Loaded configuration
     */
    public static ParserConfig load(InputStream inputStream) {
        return parseYaml(inputStream);
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static ParserConfig parseYaml(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Malformed parser configuration", e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // Section may sit at the root or under a 'qml' key
        Object section = root.containsKey("qml") ? root.get("qml") : root;
        if (!(section instanceof Map<?, ?>)) {
            throw new ConfigurationException("Section 'qml' must be a map");
        }
        Map<String, Object> qml = (Map<String, Object>) section;

        String modalityName = getString(qml, "modality", Modality.ALETHIC.name());
        Modality modality = OperatorMappings.modality(modalityName);

        String entryRuleName = getString(qml, "entry-rule", null);
        if (entryRuleName == null) {
            entryRuleName = getString(qml, "entryRule", EntryRule.EQUIVALENCE.name());
        }
        EntryRule entryRule = parseEntryRule(entryRuleName);

        Map<TokenType, Operator> operators = parseOperators(qml.get("operators"));

        ParserConfig config = new ParserConfig(modality, entryRule, operators);
        log.info("Loaded parser configuration: modality={}, entryRule={}, {} operator override(s)",
                modality, entryRule, operators.size());
        return config;
    }

    private static EntryRule parseEntryRule(String name) {
        try {
            return EntryRule.valueOf(name.trim().toUpperCase(Locale.ROOT).replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown entry rule '" + name + "'", e);
        }
    }

    private static Map<TokenType, Operator> parseOperators(Object section) {
        if (section == null) {
            return Map.of();
        }
        if (!(section instanceof Map<?, ?> map)) {
            throw new ConfigurationException("'operators' must be a map of token type to operator");
        }

        Map<String, String> names = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getValue() == null) {
                throw new ConfigurationException("No operator given for token type '" + entry.getKey() + "'");
            }
            names.put(entry.getKey().toString(), entry.getValue().toString());
            log.debug("Parsed operator override: {} -> {}", entry.getKey(), entry.getValue());
        }
        return OperatorMappings.table(names);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
