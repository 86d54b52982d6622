package com.entity.blocking.field;

import com.entity.blocking.exception.BlockingConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads set field definitions from JSON.
 *
 * <pre>
 * [
 *   {"field": "tags", "type": "Set", "corpus": [["a", "b"], ["b", "c"]]},
 *   {"field": "aliases", "type": "MinDistanceSet"}
 * ]
 * </pre>
 */
public class FieldDefinitionLoader {
    private static final Logger log = LoggerFactory.getLogger(FieldDefinitionLoader.class);

    private final ObjectMapper mapper;

    public FieldDefinitionLoader() {
        this(new ObjectMapper());
    }

    public FieldDefinitionLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws BlockingConfigurationException if the JSON is malformed or a definition is invalid
     */
    public List<FieldDefinition> load(Reader reader) {
        JsonNode root;
        try {
            root = mapper.readTree(reader);
        } catch (IOException e) {
            throw new BlockingConfigurationException("Unreadable field definitions: " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new BlockingConfigurationException("Field definitions must be a JSON array");
        }

        List<FieldDefinition> definitions = new ArrayList<>();
        for (JsonNode node : root) {
            FieldDefinition.Builder builder = FieldDefinition.builder()
                    .field(node.path("field").asText(null));
            if (node.hasNonNull("type")) {
                builder.type(SetFieldType.fromLabel(node.get("type").asText()));
            }
            if (node.hasNonNull("corpus")) {
                builder.corpus(readCorpus(node.get("corpus")));
            }
            definitions.add(builder.build());
        }
        log.info("fields.loaded count={}", definitions.size());
        return definitions;
    }

    private static List<List<String>> readCorpus(JsonNode corpusNode) {
        if (!corpusNode.isArray()) {
            throw new BlockingConfigurationException("corpus must be an array of arrays");
        }
        List<List<String>> corpus = new ArrayList<>();
        for (JsonNode document : corpusNode) {
            if (!document.isArray()) {
                throw new BlockingConfigurationException("corpus entries must be arrays");
            }
            List<String> elements = new ArrayList<>();
            document.forEach(element -> elements.add(element.asText()));
            corpus.add(elements);
        }
        return corpus;
    }
}
