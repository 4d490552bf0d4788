package im.arun.planindex.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads rule payloads from JSON or YAML. Accepts either a bare list or an object with a
 * {@code payloads} (or {@code rules}) list. Entries that fail to bind are skipped one by one;
 * the rest of the list still loads.
 */
public class RulePayloadLoader {
    private static final Logger logger = LoggerFactory.getLogger(RulePayloadLoader.class);

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public RulePayloadLoader() {
        this.jsonMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<RulePayload> load(Path path) throws IOException {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? yamlMapper : jsonMapper;
        try (InputStream in = Files.newInputStream(path)) {
            return fromTree(mapper, mapper.readTree(in));
        }
    }

    public List<RulePayload> fromJson(String json) throws IOException {
        return fromTree(jsonMapper, jsonMapper.readTree(json));
    }

    private List<RulePayload> fromTree(ObjectMapper mapper, JsonNode root) {
        JsonNode list = root;
        if (root != null && root.isObject()) {
            list = root.has("payloads") ? root.get("payloads") : root.get("rules");
        }

        List<RulePayload> payloads = new ArrayList<>();
        if (list == null || !list.isArray()) {
            logger.warn("Rule document contains no payload list");
            return payloads;
        }

        int index = 0;
        for (JsonNode node : list) {
            // Guide rules may wrap the machine payload: {"id": ..., "payload": {...}}
            JsonNode payloadNode = node.has("payload") && !node.has("kind") ? node.get("payload") : node;
            if (payloadNode == null || payloadNode.isNull()) {
                index++;
                continue;
            }
            try {
                payloads.add(mapper.treeToValue(payloadNode, RulePayload.class));
            } catch (JsonProcessingException e) {
                logger.warn("Skipping rule payload #{} that could not be read: {}", index, e.getOriginalMessage());
            }
            index++;
        }

        logger.info("Loaded {} rule payloads", payloads.size());
        return payloads;
    }
}
