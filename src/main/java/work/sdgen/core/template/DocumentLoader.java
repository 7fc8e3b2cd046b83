package work.sdgen.core.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import work.sdgen.core.error.StructuralException;

/**
 * Reads YAML documents (templates, chunks, variation files) into ordered map/list trees.
 */
public final class DocumentLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DocumentLoader() {}

    public static Object loadTree(Path path) {
        if (!Files.isRegularFile(path)) {
            throw StructuralException.invalidDocument(path.toString(), "file does not exist");
        }
        try (var in = Files.newInputStream(path)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return root == null || root.isMissingNode() ? null : convertNode(root);
        } catch (IOException ex) {
            throw StructuralException.invalidDocument(path.toString(), "unable to parse YAML: " + ex.getMessage(), ex);
        }
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> loadMapping(Path path) {
        Object tree = loadTree(path);
        if (tree == null) {
            throw StructuralException.invalidDocument(path.toString(), "document is empty");
        }
        if (!(tree instanceof Map<?, ?>)) {
            throw StructuralException.invalidDocument(path.toString(), "top level must be a mapping");
        }
        return (Map<String, Object>) tree;
    }

    public static Object parseTree(String yaml) {
        try {
            JsonNode root = YAML_MAPPER.readTree(yaml);
            return root == null || root.isMissingNode() ? null : convertNode(root);
        } catch (IOException ex) {
            throw StructuralException.invalidDocument("<inline>", "unable to parse YAML: " + ex.getMessage(), ex);
        }
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
