package work.sdgen.core.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Template documents linked by {@code implements}, leaf first.
 */
public record TemplateChain(List<TemplateDocument> documents) {
    public TemplateChain {
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("A template chain holds at least one document");
        }
        documents = List.copyOf(documents);
    }

    public TemplateDocument leaf() {
        return documents.get(0);
    }

    public List<TemplateDocument> rootFirst() {
        var reversed = new ArrayList<>(documents);
        Collections.reverse(reversed);
        return reversed;
    }

    /**
     * Key-wise merge of a mapping section over the chain; descendants win.
     */
    public Map<String, Object> mergedSection(String key) {
        var merged = new LinkedHashMap<String, Object>();
        for (TemplateDocument document : rootFirst()) {
            merged.putAll(document.section(key));
        }
        return merged;
    }

    public String name() {
        return leaf().string("name").filter(name -> !name.isBlank()).orElseGet(() -> leaf().stem());
    }
}
