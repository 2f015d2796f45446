package com.jimin.digest.core.taxonomy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * taxonomy JSON 로더
 *
 * 형식: {"version": "2025.1", "topics": ["metabolic", "keto", ...]}
 * 서버(TaxonomyConfig)와 감사 CLI가 같은 로더를 쓴다.
 */
public class TaxonomyLoader {

    private final ObjectMapper objectMapper;

    public TaxonomyLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Taxonomy load(InputStream in) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        if (root == null || !root.hasNonNull("version") || !root.path("topics").isArray()) {
            throw new IOException("taxonomy 형식 오류: version, topics 필드가 필요합니다");
        }

        Set<String> topics = new LinkedHashSet<>();
        for (JsonNode node : root.get("topics")) {
            String topic = node.asText().trim();
            if (!topic.isEmpty()) {
                topics.add(topic);
            }
        }
        return new Taxonomy(root.get("version").asText(), topics);
    }
}
