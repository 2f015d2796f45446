package com.jimin.digest.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * 카탈로그 JSON 로더
 *
 * 형식: {"feeds": [ {...}, ... ]} 또는 최상위 배열
 */
public class CatalogReader {

    private final ObjectMapper objectMapper;

    public CatalogReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<CatalogEntry> read(InputStream in) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        JsonNode feeds = root != null && root.isObject() ? root.path("feeds") : root;
        if (feeds == null || !feeds.isArray()) {
            throw new IOException("카탈로그 형식 오류: feeds 배열이 필요합니다");
        }

        List<CatalogEntry> entries = new ArrayList<>();
        for (JsonNode node : feeds) {
            entries.add(objectMapper.treeToValue(node, CatalogEntry.class));
        }
        return entries;
    }
}
