package com.jimin.digest.core.taxonomy;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 제목/요약 텍스트에서 토픽 자동 감지 (정규식, 대소문자 무시)
 *
 * 패턴 파일 형식 (한 줄에 토픽 하나, '#'은 주석):
 *   keto = keto | ketogenic | low.?carb
 *
 * 결과는 반드시 TaxonomyValidator를 다시 거친다 (패턴 파일과 어휘가 어긋날 수 있음).
 */
public class TopicTagger {

    private final Map<String, List<Pattern>> patterns;

    public TopicTagger(Map<String, List<Pattern>> patterns) {
        this.patterns = Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
    }

    public static TopicTagger load(InputStream in) throws IOException {
        Map<String, List<Pattern>> patterns = new LinkedHashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                int eq = line.indexOf('=');
                if (eq <= 0) {
                    throw new IOException("토픽 패턴 형식 오류 (" + lineNo + "행): " + line);
                }
                String topic = line.substring(0, eq).trim();
                List<Pattern> compiled = new ArrayList<>();
                for (String regex : line.substring(eq + 1).split("\\|")) {
                    if (!regex.isBlank()) {
                        compiled.add(Pattern.compile(regex.trim(), Pattern.CASE_INSENSITIVE));
                    }
                }
                patterns.put(topic, List.copyOf(compiled));
            }
        }
        return new TopicTagger(patterns);
    }

    /**
     * @param max 최대 태그 수
     * @return 패턴 파일 순서대로 감지된 토픽
     */
    public List<String> tag(String text, int max) {
        if (text == null || text.isBlank() || max <= 0) {
            return List.of();
        }

        Set<String> found = new LinkedHashSet<>();
        for (Map.Entry<String, List<Pattern>> entry : patterns.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(text).find()) {
                    found.add(entry.getKey());
                    break;
                }
            }
            if (found.size() >= max) {
                break;
            }
        }
        return List.copyOf(found);
    }

    public Set<String> knownTopics() {
        return patterns.keySet();
    }
}
