package com.jimin.digest.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jimin.digest.core.taxonomy.Taxonomy;
import com.jimin.digest.core.taxonomy.TaxonomyLoader;
import com.jimin.digest.core.taxonomy.TaxonomyValidator;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 카탈로그 토픽 감사 CLI (Spring 컨텍스트 없이 실행)
 *
 * 사용법: CatalogAuditCli <catalog.json> [taxonomy.json]
 * taxonomy 생략 시 classpath:taxonomy/topics.json
 *
 * 종료 코드: 0 = 잘못된 토픽 없음, 1 = 잘못된 토픽 있음, 2 = 입력 오류
 */
public class CatalogAuditCli {

    static final int EXIT_CLEAN = 0;
    static final int EXIT_INVALID_TOPICS = 1;
    static final int EXIT_BAD_INPUT = 2;

    private static final String BUNDLED_TAXONOMY = "/taxonomy/topics.json";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public static void main(String[] args) {
        System.exit(new CatalogAuditCli().run(args, System.out, System.err));
    }

    public int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1 || args.length > 2) {
            err.println("Usage: CatalogAuditCli <catalog.json> [taxonomy.json]");
            return EXIT_BAD_INPUT;
        }

        List<CatalogEntry> feeds;
        Taxonomy taxonomy;
        try {
            try (InputStream in = Files.newInputStream(Path.of(args[0]))) {
                feeds = new CatalogReader(objectMapper).read(in);
            }
            try (InputStream in = args.length == 2
                    ? Files.newInputStream(Path.of(args[1]))
                    : bundledTaxonomy()) {
                taxonomy = new TaxonomyLoader(objectMapper).load(in);
            }
        } catch (IOException e) {
            err.println("입력을 읽을 수 없습니다: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }

        CatalogAuditReport report = new CatalogAuditor(new TaxonomyValidator(taxonomy)).audit(feeds);
        new CatalogAuditPrinter().print(report, out, err);
        return report.isClean() ? EXIT_CLEAN : EXIT_INVALID_TOPICS;
    }

    private InputStream bundledTaxonomy() throws IOException {
        InputStream in = CatalogAuditCli.class.getResourceAsStream(BUNDLED_TAXONOMY);
        if (in == null) {
            throw new FileNotFoundException("classpath:" + BUNDLED_TAXONOMY);
        }
        return in;
    }
}
