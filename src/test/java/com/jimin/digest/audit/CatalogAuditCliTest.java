package com.jimin.digest.audit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogAuditCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void reportsInvalidTopicAndFeed() throws IOException {
        Path catalog = write("catalog.json", """
                {"feeds": [
                  {"name": "A", "topics": ["genomics"]},
                  {"name": "B", "topics": ["genomics", "not-a-topic"]}
                ]}
                """);
        Path taxonomy = write("taxonomy.json", """
                {"version": "t1", "topics": ["genomics"]}
                """);

        int exit = run(catalog.toString(), taxonomy.toString());

        assertThat(exit).isEqualTo(1);
        String report = err.toString(StandardCharsets.UTF_8);
        assertThat(report).contains("Unique invalid topics: 1")
                .contains("\"not-a-topic\" (used in 1 feed)")
                .contains("- B")
                .doesNotContain("- A");
    }

    @Test
    void cleanCatalogExitsZero() throws IOException {
        Path catalog = write("catalog.json", """
                [{"name": "A", "topics": ["genomics"]}]
                """);
        Path taxonomy = write("taxonomy.json", """
                {"version": "t1", "topics": ["genomics"]}
                """);

        assertThat(run(catalog.toString(), taxonomy.toString())).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Validated 1 feeds");
    }

    @Test
    void truncatesLongFeedLists() throws IOException {
        Path catalog = write("catalog.json", """
                {"feeds": [
                  {"name": "F1", "topics": ["x"]}, {"name": "F2", "topics": ["x"]},
                  {"name": "F3", "topics": ["x"]}, {"name": "F4", "topics": ["x"]},
                  {"name": "F5", "topics": ["x", "y"]}
                ]}
                """);
        Path taxonomy = write("taxonomy.json", """
                {"version": "t1", "topics": ["genomics"]}
                """);

        assertThat(run(catalog.toString(), taxonomy.toString())).isEqualTo(1);

        String report = err.toString(StandardCharsets.UTF_8);
        assertThat(report).contains("Total invalid topic assignments: 6")
                .contains("\"x\" (used in 5 feeds)")
                .contains("... and 2 more")
                .doesNotContain("- F4");
        assertThat(report.indexOf("\"x\"")).isLessThan(report.indexOf("\"y\""));
    }

    @Test
    void bundledTaxonomyIsUsedByDefault() throws IOException {
        Path catalog = write("catalog.json", """
                {"feeds": [{"name": "A", "topics": ["keto", "longevity"]}]}
                """);

        assertThat(run(catalog.toString())).isZero();
    }

    @Test
    void unreadableInputExitsTwo() {
        assertThat(run(dir.resolve("missing.json").toString())).isEqualTo(2);
        assertThat(run()).isEqualTo(2);
    }

    private int run(String... args) {
        return new CatalogAuditCli().run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }
}
