package com.eventquery;

import com.eventquery.compile.QueryCompiler;
import com.eventquery.event.EventRecord;
import com.eventquery.event.EventTable;
import com.eventquery.query.ClauseParser;
import com.eventquery.query.RawQuery;
import com.eventquery.search.SearchEngine;
import com.eventquery.search.SearchOptions;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 查询解析、编译与端到端检索的性能基准
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class SearchBenchmark {
    private static final String STRUCTURED_QUERY = """
            {"query":{"bool":{"must":[{"term":{"severity":"error"}},{"range":{"timestamp":{"gte":"2025-01-01T00:00:00Z"}}}]}},
             "aggs":{"by_source":{"terms":{"field":"source","size":5}}},"size":20}
            """;

    private final ClauseParser parser = new ClauseParser();
    private final QueryCompiler compiler = new QueryCompiler();
    private final RawQuery structured = RawQuery.parse(STRUCTURED_QUERY);

    @State(Scope.Benchmark)
    public static class StoreState {
        Path tempDir;
        EventTable table;
        SearchEngine engine;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("benchmark");
            table = new EventTable(tempDir.resolve("events.db"));

            // 写入 10000 条事件
            String[] severities = {"info", "info", "info", "warn", "error"};
            String[] sources = {"api", "db", "web", "auth", "queue"};
            Instant base = Instant.parse("2025-01-01T00:00:00Z");
            List<EventRecord> events = new ArrayList<>(10_000);
            for (int i = 0; i < 10_000; i++) {
                events.add(new EventRecord(
                        base.plusSeconds(i * 30L),
                        "event " + i + (i % 7 == 0 ? " connection timeout" : " request handled"),
                        severities[i % severities.length],
                        sources[i % sources.length],
                        "dev-" + (i % 50),
                        i % 11 == 0 ? "security" : "system",
                        null));
            }
            table.insertAll(events);
            engine = new SearchEngine(table);
        }

        @TearDown
        public void tearDown() throws IOException {
            if (table != null) {
                table.close();
            }
            try (Stream<Path> paths = Files.walk(tempDir)) {
                paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                    try {
                        Files.deleteIfExists(path);
                    } catch (IOException exception) {
                        throw new UncheckedIOException(exception);
                    }
                });
            }
        }
    }

    @Benchmark
    public Object parseAndCompile() {
        return compiler.compile(parser.parse(structured));
    }

    @Benchmark
    public Object parseCompactAndCompile() {
        return compiler.compile(parser.parse(RawQuery.compact("severity:error AND source:api timestamp:2025-01-01")));
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public long searchWithAggregation(StoreState state) {
        return state.engine.search(structured, SearchOptions.noCache()).took();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public long fuzzySearch(StoreState state) {
        return state.engine.search(RawQuery.parse("{\"query\":{\"fuzzy\":{\"message\":\"timout\"}},\"size\":20}"),
                SearchOptions.noCache()).took();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public long cachedSearch(StoreState state) {
        return state.engine.search(structured).took();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(SearchBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
