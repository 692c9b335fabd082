package com.eventquery.cli;

import com.eventquery.aggregation.AggregationResult;
import com.eventquery.aggregation.Bucket;
import com.eventquery.compile.CompiledQuery;
import com.eventquery.config.EngineConfig;
import com.eventquery.config.JsonMappers;
import com.eventquery.event.EventStore;
import com.eventquery.event.EventTable;
import com.eventquery.query.QueryParseException;
import com.eventquery.query.RawQuery;
import com.eventquery.search.SearchEngine;
import com.eventquery.search.SearchHit;
import com.eventquery.search.SearchOptions;
import com.eventquery.search.SearchResponse;
import com.eventquery.template.QueryTemplates;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "eqe",
    description = "🔍 事件检索引擎（Elasticsearch 风格查询 DSL）",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.SearchSubcommand.class,
        MainCommand.ExplainSubcommand.class,
        MainCommand.TemplatesSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--db"}, description = "事件库 SQLite 文件路径", defaultValue = "./events.db")
    private Path dbPath;

    @Option(names = {"--config"}, description = "properties 配置文件路径")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 事件检索引擎");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private EngineConfig loadConfig() throws IOException {
        return configFile == null ? EngineConfig.defaults() : EngineConfig.load(configFile);
    }

    /**
     * 以 '@' 开头的参数视为模板名，其余交给 RawQuery.parse。
     */
    private static RawQuery resolveQuery(String argument) {
        String trimmed = argument == null ? "" : argument.trim();
        if (trimmed.startsWith("@")) {
            return QueryTemplates.get(trimmed.substring(1));
        }
        return RawQuery.parse(trimmed);
    }

    private static void printParseError(QueryParseException exception) {
        System.err.println("❌ 查询解析失败: " + exception.getMessage());
        System.err.println("💡 " + exception.getSuggestion());
    }

    @Command(name = "search", description = "🔎 执行检索（JSON 文档、简洁查询字符串或 @模板名）")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(description = "查询", arity = "1")
        private String query;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--no-cache"}, description = "不读写结果缓存", defaultValue = "false")
        private boolean noCache;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.loadConfig();
                try (EventTable table = new EventTable(main.dbPath, config.getTableName())) {
                    return printSearch(new SearchEngine(table, config));
                }
            } catch (QueryParseException exception) {
                printParseError(exception);
                return 2;
            } catch (Exception exception) {
                System.err.println("❌ 检索失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private int printSearch(SearchEngine engine) throws IOException {
            SearchResponse response = engine.search(resolveQuery(query),
                    noCache ? SearchOptions.noCache() : SearchOptions.defaults());

            if ("json".equalsIgnoreCase(format)) {
                System.out.println(JsonMappers.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(response));
            } else {
                printTextResult(response);
            }
            return 0;
        }

        private void printTextResult(SearchResponse response) {
            if (response.hits().hits().isEmpty()) {
                System.out.println("⚠️ 未找到匹配事件");
            }

            for (SearchHit hit : response.hits().hits()) {
                System.out.println("─────────────────────────────────");
                if (hit.score() != null) {
                    System.out.printf("#%s (score: %.4f)%n", hit.id(), hit.score());
                } else {
                    System.out.printf("#%s%n", hit.id());
                }
                for (Map.Entry<String, Object> field : hit.source().entrySet()) {
                    if (field.getValue() != null) {
                        System.out.println("   " + field.getKey() + ": " + field.getValue());
                    }
                }
            }

            for (Map.Entry<String, AggregationResult> aggregation : response.aggregations().entrySet()) {
                System.out.println();
                System.out.println("📦 " + aggregation.getKey());
                if (aggregation.getValue() instanceof AggregationResult.BucketAggregation bucketAggregation) {
                    for (Bucket bucket : bucketAggregation.buckets()) {
                        Object key = bucket.keyAsString() != null ? bucket.keyAsString() : bucket.key();
                        System.out.println("   " + key + ": " + bucket.docCount());
                    }
                } else if (aggregation.getValue() instanceof AggregationResult.MetricAggregation metric) {
                    System.out.println("   value: " + metric.value());
                }
            }

            System.out.println();
            System.out.println("📊 共 " + response.hits().total() + " 条匹配，用时 " + response.took() + "ms");
        }
    }

    private static final EventStore DETACHED_STORE = new EventStore() {
        @Override
        public List<Map<String, Object>> query(String sql, List<Object> params) {
            throw new IllegalStateException("explain 不执行查询: " + sql);
        }

        @Override
        public Optional<Map<String, Object>> get(String sql, List<Object> params) {
            throw new IllegalStateException("explain 不执行查询: " + sql);
        }
    };

    @Command(name = "explain", description = "🧾 显示查询编译后的 SQL 与参数，不执行")
    static class ExplainSubcommand implements Callable<Integer> {

        @Parameters(description = "查询", arity = "1")
        private String query;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                // 只解析和编译，不打开事件库
                SearchEngine engine = new SearchEngine(DETACHED_STORE, main.loadConfig());
                CompiledQuery compiled = engine.explain(resolveQuery(query));
                System.out.println("SQL:    " + compiled.text());
                System.out.println("参数:   " + compiled.params());
                return 0;
            } catch (QueryParseException exception) {
                printParseError(exception);
                return 2;
            } catch (Exception exception) {
                System.err.println("❌ 编译失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "templates", description = "📚 列出内置查询模板")
    static class TemplatesSubcommand implements Callable<Integer> {

        @Override
        public Integer call() {
            try {
                for (Map.Entry<String, RawQuery> template : QueryTemplates.all().entrySet()) {
                    System.out.println("── " + template.getKey());
                    RawQuery rawQuery = template.getValue();
                    if (rawQuery instanceof RawQuery.Structured structured) {
                        System.out.println(JsonMappers.MAPPER.writerWithDefaultPrettyPrinter()
                                .writeValueAsString(structured.document()));
                    }
                    System.out.println();
                }
                return 0;
            } catch (IOException exception) {
                System.err.println("❌ 输出模板失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
