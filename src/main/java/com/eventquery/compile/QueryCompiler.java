package com.eventquery.compile;

import com.eventquery.config.EngineConfig;
import com.eventquery.query.NormalizedQuery;
import com.eventquery.query.SortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 将 NormalizedQuery 编译为事件表上的参数化 SQL。
 *
 * <p>模糊检索时不生成全文条件：取回满足结构化过滤的全部行，由进程内的模糊排序再收窄。
 * LIMIT 总是 size+from，分页在进程内完成。
 */
public class QueryCompiler {
    private static final Logger logger = LoggerFactory.getLogger(QueryCompiler.class);

    private final String tableName;
    private final SqlConditions conditions;

    public QueryCompiler() {
        this(EngineConfig.defaults(), Clock.systemUTC());
    }

    public QueryCompiler(EngineConfig config, Clock clock) {
        this.tableName = SqlConditions.requireSafeIdentifier(config.getTableName());
        this.conditions = new SqlConditions(clock);
    }

    public CompiledQuery compile(NormalizedQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(tableName).append(" WHERE 1=1");
        List<Object> params = new ArrayList<>();

        conditions.appendFilters(sql, query.filters(), params);

        if (query.hasTextSearch() && !query.fuzzy()) {
            conditions.textCondition(query.textSearch(), params)
                    .ifPresent(condition -> sql.append(" AND ").append(condition));
        }

        String orderBy = buildOrderBy(query.sort());
        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(orderBy);
        }

        sql.append(" LIMIT ").append(query.fetchLimit());
        return new CompiledQuery(sql.toString(), params);
    }

    private String buildOrderBy(List<SortSpec> sort) {
        List<String> clauses = new ArrayList<>(sort.size());
        for (SortSpec spec : sort) {
            if (!SqlConditions.isSafeIdentifier(spec.field())) {
                logger.warn("排序字段不合法，已跳过: {}", spec.field());
                continue;
            }
            clauses.add(spec.field() + " " + spec.direction().name());
        }
        return String.join(", ", clauses);
    }
}
