package io.github.samzhu.governor.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Repository;

import io.github.samzhu.governor.document.ModelUsage;

/**
 * 以 MongoDB {@code ai_model_usage} 集合為來源的用量帳本。
 *
 * <p>每次查詢執行一次 aggregation，由資料庫端完成加總，不把記錄載入記憶體：
 * <pre>
 * $match { success: true, requestTimestamp: { $gte: since } }
 * $group { _id: null, totalCost: { $sum: "$cost" }, operationCount: { $sum: 1 } }
 * </pre>
 *
 * <p>建議在 {@code requestTimestamp} 建立索引，避免 collection scan。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/aggregation-framework.html">Aggregation Framework Support</a>
 */
@Repository
public class MongoUsageLedger implements UsageLedger {

    private static final Logger log = LoggerFactory.getLogger(MongoUsageLedger.class);

    static final String TOTAL_COST = "totalCost";
    static final String OPERATION_COUNT = "operationCount";

    private final MongoTemplate mongoTemplate;

    public MongoUsageLedger(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public UsageTotals sumSuccessful(Instant since) {
        Aggregation aggregation = buildAggregation(since);
        AggregationResults<Document> results =
            mongoTemplate.aggregate(aggregation, ModelUsage.COLLECTION, Document.class);

        Document row = results.getUniqueMappedResult();
        if (row == null) {
            log.debug("No successful usage since {}", since);
            return UsageTotals.empty();
        }

        UsageTotals totals = new UsageTotals(
            toBigDecimal(row.get(TOTAL_COST)),
            toLong(row.get(OPERATION_COUNT)));
        log.debug("Usage since {}: cost={}, operations={}", since, totals.totalCost(), totals.operationCount());
        return totals;
    }

    static Aggregation buildAggregation(Instant since) {
        return Aggregation.newAggregation(
            Aggregation.match(Criteria.where(ModelUsage.FIELD_SUCCESS).is(true)
                .and(ModelUsage.FIELD_REQUEST_TIMESTAMP).gte(Date.from(since))),
            Aggregation.group()
                .sum(ModelUsage.FIELD_COST).as(TOTAL_COST)
                .count().as(OPERATION_COUNT));
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof org.bson.types.Decimal128 decimal128) {
            return decimal128.bigDecimalValue();
        }
        // 儲存使用 double，計算使用 BigDecimal
        return BigDecimal.valueOf(((Number) value).doubleValue());
    }

    private static long toLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }
}
