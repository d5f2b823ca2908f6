package io.github.samzhu.governor.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * AI 模型用量記錄文件（用量帳本）。
 *
 * <p>每一次 AI 模型呼叫完成後，由外部的帳本寫入端新增一筆記錄。
 * 本服務只讀取此集合，不做任何寫入。
 *
 * <p>預算計算只採計 {@code success = true} 的記錄；失敗的呼叫即使有成本也不計入。
 *
 * <p>成本以 {@code double} 儲存，計算時轉為 {@link java.math.BigDecimal}。
 */
@Document(collection = ModelUsage.COLLECTION)
public record ModelUsage(
    @Id String id,

    // ========== 操作識別 ==========
    /** 操作類型，例如 {@code score}、{@code summarize} */
    String operationType,
    /** 操作對象類型 */
    String entityType,
    /** 操作對象 ID */
    String entityId,

    // ========== 模型 ==========
    String modelName,
    String modelProvider,

    // ========== 時間 ==========
    /** 請求時間 (UTC)，滾動視窗以此欄位篩選 */
    @Indexed Instant requestTimestamp,
    /** 回應時間 (UTC)，失敗時可能為 null */
    Instant responseTimestamp,

    // ========== 用量與成本 ==========
    Integer tokensUsed,
    /** 成本 (USD) */
    Double cost,
    /** 是否成功 */
    boolean success,
    String errorMessage
) {
    public static final String COLLECTION = "ai_model_usage";

    public static final String FIELD_REQUEST_TIMESTAMP = "requestTimestamp";
    public static final String FIELD_COST = "cost";
    public static final String FIELD_SUCCESS = "success";
}
