package io.github.samzhu.governor.ledger;

import java.time.Instant;

/**
 * 用量帳本的讀取介面。
 *
 * <p>帳本由外部的持久化儲存擁有，本服務只讀取。實作遇到 I/O 錯誤時
 * 直接拋出 runtime exception，由呼叫端包裝成
 * {@link io.github.samzhu.governor.exception.LedgerQueryException}。
 */
public interface UsageLedger {

    /**
     * 加總 {@code since} 之後（含）所有成功操作的成本與次數。
     *
     * @param since 滾動視窗的起點，通常為 {@code now - window}
     * @return 成功操作的總成本與次數；沒有記錄時為 {@link UsageTotals#empty()}
     */
    UsageTotals sumSuccessful(Instant since);
}
