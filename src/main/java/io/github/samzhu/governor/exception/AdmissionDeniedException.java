package io.github.samzhu.governor.exception;

/**
 * 准入拒絕異常的共同父類別。
 *
 * <p>表示操作若執行將超出頻率或預算上限。由於操作尚未發生，拒絕不需要任何回復動作。
 * 呼叫端應依此類別與 {@link LedgerQueryException} 區分：
 * <ul>
 *   <li>{@code AdmissionDeniedException} - 可延後或稍後重試</li>
 *   <li>{@link LedgerQueryException} - 上游讀取失敗，應告警或讓工作失敗</li>
 * </ul>
 *
 * <p>本服務不會自動重試被拒絕的操作。
 */
public abstract class AdmissionDeniedException extends RuntimeException {

    private final String hint;

    protected AdmissionDeniedException(String message, String hint) {
        super(message);
        this.hint = hint;
    }

    /**
     * 給呼叫端的處理建議。
     */
    public String getHint() {
        return hint;
    }
}
