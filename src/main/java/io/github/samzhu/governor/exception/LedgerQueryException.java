package io.github.samzhu.governor.exception;

import java.util.Locale;

import io.github.samzhu.governor.budget.BudgetWindow;

/**
 * 用量帳本查詢失敗。
 *
 * <p>與 {@link AdmissionDeniedException} 不同，這代表上游資料來源異常，
 * 預算狀態無法判斷。原始例外保留在 {@link #getCause()}。
 */
public class LedgerQueryException extends RuntimeException {

    private final BudgetWindow window;

    public LedgerQueryException(BudgetWindow window, Throwable cause) {
        super(String.format(Locale.ROOT, "failed to get %s spend from usage ledger: %s",
            window.label(), describe(cause)), cause);
        this.window = window;
    }

    public BudgetWindow getWindow() {
        return window;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.toString();
    }
}
