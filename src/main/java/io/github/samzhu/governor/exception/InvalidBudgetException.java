package io.github.samzhu.governor.exception;

import java.math.BigDecimal;
import java.util.Locale;

import io.github.samzhu.governor.budget.BudgetWindow;

/**
 * 預算設定值不合法（負數）。原本的設定維持不變。
 */
public class InvalidBudgetException extends IllegalArgumentException {

    private final BudgetWindow window;
    private final BigDecimal rejectedValue;
    private final String hint;

    public InvalidBudgetException(BudgetWindow window, BigDecimal rejectedValue, String hint) {
        super(String.format(Locale.ROOT, "%s budget cannot be negative: %.2f", window.label(), rejectedValue));
        this.window = window;
        this.rejectedValue = rejectedValue;
        this.hint = hint;
    }

    public BudgetWindow getWindow() {
        return window;
    }

    public BigDecimal getRejectedValue() {
        return rejectedValue;
    }

    public String getHint() {
        return hint;
    }
}
