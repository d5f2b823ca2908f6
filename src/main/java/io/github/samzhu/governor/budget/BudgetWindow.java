package io.github.samzhu.governor.budget;

/**
 * 預算滾動視窗。
 *
 * <p>檢查順序固定為 DAILY → WEEKLY → MONTHLY，遇到第一個超出的視窗即拒絕。
 */
public enum BudgetWindow {

    DAILY("daily", "Daily"),
    WEEKLY("weekly", "Weekly"),
    MONTHLY("monthly", "Monthly");

    private final String label;
    private final String title;

    BudgetWindow(String label, String title) {
        this.label = label;
        this.title = title;
    }

    /**
     * 小寫名稱，用於錯誤訊息，例如 {@code "daily"}。
     */
    public String label() {
        return label;
    }

    /**
     * 首字大寫名稱，用於明細行，例如 {@code "Daily"}。
     */
    public String title() {
        return title;
    }

    /**
     * 對應的叢集預算設定屬性名稱，例如 {@code governor.budget.cluster-daily-usd}。
     */
    public String clusterProperty() {
        return "governor.budget.cluster-" + label + "-usd";
    }

    /**
     * 對應的本機預算設定屬性名稱，例如 {@code governor.budget.daily-usd}。
     */
    public String localProperty() {
        return "governor.budget." + label + "-usd";
    }
}
