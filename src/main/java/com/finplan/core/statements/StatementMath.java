package com.finplan.core.statements;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure statement formulas. Inputs are taken as given; out-of-range configuration is reported by
 * {@link #validateConfig}, never clamped.
 */
public final class StatementMath {

    public static final double DAYS_PER_YEAR = 365.0;

    private StatementMath() {}

    // ── P&L ─────────────────────────────────────────────────────────

    public static double cogs(double staffCosts, double rent, double otherOpex) {
        return staffCosts + rent + otherOpex;
    }

    public static double ebitda(double revenue, double cogs) {
        return revenue - cogs;
    }

    public static double ebit(double ebitda, double depreciation) {
        return ebitda - depreciation;
    }

    public static double netResult(double ebit, double interestIncome, double interestExpense, double taxes) {
        return ebit + interestIncome - interestExpense - taxes;
    }

    /**
     * Interest on the average of beginning and ending cash. A positive average earns
     * {@code depositRate}; a negative average costs {@code overdraftRate} on its absolute value.
     */
    public static InterestOnCash interestOnCash(double beginningCash, double endingCash,
                                                double depositRate, double overdraftRate) {
        double average = (beginningCash + endingCash) / 2;
        if (average > 0) {
            return new InterestOnCash(average * depositRate, 0);
        }
        if (average < 0) {
            return new InterestOnCash(0, Math.abs(average) * overdraftRate);
        }
        return InterestOnCash.NONE;
    }

    // ── Working capital ─────────────────────────────────────────────

    public static double accountsReceivable(double revenue, double dsoDays) {
        return revenue * dsoDays / DAYS_PER_YEAR;
    }

    public static double accountsPayable(double cogs, double dpoDays) {
        return cogs * dpoDays / DAYS_PER_YEAR;
    }

    public static double deferredRevenue(double revenue, double deferredRevenuePct) {
        return revenue * deferredRevenuePct;
    }

    public static double workingCapital(double accountsReceivable, double accountsPayable, double deferredRevenue) {
        return accountsReceivable - accountsPayable - deferredRevenue;
    }

    // ── Balance sheet ───────────────────────────────────────────────

    public static double endingCash(double beginningCash, double netCashFlow) {
        return beginningCash + netCashFlow;
    }

    public static double totalCurrentAssets(double cash, double accountsReceivable) {
        return cash + accountsReceivable;
    }

    public static double netFixedAssets(double tangibleAssets, double accumulatedDepreciation) {
        return tangibleAssets - accumulatedDepreciation;
    }

    public static double totalAssets(double totalCurrentAssets, double netFixedAssets) {
        return totalCurrentAssets + netFixedAssets;
    }

    public static double totalCurrentLiabilities(double accountsPayable, double deferredRevenue) {
        return accountsPayable + deferredRevenue;
    }

    public static double totalLiabilities(double totalCurrentLiabilities, double provisions) {
        return totalCurrentLiabilities + provisions;
    }

    public static double retainedEarnings(double priorRetainedEarnings, double netResult) {
        return priorRetainedEarnings + netResult;
    }

    public static BalanceCheck balanceCheck(double totalAssets, double totalLiabilities,
                                            double totalEquity, double tolerance) {
        double residual = totalAssets - (totalLiabilities + totalEquity);
        return new BalanceCheck(Math.abs(residual) <= tolerance, residual);
    }

    // ── Cash flow ───────────────────────────────────────────────────

    public static double operatingCashFlow(double netResult, double depreciation, double changeInReceivables,
                                           double changeInPayables, double changeInDeferredIncome,
                                           double changeInProvisions) {
        return netResult + depreciation - changeInReceivables + changeInPayables
                + changeInDeferredIncome + changeInProvisions;
    }

    public static double investingCashFlow(double capex) {
        return -capex;
    }

    public static double netCashFlow(double operating, double investing, double financing) {
        return operating + investing + financing;
    }

    // ── Ratios ──────────────────────────────────────────────────────

    public static double ebitdaMarginPct(double ebitda, double revenue) {
        return revenue == 0 ? 0 : ebitda / revenue * 100;
    }

    public static double netMarginPct(double netResult, double revenue) {
        return revenue == 0 ? 0 : netResult / revenue * 100;
    }

    /** {@code +Infinity} when there are no current liabilities. */
    public static double currentRatio(double currentAssets, double currentLiabilities) {
        return currentLiabilities == 0 ? Double.POSITIVE_INFINITY : currentAssets / currentLiabilities;
    }

    public static double daysInWorkingCapital(double netWorkingCapital, double revenue) {
        return revenue == 0 ? 0 : netWorkingCapital / revenue * DAYS_PER_YEAR;
    }

    // ── Validation ──────────────────────────────────────────────────

    public static List<String> validateConfig(double dsoDays, double dpoDays, double deferredRevenuePct) {
        var errors = new ArrayList<String>();
        if (!(dsoDays >= 0 && dsoDays <= DAYS_PER_YEAR)) {
            errors.add("DSO days must be between 0 and 365");
        }
        if (!(dpoDays >= 0 && dpoDays <= DAYS_PER_YEAR)) {
            errors.add("DPO days must be between 0 and 365");
        }
        if (!(deferredRevenuePct >= 0 && deferredRevenuePct <= 1)) {
            errors.add("Deferred revenue % must be between 0 and 1 (e.g., 0.35 for 35%)");
        }
        return errors;
    }

    public static List<String> validateRates(double depositRate, double overdraftRate) {
        var errors = new ArrayList<String>();
        if (!(depositRate >= 0 && depositRate <= 1)) {
            errors.add("Deposit rate must be between 0 and 1");
        }
        if (!(overdraftRate >= 0 && overdraftRate <= 1)) {
            errors.add("Overdraft rate must be between 0 and 1");
        }
        return errors;
    }
}
