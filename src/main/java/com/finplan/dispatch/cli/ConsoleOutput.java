package com.finplan.dispatch.cli;

import com.finplan.core.convergence.ConvergenceState;
import com.finplan.core.convergence.YearResult;
import com.finplan.core.projection.EvaluationFailure;
import com.finplan.core.statements.StatementSnapshot;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Finplan CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FINPLAN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FINPLAN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void failure(EvaluationFailure f) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) " + f.kind() + "|@ " + f.driverName() + " [" + f.year() + "] " + f.message()));
    }

    public static void year(YearResult result) {
        var c = result.convergence();
        String state = switch (c.state()) {
            case CONVERGED -> "@|fg(green) CONVERGED|@";
            case EXHAUSTED -> "@|fg(yellow) EXHAUSTED|@";
            default -> "@|fg(red) " + c.state() + "|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold [" + result.year() + "]|@ " + state + " after " + c.iterations()
                        + " iteration" + (c.iterations() != 1 ? "s" : "")
                        + (c.state() != ConvergenceState.FAILED ? ", residual " + money(c.residual()) : "")));
        if (c.lastError() != null) {
            error("  " + c.lastError());
        }
        result.warnings().forEach(w -> warn("  " + w));
        result.findSnapshot().ifPresent(ConsoleOutput::snapshot);
    }

    public static void snapshot(StatementSnapshot s) {
        var pnl = s.profitAndLoss();
        var bs = s.balanceSheet();
        var cf = s.cashFlow();
        System.out.printf("  Revenue %s | COGS %s | EBITDA %s (%s%%) | Net result %s%n",
                money(pnl.revenue()), money(pnl.cogs()), money(pnl.ebitda()),
                pct(pnl.ebitdaMarginPct()), money(pnl.netResult()));
        System.out.printf("  Interest +%s / -%s | Taxes %s%n",
                money(pnl.interestIncome()), money(pnl.interestExpense()), money(pnl.taxes()));
        System.out.printf("  Assets %s | Liabilities %s | Equity %s%n",
                money(bs.totalAssets()), money(bs.totalLiabilities()), money(bs.totalEquity()));
        System.out.printf("  Cash %s -> %s (CFO %s, CFI %s, CFF %s)%n",
                money(cf.beginningCash()), money(cf.endingCash()),
                money(cf.operating()), money(cf.investing()), money(cf.financing()));
    }

    private static String money(double v) {
        return String.format(Locale.ROOT, "%,.2f", v);
    }

    private static String pct(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
