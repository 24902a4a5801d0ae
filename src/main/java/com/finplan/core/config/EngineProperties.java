package com.finplan.core.config;

import com.finplan.core.convergence.CashEngineConfig;
import com.finplan.core.convergence.ConvergenceCheck;
import com.finplan.core.model.YearDomain;
import com.finplan.core.statements.StatementConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Engine defaults bound from {@code finplan.*}. Only used to build default config records;
 * engine entry points always take their configuration as arguments.
 */
@Component
@ConfigurationProperties(prefix = "finplan")
public class EngineProperties {

    private CashEngine cashEngine = new CashEngine();
    private Statements statements = new Statements();
    private Years years = new Years();

    public CashEngineConfig toCashEngineConfig() {
        return new CashEngineConfig(cashEngine.maxIterations, cashEngine.tolerance, cashEngine.convergenceCheck,
                cashEngine.depositRate, cashEngine.overdraftRate);
    }

    public StatementConfig toStatementConfig() {
        return new StatementConfig(statements.dsoDays, statements.dpoDays, statements.deferredRevenuePct);
    }

    public YearDomain toYearDomain() {
        return new YearDomain(years.first, years.last, years.historicalEnd);
    }

    public CashEngine getCashEngine() { return cashEngine; }
    public void setCashEngine(CashEngine cashEngine) { this.cashEngine = cashEngine; }
    public Statements getStatements() { return statements; }
    public void setStatements(Statements statements) { this.statements = statements; }
    public Years getYears() { return years; }
    public void setYears(Years years) { this.years = years; }

    public static class CashEngine {
        private int maxIterations = CashEngineConfig.DEFAULT_MAX_ITERATIONS;
        private double tolerance = CashEngineConfig.DEFAULT_TOLERANCE;
        private ConvergenceCheck convergenceCheck = ConvergenceCheck.BALANCE_SHEET;
        private double depositRate = CashEngineConfig.DEFAULT_DEPOSIT_RATE;
        private double overdraftRate = CashEngineConfig.DEFAULT_OVERDRAFT_RATE;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public double getTolerance() { return tolerance; }
        public void setTolerance(double tolerance) { this.tolerance = tolerance; }
        public ConvergenceCheck getConvergenceCheck() { return convergenceCheck; }
        public void setConvergenceCheck(ConvergenceCheck convergenceCheck) { this.convergenceCheck = convergenceCheck; }
        public double getDepositRate() { return depositRate; }
        public void setDepositRate(double depositRate) { this.depositRate = depositRate; }
        public double getOverdraftRate() { return overdraftRate; }
        public void setOverdraftRate(double overdraftRate) { this.overdraftRate = overdraftRate; }
    }

    public static class Statements {
        private double dsoDays = 30;
        private double dpoDays = 45;
        private double deferredRevenuePct = 0.35;

        public double getDsoDays() { return dsoDays; }
        public void setDsoDays(double dsoDays) { this.dsoDays = dsoDays; }
        public double getDpoDays() { return dpoDays; }
        public void setDpoDays(double dpoDays) { this.dpoDays = dpoDays; }
        public double getDeferredRevenuePct() { return deferredRevenuePct; }
        public void setDeferredRevenuePct(double deferredRevenuePct) { this.deferredRevenuePct = deferredRevenuePct; }
    }

    public static class Years {
        private int first = 2023;
        private int last = 2052;
        private int historicalEnd = 2024;

        public int getFirst() { return first; }
        public void setFirst(int first) { this.first = first; }
        public int getLast() { return last; }
        public void setLast(int last) { this.last = last; }
        public int getHistoricalEnd() { return historicalEnd; }
        public void setHistoricalEnd(int historicalEnd) { this.historicalEnd = historicalEnd; }
    }
}
