package com.finplan.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Finplan-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SCENARIO_ID = "scenarioId";
    public static final String YEAR = "year";

    private MdcContext() {}

    public static void setScenario(String scenarioId) {
        MDC.put(SCENARIO_ID, scenarioId);
    }

    public static void setYear(int year) {
        MDC.put(YEAR, String.valueOf(year));
    }

    public static void clearYear() {
        MDC.remove(YEAR);
    }

    public static void clear() {
        MDC.remove(SCENARIO_ID);
        MDC.remove(YEAR);
    }
}
