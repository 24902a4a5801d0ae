package com.finplan.dispatch.cli;

import com.finplan.core.config.EngineProperties;
import com.finplan.core.convergence.ConvergenceCheck;
import com.finplan.core.convergence.StatementLine;
import com.finplan.core.model.Provenance;
import com.finplan.core.model.ValueKind;
import com.finplan.core.rent.RentModel;
import com.finplan.core.rent.RentModelType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioLoaderTest {

    private ScenarioLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ScenarioLoader();
    }

    private ScenarioDocument loadFixture() throws Exception {
        try (var in = getClass().getResourceAsStream("/scenarios/school.json")) {
            assertNotNull(in, "fixture missing");
            return loader.load(in);
        }
    }

    @Test
    @DisplayName("reads drivers, values, bindings and opening balances")
    void readsFixture() throws Exception {
        var doc = loadFixture();

        assertEquals("SCN-SCHOOL", doc.scenarioId());
        assertEquals(2025, doc.years().start());
        assertEquals(6, doc.drivers().size());
        assertEquals(ValueKind.NUMERIC, doc.drivers().get(0).kind());
        assertEquals("Revenue * 0.4", doc.drivers().get(0).formula());
        assertEquals(8, doc.values().size());
        assertEquals(Provenance.IMPORTED, doc.values().get(4).provenance());
        assertEquals("revenue", doc.bindings().get(StatementLine.REVENUE));
        assertEquals(1000.0, doc.opening().cash());
        assertEquals(0.0, doc.opening().accountsReceivable());
    }

    @Test
    @DisplayName("missing sections fall back to configured defaults")
    void defaultsFillGaps() throws Exception {
        var request = loadFixture().toRequest(new EngineProperties());

        assertEquals(20, request.statementConfig().dsoDays());
        assertEquals(45, request.statementConfig().dpoDays());
        assertEquals(0.35, request.statementConfig().deferredRevenuePct());
        assertEquals(4, request.cashEngine().maxIterations());
        assertEquals(ConvergenceCheck.BALANCE_SHEET, request.cashEngine().convergenceCheck());
        assertEquals("staff", request.bindings().driverFor(StatementLine.STAFF_COSTS).orElseThrow());
    }

    @Test
    @DisplayName("reads curriculum, growth and rent sections into the request")
    void readsPlans() throws Exception {
        ScenarioDocument doc;
        try (var in = getClass().getResourceAsStream("/scenarios/campus.json")) {
            assertNotNull(in, "fixture missing");
            doc = loader.load(in);
        }

        var request = doc.toRequest(new EngineProperties());

        var curricula = request.curricula();
        assertEquals(4, curricula.years().size());
        assertEquals(0.02, curricula.cpiRate(2026));
        assertEquals(0.0, curricula.cpiRate(2025));
        assertEquals(60_000.0, curricula.salaries().get("IB").teacher());
        assertEquals("staff", curricula.staffCostDriverId());

        assertEquals(1, request.growth().size());
        assertEquals("opex", request.growth().get(0).driverId());
        assertEquals(10.0, request.growth().get(0).assumption().growthRatePct());
        assertNull(request.growth().get(0).assumption().decline());

        var rent = request.rent();
        assertEquals(RentModelType.REVENUE_SHARE, rent.model().type());
        assertEquals(2025, rent.baseYear());
        assertEquals("rent", rent.rentDriverId());
        assertEquals("revenue", rent.revenueDriverId());
        assertEquals(500_000.0, ((RentModel.RevenueShare) rent.model()).minimumRent());
    }

    @Test
    @DisplayName("a rent section without a type is rejected")
    void rentTypeRequired() throws Exception {
        var json = "{\"years\": {\"start\": 2025, \"end\": 2026}, \"rent\": {\"baseRent\": 1000}}";
        var doc = loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        var e = assertThrows(IllegalArgumentException.class, () -> doc.toRequest(new EngineProperties()));
        assertTrue(e.getMessage().contains("type"));
    }

    @Test
    @DisplayName("a document without years cannot become a request")
    void yearsRequired() throws Exception {
        var json = "{\"drivers\": []}";
        var doc = loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        var e = assertThrows(IllegalArgumentException.class, () -> doc.toRequest(new EngineProperties()));
        assertTrue(e.getMessage().contains("years"));
    }
}
