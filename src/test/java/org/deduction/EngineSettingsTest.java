package org.deduction;

import org.deduction.symbolic.SatBackendKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class EngineSettingsTest {

    @Test
    @DisplayName("类路径上的配置文件与默认值一致")
    void testLoad() {
        EngineSettings settings = EngineSettings.load();
        assertAll(
                () -> assertEquals(10, settings.getMaxDepth()),
                () -> assertEquals(200_000L, settings.getMaxNodes()),
                () -> assertEquals(5_000, settings.getMaxVariables()),
                () -> assertEquals(20_000, settings.getMaxClauses()),
                () -> assertEquals(SatBackendKind.DPLL, settings.getSatBackend()),
                () -> assertEquals(10_000L, settings.getTimeoutMillis())
        );
    }

    @Test
    @DisplayName("缺失或无法解析的键取默认值")
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("solver.maxDepth", " 4 ");
        properties.setProperty("solver.maxNodes", "lots");
        properties.setProperty("sat.backend", "Z3");
        EngineSettings settings = EngineSettings.fromProperties(properties);
        assertAll(
                () -> assertEquals(4, settings.getMaxDepth()),
                () -> assertEquals(EngineSettings.DEFAULT_MAX_NODES, settings.getMaxNodes()),
                () -> assertEquals(SatBackendKind.Z3, settings.getSatBackend())
        );
    }

    @Test
    @DisplayName("非法的设置被拒绝")
    void testInvalidSettings() {
        Properties unknownBackend = new Properties();
        unknownBackend.setProperty("sat.backend", "minisat");
        assertAll(
                () -> assertThrows(IllegalArgumentException.class, () -> EngineSettings.fromProperties(unknownBackend)),
                () -> assertThrows(IllegalArgumentException.class, () -> EngineSettings.defaults().withMaxDepth(-1)),
                () -> assertThrows(IllegalArgumentException.class, () -> EngineSettings.defaults().withSatCeilings(0, 10))
        );
    }

    @Test
    @DisplayName("with 方法返回副本")
    void testWithers() {
        EngineSettings base = EngineSettings.defaults();
        EngineSettings changed = base.withMaxNodes(50).withSatBackend(SatBackendKind.Z3).withTimeoutMillis(0);
        assertAll(
                () -> assertEquals(EngineSettings.DEFAULT_MAX_NODES, base.getMaxNodes()),
                () -> assertEquals(50, changed.getMaxNodes()),
                () -> assertEquals(SatBackendKind.Z3, changed.getSatBackend()),
                () -> assertEquals(0, changed.getTimeoutMillis())
        );
    }
}
