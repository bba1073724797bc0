package org.deduction;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.deduction.symbolic.SatBackendKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * 引擎的界限与后端设置。此类是不可变的，修改通过 with 方法得到副本。
 * <p>
 * {@link #load()} 从类路径上可选的 {@value #RESOURCE} 读取，缺失的键取默认值。
 */
@Getter
public final class EngineSettings {

    private static final Logger logger = LoggerFactory.getLogger(EngineSettings.class);

    public static final String RESOURCE = "proof-engine.properties";

    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final long DEFAULT_MAX_NODES = 200_000L;
    public static final int DEFAULT_MAX_VARIABLES = 5_000;
    public static final int DEFAULT_MAX_CLAUSES = 20_000;
    public static final long DEFAULT_TIMEOUT_MILLIS = 10_000L;

    private final int maxDepth;
    private final long maxNodes;
    private final int maxVariables;
    private final int maxClauses;
    private final SatBackendKind satBackend;
    private final long timeoutMillis;

    private EngineSettings(int maxDepth, long maxNodes, int maxVariables, int maxClauses, SatBackendKind satBackend,
                           long timeoutMillis) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("solver.maxDepth must not be negative: " + maxDepth);
        }
        if (maxNodes <= 0 || maxVariables <= 0 || maxClauses <= 0) {
            throw new IllegalArgumentException("Search and SAT bounds must be positive.");
        }
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
        this.maxVariables = maxVariables;
        this.maxClauses = maxClauses;
        this.satBackend = Objects.requireNonNull(satBackend, "SAT backend cannot be null.");
        this.timeoutMillis = timeoutMillis;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_MAX_DEPTH, DEFAULT_MAX_NODES, DEFAULT_MAX_VARIABLES, DEFAULT_MAX_CLAUSES,
                SatBackendKind.DPLL, DEFAULT_TIMEOUT_MILLIS);
    }

    /**
     * 读取类路径上的 {@value #RESOURCE}；资源不存在时返回默认设置。
     */
    public static EngineSettings load() {
        Properties properties = new Properties();
        try (InputStream in = EngineSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("EngineSettings: 类路径上没有 {}，使用默认设置", RESOURCE);
                return defaults();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        return fromProperties(properties);
    }

    public static EngineSettings fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "Properties cannot be null.");
        String backendText = properties.getProperty("sat.backend", SatBackendKind.DPLL.getLabel());
        SatBackendKind backend = SatBackendKind.fromLabel(backendText)
                .orElseThrow(() -> new IllegalArgumentException("Unknown sat.backend: " + backendText));
        EngineSettings settings = new EngineSettings(
                NumberUtils.toInt(trimmed(properties, "solver.maxDepth"), DEFAULT_MAX_DEPTH),
                NumberUtils.toLong(trimmed(properties, "solver.maxNodes"), DEFAULT_MAX_NODES),
                NumberUtils.toInt(trimmed(properties, "sat.maxVariables"), DEFAULT_MAX_VARIABLES),
                NumberUtils.toInt(trimmed(properties, "sat.maxClauses"), DEFAULT_MAX_CLAUSES),
                backend,
                NumberUtils.toLong(trimmed(properties, "request.timeoutMillis"), DEFAULT_TIMEOUT_MILLIS));
        logger.debug("EngineSettings: 载入 {}", settings);
        return settings;
    }

    private static String trimmed(Properties properties, String key) {
        return StringUtils.trimToNull(properties.getProperty(key));
    }

    public EngineSettings withMaxDepth(int maxDepth) {
        return new EngineSettings(maxDepth, maxNodes, maxVariables, maxClauses, satBackend, timeoutMillis);
    }

    public EngineSettings withMaxNodes(long maxNodes) {
        return new EngineSettings(maxDepth, maxNodes, maxVariables, maxClauses, satBackend, timeoutMillis);
    }

    public EngineSettings withSatCeilings(int maxVariables, int maxClauses) {
        return new EngineSettings(maxDepth, maxNodes, maxVariables, maxClauses, satBackend, timeoutMillis);
    }

    public EngineSettings withSatBackend(SatBackendKind satBackend) {
        return new EngineSettings(maxDepth, maxNodes, maxVariables, maxClauses, satBackend, timeoutMillis);
    }

    /**
     * 非正数表示不设时限。
     */
    public EngineSettings withTimeoutMillis(long timeoutMillis) {
        return new EngineSettings(maxDepth, maxNodes, maxVariables, maxClauses, satBackend, timeoutMillis);
    }

    @Override
    public String toString() {
        return "EngineSettings{maxDepth=" + maxDepth + ", maxNodes=" + maxNodes + ", maxVariables=" + maxVariables
                + ", maxClauses=" + maxClauses + ", satBackend=" + satBackend.getLabel()
                + ", timeoutMillis=" + timeoutMillis + '}';
    }
}
