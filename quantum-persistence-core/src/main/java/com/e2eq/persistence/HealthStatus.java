package com.e2eq.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthStatus {
    protected String backendType;
    protected boolean initialized;
    protected long schemaVersion;
    protected long latestAvailableVersion;
    protected int pendingMigrations;
    protected boolean migrationInProgress;
    protected Map<String, Object> stats;
    /** Set when the status could not be collected. */
    protected String error;
    protected String timestamp;

    public boolean isHealthy() {
        return initialized && error == null;
    }
}
