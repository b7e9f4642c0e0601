package com.servicehealth.analytics.model;

import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdGenerator;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * ActiveJDBC model for the service_metrics table: one row per health check.
 */
@Table("service_metrics")
@IdName("id")
@IdGenerator("nextval('service_metrics_id_seq')")
public class ServiceMetric extends Model {

    static {
        validatePresenceOf(
            "service_name",
            "status",
            "timestamp"
        );
    }

    /**
     * Most recent samples of a service since the given instant, newest first.
     */
    public static List<ServiceMetric> findRecent(String serviceName, Instant since, int limit) {
        return ServiceMetric.where(
            "service_name = ? AND timestamp >= ?",
            serviceName, Timestamp.from(since)
        ).orderBy("timestamp DESC").limit(limit);
    }

    /**
     * Most recent samples of a service in {@code [since, until]}, newest first.
     */
    public static List<ServiceMetric> findBetween(String serviceName, Instant since, Instant until, int limit) {
        return ServiceMetric.where(
            "service_name = ? AND timestamp >= ? AND timestamp <= ?",
            serviceName, Timestamp.from(since), Timestamp.from(until)
        ).orderBy("timestamp DESC").limit(limit);
    }

    public static int deleteOlderThan(Instant cutoff) {
        return delete("timestamp < ?", Timestamp.from(cutoff));
    }
}
