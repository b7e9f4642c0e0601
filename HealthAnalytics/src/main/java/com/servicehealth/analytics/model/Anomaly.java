package com.servicehealth.analytics.model;

import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdGenerator;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * ActiveJDBC model for the anomalies table.
 * The affected metrics are stored as JSON in the metadata column.
 */
@Table("anomalies")
@IdName("id")
@IdGenerator("nextval('anomalies_id_seq')")
public class Anomaly extends Model {

    static {
        validatePresenceOf(
            "service_name",
            "anomaly_type",
            "severity"
        );
    }

    public static int deleteOlderThan(Instant cutoff) {
        return delete("timestamp < ?", Timestamp.from(cutoff));
    }
}
