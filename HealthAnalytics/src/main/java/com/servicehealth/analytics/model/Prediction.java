package com.servicehealth.analytics.model;

import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdGenerator;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * ActiveJDBC model for the predictions table.
 * prediction_type holds the trend classification, metadata the predicted values as JSON.
 */
@Table("predictions")
@IdName("id")
@IdGenerator("nextval('predictions_id_seq')")
public class Prediction extends Model {

    static {
        validatePresenceOf(
            "service_name",
            "prediction_type"
        );
    }

    public static int deleteOlderThan(Instant cutoff) {
        return delete("timestamp < ?", Timestamp.from(cutoff));
    }
}
