package com.example.umarell.data;

import com.example.umarell.errors.InspectorException;
import com.example.umarell.errors.Stage;
import com.example.umarell.models.Reading;
import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.InfluxDBClientFactory;
import com.influxdb.client.InfluxDBClientOptions;
import com.influxdb.exceptions.InfluxException;
import com.influxdb.query.FluxRecord;
import com.influxdb.query.FluxTable;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs batched Flux reads with the InfluxDB 2.x Java client.
 */
public class InfluxTimeSeriesGateway implements TimeSeriesGateway {

    private static final Logger log = LoggerFactory.getLogger(InfluxTimeSeriesGateway.class);

    private final InfluxDBClient client;
    private final String org;
    private final String sensorTag;

    public InfluxTimeSeriesGateway(String url, String token, String org, String bucket, String sensorTag,
                                   Duration readTimeout) {
        // transport ceiling only; the per-call deadline is enforced by RemoteCallGuard
        OkHttpClient.Builder http = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(readTimeout);
        InfluxDBClientOptions options = InfluxDBClientOptions.builder()
                .okHttpClient(http)
                .url(url)
                .authenticateToken(token.toCharArray())
                .org(org)
                .bucket(bucket)
                .build();
        this.client = InfluxDBClientFactory.create(options);
        this.org = org;
        this.sensorTag = sensorTag;
    }

    InfluxTimeSeriesGateway(InfluxDBClient client, String org, String sensorTag) {
        this.client = client;
        this.org = org;
        this.sensorTag = sensorTag;
    }

    @Override
    public List<Reading> query(FluxQuery query) {
        log.debug("Flux ({} sensors): {}", query.sensorIds().size(), query.flux());

        List<FluxTable> tables;
        try {
            tables = client.getQueryApi().query(query.flux(), org);
        } catch (InfluxException e) {
            if (e.getCause() instanceof InterruptedIOException) {
                throw InspectorException.timedOut(Stage.TIME_SERIES, "InfluxDB did not answer in time");
            }
            throw InspectorException.queryFailed(Stage.TIME_SERIES,
                    "InfluxDB query failed (HTTP " + e.status() + "): " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw InspectorException.queryFailed(Stage.TIME_SERIES, "InfluxDB query failed: " + e.getMessage(), e);
        }

        List<Reading> out = new ArrayList<>();
        for (FluxTable table : tables) {
            for (FluxRecord record : table.getRecords()) {
                Object id = record.getValueByKey(sensorTag);
                if (id == null) {
                    continue;
                }
                out.add(new Reading(id.toString(), record.getField(), record.getValue(), record.getTime()));
            }
        }
        return out;
    }

    @Override
    public void close() {
        client.close();
    }
}
