package com.example.umarell.config;

import com.example.umarell.data.FluxQueryBuilder;
import com.example.umarell.data.InfluxTimeSeriesGateway;
import com.example.umarell.data.Neo4jHttpTopologyGateway;
import com.example.umarell.data.ReadingSelector;
import com.example.umarell.data.RemoteCallGuard;
import com.example.umarell.data.TimeSeriesGateway;
import com.example.umarell.data.TopologyGateway;
import com.example.umarell.data.UnavailableTimeSeriesGateway;
import com.example.umarell.data.UnavailableTopologyGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Store clients and the config cache. Missing drivers or connection settings are
 * detected here, once, and turned into a gateway that answers DependencyUnavailable.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    static final String INFLUX_CLIENT_CLASS = "com.influxdb.client.InfluxDBClientFactory";

    @Bean
    public SensorConfigResolver sensorConfigResolver(
            @Value("${umarell.sensor-config.locations}") List<String> locations,
            ObjectMapper mapper
    ) {
        List<Path> candidates = locations.stream()
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .map(Path::of)
                .toList();
        return new SensorConfigResolver(candidates, mapper);
    }

    @Bean(destroyMethod = "shutdown")
    public RemoteCallGuard remoteCallGuard(
            @Value("${umarell.remote.threads:16}") int threads,
            @Value("${umarell.remote.timeout:10s}") Duration timeout
    ) {
        return new RemoteCallGuard(threads, timeout);
    }

    /** Socket reads wait up to the transport ceiling; each call's own deadline is enforced by {@link RemoteCallGuard}. */
    @Bean
    public RestTemplate topologyRestTemplate(
            RestTemplateBuilder builder,
            @Value("${umarell.remote.transport-timeout:5m}") Duration transportTimeout
    ) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(transportTimeout)
                .build();
    }

    @Bean
    public TopologyGateway topologyGateway(
            RestTemplate topologyRestTemplate,
            ObjectMapper mapper,
            @Value("${umarell.neo4j.uri:}") String uri,
            @Value("${umarell.neo4j.database:neo4j}") String database,
            @Value("${umarell.neo4j.user:neo4j}") String user,
            @Value("${umarell.neo4j.password:}") String password
    ) {
        if (uri == null || uri.isBlank()) {
            String reason = "Topology store is not configured (set NEO4J_URI)";
            log.warn("{}; topology lookups will report DependencyUnavailable", reason);
            return new UnavailableTopologyGateway(reason);
        }
        Neo4jHttpTopologyGateway gateway =
                new Neo4jHttpTopologyGateway(topologyRestTemplate, mapper, uri, database, user, password);
        log.info("Topology store: {}", gateway.getCommitUrl());
        return gateway;
    }

    @Bean(destroyMethod = "close")
    public TimeSeriesGateway timeSeriesGateway(
            @Value("${umarell.influx.url:}") String url,
            @Value("${umarell.influx.token:}") String token,
            @Value("${umarell.influx.org:}") String org,
            @Value("${umarell.influx.bucket:}") String bucket,
            @Value("${umarell.timeseries.sensor-tag:sensor_id}") String sensorTag,
            @Value("${umarell.remote.transport-timeout:5m}") Duration transportTimeout
    ) {
        if (!onClasspath(INFLUX_CLIENT_CLASS)) {
            String reason = "InfluxDB client library (influxdb-client-java) is not on the classpath";
            log.warn("{}; zone metrics will report DependencyUnavailable", reason);
            return new UnavailableTimeSeriesGateway(reason);
        }
        if (isBlank(url) || isBlank(token) || isBlank(org) || isBlank(bucket)) {
            String reason = "InfluxDB configuration is missing (INFLUX_HOST, INFLUX_TOKEN, INFLUX_ORG, INFLUX_BUCKET)";
            log.warn("{}; zone metrics will report DependencyUnavailable", reason);
            return new UnavailableTimeSeriesGateway(reason);
        }
        log.info("Time-series store: {} org={} bucket={}", url, org, bucket);
        return new InfluxTimeSeriesGateway(url.trim(), token.trim(), org.trim(), bucket.trim(), sensorTag,
                transportTimeout);
    }

    @Bean
    public FluxQueryBuilder fluxQueryBuilder(
            @Value("${umarell.influx.bucket:}") String bucket,
            @Value("${umarell.timeseries.sensor-tag:sensor_id}") String sensorTag,
            @Value("${umarell.timeseries.measurement:}") String measurement,
            @Value("${umarell.timeseries.field:}") String field,
            @Value("${umarell.timeseries.selector:last}") String selector
    ) {
        return new FluxQueryBuilder(bucket.trim(), sensorTag, measurement, field, ReadingSelector.parse(selector));
    }

    static boolean onClasspath(String className) {
        try {
            Class.forName(className, false, StoreConfig.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            log.debug("{} not loadable: {}", className, e.toString());
            return false;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
