package com.example.umarell.data;

import com.example.umarell.models.Reading;

import java.util.List;

/** One call = one round trip to the time-series store. */
public interface TimeSeriesGateway extends AutoCloseable {

    List<Reading> query(FluxQuery query);

    @Override
    default void close() {
    }
}
