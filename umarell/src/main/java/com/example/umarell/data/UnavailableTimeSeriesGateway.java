package com.example.umarell.data;

import com.example.umarell.errors.InspectorException;
import com.example.umarell.errors.Stage;
import com.example.umarell.models.Reading;

import java.util.List;

/** Same as {@link UnavailableTopologyGateway}, for the time-series store. */
public class UnavailableTimeSeriesGateway implements TimeSeriesGateway {

    private final String reason;

    public UnavailableTimeSeriesGateway(String reason) {
        this.reason = reason;
    }

    @Override
    public List<Reading> query(FluxQuery query) {
        throw InspectorException.unavailable(Stage.TIME_SERIES, reason);
    }
}
