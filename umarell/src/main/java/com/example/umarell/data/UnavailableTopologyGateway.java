package com.example.umarell.data;

import com.example.umarell.errors.InspectorException;
import com.example.umarell.errors.Stage;
import com.example.umarell.models.Element;

import java.util.List;

/**
 * Used when the graph store was not configured at startup; every call answers
 * DependencyUnavailable with the reason found then.
 */
public class UnavailableTopologyGateway implements TopologyGateway {

    private final String reason;

    public UnavailableTopologyGateway(String reason) {
        this.reason = reason;
    }

    @Override
    public List<Element> findElements(TopologyQuery query) {
        throw InspectorException.unavailable(Stage.TOPOLOGY, reason);
    }

    @Override
    public int execute(List<CypherStatement> statements) {
        throw InspectorException.unavailable(Stage.TOPOLOGY, reason);
    }
}
