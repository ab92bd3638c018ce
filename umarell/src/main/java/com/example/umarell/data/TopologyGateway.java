package com.example.umarell.data;

import com.example.umarell.models.Element;

import java.util.List;

/** One call = one round trip to the graph store. */
public interface TopologyGateway {

    List<Element> findElements(TopologyQuery query);

    /** Runs all statements in a single transaction; returns how many were executed. */
    int execute(List<CypherStatement> statements);
}
