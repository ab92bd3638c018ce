package com.example.umarell.data;

/** A built Cypher read together with the filter it was built from. */
public record TopologyQuery(String cypher, TopologyFilter filter, int limit) {
}
