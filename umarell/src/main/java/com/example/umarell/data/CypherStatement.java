package com.example.umarell.data;

import java.util.Map;

/** A parameterised write sent through the transactional endpoint. */
public record CypherStatement(String statement, Map<String, Object> parameters) {
}
