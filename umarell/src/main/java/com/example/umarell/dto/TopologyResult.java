package com.example.umarell.dto;

import com.example.umarell.models.Element;

import java.util.List;

/** {@code truncated} is true when the store had at least as many rooms as the result cap. */
public record TopologyResult(int count, List<Element> items, boolean truncated) {}
