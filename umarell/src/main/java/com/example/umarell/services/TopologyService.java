package com.example.umarell.services;

import com.example.umarell.data.CypherQueryBuilder;
import com.example.umarell.data.RemoteCallGuard;
import com.example.umarell.data.TopologyFilter;
import com.example.umarell.data.TopologyGateway;
import com.example.umarell.data.TopologyQuery;
import com.example.umarell.dto.TopologyResult;
import com.example.umarell.errors.InspectorException;
import com.example.umarell.errors.Stage;
import com.example.umarell.models.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class TopologyService {

    private final TopologyGateway gateway;
    private final RemoteCallGuard guard;
    private final int maxItems;
    private final Set<String> wholeBuilding;

    public TopologyService(
            TopologyGateway gateway,
            RemoteCallGuard guard,
            @Value("${umarell.topology.max-items:500}") int maxItems,
            @Value("${umarell.zones.whole-building:whole building,entire building,building,all,*}") List<String> wholeBuilding
    ) {
        this.gateway = gateway;
        this.guard = guard;
        this.maxItems = maxItems;
        this.wholeBuilding = wholeBuilding.stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public TopologyResult queryTopology(String category, String floor, String nameContains, Duration timeout) {
        List<Element> items = run(TopologyFilter.of(category, floor, nameContains), timeout);
        return new TopologyResult(items.size(), items, items.size() >= maxItems);
    }

    /** Rooms whose name contains the fragment, in store order. */
    public List<Element> findByName(String roomName, Duration timeout) {
        if (roomName == null || roomName.isBlank()) {
            throw InspectorException.invalidInput("room_name is required");
        }
        return run(TopologyFilter.of(null, null, roomName), timeout);
    }

    /**
     * Rooms in a zone: every room for the whole-building literals, otherwise rooms whose
     * category contains the zone name or whose floor equals it.
     */
    public List<Element> resolveZone(String zone, Duration timeout) {
        if (zone == null || zone.isBlank()) {
            throw InspectorException.invalidInput("zone is required");
        }
        TopologyFilter filter = isWholeBuilding(zone) ? TopologyFilter.all() : TopologyFilter.zone(zone);
        return run(filter, timeout);
    }

    public boolean isWholeBuilding(String zone) {
        return zone != null && wholeBuilding.contains(zone.trim().toLowerCase(Locale.ROOT));
    }

    private List<Element> run(TopologyFilter filter, Duration timeout) {
        TopologyQuery query = CypherQueryBuilder.select(filter, maxItems);
        return guard.call(Stage.TOPOLOGY, timeout, () -> gateway.findElements(query));
    }
}
