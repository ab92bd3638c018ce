package com.example.umarell.importer;

import com.example.umarell.config.SensorConfigResolver;
import com.example.umarell.data.CypherStatement;
import com.example.umarell.data.RemoteCallGuard;
import com.example.umarell.data.TopologyGateway;
import com.example.umarell.errors.Stage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes extracted spaces as Room nodes, keyed so that the sensor mapping can find them.
 * Everything goes to the store in one transactional request.
 */
@Service
public class TopologyImporter {

    private static final Logger log = LoggerFactory.getLogger(TopologyImporter.class);

    static final String UPSERT_ROOM =
            "MERGE (r:Room {room_key: $room_key})\n" +
            "SET r.name = $name,\n" +
            "    r.long_name = $long_name,\n" +
            "    r.globalid = $globalid,\n" +
            "    r.type = $type,\n" +
            "    r.storey = $storey,\n" +
            "    r.area = $area,\n" +
            "    r.is_external = $is_external,\n" +
            "    r.category_it = $category_it,\n" +
            "    r.category_en = $category_en,\n" +
            "    r.all_properties = $all_props";

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    static final String UPSERT_PLACEHOLDER =
            "MERGE (r:Room {room_key: $room_key}) SET r.type = 'Placeholder'";

    private final SensorConfigResolver configResolver;
    private final TopologyGateway gateway;
    private final RemoteCallGuard guard;
    private final ObjectMapper mapper;

    public TopologyImporter(SensorConfigResolver configResolver, TopologyGateway gateway,
                            RemoteCallGuard guard, ObjectMapper mapper) {
        this.configResolver = configResolver;
        this.gateway = gateway;
        this.guard = guard;
        this.mapper = mapper;
    }

    public ImportReport importSpaces(List<SpaceRecord> spaces, Duration timeout) {
        Set<String> roomKeys = configResolver.loadSensorConfig().mapping().elementIds();
        RoomKeyMatcher matcher = new RoomKeyMatcher(roomKeys);

        List<CypherStatement> statements = new ArrayList<>();
        Set<String> matched = new LinkedHashSet<>();

        for (SpaceRecord space : spaces) {
            String key = matcher.match(space);
            if (key != null) {
                matched.add(key);
            } else if (space.globalId() != null && !space.globalId().isBlank()) {
                key = "ifc_auto_" + space.globalId();
            } else {
                log.warn("Skipping space without global id and without a configured key: {}", space.name());
                continue;
            }
            statements.add(new CypherStatement(UPSERT_ROOM, properties(key, space)));
        }
        int upserted = statements.size();

        List<String> placeholders = new ArrayList<>();
        for (String key : roomKeys) {
            if (!matched.contains(key)) {
                placeholders.add(key);
                statements.add(new CypherStatement(UPSERT_PLACEHOLDER, Map.of("room_key", key)));
            }
        }

        guard.call(Stage.TOPOLOGY, timeout, () -> gateway.execute(statements));
        log.info("Imported {} rooms ({} matched to sensor config, {} placeholders)",
                upserted, matched.size(), placeholders.size());
        return new ImportReport(upserted, matched.size(), placeholders.size(), placeholders);
    }

    Map<String, Object> properties(String key, SpaceRecord space) {
        Map<String, Object> locali = space.pset("IFC_Locali");
        Map<String, Object> common = space.pset("Pset_SpaceCommon");

        Object customStorey = locali.get("PBSs_III_PIANO");
        String storey = customStorey != null ? customStorey.toString() : space.containerStorey();
        Object catIt = locali.get("SBSm_CATEGORIA_DESCRIZIONE");
        String categoryIt = catIt == null ? null : catIt.toString();

        Map<String, Object> p = new HashMap<>();
        p.put("room_key", key);
        p.put("name", space.name());
        p.put("long_name", space.longName());
        p.put("globalid", space.globalId());
        p.put("type", space.objectType());
        p.put("storey", storey);
        p.put("area", area(common));
        p.put("is_external", common.get("IsExternal"));
        p.put("category_it", categoryIt);
        p.put("category_en", CategoryTranslator.toEnglish(categoryIt));
        p.put("all_props", psetsJson(space));
        return p;
    }

    private static Double area(Map<String, Object> common) {
        for (String k : List.of("GrossPlannedArea", "NetPlannedArea", "Area")) {
            Object v = common.get(k);
            if (v instanceof Number n && n.doubleValue() != 0) {
                return n.doubleValue();
            }
            if (v instanceof String s && NUMBER.matcher(s.trim()).matches()) {
                return Double.parseDouble(s.trim());
            }
        }
        return null;
    }

    private String psetsJson(SpaceRecord space) {
        try {
            return mapper.writeValueAsString(space.psets() == null ? Map.of() : space.psets());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise property sets of " + space.globalId(), e);
        }
    }
}
