package com.civicdesk;

import com.civicdesk.models.LocationZone;

import java.util.Locale;

/**
 * Maps a free-text location to a coarse zone. Implementations must be total:
 * anything unrecognised maps to {@link LocationZone#OTHER}.
 */
@FunctionalInterface
public interface LocationZoneResolver {

    LocationZone resolve(String location);

    /**
     * Case-insensitive keyword match anywhere in the location text.
     * City centre keywords win over compass directions.
     */
    static LocationZoneResolver keywords() {
        return location -> {
            if (location == null || location.isBlank()) {
                return LocationZone.OTHER;
            }
            String key = location.toLowerCase(Locale.ROOT);
            if (key.contains("city") || key.contains("downtown") || key.contains("cbd")) {
                return LocationZone.CITY_CENTRE;
            }
            if (key.contains("north")) {
                return LocationZone.NORTH;
            }
            if (key.contains("south")) {
                return LocationZone.SOUTH;
            }
            if (key.contains("east")) {
                return LocationZone.EAST;
            }
            if (key.contains("west")) {
                return LocationZone.WEST;
            }
            return LocationZone.OTHER;
        };
    }
}
