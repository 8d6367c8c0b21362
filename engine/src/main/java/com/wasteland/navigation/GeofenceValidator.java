package com.wasteland.navigation;

import com.wasteland.data.model.Coordinate;
import com.wasteland.data.model.Location;

import javax.inject.Singleton;
import java.util.Optional;

/**
 * Checks whether a reported position lies inside a location's geofence.
 *
 * <p>Distances use the haversine formula on a spherical Earth. Good to a fraction of a
 * percent, which is plenty for radii of tens to hundreds of metres.
 */
@Singleton
public class GeofenceValidator {

    /**
     * Mean Earth radius in metres.
     */
    public static final double EARTH_RADIUS_METERS = 6_371_000;

    /**
     * Check a reported coordinate against a location. An absent coordinate is accepted unmeasured.
     */
    public GeofenceResult check(Optional<Coordinate> reported, Location target) {
        if (reported.isEmpty()) {
            return GeofenceResult.skipped(target.radiusMeters());
        }
        double distance = distanceMeters(reported.get(), target.coordinate());
        return new GeofenceResult(distance <= target.radiusMeters(), distance, target.radiusMeters());
    }

    /**
     * Great-circle distance between two coordinates in metres.
     */
    public static double distanceMeters(Coordinate from, Coordinate to) {
        double lat1 = Math.toRadians(from.latitude());
        double lat2 = Math.toRadians(to.latitude());
        double dLat = Math.toRadians(to.latitude() - from.latitude());
        double dLon = Math.toRadians(to.longitude() - from.longitude());

        double sinLat = Math.sin(dLat / 2);
        double sinLon = Math.sin(dLon / 2);
        double a = sinLat * sinLat + Math.cos(lat1) * Math.cos(lat2) * sinLon * sinLon;
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.sqrt(Math.min(1.0, a)));
    }
}
