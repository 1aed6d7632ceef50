package com.example.EV_Charging_Platform.controller;

import com.example.EV_Charging_Platform.config.PlatformProperties;
import com.example.EV_Charging_Platform.dto.*;
import com.example.EV_Charging_Platform.model.ConnectorType;
import com.example.EV_Charging_Platform.model.GeoPoint;
import com.example.EV_Charging_Platform.model.Station;
import com.example.EV_Charging_Platform.service.NearbyQuery;
import com.example.EV_Charging_Platform.service.NearbyResult;
import com.example.EV_Charging_Platform.service.StationAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

/**
 * REST API Controller for station discovery
 *
 * Discovery never fails because of a provider: partial answers come back with 200 and the
 * per-provider problems listed next to the stations.
 */
@RestController
@RequestMapping("/api/v1/stations")
@CrossOrigin(origins = "*")
public class StationController {

    private static final Logger logger = LoggerFactory.getLogger(StationController.class);

    private final StationAggregator aggregator;
    private final double defaultRadiusMeters;

    public StationController(StationAggregator aggregator, PlatformProperties properties) {
        this.aggregator = aggregator;
        this.defaultRadiusMeters = properties.getDiscovery().getDefaultRadiusMeters();
    }

    /**
     * Nearby stations across all providers
     *
     * GET /api/v1/stations/nearby?lat=37.77&lon=-122.42&radiusMeters=5000&connectorType=CCS&availableOnly=true
     */
    @GetMapping("/nearby")
    public ResponseEntity<?> nearby(@RequestParam double lat,
                                    @RequestParam double lon,
                                    @RequestParam(required = false) Double radiusMeters,
                                    @RequestParam(required = false) String connectorType,
                                    @RequestParam(defaultValue = "false") boolean availableOnly,
                                    @RequestParam(required = false) Double minPowerKw,
                                    @RequestParam(required = false) Double maxPricePerKwh) {
        try {
            if (!GeoPoint.isValid(lat, lon)) {
                return ResponseEntity.badRequest()
                        .body(new ErrorResponse("INVALID_LOCATION", "Coordinates out of range"));
            }
            ConnectorType connector = null;
            if (connectorType != null && !connectorType.isBlank()) {
                connector = ConnectorType.fromProviderValue(connectorType);
                if (connector == null) {
                    return ResponseEntity.badRequest()
                            .body(new ErrorResponse("INVALID_CONNECTOR_TYPE", "Unknown connector type " + connectorType));
                }
            }

            GeoPoint center = new GeoPoint(lat, lon);
            NearbyQuery query = new NearbyQuery(center, radiusMeters != null ? radiusMeters : defaultRadiusMeters)
                    .connectorType(connector)
                    .availableOnly(availableOnly)
                    .minPowerKw(minPowerKw)
                    .maxPricePerKwh(maxPricePerKwh);

            NearbyResult result = aggregator.nearby(query);
            return ResponseEntity.ok(new NearbyStationsResponse(result, center, System.currentTimeMillis()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_QUERY", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error discovering stations near {},{}", lat, lon, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Discovery failed"));
        }
    }

    /**
     * GET /api/v1/stations/{stationId}
     */
    @GetMapping("/{stationId}")
    public ResponseEntity<?> station(@PathVariable String stationId) {
        try {
            Optional<Station> station = aggregator.station(stationId);
            if (station.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponse("STATION_NOT_FOUND", "Unknown station " + stationId));
            }
            return ResponseEntity.ok(station.get());
        } catch (Exception e) {
            logger.error("Error loading station {}", stationId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Station lookup failed"));
        }
    }

    /**
     * Available vs total chargers of one station
     *
     * GET /api/v1/stations/{stationId}/availability
     */
    @GetMapping("/{stationId}/availability")
    public ResponseEntity<?> availability(@PathVariable String stationId) {
        try {
            Optional<Station> station = aggregator.station(stationId);
            if (station.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponse("STATION_NOT_FOUND", "Unknown station " + stationId));
            }
            return ResponseEntity.ok(new StationAvailabilityResponse(station.get()));
        } catch (Exception e) {
            logger.error("Error loading availability of {}", stationId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Availability lookup failed"));
        }
    }
}
