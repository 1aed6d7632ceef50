package com.example.EV_Charging_Platform.service;

import com.example.EV_Charging_Platform.model.ConnectorType;

import java.math.BigDecimal;

/**
 * Charging totals of one user over their completed sessions
 */
public class SessionStats {

    private final String userId;
    private final int totalSessions;
    private final int failedSessions;
    private final double totalEnergyKwh;
    private final BigDecimal totalCost;
    private final long totalDurationMinutes;
    private final double averageSessionKwh;
    private final String favoriteStationId; // null without completed sessions
    private final ConnectorType mostUsedConnector; // null when no session recorded its connector

    public SessionStats(String userId, int totalSessions, int failedSessions, double totalEnergyKwh,
                        BigDecimal totalCost, long totalDurationMinutes, double averageSessionKwh,
                        String favoriteStationId, ConnectorType mostUsedConnector) {
        this.userId = userId;
        this.totalSessions = totalSessions;
        this.failedSessions = failedSessions;
        this.totalEnergyKwh = totalEnergyKwh;
        this.totalCost = totalCost;
        this.totalDurationMinutes = totalDurationMinutes;
        this.averageSessionKwh = averageSessionKwh;
        this.favoriteStationId = favoriteStationId;
        this.mostUsedConnector = mostUsedConnector;
    }

    public String getUserId() { return userId; }
    public int getTotalSessions() { return totalSessions; }
    public int getFailedSessions() { return failedSessions; }
    public double getTotalEnergyKwh() { return totalEnergyKwh; }
    public BigDecimal getTotalCost() { return totalCost; }
    public long getTotalDurationMinutes() { return totalDurationMinutes; }
    public double getAverageSessionKwh() { return averageSessionKwh; }
    public String getFavoriteStationId() { return favoriteStationId; }
    public ConnectorType getMostUsedConnector() { return mostUsedConnector; }

    @Override
    public String toString() {
        return String.format("SessionStats{user='%s', sessions=%d, energy=%.2fkWh, cost=%s}",
                userId, totalSessions, totalEnergyKwh, totalCost);
    }
}
