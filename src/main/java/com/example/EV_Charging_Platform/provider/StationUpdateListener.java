package com.example.EV_Charging_Platform.provider;

@FunctionalInterface
public interface StationUpdateListener {

    void onStationUpdate(ProviderStation update);
}
