package com.climateplatform.collector.registry;

/** Identifiers of the sources this service ships fetchers for. */
public final class SourceIds {

    public static final String CLIMATE_DATA_CA = "climate_data_ca";
    public static final String GLOBE           = "globe";
    public static final String NASA_EARTH_DATA = "nasa_earth_data";
    public static final String NOAA_CLIMATE    = "noaa_climate";

    private SourceIds() {}
}
