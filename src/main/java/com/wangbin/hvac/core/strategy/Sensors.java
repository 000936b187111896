package com.wangbin.hvac.core.strategy;

/**
 * 逻辑传感器默认候选顺序
 */
public final class Sensors {

    public static final String SPACE = "space";
    public static final String SUPPLY = "supply";
    public static final String RETURN = "return";
    public static final String MIXED = "mixed";
    public static final String OUTDOOR = "outdoor";
    public static final String WATER_SUPPLY = "waterSupply";
    public static final String WATER_RETURN = "waterReturn";
    public static final String LOOP = "loop";
    public static final String AMPS = "amps";
    public static final String COMPRESSOR_AMPS = "compressorAmps";
    public static final String BUNDLE_SUPPLY = "bundleSupply";
    public static final String SUPPLY_AIR = "supplyAir";

    public static final SensorChain SPACE_TEMP = SensorChain.of(SPACE, 72,
            "Space", "SpaceTemp", "spaceTemp", "ZoneTemp", "zoneTemp", "RoomTemp", "roomTemp",
            "currentTemp", "Return", "ReturnAir");
    public static final SensorChain SUPPLY_TEMP = SensorChain.of(SUPPLY, 55,
            "Supply", "SupplyTemp", "supplyTemp", "SupplyAir", "supplyAirTemp", "DischargeAir");
    public static final SensorChain RETURN_TEMP = SensorChain.of(RETURN, 72,
            "Return", "ReturnTemp", "returnTemp", "ReturnAir");
    public static final SensorChain MIXED_TEMP = SensorChain.of(MIXED, 55,
            "MixedAir", "Mixed_Air", "mixedAirTemp", "MAT");
    public static final SensorChain OUTDOOR_TEMP = SensorChain.of(OUTDOOR, 50,
            "Outdoor_Air", "OutdoorTemp", "outdoorTemp", "OAT", "outsideTemp", "Outdoor");
    public static final SensorChain WATER_SUPPLY_TEMP = SensorChain.of(WATER_SUPPLY, 140,
            "H20Supply", "H2OSupply", "Supply", "SupplyTemp", "waterSupplyTemp");
    public static final SensorChain WATER_RETURN_TEMP = SensorChain.of(WATER_RETURN, 120,
            "H20Return", "H2OReturn", "Return", "ReturnTemp", "waterReturnTemp");
    public static final SensorChain LOOP_TEMP = SensorChain.of(LOOP, 45,
            "LoopTemp", "loopTemp", "H20Supply", "H2OSupply", "Supply", "SupplyTemp");
    public static final SensorChain MOTOR_AMPS = SensorChain.of(AMPS, 0,
            "Amps", "amps", "PumpAmps", "pumpAmps", "current");
    public static final SensorChain COMPRESSOR_CURRENT = SensorChain.of(COMPRESSOR_AMPS, 0,
            "CompressorAmps", "compressorAmps", "Amps", "amps");
    public static final SensorChain BUNDLE_SUPPLY_TEMP = SensorChain.of(BUNDLE_SUPPLY, 140,
            "Supply", "supplyTemperature", "SupplyTemp", "supplyTemp", "SupplyTemperature", "bundleTemp",
            "BundleTemp", "steamBundleTemp", "SteamBundleTemp", "heatExchangerTemp", "HeatExchangerTemp");
    public static final SensorChain SUPPLY_AIR_TEMP = SensorChain.of(SUPPLY_AIR, 65,
            "SupplyTemp", "Supply_Air_Temp", "SupplyAirTemp", "supplyAirTemp", "Supply");

    private Sensors() {
    }
}
