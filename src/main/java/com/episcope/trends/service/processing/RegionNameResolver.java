package com.episcope.trends.service.processing;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Maps numeric region codes returned for Ghana to region names.
 */
@Component
public class RegionNameResolver {

    private static final String GHANA = "GH";

    private static final Map<String, String> GHANA_REGIONS = Map.ofEntries(
            Map.entry("0", "Unknown Region"),
            Map.entry("21", "Upper West"),
            Map.entry("34", "Upper East"),
            Map.entry("36", "Central"),
            Map.entry("38", "Upper East"),
            Map.entry("39", "Upper East"),
            Map.entry("41", "Volta"),
            Map.entry("42", "Ashanti"),
            Map.entry("43", "Central"),
            Map.entry("47", "Volta"),
            Map.entry("50", "Upper West"),
            Map.entry("51", "Upper West"),
            Map.entry("52", "Ashanti"),
            Map.entry("55", "Northern"),
            Map.entry("56", "Northern"),
            Map.entry("57", "Northern"),
            Map.entry("58", "Northern"),
            Map.entry("59", "Northern"),
            Map.entry("62", "Greater Accra"),
            Map.entry("69", "Eastern"),
            Map.entry("70", "Eastern"),
            Map.entry("81", "Bono"),
            Map.entry("82", "Bono"),
            Map.entry("83", "Ahafo"),
            Map.entry("84", "Bono East"),
            Map.entry("85", "Savannah"),
            Map.entry("86", "North East"),
            Map.entry("87", "Oti"),
            Map.entry("88", "Western North"),
            Map.entry("91", "Western North"),
            Map.entry("94", "Western"),
            Map.entry("95", "Western"),
            Map.entry("97", "Central"),
            Map.entry("98", "Central"),
            Map.entry("100", "Greater Accra")
    );

    /**
     * Region name for a numeric code. Codes outside Ghana are not mapped.
     */
    public String resolve(String code, String geo) {
        if (geo == null || !geo.toUpperCase().startsWith(GHANA)) {
            return "Region " + code;
        }
        String name = GHANA_REGIONS.get(code);
        if (name != null) {
            return name;
        }
        return rangeHeuristic(code);
    }

    static String rangeHeuristic(String code) {
        int value;
        try {
            value = Integer.parseInt(code);
        } catch (NumberFormatException e) {
            return "Region " + code + " (Ghana)";
        }
        if (value >= 80 && value <= 89) {
            return "Bono Region";
        }
        if (value >= 90 && value <= 99) {
            return "Western Region";
        }
        if (value >= 40 && value <= 49) {
            return "Central/Volta Region";
        }
        if (value >= 50 && value <= 59) {
            return "Northern Region";
        }
        if (value >= 60 && value <= 79) {
            return "Eastern Region";
        }
        return "Region " + code + " (Ghana)";
    }
}
