package com.caltrack.backend.nutrient;

public enum NutrientCategory {
    VITAMIN,
    MINERAL
}
