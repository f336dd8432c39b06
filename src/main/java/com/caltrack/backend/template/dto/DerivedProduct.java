package com.caltrack.backend.template.dto;

import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.product.entity.ProductEntity;

public record DerivedProduct(ProductEntity product, FoodEntryEntity entry) {}
