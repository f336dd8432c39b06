package com.caltrack.backend.product.repo;

import com.caltrack.backend.product.entity.ProductEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<ProductEntity, String> {

    Optional<ProductEntity> findFirstByBarcode(String barcode);

    List<ProductEntity> findAllByOrderByNameAsc();
}
