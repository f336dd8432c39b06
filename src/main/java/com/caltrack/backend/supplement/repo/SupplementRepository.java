package com.caltrack.backend.supplement.repo;

import com.caltrack.backend.supplement.entity.SupplementEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SupplementRepository extends JpaRepository<SupplementEntity, String> {

    List<SupplementEntity> findAllByOrderByNameAsc();
}
