package com.caltrack.backend.template.repo;

import com.caltrack.backend.template.entity.AiFoodTemplateEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AiFoodTemplateRepository extends JpaRepository<AiFoodTemplateEntity, String> {

    Optional<AiFoodTemplateEntity> findFirstByNameIgnoreCase(String name);

    List<AiFoodTemplateEntity> findAllByOrderByLastUsedDesc();
}
