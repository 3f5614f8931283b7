package com.fulqrom.backend.modules.access.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.fulqrom.backend.modules.access.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RoleRepository extends JpaRepository<Role, String> {

    Optional<Role> findByName(String name);

    boolean existsByName(String name);

    List<Role> findAllByOrderByNameAsc();

    List<Role> findByActiveOrderByNameAsc(boolean active);
}
