package com.fulqrom.backend.modules.access.infrastructure.persistence;

import java.util.Optional;

import com.fulqrom.backend.modules.access.domain.AppUser;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, String> {

    @EntityGraph(attributePaths = {"roles", "resourceAccess"})
    @Query("select u from AppUser u where u.id = :id")
    Optional<AppUser> findWithAccessById(@Param("id") String id);

    @EntityGraph(attributePaths = {"roles", "resourceAccess"})
    @Query("select u from AppUser u where u.auth0Id = :auth0Id")
    Optional<AppUser> findWithAccessByAuth0Id(@Param("auth0Id") String auth0Id);

    @EntityGraph(attributePaths = {"roles", "resourceAccess"})
    @Query("select u from AppUser u where u.customId = :customId")
    Optional<AppUser> findWithAccessByCustomId(@Param("customId") String customId);

    @Query("""
            select count(u)
              from AppUser u
              join u.roles r
             where r.id = :roleId
            """)
    long countByRoleId(@Param("roleId") String roleId);
}
