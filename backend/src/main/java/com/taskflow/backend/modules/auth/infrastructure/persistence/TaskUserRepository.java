package com.taskflow.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.taskflow.backend.modules.auth.domain.TaskUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskUserRepository extends JpaRepository<TaskUser, UUID> {

    @Query("select tu from TaskUser tu where lower(tu.username) = lower(:username)")
    Optional<TaskUser> findByUsernameIgnoreCase(@Param("username") String username);

    @Query("""
            select case when count(tu) > 0 then true else false end
              from TaskUser tu
             where lower(tu.username) = lower(:username)
            """)
    boolean existsByUsernameIgnoreCase(@Param("username") String username);
}
