package com.aim.auth.repository;

import com.aim.auth.model.Role;
import com.aim.auth.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, String> {

    Optional<User> findByUsernameKey(String usernameKey);

    Optional<User> findByEmail(String email);

    Optional<User> findByApiKey(String apiKey);

    boolean existsByUsernameKey(String usernameKey);

    boolean existsByEmail(String email);

    boolean existsByApiKey(String apiKey);

    long countByActiveTrue();

    List<User> findAllByOrderByCreatedAtDesc();

    @Modifying
    @Transactional
    @Query("UPDATE User u SET u.lastLogin = :ts WHERE u.id = :id")
    int updateLastLogin(@Param("id") String id, @Param("ts") Instant timestamp);

    @Modifying
    @Transactional
    @Query("UPDATE User u SET u.passwordHash = :hash, u.passwordChanged = :changed WHERE u.id = :id")
    int updatePassword(@Param("id") String id,
                       @Param("hash") String passwordHash,
                       @Param("changed") boolean passwordChanged);

    @Modifying
    @Transactional
    @Query("UPDATE User u SET u.apiKey = :apiKey WHERE u.id = :id")
    int updateApiKey(@Param("id") String id, @Param("apiKey") String apiKey);

    @Modifying
    @Transactional
    @Query("UPDATE User u SET u.active = :active WHERE u.id = :id")
    int updateActive(@Param("id") String id, @Param("active") boolean active);

    @Modifying
    @Transactional
    @Query("UPDATE User u SET u.role = :role WHERE u.id = :id")
    int updateRole(@Param("id") String id, @Param("role") Role role);
}
