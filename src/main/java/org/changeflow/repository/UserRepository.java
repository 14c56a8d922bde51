package org.changeflow.repository;

import org.changeflow.models.entity.ApplicationUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<ApplicationUser, Long> {
    Optional<ApplicationUser> findByUserUid(String userUid);

    Optional<ApplicationUser> findByEmailIgnoreCase(String email);
}
