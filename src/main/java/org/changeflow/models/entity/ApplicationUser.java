package org.changeflow.models.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

import java.time.Instant;

@Setter
@Getter
@Entity
@Table(name = "app_user", schema = "auth")
public class ApplicationUser {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id", nullable = false)
    private Long id;

    @Column(name = "user_uid", nullable = false, length = 40)
    private String userUid;

    @NotBlank(message = "Name is mandatory")
    @Column(name = "name", nullable = false, length = 60)
    private String name;

    @Email(message = "Email must be valid")
    @NotBlank(message = "Email is mandatory")
    @Column(name = "email", nullable = false, length = 120, unique = true)
    private String email;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public ApplicationUser(String userUid, String name, String email) {
        this.userUid = userUid;
        this.name = name;
        this.email = email;
        this.createdAt = Instant.now();
    }

    public ApplicationUser() {
    }
}
