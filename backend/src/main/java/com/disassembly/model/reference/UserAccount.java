package com.disassembly.model.reference;

import com.disassembly.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.util.UUID;

/**
 * Owning actor of a product tree.
 * Account management lives elsewhere; this entity only backs the owner existence check.
 */
@Entity
@Table(name = "user_account", indexes = {
    @Index(name = "idx_user_account_username", columnList = "username")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String username;

    @Column(length = 255)
    private String email;
}
