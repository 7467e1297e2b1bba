package com.disassembly.repository;

import com.disassembly.model.reference.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for user accounts.
 */
@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {
}
