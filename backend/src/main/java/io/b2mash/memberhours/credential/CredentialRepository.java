package io.b2mash.memberhours.credential;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CredentialRepository extends JpaRepository<CredentialRecord, UUID> {

  Optional<CredentialRecord> findByEmail(String email);
}
