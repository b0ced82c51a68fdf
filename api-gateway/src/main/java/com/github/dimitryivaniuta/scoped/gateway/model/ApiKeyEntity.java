package com.github.dimitryivaniuta.scoped.gateway.model;

import java.time.OffsetDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Reactive R2DBC entity for the {@code api_keys} table.
 *
 * <p>The clear-text prefix is unique and indexed for lookup; only the BCrypt hash of the
 * full key is stored. An empty {@code scopes} array means unrestricted (legacy) access.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("api_keys")
public class ApiKeyEntity {

    @Id
    @Column("id")
    private Long id;

    @Column("name")
    private String name;

    /** Unique lookup prefix, the part of the key before the dot. */
    @Column("prefix")
    private String prefix;

    /** BCrypt hash of the full key; never expose in APIs/logs. */
    @ToString.Exclude
    @Column("hashed_key")
    private String hashedKey;

    @Column("scopes")
    private ScopeList scopes;

    @Column("revoked")
    private boolean revoked;

    @Column("expires_at")
    private OffsetDateTime expiresAt;

    @Column("last_used_at")
    private OffsetDateTime lastUsedAt;

    /** Set by DB default {@code now()}. */
    @Column("created_at")
    private OffsetDateTime createdAt;
}
