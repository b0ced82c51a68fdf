package com.github.dimitryivaniuta.scoped.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * A user group and the scopes its members receive ({@code scoped_groups}).
 * Membership lives in {@code user_groups}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("scoped_groups")
public class ScopedGroupEntity {

    @Id
    @Column("id")
    private Long id;

    @Column("name")
    private String name;

    @Column("scopes")
    private ScopeList scopes;
}
