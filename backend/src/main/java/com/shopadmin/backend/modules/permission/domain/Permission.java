package com.shopadmin.backend.modules.permission.domain;

import java.util.UUID;

import com.shopadmin.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Catalog entry naming one capability, a (resource, action) pair.
 * The name is always {@code resource.action}, e.g. {@code order.write}.
 */
@Entity
@Table(name = "permission")
public class Permission extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "display_name", nullable = false, length = 255)
    private String displayName;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "resource_type", nullable = false, length = 32, updatable = false)
    private ResourceType resourceType;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 16, updatable = false)
    private ActionType actionType;

    @Column(name = "is_system", nullable = false, updatable = false)
    private boolean system;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    protected Permission() {
    }

    public Permission(ResourceType resourceType, ActionType actionType, String displayName, String description) {
        this.resourceType = resourceType;
        this.actionType = actionType;
        this.name = nameOf(resourceType, actionType);
        this.displayName = displayName;
        this.description = description;
    }

    public static String nameOf(ResourceType resourceType, ActionType actionType) {
        return resourceType.code() + "." + actionType.code();
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public ActionType getActionType() {
        return actionType;
    }

    public boolean isSystem() {
        return system;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
