package com.decoadmin.backend.modules.organization.domain;

public enum MembershipRole {
    MEMBER,
    ADMIN;

    public boolean isAdmin() {
        return this == ADMIN;
    }
}
