package com.shopadmin.backend.modules.auth.domain;

public enum AppUserStatus {
    ACTIVE,
    INACTIVE
}
